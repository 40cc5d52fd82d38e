package com.mk.fx.qa.latency.harness.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestResult;
import com.mk.fx.qa.latency.harness.model.TestRun;
import com.mk.fx.qa.latency.harness.model.TestSuiteDefinition;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stores one JSON document per suite, run and baseline under {@code suites/}, {@code runs/} and
 * {@code baselines/} of the data directory, with an in-memory cache loaded at start-up.
 *
 * <p>A run document holds the run's metadata only. Its results are appended, one JSON line each,
 * to {@code runs/<id>.results.jsonl}; on load a later line replaces an earlier one with the same
 * result id.
 *
 * <p>Every operation holds this instance's monitor, which makes baseline activation atomic with
 * respect to readers. Documents are written to a temporary file and moved into place.
 */
@Slf4j
@Component
@ConditionalOnProperty(
    prefix = "latency.harness.storage",
    name = "type",
    havingValue = "file",
    matchIfMissing = true)
public class FileBasedLatencyStorage implements LatencyHarnessStorage {

  private static final int DEFAULT_RESULT_LIMIT = 1000;
  private static final String RESULTS_SUFFIX = ".results.jsonl";

  private final Path suitesDir;
  private final Path runsDir;
  private final Path baselinesDir;
  private final ObjectMapper mapper;
  private final ObjectWriter resultLineWriter;

  private final Map<String, TestSuiteDefinition> suites = new LinkedHashMap<>();
  private final Map<String, TestRun> runs = new LinkedHashMap<>();
  private final Map<String, List<TestResult>> results = new LinkedHashMap<>();
  private final Map<String, PerformanceBaseline> baselines = new LinkedHashMap<>();

  @Autowired
  public FileBasedLatencyStorage(HarnessCfg properties, ObjectMapper mapper) {
    this(Path.of(properties.getStorage().getDataDir()), mapper);
  }

  public FileBasedLatencyStorage(Path dataDir, ObjectMapper mapper) {
    this.suitesDir = dataDir.resolve("suites");
    this.runsDir = dataDir.resolve("runs");
    this.baselinesDir = dataDir.resolve("baselines");
    this.mapper = mapper;
    this.resultLineWriter = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
  }

  @PostConstruct
  public synchronized void initialize() {
    try {
      Files.createDirectories(suitesDir);
      Files.createDirectories(runsDir);
      Files.createDirectories(baselinesDir);
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot create storage directories", ex);
    }
    load(suitesDir, TestSuiteDefinition.class, (file, suite) -> suites.put(suite.id(), suite));
    load(
        runsDir,
        TestRun.class,
        (file, run) -> {
          runs.put(run.getId(), run.withResults(List.of()));
          results.put(run.getId(), loadResults(run));
        });
    load(
        baselinesDir,
        PerformanceBaseline.class,
        (file, baseline) -> baselines.put(baseline.id(), baseline));
    log.info(
        "File storage initialised at {} ({} suites, {} runs, {} baselines)",
        suitesDir.getParent(),
        suites.size(),
        runs.size(),
        baselines.size());
  }

  private <T> void load(Path dir, Class<T> type, BiConsumer<Path, T> sink) {
    try (Stream<Path> files = Files.list(dir)) {
      files
          .filter(file -> file.getFileName().toString().endsWith(".json"))
          .sorted()
          .forEach(
              file -> {
                try {
                  sink.accept(file, mapper.readValue(file.toFile(), type));
                } catch (IOException | RuntimeException ex) {
                  log.warn(
                      "Skipping unreadable {} file {}: {}",
                      type.getSimpleName(),
                      file,
                      ex.getMessage());
                }
              });
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot list " + dir, ex);
    }
  }

  private List<TestResult> loadResults(TestRun run) {
    Map<String, TestResult> byId = new LinkedHashMap<>();
    run.getResults().forEach(result -> byId.put(result.id(), result));
    var file = resultsFile(run.getId());
    if (Files.exists(file)) {
      List<String> lines;
      try {
        lines = Files.readAllLines(file);
      } catch (IOException ex) {
        throw new UncheckedIOException("Cannot read " + file, ex);
      }
      for (String line : lines) {
        if (line.isBlank()) {
          continue;
        }
        try {
          var result = mapper.readValue(line, TestResult.class);
          byId.remove(result.id());
          byId.put(result.id(), result);
        } catch (IOException ex) {
          log.warn("Skipping unreadable result line in {}: {}", file, ex.getMessage());
        }
      }
    }
    return new ArrayList<>(byId.values());
  }

  // Suites

  @Override
  public synchronized List<TestSuiteDefinition> listSuites() {
    return List.copyOf(suites.values());
  }

  @Override
  public synchronized Optional<TestSuiteDefinition> getSuite(String suiteId) {
    return Optional.ofNullable(suites.get(suiteId));
  }

  @Override
  public synchronized void saveSuite(TestSuiteDefinition suite) {
    write(suitesDir, suite.id(), suite);
    suites.put(suite.id(), suite);
  }

  @Override
  public synchronized boolean deleteSuite(String suiteId) {
    if (suites.remove(suiteId) == null) {
      return false;
    }
    delete(suitesDir, suiteId);
    return true;
  }

  // Runs

  @Override
  public synchronized RunPage listRuns(RunStatus status, String suiteId, int limit, int offset) {
    List<TestRun> matching =
        runs.values().stream()
            .filter(run -> status == null || run.getStatus() == status)
            .filter(run -> suiteId == null || suiteId.equals(run.getSuiteId()))
            .sorted(
                Comparator.comparing(
                        TestRun::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .reversed())
            .toList();
    List<TestRun> page =
        matching.stream()
            .skip(Math.max(0, offset))
            .limit(Math.max(0, limit))
            .map(run -> run.withResults(results.getOrDefault(run.getId(), List.of())))
            .toList();
    return new RunPage(page, matching.size());
  }

  @Override
  public synchronized Optional<TestRun> getRun(String runId) {
    return Optional.ofNullable(runs.get(runId))
        .map(run -> run.withResults(results.getOrDefault(runId, List.of())));
  }

  @Override
  public synchronized void saveRun(TestRun run) {
    results.computeIfAbsent(run.getId(), id -> new ArrayList<>());
    writeRun(run);
  }

  @Override
  public synchronized boolean updateRunStatus(String runId, RunStatus status, Instant completedAt) {
    var run = runs.get(runId);
    if (run == null) {
      return false;
    }
    var updated =
        new TestRun(
            run.getId(),
            run.getSuiteId(),
            run.getSuiteName(),
            run.getStartedAt(),
            run.getClientId(),
            run.getClientType(),
            run.getTotalConfigurations(),
            status,
            completedAt != null ? completedAt : run.getCompletedAt(),
            run.getCompletedConfigurations(),
            List.of(),
            run.getErrorMessage());
    writeRun(updated);
    return true;
  }

  @Override
  public synchronized boolean deleteRun(String runId) {
    if (runs.remove(runId) == null) {
      return false;
    }
    results.remove(runId);
    delete(runsDir, runId);
    try {
      Files.deleteIfExists(resultsFile(runId));
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to delete results of run " + runId, ex);
    }
    return true;
  }

  private void writeRun(TestRun run) {
    var metadata = run.withResults(List.of());
    write(runsDir, metadata.getId(), metadata);
    runs.put(metadata.getId(), metadata);
  }

  // Results

  @Override
  public synchronized void saveResult(String runId, TestResult result) {
    var file = resultsFile(runId);
    try {
      Files.writeString(
          file,
          resultLineWriter.writeValueAsString(result) + System.lineSeparator(),
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to append result to " + file, ex);
    }
    var stored = results.computeIfAbsent(runId, id -> new ArrayList<>());
    stored.removeIf(existing -> existing.id().equals(result.id()));
    stored.add(result);
  }

  @Override
  public synchronized List<TestResult> getResults(String runId, String configId, Integer limit) {
    int max = limit == null ? DEFAULT_RESULT_LIMIT : Math.max(0, limit);
    return results.getOrDefault(runId, List.of()).stream()
        .filter(result -> configId == null || configId.equals(result.configId()))
        .limit(max)
        .toList();
  }

  // Baselines

  @Override
  public synchronized List<PerformanceBaseline> listBaselines() {
    return baselines.values().stream()
        .sorted(
            Comparator.comparing(
                    PerformanceBaseline::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .reversed())
        .toList();
  }

  @Override
  public synchronized Optional<PerformanceBaseline> getBaseline(String baselineId) {
    return Optional.ofNullable(baselines.get(baselineId));
  }

  @Override
  public synchronized void saveBaseline(PerformanceBaseline baseline) {
    if (baseline.isActive()) {
      deactivateAllExcept(baseline.id());
    }
    write(baselinesDir, baseline.id(), baseline);
    baselines.put(baseline.id(), baseline);
  }

  @Override
  public synchronized boolean deleteBaseline(String baselineId) {
    if (baselines.remove(baselineId) == null) {
      return false;
    }
    delete(baselinesDir, baselineId);
    return true;
  }

  @Override
  public synchronized Optional<PerformanceBaseline> getActiveBaseline() {
    return baselines.values().stream().filter(PerformanceBaseline::isActive).findFirst();
  }

  @Override
  public synchronized boolean activateBaseline(String baselineId) {
    var baseline = baselines.get(baselineId);
    if (baseline == null) {
      return false;
    }
    saveBaseline(baseline.withActive(true));
    return true;
  }

  private void deactivateAllExcept(String baselineId) {
    for (PerformanceBaseline other : List.copyOf(baselines.values())) {
      if (other.isActive() && !other.id().equals(baselineId)) {
        var inactive = other.withActive(false);
        write(baselinesDir, inactive.id(), inactive);
        baselines.put(inactive.id(), inactive);
      }
    }
  }

  // Files

  private void write(Path dir, String id, Object document) {
    var target = dir.resolve(fileName(id));
    var temp = dir.resolve(fileName(id) + ".tmp");
    try {
      mapper.writeValue(temp.toFile(), document);
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write " + target, ex);
    }
  }

  private void delete(Path dir, String id) {
    try {
      Files.deleteIfExists(dir.resolve(fileName(id)));
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to delete " + id + " from " + dir, ex);
    }
  }

  private Path resultsFile(String runId) {
    return runsDir.resolve(checkedId(runId) + RESULTS_SUFFIX);
  }

  private static String fileName(String id) {
    return checkedId(id) + ".json";
  }

  private static String checkedId(String id) {
    if (id == null || id.isBlank() || id.contains("/") || id.contains("\\") || id.contains("..")) {
      throw new IllegalArgumentException("Invalid storage id: " + id);
    }
    return id;
  }
}
