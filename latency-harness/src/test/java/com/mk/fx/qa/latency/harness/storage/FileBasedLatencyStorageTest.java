package com.mk.fx.qa.latency.harness.storage;

import static com.mk.fx.qa.latency.harness.LatencyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.harness.cfg.ObjectMapperConfig;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileBasedLatencyStorageTest extends LatencyHarnessStorageContract {

  @TempDir Path dataDir;

  @Override
  LatencyHarnessStorage createStorage() {
    return open();
  }

  private FileBasedLatencyStorage open() {
    var fileStorage = new FileBasedLatencyStorage(dataDir, ObjectMapperConfig.create());
    fileStorage.initialize();
    return fileStorage;
  }

  @Test
  void restart_reloadsRunsResultsSuitesAndBaselines() {
    var run = run("run-1", "suite-a", RunStatus.RUNNING, T0);
    storage.saveRun(run);
    storage.saveResult("run-1", resultAt(T0.plusSeconds(1), 300));
    storage.saveResult("run-1", resultAt(T0.plusSeconds(2), 320));
    storage.saveSuite(suite("custom", 2));
    storage.saveBaseline(baseline("b1", true, T0));

    var reopened = open();

    var stored = reopened.getRun("run-1").orElseThrow();
    assertEquals(2, stored.getResults().size());
    assertEquals(320.0, stored.getResults().get(1).e2eLatencyMs(), 1e-9);
    assertEquals(run.getStartedAt(), stored.getStartedAt());
    assertEquals(suite("custom", 2), reopened.getSuite("custom").orElseThrow());
    assertEquals("b1", reopened.getActiveBaseline().orElseThrow().id());
  }

  @Test
  void initialize_skipsUnreadableDocuments() throws Exception {
    storage.saveSuite(suite("custom", 1));
    Files.writeString(dataDir.resolve("suites").resolve("broken.json"), "{ not json");

    var reopened = open();

    assertEquals(1, reopened.listSuites().size());
  }

  @Test
  void documents_areWrittenWithoutTemporaryLeftovers() throws Exception {
    storage.saveRun(run("run-1", "suite-a", RunStatus.RUNNING, T0));
    storage.saveResult("run-1", resultAt(T0.plusSeconds(1), 300));

    try (var files = Files.list(dataDir.resolve("runs"))) {
      assertEquals(
          List.of("run-1.json", "run-1.results.jsonl"),
          files.map(f -> f.getFileName().toString()).sorted().toList());
    }
  }

  @Test
  void saveResult_appendsOneLineWithoutRewritingRunDocument() throws Exception {
    storage.saveRun(run("run-1", "suite-a", RunStatus.RUNNING, T0));
    var runDocument = Files.readString(dataDir.resolve("runs").resolve("run-1.json"));

    storage.saveResult("run-1", resultAt(T0.plusSeconds(1), 300));
    storage.saveResult("run-1", resultAt(T0.plusSeconds(2), 320));

    var runsDir = dataDir.resolve("runs");
    assertEquals(runDocument, Files.readString(runsDir.resolve("run-1.json")));
    assertEquals(2, Files.readAllLines(runsDir.resolve("run-1.results.jsonl")).size());
  }

  @Test
  void restart_resavedResultKeepsLatestVersion() {
    storage.saveRun(run("run-1", "suite-a", RunStatus.RUNNING, T0));
    var first = resultAt(T0.plusSeconds(1), 300);
    storage.saveResult("run-1", first);
    storage.saveResult("run-1", resultAt(T0.plusSeconds(2), 320));
    storage.saveResult("run-1", first.toBuilder().e2eLatencyMs(310).build());

    var stored = open().getRun("run-1").orElseThrow().getResults();

    assertEquals(2, stored.size());
    assertEquals(320.0, stored.get(0).e2eLatencyMs(), 1e-9);
    assertEquals(310.0, stored.get(1).e2eLatencyMs(), 1e-9);
    assertEquals(
        List.of(320.0, 310.0),
        storage.getRun("run-1").orElseThrow().getResults().stream()
            .map(TestResult::e2eLatencyMs)
            .toList());
  }

  @Test
  void deleteRun_removesResultsFile() {
    storage.saveRun(run("run-1", "suite-a", RunStatus.RUNNING, T0));
    storage.saveResult("run-1", resultAt(T0.plusSeconds(1), 300));

    assertTrue(storage.deleteRun("run-1"));

    assertFalse(Files.exists(dataDir.resolve("runs").resolve("run-1.results.jsonl")));
    assertTrue(open().getRun("run-1").isEmpty());
  }

  @Test
  void saveSuite_pathLikeId_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> storage.saveSuite(suite("../escape", 1)));
  }
}
