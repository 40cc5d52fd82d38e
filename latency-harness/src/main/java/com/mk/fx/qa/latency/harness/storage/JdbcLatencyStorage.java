package com.mk.fx.qa.latency.harness.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestResult;
import com.mk.fx.qa.latency.harness.model.TestRun;
import com.mk.fx.qa.latency.harness.model.TestSuiteDefinition;
import jakarta.annotation.PostConstruct;
import java.io.UncheckedIOException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational backend. Queryable columns are kept next to a JSON copy of each document; the JSON
 * copy is what gets read back, except for run status and baseline activation whose columns are
 * authoritative.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "latency.harness.storage", name = "type", havingValue = "jdbc")
public class JdbcLatencyStorage implements LatencyHarnessStorage {

  private static final String SCHEMA = "latency-harness-schema.sql";
  private static final int DEFAULT_RESULT_LIMIT = 1000;

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final ObjectMapper mapper;

  public JdbcLatencyStorage(
      JdbcTemplate jdbc, PlatformTransactionManager txManager, ObjectMapper mapper) {
    this.jdbc = jdbc;
    this.tx = new TransactionTemplate(txManager);
    this.mapper = mapper;
  }

  @PostConstruct
  public void initialize() {
    var populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA));
    populator.execute(Objects.requireNonNull(jdbc.getDataSource(), "DataSource is required"));
    log.info("JDBC storage schema initialised from {}", SCHEMA);
  }

  // Suites

  @Override
  public List<TestSuiteDefinition> listSuites() {
    return jdbc.query(
        "SELECT definition_json FROM latency_test_suites ORDER BY name",
        (rs, i) -> read(rs.getString(1), TestSuiteDefinition.class));
  }

  @Override
  public Optional<TestSuiteDefinition> getSuite(String suiteId) {
    return jdbc
        .query(
            "SELECT definition_json FROM latency_test_suites WHERE id = ?",
            (rs, i) -> read(rs.getString(1), TestSuiteDefinition.class),
            suiteId)
        .stream()
        .findFirst();
  }

  @Override
  public void saveSuite(TestSuiteDefinition suite) {
    var json = write(suite);
    var now = Timestamp.from(Instant.now());
    tx.executeWithoutResult(
        status -> {
          int updated =
              jdbc.update(
                  "UPDATE latency_test_suites SET name = ?, description = ?, definition_json = ?,"
                      + " updated_at = ? WHERE id = ?",
                  suite.name(),
                  suite.description(),
                  json,
                  now,
                  suite.id());
          if (updated == 0) {
            jdbc.update(
                "INSERT INTO latency_test_suites"
                    + " (id, name, description, definition_json, created_at, updated_at)"
                    + " VALUES (?, ?, ?, ?, ?, ?)",
                suite.id(),
                suite.name(),
                suite.description(),
                json,
                now,
                now);
          }
        });
  }

  @Override
  public boolean deleteSuite(String suiteId) {
    return jdbc.update("DELETE FROM latency_test_suites WHERE id = ?", suiteId) > 0;
  }

  // Runs

  @Override
  public RunPage listRuns(RunStatus status, String suiteId, int limit, int offset) {
    var where = new StringBuilder(" WHERE 1 = 1");
    List<Object> args = new ArrayList<>();
    if (status != null) {
      where.append(" AND status = ?");
      args.add(status.getValue());
    }
    if (suiteId != null) {
      where.append(" AND suite_id = ?");
      args.add(suiteId);
    }
    Integer total =
        jdbc.queryForObject(
            "SELECT COUNT(*) FROM latency_test_runs" + where, Integer.class, args.toArray());
    List<Object> pageArgs = new ArrayList<>(args);
    pageArgs.add(Math.max(0, limit));
    pageArgs.add(Math.max(0, offset));
    List<TestRun> runs =
        jdbc.query(
            "SELECT id, status, completed_at, run_json FROM latency_test_runs"
                + where
                + " ORDER BY started_at DESC LIMIT ? OFFSET ?",
            (rs, i) ->
                withStatus(
                    read(rs.getString("run_json"), TestRun.class),
                    RunStatus.fromValue(rs.getString("status")),
                    toInstant(rs.getTimestamp("completed_at"))),
            pageArgs.toArray());
    List<TestRun> page =
        runs.stream().map(run -> run.withResults(loadResults(run.getId(), null, null))).toList();
    return new RunPage(page, total == null ? 0 : total);
  }

  @Override
  public Optional<TestRun> getRun(String runId) {
    return jdbc
        .query(
            "SELECT status, completed_at, run_json FROM latency_test_runs WHERE id = ?",
            (rs, i) ->
                withStatus(
                    read(rs.getString("run_json"), TestRun.class),
                    RunStatus.fromValue(rs.getString("status")),
                    toInstant(rs.getTimestamp("completed_at"))),
            runId)
        .stream()
        .findFirst()
        .map(run -> run.withResults(loadResults(runId, null, null)));
  }

  @Override
  public void saveRun(TestRun run) {
    var json = write(run.withResults(List.of()));
    tx.executeWithoutResult(
        status -> {
          int updated =
              jdbc.update(
                  "UPDATE latency_test_runs SET suite_id = ?, suite_name = ?, client_id = ?,"
                      + " client_type = ?, status = ?, total_configurations = ?,"
                      + " completed_configurations = ?, started_at = ?, completed_at = ?,"
                      + " run_json = ? WHERE id = ?",
                  run.getSuiteId(),
                  run.getSuiteName(),
                  run.getClientId(),
                  run.getClientType() == null ? null : run.getClientType().getValue(),
                  run.getStatus().getValue(),
                  run.getTotalConfigurations(),
                  run.getCompletedConfigurations(),
                  toTimestamp(run.getStartedAt()),
                  toTimestamp(run.getCompletedAt()),
                  json,
                  run.getId());
          if (updated == 0) {
            jdbc.update(
                "INSERT INTO latency_test_runs (id, suite_id, suite_name, client_id, client_type,"
                    + " status, total_configurations, completed_configurations, started_at,"
                    + " completed_at, run_json) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                run.getId(),
                run.getSuiteId(),
                run.getSuiteName(),
                run.getClientId(),
                run.getClientType() == null ? null : run.getClientType().getValue(),
                run.getStatus().getValue(),
                run.getTotalConfigurations(),
                run.getCompletedConfigurations(),
                toTimestamp(run.getStartedAt()),
                toTimestamp(run.getCompletedAt()),
                json);
          }
        });
  }

  @Override
  public boolean updateRunStatus(String runId, RunStatus status, Instant completedAt) {
    return jdbc.update(
            "UPDATE latency_test_runs SET status = ?,"
                + " completed_at = COALESCE(?, completed_at) WHERE id = ?",
            status.getValue(),
            toTimestamp(completedAt),
            runId)
        > 0;
  }

  @Override
  public boolean deleteRun(String runId) {
    Boolean deleted =
        tx.execute(
            status -> {
              jdbc.update("DELETE FROM latency_test_results WHERE run_id = ?", runId);
              return jdbc.update("DELETE FROM latency_test_runs WHERE id = ?", runId) > 0;
            });
    return Boolean.TRUE.equals(deleted);
  }

  // Results

  @Override
  public void saveResult(String runId, TestResult result) {
    tx.executeWithoutResult(
        status -> {
          jdbc.update("DELETE FROM latency_test_results WHERE id = ?", result.id());
          insertResult(runId, result);
        });
  }

  @Override
  public List<TestResult> getResults(String runId, String configId, Integer limit) {
    return loadResults(runId, configId, limit == null ? DEFAULT_RESULT_LIMIT : limit);
  }

  private List<TestResult> loadResults(String runId, String configId, Integer limit) {
    var sql = new StringBuilder("SELECT result_json FROM latency_test_results WHERE run_id = ?");
    List<Object> args = new ArrayList<>();
    args.add(runId);
    if (configId != null) {
      sql.append(" AND config_id = ?");
      args.add(configId);
    }
    sql.append(" ORDER BY recorded_at");
    if (limit != null) {
      sql.append(" LIMIT ?");
      args.add(Math.max(0, limit));
    }
    return jdbc.query(
        sql.toString(), (rs, i) -> read(rs.getString(1), TestResult.class), args.toArray());
  }

  private void insertResult(String runId, TestResult result) {
    jdbc.update(
        "INSERT INTO latency_test_results (id, run_id, config_id, scenario_name, repetition,"
            + " recorded_at, stt_latency_ms, llm_ttfb_ms, llm_completion_ms, tts_ttfb_ms,"
            + " tts_completion_ms, e2e_latency_ms, network_profile, is_success, errors,"
            + " result_json) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        result.id(),
        runId,
        result.configId(),
        result.scenarioName(),
        result.repetition(),
        toTimestamp(result.timestamp()),
        result.sttLatencyMs(),
        result.llmTtfbMs(),
        result.llmCompletionMs(),
        result.ttsTtfbMs(),
        result.ttsCompletionMs(),
        result.e2eLatencyMs(),
        result.networkProfile().getValue(),
        result.isSuccess(),
        write(result.errors()),
        write(result));
  }

  // Baselines

  @Override
  public List<PerformanceBaseline> listBaselines() {
    return jdbc.query(
        "SELECT is_active, baseline_json FROM latency_baselines ORDER BY created_at DESC",
        (rs, i) ->
            read(rs.getString("baseline_json"), PerformanceBaseline.class)
                .withActive(rs.getBoolean("is_active")));
  }

  @Override
  public Optional<PerformanceBaseline> getBaseline(String baselineId) {
    return jdbc
        .query(
            "SELECT is_active, baseline_json FROM latency_baselines WHERE id = ?",
            (rs, i) ->
                read(rs.getString("baseline_json"), PerformanceBaseline.class)
                    .withActive(rs.getBoolean("is_active")),
            baselineId)
        .stream()
        .findFirst();
  }

  @Override
  public void saveBaseline(PerformanceBaseline baseline) {
    var json = write(baseline);
    tx.executeWithoutResult(
        status -> {
          if (baseline.isActive()) {
            jdbc.update("UPDATE latency_baselines SET is_active = FALSE WHERE is_active = TRUE");
          }
          int updated =
              jdbc.update(
                  "UPDATE latency_baselines SET name = ?, description = ?, run_id = ?,"
                      + " is_active = ?, baseline_json = ? WHERE id = ?",
                  baseline.name(),
                  baseline.description(),
                  baseline.runId(),
                  baseline.isActive(),
                  json,
                  baseline.id());
          if (updated == 0) {
            jdbc.update(
                "INSERT INTO latency_baselines"
                    + " (id, name, description, run_id, created_at, is_active, baseline_json)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?)",
                baseline.id(),
                baseline.name(),
                baseline.description(),
                baseline.runId(),
                toTimestamp(
                    baseline.createdAt() == null ? Instant.now() : baseline.createdAt()),
                baseline.isActive(),
                json);
          }
        });
  }

  @Override
  public boolean deleteBaseline(String baselineId) {
    return jdbc.update("DELETE FROM latency_baselines WHERE id = ?", baselineId) > 0;
  }

  @Override
  public Optional<PerformanceBaseline> getActiveBaseline() {
    return jdbc
        .query(
            "SELECT baseline_json FROM latency_baselines WHERE is_active = TRUE",
            (rs, i) -> read(rs.getString(1), PerformanceBaseline.class).withActive(true))
        .stream()
        .findFirst();
  }

  @Override
  public boolean activateBaseline(String baselineId) {
    Boolean activated =
        tx.execute(
            status -> {
              Integer exists =
                  jdbc.queryForObject(
                      "SELECT COUNT(*) FROM latency_baselines WHERE id = ?",
                      Integer.class,
                      baselineId);
              if (exists == null || exists == 0) {
                return false;
              }
              jdbc.update("UPDATE latency_baselines SET is_active = FALSE WHERE is_active = TRUE");
              jdbc.update("UPDATE latency_baselines SET is_active = TRUE WHERE id = ?", baselineId);
              return true;
            });
    return Boolean.TRUE.equals(activated);
  }

  // Mapping

  private static TestRun withStatus(TestRun run, RunStatus status, Instant completedAt) {
    return new TestRun(
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
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new UncheckedIOException("Failed to serialise " + value.getClass().getSimpleName(), ex);
    }
  }

  private <T> T read(String json, Class<T> type) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new UncheckedIOException("Failed to read stored " + type.getSimpleName(), ex);
    }
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
