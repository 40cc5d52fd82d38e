package com.mk.fx.qa.latency.harness.storage;

import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestResult;
import com.mk.fx.qa.latency.harness.model.TestRun;
import com.mk.fx.qa.latency.harness.model.TestSuiteDefinition;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for suites, runs, results and baselines. Implementations must be safe for
 * concurrent use and must apply baseline activation atomically: no reader may observe two active
 * baselines.
 */
public interface LatencyHarnessStorage {

  // Suites

  List<TestSuiteDefinition> listSuites();

  Optional<TestSuiteDefinition> getSuite(String suiteId);

  void saveSuite(TestSuiteDefinition suite);

  /** Returns false when no such suite exists. */
  boolean deleteSuite(String suiteId);

  // Runs

  /**
   * Runs ordered by start time, most recent first.
   *
   * @param status optional status filter
   * @param suiteId optional suite filter
   */
  RunPage listRuns(RunStatus status, String suiteId, int limit, int offset);

  /** The run with every result stored for it. */
  Optional<TestRun> getRun(String runId);

  /** Stores run metadata. Results are written through {@link #saveResult}. */
  void saveRun(TestRun run);

  boolean updateRunStatus(String runId, RunStatus status, Instant completedAt);

  boolean deleteRun(String runId);

  // Results

  void saveResult(String runId, TestResult result);

  /**
   * @param configId optional config_id filter
   * @param limit optional maximum number of results, in storage order
   */
  List<TestResult> getResults(String runId, String configId, Integer limit);

  // Baselines

  List<PerformanceBaseline> listBaselines();

  Optional<PerformanceBaseline> getBaseline(String baselineId);

  /** Stores a baseline; when it is active every other baseline is deactivated in the same step. */
  void saveBaseline(PerformanceBaseline baseline);

  boolean deleteBaseline(String baselineId);

  Optional<PerformanceBaseline> getActiveBaseline();

  /** Makes {@code baselineId} the only active baseline. Returns false if it does not exist. */
  boolean activateBaseline(String baselineId);
}
