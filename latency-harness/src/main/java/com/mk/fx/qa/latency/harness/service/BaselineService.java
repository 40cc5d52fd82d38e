package com.mk.fx.qa.latency.harness.service;

import com.mk.fx.qa.latency.harness.analysis.ResultsAnalyzer;
import com.mk.fx.qa.latency.harness.dto.report.BaselineCheckReport;
import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.storage.LatencyHarnessStorage;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Creates, activates and checks performance baselines. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

  private final LatencyHarnessStorage storage;
  private final LatencyTestOrchestrator orchestrator;
  private final ResultsAnalyzer analyzer;

  /**
   * Snapshots a completed run as a baseline. A blank name defaults to {@code "Baseline from
   * <runId>"}.
   *
   * @throws ResourceNotFoundException if the run is unknown
   * @throws IllegalArgumentException if the run is not completed or has no successful result
   */
  public PerformanceBaseline createBaseline(
      String runId, String name, String description, boolean setActive) {
    var run = orchestrator.getRun(runId);
    if (run.getStatus() != RunStatus.COMPLETED) {
      throw new IllegalArgumentException(
          "Run " + runId + " is " + run.getStatus().getValue() + ", only completed runs qualify");
    }
    if (run.successfulResults().isEmpty()) {
      throw new IllegalArgumentException("Run " + runId + " has no successful results");
    }
    var baseline =
        new PerformanceBaseline(
            UUID.randomUUID().toString(),
            name == null || name.isBlank() ? "Baseline from " + runId : name,
            description,
            runId,
            Instant.now(),
            setActive,
            analyzer.configMetrics(run),
            analyzer.overallMetrics(run));
    storage.saveBaseline(baseline);
    log.info(
        "Baseline {} created from run {} ({} configurations, active={})",
        baseline.id(),
        runId,
        baseline.configMetrics().size(),
        setActive);
    return baseline;
  }

  public List<PerformanceBaseline> listBaselines() {
    return storage.listBaselines();
  }

  public PerformanceBaseline getBaseline(String baselineId) {
    return storage
        .getBaseline(baselineId)
        .orElseThrow(() -> new ResourceNotFoundException("Baseline", baselineId));
  }

  public void deleteBaseline(String baselineId) {
    if (!storage.deleteBaseline(baselineId)) {
      throw new ResourceNotFoundException("Baseline", baselineId);
    }
    log.info("Baseline {} deleted", baselineId);
  }

  /**
   * @throws ResourceNotFoundException when no baseline is active
   */
  public PerformanceBaseline getActiveBaseline() {
    return storage
        .getActiveBaseline()
        .orElseThrow(() -> new ResourceNotFoundException("Baseline", "active"));
  }

  public PerformanceBaseline activateBaseline(String baselineId) {
    if (!storage.activateBaseline(baselineId)) {
      throw new ResourceNotFoundException("Baseline", baselineId);
    }
    log.info("Baseline {} activated", baselineId);
    return getBaseline(baselineId);
  }

  public BaselineCheckReport checkBaseline(String baselineId, String runId) {
    var baseline = getBaseline(baselineId);
    return analyzer.checkBaseline(baseline, orchestrator.getRun(runId));
  }
}
