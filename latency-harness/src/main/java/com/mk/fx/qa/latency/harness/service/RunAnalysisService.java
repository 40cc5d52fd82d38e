package com.mk.fx.qa.latency.harness.service;

import com.mk.fx.qa.latency.harness.analysis.ResultsAnalyzer;
import com.mk.fx.qa.latency.harness.analysis.ResultsExporter;
import com.mk.fx.qa.latency.harness.dto.report.AnalysisReport;
import com.mk.fx.qa.latency.harness.dto.report.RunComparisonReport;
import com.mk.fx.qa.latency.harness.storage.LatencyHarnessStorage;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Read-only views over a run's results: analysis, comparison and export. */
@Service
@RequiredArgsConstructor
public class RunAnalysisService {

  private final LatencyHarnessStorage storage;
  private final LatencyTestOrchestrator orchestrator;
  private final ResultsAnalyzer analyzer;
  private final ResultsExporter exporter;

  /** Analysis of a run, with regressions against the active baseline when there is one. */
  public AnalysisReport analyze(String runId) {
    var run = orchestrator.getRun(runId);
    return analyzer.analyze(run, storage.getActiveBaseline().orElse(null));
  }

  public RunComparisonReport compareRuns(String run1Id, String run2Id) {
    return analyzer.compareRuns(orchestrator.getRun(run1Id), orchestrator.getRun(run2Id));
  }

  public String exportCsv(String runId) {
    return exporter.toCsv(orchestrator.getRun(runId));
  }

  public Map<String, Object> exportJson(String runId) {
    return exporter.toJsonDocument(orchestrator.getRun(runId));
  }
}
