package com.mk.fx.qa.latency.harness.analysis;

import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import com.mk.fx.qa.latency.harness.dto.report.AnalysisReport;
import com.mk.fx.qa.latency.harness.dto.report.BaselineCheckReport;
import com.mk.fx.qa.latency.harness.dto.report.RunComparisonReport;
import com.mk.fx.qa.latency.harness.model.BaselineMetrics;
import com.mk.fx.qa.latency.harness.model.NetworkProfile;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.model.RegressionSeverity;
import com.mk.fx.qa.latency.harness.model.TestResult;
import com.mk.fx.qa.latency.harness.model.TestRun;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a run's results into rankings, projections, baseline metrics and comparisons. Only
 * successful results feed any latency figure; failed results are counted and nothing more.
 */
@Component
@RequiredArgsConstructor
public class ResultsAnalyzer {

  static final double TARGET_500_MS = 500.0;
  static final double TARGET_1000_MS = 1000.0;
  static final double IMPROVED_BELOW_PERCENT = -5.0;
  static final double REGRESSED_ABOVE_PERCENT = 10.0;
  static final double HIGH_VARIANCE_RATIO = 0.30;
  static final double FAILURE_RATE_THRESHOLD = 0.05;

  static final String METRIC_E2E_MEDIAN = "e2e_median_ms";
  static final String METRIC_E2E_P99 = "e2e_p99_ms";

  private final HarnessCfg properties;

  // -------------------------------------------------------------------------
  // Ranking
  // -------------------------------------------------------------------------

  /** Successful results grouped by config_id, ranked by ascending median end-to-end latency. */
  public List<AnalysisReport.RankedConfiguration> rankConfigurations(TestRun run) {
    List<AnalysisReport.RankedConfiguration> ranked = new ArrayList<>();
    for (Map.Entry<String, List<TestResult>> group : groupByConfig(run.successfulResults())) {
      ranked.add(rank(group.getKey(), group.getValue()));
    }
    ranked.sort(
        Comparator.comparingDouble((AnalysisReport.RankedConfiguration c) -> c.medianE2eMs)
            .thenComparing(c -> c.configId));
    for (int i = 0; i < ranked.size(); i++) {
      ranked.get(i).rank = i + 1;
    }
    return ranked;
  }

  private AnalysisReport.RankedConfiguration rank(String configId, List<TestResult> results) {
    var first = results.get(0);
    List<Double> e2e = values(results, TestResult::e2eLatencyMs);
    var c = new AnalysisReport.RankedConfiguration();
    c.configId = configId;
    c.sttProvider = first.sttConfig() != null ? first.sttConfig().provider() : null;
    c.llmProvider = first.llmConfig() != null ? first.llmConfig().provider() : null;
    c.llmModel = first.llmConfig() != null ? first.llmConfig().model() : null;
    c.ttsProvider = first.ttsConfig() != null ? first.ttsConfig().provider() : null;
    c.medianE2eMs = LatencyStatistics.median(e2e);
    c.p99E2eMs = LatencyStatistics.p99(e2e);
    c.minE2eMs = LatencyStatistics.min(e2e);
    c.maxE2eMs = LatencyStatistics.max(e2e);
    c.stdDevMs = LatencyStatistics.stdDev(e2e);
    c.sampleCount = results.size();
    c.breakdown = stageMedians(results);

    int networkStages = NetworkProjector.networkStageCount(first);
    Map<String, AnalysisReport.NetworkMeetsTarget> projections = new LinkedHashMap<>();
    for (NetworkProfile profile : NetworkProfile.values()) {
      var p = new AnalysisReport.NetworkMeetsTarget();
      p.e2eMs = NetworkProjector.project(c.medianE2eMs, networkStages, profile);
      p.meets500ms = p.e2eMs < TARGET_500_MS;
      p.meets1000ms = p.e2eMs < TARGET_1000_MS;
      projections.put(profile.getValue(), p);
    }
    c.networkProjections = projections;
    c.estimatedCostPerHour = estimateCostPerHour(c.sttProvider, c.llmProvider, c.ttsProvider);
    return c;
  }

  /** Sum of the configured hourly rates of the three providers, or null when none is priced. */
  Double estimateCostPerHour(String... providers) {
    Map<String, Double> rates = properties.getAnalysis().getProviderCostPerHour();
    double total = 0.0;
    boolean priced = false;
    for (String provider : providers) {
      if (provider != null && rates.containsKey(provider)) {
        total += rates.get(provider);
        priced = true;
      }
    }
    return priced ? LatencyStatistics.round2(total) : null;
  }

  // -------------------------------------------------------------------------
  // Full report
  // -------------------------------------------------------------------------

  /**
   * Builds the analysis report.
   *
   * @param baseline baseline to detect regressions against, or null to skip regression detection
   */
  public AnalysisReport analyze(TestRun run, PerformanceBaseline baseline) {
    var report = new AnalysisReport();
    report.runId = run.getId();
    report.suiteName = run.getSuiteName();
    report.generatedAt = Instant.now();

    var ranked = rankConfigurations(run);
    report.summary = summarize(run, ranked.size());
    report.rankedConfigurations = ranked;
    report.networkProjections = projectProfiles(ranked);
    if (baseline != null) {
      report.baselineId = baseline.id();
      report.regressions = detectRegressions(baseline, ranked);
    } else {
      report.regressions = List.of();
    }
    report.recommendations = recommend(run, report);
    return report;
  }

  private AnalysisReport.Summary summarize(TestRun run, int configCount) {
    var all = run.getResults();
    var successful = run.successfulResults();
    var s = new AnalysisReport.Summary();
    s.totalConfigurations = configCount;
    s.totalTests = all.size();
    s.successfulTests = successful.size();
    s.failedTests = all.size() - successful.size();
    if (!successful.isEmpty()) {
      List<Double> e2e = values(successful, TestResult::e2eLatencyMs);
      s.overallMedianE2eMs = LatencyStatistics.median(e2e);
      s.overallP99E2eMs = LatencyStatistics.p99(e2e);
      s.overallMinE2eMs = LatencyStatistics.min(e2e);
      s.overallMaxE2eMs = LatencyStatistics.max(e2e);
      s.stageMedians = stageMedians(successful);
    }
    s.testDurationMinutes = LatencyStatistics.round2(run.getElapsedTimeSeconds() / 60.0);
    return s;
  }

  private List<AnalysisReport.NetworkProjection> projectProfiles(
      List<AnalysisReport.RankedConfiguration> ranked) {
    if (ranked.isEmpty()) {
      return List.of();
    }
    double target = properties.getAnalysis().getLatencyTargetMs();
    List<AnalysisReport.NetworkProjection> projections = new ArrayList<>();
    for (NetworkProfile profile : NetworkProfile.values()) {
      List<Double> medians = new ArrayList<>();
      List<Double> p99s = new ArrayList<>();
      int meeting = 0;
      for (AnalysisReport.RankedConfiguration c : ranked) {
        double added = c.networkProjections.get(profile.getValue()).e2eMs - c.medianE2eMs;
        double median = c.medianE2eMs + added;
        medians.add(median);
        p99s.add(c.p99E2eMs + added);
        if (median < target) {
          meeting++;
        }
      }
      var p = new AnalysisReport.NetworkProjection();
      p.network = profile.getValue();
      p.addedLatencyMs = profile.getAddedLatencyMs();
      p.projectedMedianMs = LatencyStatistics.median(medians);
      p.projectedP99Ms = LatencyStatistics.p99(p99s);
      p.meetsTarget = p.projectedMedianMs < target;
      p.configsMeetingTarget = meeting;
      p.totalConfigs = ranked.size();
      projections.add(p);
    }
    return projections;
  }

  private List<AnalysisReport.Regression> detectRegressions(
      PerformanceBaseline baseline, List<AnalysisReport.RankedConfiguration> ranked) {
    List<AnalysisReport.Regression> regressions = new ArrayList<>();
    for (AnalysisReport.RankedConfiguration c : ranked) {
      var reference = baseline.configMetrics().get(c.configId);
      if (reference == null) {
        continue;
      }
      addRegression(
          regressions, c.configId, METRIC_E2E_MEDIAN, reference.medianE2eMs(), c.medianE2eMs);
      addRegression(
          regressions, c.configId, METRIC_E2E_P99, reference.p99E2eMs(), c.p99E2eMs);
    }
    regressions.sort(
        Comparator.comparingDouble((AnalysisReport.Regression r) -> r.changePercent).reversed());
    return regressions;
  }

  private static void addRegression(
      List<AnalysisReport.Regression> sink,
      String configId,
      String metric,
      double baselineValue,
      double currentValue) {
    if (baselineValue <= 0.0) {
      return;
    }
    double change = LatencyStatistics.changePercent(baselineValue, currentValue);
    var severity = RegressionSeverity.classify(change);
    if (severity == RegressionSeverity.NONE) {
      return;
    }
    var r = new AnalysisReport.Regression();
    r.configId = configId;
    r.metric = metric;
    r.baselineValue = baselineValue;
    r.currentValue = currentValue;
    r.changePercent = change;
    r.severity = severity;
    sink.add(r);
  }

  private List<String> recommend(TestRun run, AnalysisReport report) {
    List<String> out = new ArrayList<>();
    var ranked = report.rankedConfigurations;
    if (ranked.isEmpty()) {
      out.add("No successful results to analyse; check client connectivity and provider errors.");
      return out;
    }
    var best = ranked.get(0);
    out.add(
        String.format(
            "Best configuration: %s with median %.1f ms (p99 %.1f ms).",
            best.configId, best.medianE2eMs, best.p99E2eMs));

    double target = properties.getAnalysis().getLatencyTargetMs();
    List<String> meeting =
        report.networkProjections.stream()
            .filter(p -> p.meetsTarget)
            .map(p -> p.network)
            .toList();
    if (meeting.isEmpty()) {
      out.add(
          String.format(
              "No network profile meets the %.0f ms median target; prefer on-device stages.",
              target));
    } else {
      out.add(
          String.format(
              "Median target of %.0f ms is met on: %s.", target, String.join(", ", meeting)));
    }

    for (AnalysisReport.RankedConfiguration c : ranked) {
      if (c.sampleCount > 1 && c.stdDevMs > HIGH_VARIANCE_RATIO * c.medianE2eMs) {
        out.add(
            String.format(
                "%s shows high variance: stddev %.1f ms is over 30%% of its %.1f ms median.",
                c.configId, c.stdDevMs, c.medianE2eMs));
      }
    }

    var summary = report.summary;
    if (summary.totalTests > 0) {
      double failureRate = (double) summary.failedTests / summary.totalTests;
      if (failureRate > FAILURE_RATE_THRESHOLD) {
        out.add(
            String.format(
                "Failure rate is %.1f%% (%d of %d tests); investigate errors on client %s.",
                failureRate * 100.0, summary.failedTests, summary.totalTests, run.getClientId()));
      }
    }
    return out;
  }

  // -------------------------------------------------------------------------
  // Baselines
  // -------------------------------------------------------------------------

  /** Per config_id metrics over the successful results of {@code run}. */
  public Map<String, BaselineMetrics> configMetrics(TestRun run) {
    Map<String, BaselineMetrics> metrics = new LinkedHashMap<>();
    for (Map.Entry<String, List<TestResult>> group : groupByConfig(run.successfulResults())) {
      metrics.put(group.getKey(), metricsOf(group.getValue()));
    }
    return metrics;
  }

  /** Metrics across every successful result of {@code run}. */
  public BaselineMetrics overallMetrics(TestRun run) {
    return metricsOf(run.successfulResults());
  }

  static BaselineMetrics metricsOf(List<TestResult> results) {
    List<Double> e2e = values(results, TestResult::e2eLatencyMs);
    var stages = stageMedians(results);
    return new BaselineMetrics(
        LatencyStatistics.median(e2e),
        LatencyStatistics.p99(e2e),
        LatencyStatistics.min(e2e),
        LatencyStatistics.max(e2e),
        stages.sttMs,
        stages.llmTtfbMs,
        stages.llmCompletionMs,
        stages.ttsTtfbMs,
        stages.ttsCompletionMs,
        results.size());
  }

  /**
   * Compares the run's per-config medians with the baseline's. Comparisons are ordered by change
   * percent descending with configurations unknown to the baseline last.
   */
  public BaselineCheckReport checkBaseline(PerformanceBaseline baseline, TestRun run) {
    var report = new BaselineCheckReport();
    report.baselineId = baseline.id();
    report.baselineName = baseline.name();
    report.runId = run.getId();
    report.checkedAt = Instant.now();

    List<BaselineCheckReport.ConfigComparison> comparisons = new ArrayList<>();
    for (Map.Entry<String, List<TestResult>> group : groupByConfig(run.successfulResults())) {
      double current =
          LatencyStatistics.median(values(group.getValue(), TestResult::e2eLatencyMs));
      var c = new BaselineCheckReport.ConfigComparison();
      c.configId = group.getKey();
      c.currentMedianMs = current;
      var reference = baseline.configMetrics().get(group.getKey());
      if (reference == null) {
        c.note = "Configuration not in baseline";
      } else if (reference.medianE2eMs() <= 0.0) {
        c.baselineMedianMs = reference.medianE2eMs();
        c.note = "Baseline median is zero, change not computed";
      } else {
        double change = LatencyStatistics.changePercent(reference.medianE2eMs(), current);
        c.baselineMedianMs = reference.medianE2eMs();
        c.changePercent = change;
        c.improved = change < IMPROVED_BELOW_PERCENT;
        c.regressed = change > REGRESSED_ABOVE_PERCENT;
        c.severity = RegressionSeverity.classify(change);
      }
      comparisons.add(c);
    }
    comparisons.sort(
        Comparator.comparing(
            (BaselineCheckReport.ConfigComparison c) -> c.changePercent,
            Comparator.nullsLast(Comparator.<Double>reverseOrder())));
    report.configComparisons = comparisons;

    var overall = new BaselineCheckReport.Overall();
    var successful = run.successfulResults();
    if (!successful.isEmpty()) {
      overall.currentMedianMs =
          LatencyStatistics.median(values(successful, TestResult::e2eLatencyMs));
      overall.meetsTarget500ms = overall.currentMedianMs < TARGET_500_MS;
      overall.meetsTarget1000ms = overall.currentMedianMs < TARGET_1000_MS;
    }
    if (baseline.overallMetrics() != null) {
      overall.baselineMedianMs = baseline.overallMetrics().medianE2eMs();
    }
    if (overall.currentMedianMs != null
        && overall.baselineMedianMs != null
        && overall.baselineMedianMs > 0.0) {
      overall.changePercent =
          LatencyStatistics.changePercent(overall.baselineMedianMs, overall.currentMedianMs);
      overall.improved = overall.changePercent < IMPROVED_BELOW_PERCENT;
      overall.regressed = overall.changePercent > REGRESSED_ABOVE_PERCENT;
    }
    report.overall = overall;
    report.regressions = detectRegressions(baseline, rankConfigurations(run));

    var summary = new BaselineCheckReport.Summary();
    summary.totalConfigs = comparisons.size();
    summary.improvedConfigs = (int) comparisons.stream().filter(c -> c.improved).count();
    summary.regressedConfigs = (int) comparisons.stream().filter(c -> c.regressed).count();
    summary.newConfigs =
        (int) comparisons.stream().filter(c -> c.baselineMedianMs == null).count();
    report.summary = summary;
    return report;
  }

  // -------------------------------------------------------------------------
  // Run comparison
  // -------------------------------------------------------------------------

  public RunComparisonReport compareRuns(TestRun run1, TestRun run2) {
    var report = new RunComparisonReport();
    report.run1Id = run1.getId();
    report.run2Id = run2.getId();

    Map<String, Double> medians1 = configMedians(run1);
    Map<String, Double> medians2 = configMedians(run2);
    List<RunComparisonReport.ConfigDelta> deltas = new ArrayList<>();
    for (Map.Entry<String, Double> entry : medians1.entrySet()) {
      Double other = medians2.get(entry.getKey());
      if (other == null || entry.getValue() <= 0.0) {
        continue;
      }
      var d = new RunComparisonReport.ConfigDelta();
      d.configId = entry.getKey();
      d.run1MedianMs = entry.getValue();
      d.run2MedianMs = other;
      d.changePercent = LatencyStatistics.changePercent(entry.getValue(), other);
      deltas.add(d);
    }
    deltas.sort(
        Comparator.comparingDouble((RunComparisonReport.ConfigDelta d) -> d.changePercent)
            .reversed());
    report.configComparisons = deltas;
    report.onlyInRun1 =
        medians1.keySet().stream().filter(id -> !medians2.containsKey(id)).sorted().toList();
    report.onlyInRun2 =
        medians2.keySet().stream().filter(id -> !medians1.containsKey(id)).sorted().toList();

    report.run1OverallMedianMs = overallMedian(run1);
    report.run2OverallMedianMs = overallMedian(run2);
    if (report.run1OverallMedianMs != null
        && report.run2OverallMedianMs != null
        && report.run1OverallMedianMs > 0.0) {
      report.overallChangePercent =
          LatencyStatistics.changePercent(report.run1OverallMedianMs, report.run2OverallMedianMs);
    }
    return report;
  }

  private static Map<String, Double> configMedians(TestRun run) {
    Map<String, Double> medians = new LinkedHashMap<>();
    for (Map.Entry<String, List<TestResult>> group : groupByConfig(run.successfulResults())) {
      medians.put(
          group.getKey(),
          LatencyStatistics.median(values(group.getValue(), TestResult::e2eLatencyMs)));
    }
    return medians;
  }

  private static Double overallMedian(TestRun run) {
    var successful = run.successfulResults();
    return successful.isEmpty()
        ? null
        : LatencyStatistics.median(values(successful, TestResult::e2eLatencyMs));
  }

  // -------------------------------------------------------------------------
  // Helpers
  // -------------------------------------------------------------------------

  private static List<Map.Entry<String, List<TestResult>>> groupByConfig(
      List<TestResult> results) {
    Map<String, List<TestResult>> groups =
        results.stream()
            .collect(
                Collectors.groupingBy(
                    TestResult::configId, LinkedHashMap::new, Collectors.toList()));
    return new ArrayList<>(groups.entrySet());
  }

  private static AnalysisReport.LatencyBreakdown stageMedians(List<TestResult> results) {
    var b = new AnalysisReport.LatencyBreakdown();
    List<Double> stt =
        results.stream().map(TestResult::sttLatencyMs).filter(Objects::nonNull).toList();
    b.sttMs = stt.isEmpty() ? null : LatencyStatistics.median(stt);
    b.llmTtfbMs = LatencyStatistics.median(values(results, TestResult::llmTtfbMs));
    b.llmCompletionMs = LatencyStatistics.median(values(results, TestResult::llmCompletionMs));
    b.ttsTtfbMs = LatencyStatistics.median(values(results, TestResult::ttsTtfbMs));
    b.ttsCompletionMs = LatencyStatistics.median(values(results, TestResult::ttsCompletionMs));
    return b;
  }

  private static List<Double> values(List<TestResult> results, ToDoubleFunction<TestResult> f) {
    return results.stream().map(r -> (Double) f.applyAsDouble(r)).toList();
  }
}
