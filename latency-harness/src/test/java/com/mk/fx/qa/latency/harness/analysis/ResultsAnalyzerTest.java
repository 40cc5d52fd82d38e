package com.mk.fx.qa.latency.harness.analysis;

import static com.mk.fx.qa.latency.harness.LatencyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import com.mk.fx.qa.latency.harness.model.BaselineMetrics;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.model.RegressionSeverity;
import com.mk.fx.qa.latency.harness.model.TestConfiguration;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultsAnalyzerTest {

  private static final String CLOUD_ID =
      TestConfiguration.configIdOf(DEEPGRAM, ANTHROPIC, CHATTERBOX);
  private static final String ON_DEVICE_ID =
      TestConfiguration.configIdOf(APPLE_STT, MLX, APPLE_TTS);
  private static final String HYBRID_ID =
      TestConfiguration.configIdOf(APPLE_STT, ANTHROPIC, APPLE_TTS);

  private HarnessCfg cfg;
  private ResultsAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    cfg = new HarnessCfg();
    analyzer = new ResultsAnalyzer(cfg);
  }

  private static BaselineMetrics metrics(double median, double p99) {
    return new BaselineMetrics(median, p99, median, p99, null, 0, 0, 0, 0, 5);
  }

  private static PerformanceBaseline baseline(Map<String, BaselineMetrics> perConfig) {
    return new PerformanceBaseline(
        "b-1", "Nightly", null, "run-0", Instant.now(), true, perConfig, metrics(100, 100));
  }

  private static List<TestResult> repeated(TestResult template, double... e2e) {
    List<TestResult> out = new ArrayList<>();
    for (double value : e2e) {
      out.add(template.toBuilder().id(null).e2eLatencyMs(value).build());
    }
    return out;
  }

  // -----------------------------------------------------
  // Ranking and report
  // -----------------------------------------------------

  @Test
  void rankConfigurations_ordersByMedianAndSkipsFailures() {
    List<TestResult> results = new ArrayList<>();
    results.addAll(repeated(success(400), 400, 420, 410, 430));
    results.addAll(repeated(success(APPLE_STT, MLX, APPLE_TTS, 300), 300, 310));
    results.add(success(1).toBuilder().errors(List.of("timeout")).build());

    var ranked = analyzer.rankConfigurations(completedRun("run-1", results));

    assertEquals(2, ranked.size());
    assertEquals(ON_DEVICE_ID, ranked.get(0).configId);
    assertEquals(1, ranked.get(0).rank);
    assertEquals(305.0, ranked.get(0).medianE2eMs, 1e-9);
    assertEquals(CLOUD_ID, ranked.get(1).configId);
    assertEquals(2, ranked.get(1).rank);
    assertEquals(4, ranked.get(1).sampleCount);
    assertEquals(415.0, ranked.get(1).medianE2eMs, 1e-9);
  }

  @Test
  void rankConfigurations_projectsOnlyNetworkStages() {
    var run = completedRun("run-1", repeated(success(APPLE_STT, MLX, APPLE_TTS, 450), 450));

    var ranked = analyzer.rankConfigurations(run).get(0);

    ranked.networkProjections.values().forEach(p -> assertEquals(450.0, p.e2eMs, 1e-9));
    assertTrue(ranked.networkProjections.get("intercontinental").meets500ms);
  }

  @Test
  void analyze_singleConfigurationRepeated_reportsOneRankedEntry() {
    var run = completedRun("run-1", repeated(success(300), 300, 320, 340, 360));

    var report = analyzer.analyze(run, null);

    assertEquals("run-1", report.runId);
    assertEquals(1, report.rankedConfigurations.size());
    assertEquals(4, report.rankedConfigurations.get(0).sampleCount);
    assertEquals(4, report.summary.totalTests);
    assertEquals(0, report.summary.failedTests);
    assertEquals(330.0, report.summary.overallMedianE2eMs, 1e-9);
    assertEquals(1.5, report.summary.testDurationMinutes, 1e-9);
    assertTrue(report.regressions.isEmpty());
    assertNull(report.baselineId);
    assertTrue(report.recommendations.get(0).startsWith("Best configuration: " + CLOUD_ID));
  }

  @Test
  void analyze_networkProjectionsUseConfiguredTarget() {
    // 300 ms cloud pipeline: +30 on wifi, +150 on cellular_us
    var run = completedRun("run-1", repeated(success(300), 300));
    cfg.getAnalysis().setLatencyTargetMs(400);

    var report = analyzer.analyze(run, null);

    var wifi = report.networkProjections.get(1);
    var cellular = report.networkProjections.get(2);
    assertEquals("wifi", wifi.network);
    assertEquals(330.0, wifi.projectedMedianMs, 1e-9);
    assertTrue(wifi.meetsTarget);
    assertEquals(1, wifi.configsMeetingTarget);
    assertEquals(450.0, cellular.projectedMedianMs, 1e-9);
    assertFalse(cellular.meetsTarget);
  }

  @Test
  void analyze_noSuccessfulResults_recommendsConnectivityCheck() {
    var failed = success(1).toBuilder().errors(List.of("provider down")).build();

    var report = analyzer.analyze(completedRun("run-1", List.of(failed)), null);

    assertTrue(report.rankedConfigurations.isEmpty());
    assertEquals(1, report.summary.failedTests);
    assertNull(report.summary.overallMedianE2eMs);
    assertEquals(1, report.recommendations.size());
  }

  @Test
  void analyze_highVarianceAndFailureRate_areRecommended() {
    List<TestResult> results = new ArrayList<>(repeated(success(100), 100, 100, 400, 400));
    results.add(success(1).toBuilder().errors(List.of("timeout")).build());

    var report = analyzer.analyze(completedRun("run-1", results), null);

    assertTrue(report.recommendations.stream().anyMatch(r -> r.contains("high variance")));
    assertTrue(report.recommendations.stream().anyMatch(r -> r.startsWith("Failure rate")));
  }

  @Test
  void estimateCostPerHour_sumsPricedProviders() {
    cfg.getAnalysis().setProviderCostPerHour(Map.of("deepgram", 0.26, "anthropic", 1.2));

    assertEquals(1.46, analyzer.estimateCostPerHour("deepgram", "anthropic", "chatterbox"), 1e-9);
    assertNull(analyzer.estimateCostPerHour("apple", "mlx", "apple"));
  }

  // -----------------------------------------------------
  // Regressions and baselines
  // -----------------------------------------------------

  @Test
  void analyze_withBaseline_flagsSevereRegression() {
    var run = completedRun("run-1", repeated(success(151), 151, 151, 151));

    var report = analyzer.analyze(run, baseline(Map.of(CLOUD_ID, metrics(100, 100))));

    assertEquals("b-1", report.baselineId);
    assertEquals(2, report.regressions.size());
    var median =
        report.regressions.stream()
            .filter(r -> r.metric.equals(ResultsAnalyzer.METRIC_E2E_MEDIAN))
            .findFirst()
            .orElseThrow();
    assertEquals(51.0, median.changePercent, 1e-9);
    assertEquals(RegressionSeverity.SEVERE, median.severity);
  }

  @Test
  void analyze_withBaseline_smallChangesAreNotRegressions() {
    var run = completedRun("run-1", repeated(success(108), 108));

    var report = analyzer.analyze(run, baseline(Map.of(CLOUD_ID, metrics(100, 100))));

    assertTrue(report.regressions.isEmpty());
  }

  @Test
  void regressionSeverity_classifiesThresholds() {
    assertEquals(RegressionSeverity.NONE, RegressionSeverity.classify(10.0));
    assertEquals(RegressionSeverity.MINOR, RegressionSeverity.classify(10.5));
    assertEquals(RegressionSeverity.MODERATE, RegressionSeverity.classify(21.0));
    assertEquals(RegressionSeverity.SEVERE, RegressionSeverity.classify(51.0));
  }

  @Test
  void checkBaseline_ordersRegressedFirstAndNewConfigsLast() {
    List<TestResult> results = new ArrayList<>();
    results.addAll(repeated(success(94), 94));
    results.addAll(repeated(success(APPLE_STT, ANTHROPIC, APPLE_TTS, 115), 115));
    results.addAll(repeated(success(APPLE_STT, MLX, APPLE_TTS, 80), 80));
    var reference =
        baseline(Map.of(CLOUD_ID, metrics(100, 100), HYBRID_ID, metrics(100, 100)));

    var report = analyzer.checkBaseline(reference, completedRun("run-2", results));

    var comparisons = report.configComparisons;
    assertEquals(
        List.of(HYBRID_ID, CLOUD_ID, ON_DEVICE_ID),
        comparisons.stream().map(c -> c.configId).toList());
    assertTrue(comparisons.get(0).regressed);
    assertEquals(RegressionSeverity.MINOR, comparisons.get(0).severity);
    assertTrue(comparisons.get(1).improved);
    assertEquals(-6.0, comparisons.get(1).changePercent, 1e-9);
    assertNull(comparisons.get(2).changePercent);
    assertEquals("Configuration not in baseline", comparisons.get(2).note);

    assertEquals(3, report.summary.totalConfigs);
    assertEquals(1, report.summary.improvedConfigs);
    assertEquals(1, report.summary.regressedConfigs);
    assertEquals(1, report.summary.newConfigs);
    assertEquals(94.0, report.overall.currentMedianMs, 1e-9);
    assertTrue(report.overall.meetsTarget500ms);
    assertTrue(report.overall.improved);
  }

  @Test
  void checkBaseline_zeroBaselineMedian_isComparedButNotNew() {
    var results = repeated(success(94), 94, 96);
    var reference = baseline(Map.of(CLOUD_ID, metrics(0, 0)));

    var report = analyzer.checkBaseline(reference, completedRun("run-2", results));

    var comparison = report.configComparisons.get(0);
    assertEquals(0.0, comparison.baselineMedianMs, 1e-9);
    assertNull(comparison.changePercent);
    assertFalse(comparison.regressed);
    assertEquals("Baseline median is zero, change not computed", comparison.note);
    assertEquals(1, report.summary.totalConfigs);
    assertEquals(0, report.summary.newConfigs);
  }

  @Test
  void configMetrics_aggregatesPerConfigId() {
    List<TestResult> results = new ArrayList<>(repeated(success(200), 200, 300, 400));
    results.addAll(repeated(success(APPLE_STT, MLX, APPLE_TTS, 90), 90));

    var metrics = analyzer.configMetrics(completedRun("run-1", results));
    var overall = analyzer.overallMetrics(completedRun("run-1", results));

    assertEquals(2, metrics.size());
    assertEquals(300.0, metrics.get(CLOUD_ID).medianE2eMs(), 1e-9);
    assertEquals(3, metrics.get(CLOUD_ID).sampleCount());
    assertEquals(4, overall.sampleCount());
    assertEquals(90.0, overall.minE2eMs(), 1e-9);
  }

  // -----------------------------------------------------
  // Run comparison
  // -----------------------------------------------------

  @Test
  void compareRuns_reportsSharedDeltasAndOneSidedConfigs() {
    List<TestResult> first = new ArrayList<>(repeated(success(100), 100));
    first.addAll(repeated(success(APPLE_STT, MLX, APPLE_TTS, 50), 50));
    List<TestResult> second = new ArrayList<>(repeated(success(120), 120));
    second.addAll(repeated(success(APPLE_STT, ANTHROPIC, APPLE_TTS, 70), 70));

    var report =
        analyzer.compareRuns(completedRun("run-1", first), completedRun("run-2", second));

    assertEquals(1, report.configComparisons.size());
    assertEquals(CLOUD_ID, report.configComparisons.get(0).configId);
    assertEquals(20.0, report.configComparisons.get(0).changePercent, 1e-9);
    assertEquals(List.of(ON_DEVICE_ID), report.onlyInRun1);
    assertEquals(List.of(HYBRID_ID), report.onlyInRun2);
    assertEquals(75.0, report.run1OverallMedianMs, 1e-9);
    assertEquals(95.0, report.run2OverallMedianMs, 1e-9);
    assertEquals(26.67, report.overallChangePercent, 1e-9);
  }
}
