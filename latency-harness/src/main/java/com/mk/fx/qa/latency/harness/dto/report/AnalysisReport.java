package com.mk.fx.qa.latency.harness.dto.report;

import com.mk.fx.qa.latency.harness.model.RegressionSeverity;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Analysis of one run: summary statistics, configurations ranked by median end-to-end latency,
 * projections under every network profile, regressions against the active baseline and
 * recommendations.
 */
public class AnalysisReport {

  public String runId;
  public String suiteName;
  public Instant generatedAt;

  public Summary summary;
  public List<RankedConfiguration> rankedConfigurations;
  public List<NetworkProjection> networkProjections;
  public String baselineId;
  public List<Regression> regressions;
  public List<String> recommendations;

  public static class Summary {
    public int totalConfigurations;
    public int totalTests;
    public int successfulTests;
    public int failedTests;
    public Double overallMedianE2eMs;
    public Double overallP99E2eMs;
    public Double overallMinE2eMs;
    public Double overallMaxE2eMs;
    public LatencyBreakdown stageMedians;
    public double testDurationMinutes;
  }

  public static class RankedConfiguration {
    public int rank;
    public String configId;
    public String sttProvider;
    public String llmProvider;
    public String llmModel;
    public String ttsProvider;
    public double medianE2eMs;
    public double p99E2eMs;
    public double minE2eMs;
    public double maxE2eMs;
    public double stdDevMs;
    public int sampleCount;
    public LatencyBreakdown breakdown;
    public Map<String, NetworkMeetsTarget> networkProjections;
    public Double estimatedCostPerHour;
  }

  /** Per-stage medians. STT is absent when no sample measured it. */
  public static class LatencyBreakdown {
    public Double sttMs;
    public double llmTtfbMs;
    public double llmCompletionMs;
    public double ttsTtfbMs;
    public double ttsCompletionMs;
  }

  public static class NetworkMeetsTarget {
    public double e2eMs;
    public boolean meets500ms;
    public boolean meets1000ms;
  }

  public static class NetworkProjection {
    public String network;
    public double addedLatencyMs;
    public double projectedMedianMs;
    public double projectedP99Ms;
    public boolean meetsTarget;
    public int configsMeetingTarget;
    public int totalConfigs;
  }

  public static class Regression {
    public String configId;
    public String metric;
    public double baselineValue;
    public double currentValue;
    public double changePercent;
    public RegressionSeverity severity;
  }
}
