package com.mk.fx.qa.latency.harness.dto.report;

import java.util.List;

/**
 * Side-by-side medians of two runs. Change percentages are relative to {@code run1}, so a
 * positive value means {@code run2} is slower.
 */
public class RunComparisonReport {

  public String run1Id;
  public String run2Id;

  public Double run1OverallMedianMs;
  public Double run2OverallMedianMs;
  public Double overallChangePercent;

  public List<ConfigDelta> configComparisons;
  public List<String> onlyInRun1;
  public List<String> onlyInRun2;

  public static class ConfigDelta {
    public String configId;
    public double run1MedianMs;
    public double run2MedianMs;
    public double changePercent;
  }
}
