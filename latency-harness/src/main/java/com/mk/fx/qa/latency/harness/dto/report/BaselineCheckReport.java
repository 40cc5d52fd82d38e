package com.mk.fx.qa.latency.harness.dto.report;

import com.mk.fx.qa.latency.harness.model.RegressionSeverity;
import java.time.Instant;
import java.util.List;

/** Outcome of checking a run against a stored baseline. */
public class BaselineCheckReport {

  public String baselineId;
  public String baselineName;
  public String runId;
  public Instant checkedAt;

  public Overall overall;
  public List<AnalysisReport.Regression> regressions;
  public List<ConfigComparison> configComparisons;
  public Summary summary;

  public static class Overall {
    public Double baselineMedianMs;
    public Double currentMedianMs;
    public Double changePercent;
    public boolean improved;
    public boolean regressed;
    public boolean meetsTarget500ms;
    public boolean meetsTarget1000ms;
  }

  public static class ConfigComparison {
    public String configId;
    public Double baselineMedianMs;
    public double currentMedianMs;
    public Double changePercent;
    public boolean improved;
    public boolean regressed;
    // null for configurations the baseline does not know
    public RegressionSeverity severity;
    public String note;
  }

  public static class Summary {
    public int totalConfigs;
    public int improvedConfigs;
    public int regressedConfigs;
    public int newConfigs;
  }
}
