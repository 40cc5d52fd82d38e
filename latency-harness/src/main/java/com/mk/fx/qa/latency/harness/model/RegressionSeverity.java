package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of a median latency increase relative to a baseline. */
public enum RegressionSeverity {
  NONE("none"),
  MINOR("minor"),
  MODERATE("moderate"),
  SEVERE("severe");

  private final String value;

  RegressionSeverity(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Classifies a change percentage: above 50 is severe, above 20 moderate, above 10 minor.
   *
   * @param changePercent relative change of the current median against the baseline median
   */
  public static RegressionSeverity classify(double changePercent) {
    if (changePercent > 50) {
      return SEVERE;
    }
    if (changePercent > 20) {
      return MODERATE;
    }
    if (changePercent > 10) {
      return MINOR;
    }
    return NONE;
  }
}
