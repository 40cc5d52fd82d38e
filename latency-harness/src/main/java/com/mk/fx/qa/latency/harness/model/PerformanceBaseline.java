package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * Stored snapshot of a completed run's latency figures, used as the regression reference. At most
 * one baseline is active at a time.
 */
public record PerformanceBaseline(
    String id,
    String name,
    String description,
    String runId,
    Instant createdAt,
    @JsonProperty("isActive") boolean isActive,
    Map<String, BaselineMetrics> configMetrics,
    BaselineMetrics overallMetrics) {

  public PerformanceBaseline {
    configMetrics = configMetrics == null ? Map.of() : Map.copyOf(configMetrics);
  }

  public PerformanceBaseline withActive(boolean active) {
    return new PerformanceBaseline(
        id, name, description, runId, createdAt, active, configMetrics, overallMetrics);
  }
}
