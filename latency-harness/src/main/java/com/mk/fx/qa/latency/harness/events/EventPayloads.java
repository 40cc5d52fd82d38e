package com.mk.fx.qa.latency.harness.events;

import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestResult;

/** Payload shapes of the three harness event types. */
public final class EventPayloads {

  private EventPayloads() {}

  public record Progress(
      String runId,
      int completedConfigurations,
      int totalConfigurations,
      double progressPercent) {}

  public record Result(String runId, TestResult result) {}

  public record RunComplete(
      String runId, RunStatus status, int completed, int total, double elapsedTimeSeconds) {}
}
