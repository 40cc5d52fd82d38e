package com.mk.fx.qa.latency.harness.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HarnessEventType {
  TEST_PROGRESS("test_progress"),
  TEST_RESULT("test_result"),
  RUN_COMPLETE("run_complete");

  private final String value;

  HarnessEventType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
