package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Expected size class of the model response for a scenario. */
public enum ResponseType {
  SHORT("short"),
  MEDIUM("medium"),
  LONG("long");

  private final String value;

  ResponseType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ResponseType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported response type: " + value));
  }
}
