package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Simulated network condition with the fixed overhead it adds to every network-bound stage. */
public enum NetworkProfile {
  LOCALHOST("localhost", 0),
  WIFI("wifi", 10),
  CELLULAR_US("cellular_us", 50),
  CELLULAR_EU("cellular_eu", 70),
  INTERCONTINENTAL("intercontinental", 120);

  private final String value;
  private final double addedLatencyMs;

  NetworkProfile(String value, double addedLatencyMs) {
    this.value = value;
    this.addedLatencyMs = addedLatencyMs;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public double getAddedLatencyMs() {
    return addedLatencyMs;
  }

  @JsonCreator
  public static NetworkProfile fromValue(String value) {
    return Arrays.stream(values())
        .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported network profile: " + value));
  }
}
