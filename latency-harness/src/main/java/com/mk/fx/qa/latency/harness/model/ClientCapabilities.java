package com.mk.fx.qa.latency.harness.model;

import java.util.List;

/** What a test client declares it can execute. */
public record ClientCapabilities(
    List<String> supportedSttProviders,
    List<String> supportedLlmProviders,
    List<String> supportedTtsProviders,
    boolean hasHighPrecisionTiming,
    boolean hasDeviceMetrics,
    boolean hasOnDeviceMl,
    int maxConcurrentTests) {

  public ClientCapabilities {
    supportedSttProviders =
        supportedSttProviders == null ? List.of() : List.copyOf(supportedSttProviders);
    supportedLlmProviders =
        supportedLlmProviders == null ? List.of() : List.copyOf(supportedLlmProviders);
    supportedTtsProviders =
        supportedTtsProviders == null ? List.of() : List.copyOf(supportedTtsProviders);
    maxConcurrentTests = Math.max(1, maxConcurrentTests);
  }

  /** True when every provider referenced by {@code space} is supported on its stage. */
  public boolean covers(ParameterSpace space) {
    return supportedSttProviders.containsAll(space.sttProviders())
        && supportedLlmProviders.containsAll(space.llmProviders())
        && supportedTtsProviders.containsAll(space.ttsProviders());
  }
}
