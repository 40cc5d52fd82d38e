package com.mk.fx.qa.latency.harness.model;

import java.util.Set;

/** Language-model stage settings. */
public record LlmTestConfig(
    String provider,
    String model,
    Integer maxTokens,
    Double temperature,
    Double topP,
    Boolean stream) {

  private static final Set<String> ON_DEVICE_PROVIDERS = Set.of("mlx");

  public LlmTestConfig {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("LLM provider must not be blank");
    }
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("LLM model must not be blank");
    }
    maxTokens = maxTokens == null ? 512 : maxTokens;
    temperature = temperature == null ? 0.7 : temperature;
    stream = stream == null ? Boolean.TRUE : stream;
  }

  public static LlmTestConfig of(String provider, String model) {
    return new LlmTestConfig(provider, model, null, null, null, null);
  }

  public boolean requiresNetwork() {
    return !ON_DEVICE_PROVIDERS.contains(provider);
  }
}
