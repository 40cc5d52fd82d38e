package com.mk.fx.qa.latency.harness.model;

import java.util.Set;

/** Speech-to-text stage settings. */
public record SttTestConfig(String provider, String model, Integer chunkSizeMs, String language) {

  private static final Set<String> ON_DEVICE_PROVIDERS =
      Set.of("apple", "glm-asr-ondevice", "web-speech");

  public SttTestConfig {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("STT provider must not be blank");
    }
    language = language == null ? "en-US" : language;
  }

  public static SttTestConfig of(String provider) {
    return new SttTestConfig(provider, null, null, null);
  }

  public boolean requiresNetwork() {
    return !ON_DEVICE_PROVIDERS.contains(provider);
  }
}
