package com.mk.fx.qa.latency.harness.model;

import java.util.Set;

/** Text-to-speech stage settings. */
public record TtsTestConfig(
    String provider,
    String voiceId,
    Double speed,
    Boolean useStreaming,
    ChatterboxConfig chatterboxConfig) {

  private static final Set<String> ON_DEVICE_PROVIDERS = Set.of("apple", "web-speech");

  public TtsTestConfig {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("TTS provider must not be blank");
    }
    speed = speed == null ? 1.0 : speed;
    useStreaming = useStreaming == null ? Boolean.TRUE : useStreaming;
  }

  public static TtsTestConfig of(String provider) {
    return new TtsTestConfig(provider, null, null, null, null);
  }

  public boolean requiresNetwork() {
    return !ON_DEVICE_PROVIDERS.contains(provider);
  }
}
