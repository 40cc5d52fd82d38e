package com.mk.fx.qa.latency.harness.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidate settings per pipeline stage. An empty audio dimension expands to a single default
 * audio engine configuration.
 */
public record ParameterSpace(
    List<SttTestConfig> sttConfigs,
    List<LlmTestConfig> llmConfigs,
    List<TtsTestConfig> ttsConfigs,
    List<AudioEngineTestConfig> audioConfigs) {

  public ParameterSpace {
    sttConfigs = sttConfigs == null ? List.of() : List.copyOf(sttConfigs);
    llmConfigs = llmConfigs == null ? List.of() : List.copyOf(llmConfigs);
    ttsConfigs = ttsConfigs == null ? List.of() : List.copyOf(ttsConfigs);
    audioConfigs =
        audioConfigs == null || audioConfigs.isEmpty()
            ? List.of(AudioEngineTestConfig.defaults())
            : List.copyOf(audioConfigs);
  }

  public static ParameterSpace of(
      List<SttTestConfig> sttConfigs,
      List<LlmTestConfig> llmConfigs,
      List<TtsTestConfig> ttsConfigs) {
    return new ParameterSpace(sttConfigs, llmConfigs, ttsConfigs, null);
  }

  public Set<String> sttProviders() {
    Set<String> providers = new LinkedHashSet<>();
    sttConfigs.forEach(c -> providers.add(c.provider()));
    return providers;
  }

  public Set<String> llmProviders() {
    Set<String> providers = new LinkedHashSet<>();
    llmConfigs.forEach(c -> providers.add(c.provider()));
    return providers;
  }

  public Set<String> ttsProviders() {
    Set<String> providers = new LinkedHashSet<>();
    ttsConfigs.forEach(c -> providers.add(c.provider()));
    return providers;
  }
}
