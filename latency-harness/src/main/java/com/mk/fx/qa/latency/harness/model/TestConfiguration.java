package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One point of an expanded suite: a scenario repetition with one setting per stage under one
 * network profile.
 */
public record TestConfiguration(
    String id,
    String scenarioName,
    int repetition,
    SttTestConfig stt,
    LlmTestConfig llm,
    TtsTestConfig tts,
    AudioEngineTestConfig audioEngine,
    NetworkProfile networkProfile) {

  public TestConfiguration {
    audioEngine = audioEngine == null ? AudioEngineTestConfig.defaults() : audioEngine;
    networkProfile = networkProfile == null ? NetworkProfile.LOCALHOST : networkProfile;
  }

  /**
   * Aggregation key shared by every repetition and network profile of the same provider
   * combination.
   */
  @JsonIgnore
  public String configId() {
    return configIdOf(stt, llm, tts);
  }

  /** Number of stages whose provider is reached over the network. */
  @JsonIgnore
  public int networkStageCount() {
    return (stt.requiresNetwork() ? 1 : 0)
        + (llm.requiresNetwork() ? 1 : 0)
        + (tts.requiresNetwork() ? 1 : 0);
  }

  public static String configIdOf(SttTestConfig stt, LlmTestConfig llm, TtsTestConfig tts) {
    return stt.provider() + "_" + llm.provider() + "_" + llm.model() + "_" + tts.provider();
  }
}
