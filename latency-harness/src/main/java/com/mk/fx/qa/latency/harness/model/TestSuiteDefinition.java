package com.mk.fx.qa.latency.harness.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of a latency test matrix.
 *
 * <p>{@link #generateConfigurations()} expands the matrix in a fixed nested order (scenario, STT,
 * LLM, TTS, audio engine, network profile, repetition) and numbers each point {@code config_<n>}
 * starting at 1, so two expansions of the same suite are identical.
 */
public record TestSuiteDefinition(
    String id,
    String name,
    String description,
    List<TestScenario> scenarios,
    List<NetworkProfile> networkProfiles,
    ParameterSpace parameterSpace) {

  public TestSuiteDefinition {
    scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    networkProfiles = networkProfiles == null ? List.of() : List.copyOf(networkProfiles);
    parameterSpace =
        parameterSpace == null ? new ParameterSpace(null, null, null, null) : parameterSpace;
  }

  public List<TestConfiguration> generateConfigurations() {
    List<TestConfiguration> configurations = new ArrayList<>(totalTestCount());
    int index = 0;
    for (TestScenario scenario : scenarios) {
      for (SttTestConfig stt : parameterSpace.sttConfigs()) {
        for (LlmTestConfig llm : parameterSpace.llmConfigs()) {
          for (TtsTestConfig tts : parameterSpace.ttsConfigs()) {
            for (AudioEngineTestConfig audio : parameterSpace.audioConfigs()) {
              for (NetworkProfile profile : networkProfiles) {
                for (int repetition = 1; repetition <= scenario.repetitions(); repetition++) {
                  index++;
                  configurations.add(
                      new TestConfiguration(
                          "config_" + index,
                          scenario.name(),
                          repetition,
                          stt,
                          llm,
                          tts,
                          audio,
                          profile));
                }
              }
            }
          }
        }
      }
    }
    return configurations;
  }

  /**
   * Number of configurations {@link #generateConfigurations()} produces.
   *
   * @throws IllegalArgumentException if the matrix is larger than an {@code int} can count
   */
  public int totalTestCount() {
    try {
      int count = scenarios.stream().mapToInt(TestScenario::repetitions).reduce(0, Math::addExact);
      count = Math.multiplyExact(count, parameterSpace.sttConfigs().size());
      count = Math.multiplyExact(count, parameterSpace.llmConfigs().size());
      count = Math.multiplyExact(count, parameterSpace.ttsConfigs().size());
      count = Math.multiplyExact(count, parameterSpace.audioConfigs().size());
      return Math.multiplyExact(count, networkProfiles.size());
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("Suite " + id + " expands to too many configurations", ex);
    }
  }

  /**
   * Rejects definitions that cannot produce a runnable matrix.
   *
   * @throws IllegalArgumentException describing the first problem found
   */
  public void validate() {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Suite id must not be blank");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Suite name must not be blank");
    }
    if (scenarios.isEmpty()) {
      throw new IllegalArgumentException("Suite " + id + " must define at least one scenario");
    }
    for (TestScenario scenario : scenarios) {
      if (scenario.name() == null || scenario.name().isBlank()) {
        throw new IllegalArgumentException("Scenario name must not be blank in suite " + id);
      }
      if (scenario.repetitions() < 1) {
        throw new IllegalArgumentException(
            "Scenario " + scenario.name() + " must have at least one repetition");
      }
    }
    if (networkProfiles.isEmpty()) {
      throw new IllegalArgumentException(
          "Suite " + id + " must test under at least one network profile");
    }
    if (parameterSpace.sttConfigs().isEmpty()
        || parameterSpace.llmConfigs().isEmpty()
        || parameterSpace.ttsConfigs().isEmpty()) {
      throw new IllegalArgumentException(
          "Suite " + id + " needs at least one STT, LLM and TTS configuration");
    }
    totalTestCount();
  }
}
