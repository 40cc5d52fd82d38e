package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * Measurement of one executed configuration. A result is successful exactly when it carries no
 * errors; failed results are kept for reporting but never feed latency statistics.
 */
@Builder(toBuilder = true)
public record TestResult(
    String id,
    String configId,
    String scenarioName,
    int repetition,
    Instant timestamp,
    ClientType clientType,
    Double sttLatencyMs,
    double llmTtfbMs,
    double llmCompletionMs,
    double ttsTtfbMs,
    double ttsCompletionMs,
    double e2eLatencyMs,
    NetworkProfile networkProfile,
    Map<String, Double> networkProjections,
    Double sttConfidence,
    Double ttsAudioDurationMs,
    Integer llmOutputTokens,
    Integer llmInputTokens,
    Double peakCpuPercent,
    Double peakMemoryMb,
    String thermalState,
    SttTestConfig sttConfig,
    LlmTestConfig llmConfig,
    TtsTestConfig ttsConfig,
    AudioEngineTestConfig audioConfig,
    List<String> errors) {

  public TestResult {
    id = id == null ? UUID.randomUUID().toString() : id;
    timestamp = timestamp == null ? Instant.now() : timestamp;
    networkProfile = networkProfile == null ? NetworkProfile.LOCALHOST : networkProfile;
    networkProjections = networkProjections == null ? Map.of() : Map.copyOf(networkProjections);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return errors.isEmpty();
  }

  /** Builds a failed result for a configuration that produced no measurement. */
  public static TestResult failure(
      TestConfiguration configuration, ClientType clientType, String error) {
    return TestResult.builder()
        .configId(configuration.configId())
        .scenarioName(configuration.scenarioName())
        .repetition(configuration.repetition())
        .clientType(clientType)
        .networkProfile(configuration.networkProfile())
        .sttConfig(configuration.stt())
        .llmConfig(configuration.llm())
        .ttsConfig(configuration.tts())
        .audioConfig(configuration.audioEngine())
        .errors(List.of(error))
        .build();
  }
}
