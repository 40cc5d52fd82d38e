package com.mk.fx.qa.latency.agent.dto;

import java.util.Map;

/**
 * One configuration the harness asks the client to execute: a scenario repetition with one
 * setting per pipeline stage, under a simulated network profile.
 */
public record DispatchedConfiguration(
        String id,
        String scenarioName,
        int repetition,
        Stt stt,
        Llm llm,
        Tts tts,
        AudioEngine audioEngine,
        String networkProfile) {

    public record Stt(String provider, String model, Integer chunkSizeMs, String language) {}

    public record Llm(
            String provider,
            String model,
            Integer maxTokens,
            Double temperature,
            Double topP,
            Boolean stream) {}

    /** {@code chatterboxConfig} is passed through untyped, only Chatterbox clients read it. */
    public record Tts(
            String provider,
            String voiceId,
            Double speed,
            Boolean useStreaming,
            Map<String, Object> chatterboxConfig) {}

    public record AudioEngine(
            Double sampleRate,
            Integer bufferSize,
            Double vadThreshold,
            Integer vadSmoothingWindow) {}
}
