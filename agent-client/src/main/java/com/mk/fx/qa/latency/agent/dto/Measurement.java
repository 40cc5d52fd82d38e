package com.mk.fx.qa.latency.agent.dto;

import java.util.List;

/**
 * Latencies measured for one configuration, in milliseconds. A measurement with errors is
 * reported as a failed configuration and its timings are ignored by the harness.
 */
public record Measurement(
        Double sttLatencyMs,
        double llmTtfbMs,
        double llmCompletionMs,
        double ttsTtfbMs,
        double ttsCompletionMs,
        double e2eLatencyMs,
        Double sttConfidence,
        Double ttsAudioDurationMs,
        Integer llmOutputTokens,
        Integer llmInputTokens,
        Double peakCpuPercent,
        Double peakMemoryMb,
        String thermalState,
        List<String> errors) {

    public Measurement {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Stage timings only, no device metrics. */
    public static Measurement of(
            Double sttLatencyMs,
            double llmTtfbMs,
            double llmCompletionMs,
            double ttsTtfbMs,
            double ttsCompletionMs,
            double e2eLatencyMs) {
        return new Measurement(
                sttLatencyMs,
                llmTtfbMs,
                llmCompletionMs,
                ttsTtfbMs,
                ttsCompletionMs,
                e2eLatencyMs,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                List.of());
    }

    public static Measurement failed(String error) {
        return new Measurement(
                null, 0, 0, 0, 0, 0, null, null, null, null, null, null, null, List.of(error));
    }
}
