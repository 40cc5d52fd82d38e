package com.mk.fx.qa.latency.agent.dto;

import java.util.List;

/** Providers and features a test client declares in its heartbeat. */
public record AgentCapabilities(
        List<String> supportedSttProviders,
        List<String> supportedLlmProviders,
        List<String> supportedTtsProviders,
        boolean hasHighPrecisionTiming,
        boolean hasDeviceMetrics,
        boolean hasOnDeviceMl,
        int maxConcurrentTests) {

    public AgentCapabilities {
        supportedSttProviders =
                supportedSttProviders == null ? List.of() : List.copyOf(supportedSttProviders);
        supportedLlmProviders =
                supportedLlmProviders == null ? List.of() : List.copyOf(supportedLlmProviders);
        supportedTtsProviders =
                supportedTtsProviders == null ? List.of() : List.copyOf(supportedTtsProviders);
        maxConcurrentTests = Math.max(1, maxConcurrentTests);
    }
}
