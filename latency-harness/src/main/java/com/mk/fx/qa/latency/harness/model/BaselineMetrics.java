package com.mk.fx.qa.latency.harness.model;

/** Aggregated latency figures stored in a baseline, per configuration or overall. */
public record BaselineMetrics(
    double medianE2eMs,
    double p99E2eMs,
    double minE2eMs,
    double maxE2eMs,
    Double medianSttMs,
    double medianLlmTtfbMs,
    double medianLlmCompletionMs,
    double medianTtsTtfbMs,
    double medianTtsCompletionMs,
    int sampleCount) {}
