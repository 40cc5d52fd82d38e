package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record BaselineSummaryResponse(
    String id,
    String name,
    String description,
    String runId,
    Instant createdAt,
    @JsonProperty("isActive") boolean isActive,
    int configCount,
    Double overallMedianE2eMs) {}
