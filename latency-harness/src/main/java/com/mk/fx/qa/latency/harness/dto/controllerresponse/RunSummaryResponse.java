package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.ClientType;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import java.time.Instant;

/** A run without its results, as listed by the run history endpoint. */
public record RunSummaryResponse(
    String id,
    String suiteId,
    String suiteName,
    RunStatus status,
    String clientId,
    ClientType clientType,
    Instant startedAt,
    Instant completedAt,
    int completedConfigurations,
    int totalConfigurations,
    double progressPercent,
    double elapsedTimeSeconds,
    String errorMessage) {}
