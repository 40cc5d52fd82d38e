package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.RunStatus;

public record RunStartResponse(
    String runId, RunStatus status, int totalConfigurations, String clientId, String message) {}
