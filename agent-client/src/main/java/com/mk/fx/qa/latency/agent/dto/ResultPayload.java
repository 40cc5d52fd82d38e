package com.mk.fx.qa.latency.agent.dto;

public record ResultPayload(String clientId, String dispatchId, Measurement result) {}
