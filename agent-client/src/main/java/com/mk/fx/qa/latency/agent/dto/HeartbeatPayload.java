package com.mk.fx.qa.latency.agent.dto;

public record HeartbeatPayload(
        String clientId, String clientType, AgentCapabilities capabilities) {}
