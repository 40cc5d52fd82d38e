package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Point-in-time view of a registered test client. */
public record ClientStatus(
    String clientId,
    ClientType clientType,
    @JsonProperty("isConnected") boolean isConnected,
    @JsonProperty("isRunningTest") boolean isRunningTest,
    String currentConfigId,
    Instant lastHeartbeat,
    ClientCapabilities capabilities) {}
