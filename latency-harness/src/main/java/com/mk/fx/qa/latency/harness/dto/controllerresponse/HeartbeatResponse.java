package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.ClientStatus;

public record HeartbeatResponse(String status, ClientStatus client) {}
