package com.mk.fx.qa.latency.harness.dto.controllerresponse;

public record ResultAcknowledgement(String status, String dispatchId) {}
