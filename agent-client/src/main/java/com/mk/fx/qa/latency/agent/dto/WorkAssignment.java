package com.mk.fx.qa.latency.agent.dto;

/** Work returned by the poll endpoint. {@code dispatchId} must be echoed with the result. */
public record WorkAssignment(
        String dispatchId, String runId, String configId, DispatchedConfiguration configuration) {}
