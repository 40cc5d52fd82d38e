package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.RunStatus;

/**
 * Response object for run cancellation requests. Contains the run ID, the run status at the time
 * of the request and a message.
 */
public record RunCancellationResponse(String runId, RunStatus status, String message) {}
