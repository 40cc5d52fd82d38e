package com.mk.fx.qa.latency.harness.transport;

import com.mk.fx.qa.latency.harness.model.TestConfiguration;

/**
 * A configuration waiting to be picked up by a polling client. The client echoes {@code
 * dispatchId} when submitting its result.
 */
public record WorkItem(
    String dispatchId, String runId, String configId, TestConfiguration configuration) {}
