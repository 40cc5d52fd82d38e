package com.mk.fx.qa.latency.harness.events;

import java.time.Instant;

/**
 * Envelope for every event a run emits.
 *
 * @param type event kind, also used as the SSE event name
 * @param runId run that produced the event
 * @param payload one of the payload records in this package
 * @param timestamp emission time
 */
public record HarnessEvent(
    HarnessEventType type, String runId, Object payload, Instant timestamp) {}
