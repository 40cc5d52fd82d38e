package com.mk.fx.qa.latency.harness.client;

import java.time.Instant;

/**
 * Published when a client stops sending heartbeats for longer than the configured timeout.
 *
 * @param clientId evicted client
 * @param lastHeartbeat last time the client was heard from
 */
public record ClientEvictedEvent(String clientId, Instant lastHeartbeat) {}
