package com.mk.fx.qa.latency.harness.cfg;

/**
 * Error body returned by every failing endpoint.
 *
 * @param error short error title
 * @param details human-readable explanation
 */
public record ErrorResponse(String error, String details) {}
