package com.mk.fx.qa.latency.harness.events;

/** Outbound side of the event channel, used by the orchestrator. Must never block the caller. */
public interface HarnessEventSink {

  void emit(HarnessEventType type, String runId, Object payload);
}
