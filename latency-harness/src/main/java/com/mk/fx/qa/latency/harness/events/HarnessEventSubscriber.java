package com.mk.fx.qa.latency.harness.events;

@FunctionalInterface
public interface HarnessEventSubscriber {

  void onEvent(HarnessEvent event) throws Exception;
}
