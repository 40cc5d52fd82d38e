package com.mk.fx.qa.latency.harness.events;

import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Bridges the event bus to server-sent event streams, one bus subscription per open stream. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SseEventBroadcaster {

  private final HarnessEventBus eventBus;

  /**
   * Opens a stream of harness events.
   *
   * @param runId when not null only events of this run are forwarded
   */
  public SseEmitter open(String runId) {
    var emitter = new SseEmitter(0L);
    var forwarder = new EmitterForwarder(emitter, runId);
    var subscription = eventBus.subscribe(forwarder);
    forwarder.subscription = subscription;
    emitter.onCompletion(subscription::close);
    emitter.onTimeout(subscription::close);
    emitter.onError(ex -> subscription.close());
    log.info("SSE stream opened (runId={})", runId == null ? "*" : runId);
    return emitter;
  }

  private static final class EmitterForwarder implements HarnessEventSubscriber {

    private final SseEmitter emitter;
    private final String runId;
    private volatile HarnessEventBus.Subscription subscription;

    private EmitterForwarder(SseEmitter emitter, String runId) {
      this.emitter = emitter;
      this.runId = runId;
    }

    @Override
    public void onEvent(HarnessEvent event) {
      if (runId != null && !runId.equals(event.runId())) {
        return;
      }
      try {
        emitter.send(
            SseEmitter.event()
                .name(event.type().getValue())
                .data(event.payload(), MediaType.APPLICATION_JSON));
      } catch (IOException | IllegalStateException ex) {
        log.info("SSE stream closed by peer: {}", ex.getMessage());
        if (subscription != null) {
          subscription.close();
        }
        emitter.completeWithError(ex);
      }
    }
  }
}
