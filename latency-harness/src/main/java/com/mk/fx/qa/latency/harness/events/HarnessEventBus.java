package com.mk.fx.qa.latency.harness.events;

import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publish/subscribe channel between running runs and their observers.
 *
 * <p>Every subscriber owns a bounded queue drained by its own daemon thread, so {@link #emit}
 * only ever enqueues. Events for one run are emitted from a single worker thread and each queue
 * is FIFO, which keeps a run's progress and result events ahead of its completion event for every
 * subscriber. When a subscriber's queue is full the event is dropped for that subscriber only.
 */
@Slf4j
@Component
public class HarnessEventBus implements HarnessEventSink {

  private final int queueCapacity;
  private final Map<Long, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final AtomicLong subscriptionIds = new AtomicLong();

  public HarnessEventBus(HarnessCfg properties) {
    this.queueCapacity = properties.getEventQueueCapacity();
  }

  @Override
  public void emit(HarnessEventType type, String runId, Object payload) {
    var event = new HarnessEvent(type, runId, payload, Instant.now());
    for (Subscription subscription : subscriptions.values()) {
      subscription.offer(event);
    }
  }

  /** Registers a subscriber. Close the returned subscription to stop delivery. */
  public Subscription subscribe(HarnessEventSubscriber subscriber) {
    long id = subscriptionIds.incrementAndGet();
    var subscription = new Subscription(id, subscriber, queueCapacity);
    subscriptions.put(id, subscription);
    subscription.start();
    log.debug("Event subscriber {} registered", id);
    return subscription;
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  @PreDestroy
  void onShutdown() {
    subscriptions.values().forEach(Subscription::close);
  }

  /** Handle for one subscriber and its delivery thread. */
  public final class Subscription implements AutoCloseable {

    private final long id;
    private final HarnessEventSubscriber subscriber;
    private final BlockingQueue<HarnessEvent> queue;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();
    private final Thread worker;

    private Subscription(long id, HarnessEventSubscriber subscriber, int capacity) {
      this.id = id;
      this.subscriber = subscriber;
      this.queue = new LinkedBlockingQueue<>(capacity);
      this.worker = new Thread(this::drain, "harness-event-subscriber-" + id);
      this.worker.setDaemon(true);
    }

    private void start() {
      worker.start();
    }

    private void offer(HarnessEvent event) {
      if (!open.get()) {
        return;
      }
      if (!queue.offer(event)) {
        long total = dropped.incrementAndGet();
        log.warn(
            "Event subscriber {} queue full, dropped {} for run {} ({} dropped so far)",
            id,
            event.type().getValue(),
            event.runId(),
            total);
      }
    }

    private void drain() {
      while (open.get()) {
        HarnessEvent event;
        try {
          event = queue.take();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
        try {
          subscriber.onEvent(event);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        } catch (Exception ex) {
          log.warn(
              "Event subscriber {} failed to handle {} for run {}: {}",
              id,
              event.type().getValue(),
              event.runId(),
              ex.getMessage());
        }
      }
    }

    public long droppedEvents() {
      return dropped.get();
    }

    @Override
    public void close() {
      if (open.compareAndSet(true, false)) {
        subscriptions.remove(id);
        worker.interrupt();
        log.debug("Event subscriber {} removed", id);
      }
    }
  }
}
