package com.mk.fx.qa.latency.harness.transport;

import com.mk.fx.qa.latency.harness.client.ClientEvictedEvent;
import com.mk.fx.qa.latency.harness.exception.ClientDisconnectedException;
import com.mk.fx.qa.latency.harness.exception.DispatchException;
import com.mk.fx.qa.latency.harness.exception.DispatchTimeoutException;
import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.TestConfiguration;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Pull-based transport: dispatched configurations wait in a per-client queue until the client
 * long-polls for work, and the dispatching worker waits on a future completed by the client's
 * result submission.
 *
 * <p>A dispatch that times out is abandoned: its work item is withdrawn if still queued and a
 * late result for it is rejected as unknown.
 */
@Slf4j
@Component
public class PollingClientTransport implements ClientTransport {

  private final Map<String, BlockingQueue<WorkItem>> queues = new ConcurrentHashMap<>();
  private final Map<String, PendingDispatch> pending = new ConcurrentHashMap<>();

  @Override
  public TestResult dispatch(
      String runId, String clientId, TestConfiguration configuration, Duration timeout)
      throws DispatchException, InterruptedException {
    var dispatchId = UUID.randomUUID().toString();
    var item = new WorkItem(dispatchId, runId, configuration.configId(), configuration);
    var future = new CompletableFuture<TestResult>();
    pending.put(dispatchId, new PendingDispatch(clientId, future));
    var queue = queueFor(clientId);
    queue.add(item);
    log.debug(
        "Run {} queued {} for client {} (dispatch {})",
        runId,
        configuration.id(),
        clientId,
        dispatchId);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      throw new DispatchTimeoutException(clientId, configuration.id(), timeout);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof ClientDisconnectedException disconnected) {
        throw disconnected;
      }
      throw new DispatchException(
          "Dispatch of " + configuration.id() + " to " + clientId + " failed", ex.getCause());
    } finally {
      pending.remove(dispatchId);
      queue.remove(item);
    }
  }

  /**
   * Waits up to {@code wait} for the next configuration dispatched to {@code clientId}.
   *
   * @return empty when nothing was dispatched within the window
   */
  public Optional<WorkItem> pollWork(String clientId, Duration wait) {
    try {
      return Optional.ofNullable(queueFor(clientId).poll(wait.toMillis(), TimeUnit.MILLISECONDS));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  /**
   * Completes a pending dispatch with the client's measurement.
   *
   * @throws ResourceNotFoundException if the dispatch is unknown, already answered, abandoned
   *     after a timeout, or belongs to another client
   */
  public void submitResult(String clientId, String dispatchId, TestResult result) {
    var dispatch = pending.get(dispatchId);
    if (dispatch == null || !dispatch.clientId().equals(clientId)) {
      throw new ResourceNotFoundException("Dispatch", dispatchId);
    }
    if (!dispatch.future().complete(result)) {
      throw new ResourceNotFoundException("Dispatch", dispatchId);
    }
  }

  /** Number of dispatches currently awaiting a result. */
  public int pendingCount() {
    return pending.size();
  }

  @EventListener
  public void onClientEvicted(ClientEvictedEvent event) {
    var clientId = event.clientId();
    queues.remove(clientId);
    pending.values().stream()
        .filter(dispatch -> dispatch.clientId().equals(clientId))
        .forEach(
            dispatch ->
                dispatch.future().completeExceptionally(new ClientDisconnectedException(clientId)));
  }

  private BlockingQueue<WorkItem> queueFor(String clientId) {
    return queues.computeIfAbsent(clientId, id -> new LinkedBlockingQueue<>());
  }

  private record PendingDispatch(String clientId, CompletableFuture<TestResult> future) {}
}
