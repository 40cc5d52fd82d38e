package com.mk.fx.qa.latency.harness.transport;

import static com.mk.fx.qa.latency.harness.LatencyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.harness.client.ClientEvictedEvent;
import com.mk.fx.qa.latency.harness.exception.ClientDisconnectedException;
import com.mk.fx.qa.latency.harness.exception.DispatchTimeoutException;
import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.TestConfiguration;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PollingClientTransportTest {

  private static final Duration POLL = Duration.ofSeconds(2);

  private PollingClientTransport transport;
  private ExecutorService worker;
  private TestConfiguration configuration;

  @BeforeEach
  void setUp() {
    transport = new PollingClientTransport();
    worker = Executors.newSingleThreadExecutor();
    configuration = suite("s", 1).generateConfigurations().get(0);
  }

  @AfterEach
  void tearDown() {
    worker.shutdownNow();
  }

  private Future<TestResult> dispatchAsync(String clientId, Duration timeout) {
    return worker.submit(() -> transport.dispatch("run-1", clientId, configuration, timeout));
  }

  @Test
  void dispatch_pollThenSubmit_returnsClientMeasurement() throws Exception {
    var pending = dispatchAsync("ios-1", Duration.ofSeconds(5));

    var item = transport.pollWork("ios-1", POLL).orElseThrow();
    assertEquals("run-1", item.runId());
    assertEquals(configuration.configId(), item.configId());
    assertEquals(configuration, item.configuration());

    transport.submitResult("ios-1", item.dispatchId(), measurement(420));

    assertEquals(420.0, pending.get(5, TimeUnit.SECONDS).e2eLatencyMs(), 1e-9);
    assertEquals(0, transport.pendingCount());
  }

  @Test
  void pollWork_nothingDispatched_returnsEmpty() {
    assertTrue(transport.pollWork("ios-1", Duration.ofMillis(50)).isEmpty());
  }

  @Test
  void pollWork_onlySeesOwnQueue() throws Exception {
    var pending = dispatchAsync("ios-1", Duration.ofSeconds(5));
    var item = transport.pollWork("ios-1", POLL).orElseThrow();

    assertTrue(transport.pollWork("ios-2", Duration.ofMillis(50)).isEmpty());

    transport.submitResult("ios-1", item.dispatchId(), measurement(100));
    pending.get(5, TimeUnit.SECONDS);
  }

  @Test
  void dispatch_noResultInTime_timesOutAndRejectsLateResult() throws Exception {
    var pending = dispatchAsync("ios-1", Duration.ofMillis(200));
    var item = transport.pollWork("ios-1", POLL).orElseThrow();

    var ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
    assertInstanceOf(DispatchTimeoutException.class, ex.getCause());
    assertEquals(0, transport.pendingCount());
    assertThrows(
        ResourceNotFoundException.class,
        () -> transport.submitResult("ios-1", item.dispatchId(), measurement(100)));
  }

  @Test
  void dispatch_timeoutBeforePickup_withdrawsWorkItem() throws Exception {
    var pending = dispatchAsync("ios-1", Duration.ofMillis(100));

    var ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
    assertInstanceOf(DispatchTimeoutException.class, ex.getCause());
    assertTrue(transport.pollWork("ios-1", Duration.ofMillis(50)).isEmpty());
  }

  @Test
  void submitResult_fromOtherClient_isRejected() throws Exception {
    var pending = dispatchAsync("ios-1", Duration.ofSeconds(5));
    var item = transport.pollWork("ios-1", POLL).orElseThrow();

    assertThrows(
        ResourceNotFoundException.class,
        () -> transport.submitResult("ios-2", item.dispatchId(), measurement(100)));

    transport.submitResult("ios-1", item.dispatchId(), measurement(100));
    pending.get(5, TimeUnit.SECONDS);
  }

  @Test
  void submitResult_unknownDispatch_throwsNotFound() {
    assertThrows(
        ResourceNotFoundException.class,
        () -> transport.submitResult("ios-1", "nope", measurement(100)));
  }

  @Test
  void onClientEvicted_failsPendingDispatchWithDisconnect() throws Exception {
    var pending = dispatchAsync("ios-1", Duration.ofSeconds(5));
    transport.pollWork("ios-1", POLL).orElseThrow();

    transport.onClientEvicted(new ClientEvictedEvent("ios-1", Instant.now()));

    var ex = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
    var disconnected = assertInstanceOf(ClientDisconnectedException.class, ex.getCause());
    assertEquals("ios-1", disconnected.getClientId());
  }
}
