package com.mk.fx.qa.latency.harness.client;

import static com.mk.fx.qa.latency.harness.LatencyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.ClientCapabilities;
import com.mk.fx.qa.latency.harness.model.ClientType;
import com.mk.fx.qa.latency.harness.model.ParameterSpace;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClientRegistryTest {

  private static final Instant T0 = Instant.parse("2026-05-01T10:00:00Z");
  private static final ParameterSpace SPACE = suite("s", 1).parameterSpace();

  private final List<Object> published = new ArrayList<>();
  private MutableClock clock;
  private ClientRegistry registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    registry = new ClientRegistry(Duration.ofSeconds(30), published::add, clock);
  }

  private static ClientCapabilities webOnly() {
    return capabilities(List.of("web-speech"), List.of("anthropic"), List.of("web-speech"));
  }

  @Test
  void register_newClient_isConnectedAndIdle() {
    var status = registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());

    assertTrue(status.isConnected());
    assertFalse(status.isRunningTest());
    assertEquals(T0, status.lastHeartbeat());
    assertEquals(1, registry.listClients().size());
  }

  @Test
  void register_knownClient_refreshesHeartbeatAndKeepsCapabilities() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());
    clock.advance(Duration.ofSeconds(10));

    var status = registry.register("ios-1", ClientType.IOS_SIMULATOR, null);

    assertEquals(T0.plusSeconds(10), status.lastHeartbeat());
    assertEquals(suiteCapabilities(), status.capabilities());
  }

  @Test
  void heartbeat_unknownClient_throwsNotFound() {
    assertThrows(ResourceNotFoundException.class, () -> registry.heartbeat("ghost"));
  }

  @Test
  void claimCapable_picksFirstCapableInRegistrationOrder() {
    registry.register("web-1", ClientType.WEB, webOnly());
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());
    registry.register("ios-2", ClientType.IOS_DEVICE, suiteCapabilities());

    assertEquals("ios-1", registry.claimCapable(SPACE, null).orElseThrow());
    assertEquals("ios-2", registry.claimCapable(SPACE, null).orElseThrow());
    assertTrue(registry.claimCapable(SPACE, null).isEmpty());
    assertTrue(registry.getClient("ios-1").orElseThrow().isRunningTest());
  }

  @Test
  void claimCapable_respectsClientType() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());
    registry.register("ios-2", ClientType.IOS_DEVICE, suiteCapabilities());

    assertEquals("ios-2", registry.claimCapable(SPACE, ClientType.IOS_DEVICE).orElseThrow());
    assertTrue(registry.claimCapable(SPACE, ClientType.WEB).isEmpty());
  }

  @Test
  void findCapable_doesNotReserve() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());

    assertEquals("ios-1", registry.findCapable(SPACE, null).orElseThrow());
    assertEquals("ios-1", registry.findCapable(SPACE, null).orElseThrow());
  }

  @Test
  void claim_explicitClient_mustBeIdleAndCapable() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());
    registry.register("web-1", ClientType.WEB, webOnly());

    assertFalse(registry.claim("web-1", SPACE));
    assertTrue(registry.claim("ios-1", SPACE));
    assertFalse(registry.claim("ios-1", SPACE));
    assertThrows(ResourceNotFoundException.class, () -> registry.claim("ghost", SPACE));
  }

  @Test
  void markIdle_releasesClient() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());
    registry.claimCapable(SPACE, null);
    registry.markBusy("ios-1", "config_3");
    assertEquals("config_3", registry.getClient("ios-1").orElseThrow().currentConfigId());

    registry.markIdle("ios-1");

    var status = registry.getClient("ios-1").orElseThrow();
    assertFalse(status.isRunningTest());
    assertNull(status.currentConfigId());
    assertTrue(registry.claimCapable(SPACE, null).isPresent());
  }

  @Test
  void evictStale_removesSilentClientsAndPublishesEvents() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());
    registry.register("ios-2", ClientType.IOS_SIMULATOR, suiteCapabilities());
    clock.advance(Duration.ofSeconds(20));
    registry.heartbeat("ios-2");

    var evicted = registry.evictStale(T0.plusSeconds(31));

    assertEquals(List.of("ios-1"), evicted);
    assertFalse(registry.isConnected("ios-1"));
    assertTrue(registry.isConnected("ios-2"));
    assertEquals(List.of(new ClientEvictedEvent("ios-1", T0)), published);
  }

  @Test
  void evictStale_atExactTimeout_keepsClient() {
    registry.register("ios-1", ClientType.IOS_SIMULATOR, suiteCapabilities());

    assertTrue(registry.evictStale(T0.plusSeconds(30)).isEmpty());
    assertTrue(registry.isConnected("ios-1"));
  }

  @Test
  void claimCapable_concurrentClaims_neverShareAClient() throws Exception {
    for (int i = 0; i < 5; i++) {
      registry.register("ios-" + i, ClientType.IOS_SIMULATOR, suiteCapabilities());
    }
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<String>> claims = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      claims.add(
          pool.submit(
              () -> {
                start.await();
                return registry.claimCapable(SPACE, null).orElse(null);
              }));
    }
    start.countDown();

    List<String> winners = new ArrayList<>();
    for (Future<String> claim : claims) {
      String id = claim.get(5, TimeUnit.SECONDS);
      if (id != null) {
        winners.add(id);
      }
    }
    pool.shutdownNow();

    assertEquals(5, winners.size());
    assertEquals(5, winners.stream().distinct().count());
  }

  /** Clock whose time only moves when a test advances it. */
  static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public Instant instant() {
      return now;
    }

    @Override
    public ZoneOffset getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }
  }
}
