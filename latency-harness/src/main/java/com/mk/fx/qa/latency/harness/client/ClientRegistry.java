package com.mk.fx.qa.latency.harness.client;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.ClientCapabilities;
import com.mk.fx.qa.latency.harness.model.ClientStatus;
import com.mk.fx.qa.latency.harness.model.ClientType;
import com.mk.fx.qa.latency.harness.model.ParameterSpace;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Tracks connected test clients, their capabilities and whether they are executing a run.
 *
 * <p>All state lives in one map guarded by this instance's monitor, so selecting a client and
 * marking it busy happen as a single step and two runs can never claim the same client. Clients
 * are scanned in registration order.
 */
@Slf4j
@Component
public class ClientRegistry {

  private final Map<String, ClientEntry> clients = new LinkedHashMap<>();
  private final Duration heartbeatTimeout;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  @Autowired
  public ClientRegistry(HarnessCfg properties, ApplicationEventPublisher eventPublisher) {
    this(properties.getHeartbeatTimeout(), eventPublisher, Clock.systemUTC());
  }

  @VisibleForTesting
  ClientRegistry(Duration heartbeatTimeout, ApplicationEventPublisher eventPublisher, Clock clock) {
    this.heartbeatTimeout = heartbeatTimeout;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Registers a client, or refreshes type, capabilities and heartbeat of a known one. */
  public synchronized ClientStatus register(
      String clientId, ClientType clientType, ClientCapabilities capabilities) {
    Objects.requireNonNull(clientId, "Client id cannot be null");
    Objects.requireNonNull(clientType, "Client type cannot be null");
    var entry = clients.get(clientId);
    if (entry == null) {
      entry = new ClientEntry(clientId, clientType, capabilities, clock.instant());
      clients.put(clientId, entry);
      log.info("Client {} registered (type={})", clientId, clientType.getValue());
    } else {
      entry.clientType = clientType;
      if (capabilities != null) {
        entry.capabilities = capabilities;
      }
      entry.lastHeartbeat = clock.instant();
    }
    return entry.toStatus();
  }

  /**
   * Refreshes the heartbeat of a known client.
   *
   * @throws ResourceNotFoundException if the client never registered or was evicted
   */
  public synchronized ClientStatus heartbeat(String clientId) {
    var entry = clients.get(clientId);
    if (entry == null) {
      throw new ResourceNotFoundException("Client", clientId);
    }
    entry.lastHeartbeat = clock.instant();
    return entry.toStatus();
  }

  /**
   * First idle client, in registration order, whose capabilities cover every provider in {@code
   * space}. Does not reserve the client.
   */
  public synchronized Optional<String> findCapable(ParameterSpace space, ClientType clientType) {
    return clients.values().stream()
        .filter(entry -> isSelectable(entry, space, clientType))
        .map(entry -> entry.clientId)
        .findFirst();
  }

  /** Same selection as {@link #findCapable} but marks the chosen client busy in the same step. */
  public synchronized Optional<String> claimCapable(ParameterSpace space, ClientType clientType) {
    var found = findCapable(space, clientType);
    found.ifPresent(id -> clients.get(id).busy = true);
    return found;
  }

  /**
   * Claims a specific client.
   *
   * @return false when the client is busy or does not support the providers in {@code space}
   * @throws ResourceNotFoundException if the client is not registered
   */
  public synchronized boolean claim(String clientId, ParameterSpace space) {
    var entry = clients.get(clientId);
    if (entry == null) {
      throw new ResourceNotFoundException("Client", clientId);
    }
    if (!isSelectable(entry, space, null)) {
      return false;
    }
    entry.busy = true;
    return true;
  }

  private boolean isSelectable(ClientEntry entry, ParameterSpace space, ClientType clientType) {
    if (entry.busy) {
      return false;
    }
    if (clientType != null && entry.clientType != clientType) {
      return false;
    }
    return entry.capabilities != null && entry.capabilities.covers(space);
  }

  public synchronized void markBusy(String clientId, String configId) {
    var entry = clients.get(clientId);
    if (entry != null) {
      entry.busy = true;
      entry.currentConfigId = configId;
    }
  }

  public synchronized void markIdle(String clientId) {
    var entry = clients.get(clientId);
    if (entry != null) {
      entry.busy = false;
      entry.currentConfigId = null;
    }
  }

  public synchronized boolean isConnected(String clientId) {
    return clients.containsKey(clientId);
  }

  public synchronized Optional<ClientStatus> getClient(String clientId) {
    return Optional.ofNullable(clients.get(clientId)).map(ClientEntry::toStatus);
  }

  public synchronized List<ClientStatus> listClients() {
    return clients.values().stream().map(ClientEntry::toStatus).toList();
  }

  @Scheduled(fixedDelayString = "#{@harnessCfg.heartbeatCheckInterval.toMillis()}")
  public void evictStaleClients() {
    evictStale(clock.instant());
  }

  /**
   * Removes every client whose last heartbeat is older than the heartbeat timeout and publishes a
   * {@link ClientEvictedEvent} for each, outside the registry lock.
   *
   * @return ids of the evicted clients
   */
  public List<String> evictStale(Instant now) {
    List<ClientEvictedEvent> evicted = new ArrayList<>();
    synchronized (this) {
      Iterator<ClientEntry> iterator = clients.values().iterator();
      while (iterator.hasNext()) {
        var entry = iterator.next();
        if (Duration.between(entry.lastHeartbeat, now).compareTo(heartbeatTimeout) > 0) {
          iterator.remove();
          evicted.add(new ClientEvictedEvent(entry.clientId, entry.lastHeartbeat));
        }
      }
    }
    for (ClientEvictedEvent event : evicted) {
      log.info(
          "Client {} evicted, no heartbeat since {} (timeout {}s)",
          event.clientId(),
          event.lastHeartbeat(),
          heartbeatTimeout.toSeconds());
      eventPublisher.publishEvent(event);
    }
    return evicted.stream().map(ClientEvictedEvent::clientId).toList();
  }

  private static final class ClientEntry {
    private final String clientId;
    private ClientType clientType;
    private ClientCapabilities capabilities;
    private Instant lastHeartbeat;
    private boolean busy;
    private String currentConfigId;

    private ClientEntry(
        String clientId,
        ClientType clientType,
        ClientCapabilities capabilities,
        Instant lastHeartbeat) {
      this.clientId = clientId;
      this.clientType = clientType;
      this.capabilities = capabilities;
      this.lastHeartbeat = lastHeartbeat;
    }

    private ClientStatus toStatus() {
      return new ClientStatus(
          clientId, clientType, true, busy, currentConfigId, lastHeartbeat, capabilities);
    }
  }
}
