package com.mk.fx.qa.latency.agent;

import com.mk.fx.qa.latency.agent.dto.AgentCapabilities;
import com.mk.fx.qa.latency.agent.dto.HeartbeatPayload;
import com.mk.fx.qa.latency.agent.dto.Measurement;
import com.mk.fx.qa.latency.agent.dto.ResultPayload;
import com.mk.fx.qa.latency.agent.dto.WorkAssignment;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Client side of the harness work protocol: heartbeats keep the client registered, {@link
 * #pollWork} long-polls for the next dispatched configuration and {@link #submitResult} answers
 * it. {@link #serve} ties these together until {@link #close()} is called.
 */
@Slf4j
public class HarnessAgentClient implements AutoCloseable {

    private static final String API = "/api/latency-tests";

    /** Extra time allowed on top of the poll window before the HTTP call itself times out. */
    private static final Duration POLL_GRACE = Duration.ofSeconds(10);

    private final HarnessHttpClient http;
    private final String clientId;
    private final String clientType;
    private final AgentCapabilities capabilities;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ScheduledExecutorService heartbeatScheduler;

    public HarnessAgentClient(
            HarnessHttpClient http,
            String clientId,
            String clientType,
            AgentCapabilities capabilities) {
        this.http = Objects.requireNonNull(http, "HTTP client cannot be null");
        this.clientId = Objects.requireNonNull(clientId, "Client id cannot be null");
        this.clientType = Objects.requireNonNull(clientType, "Client type cannot be null");
        this.capabilities = capabilities;
    }

    /** Registers the client, or refreshes its registration and capabilities. */
    public void heartbeat() {
        http.executeForBody(
                Request.builder()
                        .method(HttpMethod.POST)
                        .path(API + "/heartbeat")
                        .body(new HeartbeatPayload(clientId, clientType, capabilities))
                        .build(),
                Map.class);
        log.debug("Heartbeat sent for client {}", clientId);
    }

    /**
     * Waits up to {@code wait} for the next configuration. The harness caps the window at its own
     * poll limit.
     *
     * @return empty when nothing was dispatched within the window
     * @throws HarnessClientException with status 404 when the harness no longer knows this client
     */
    public Optional<WorkAssignment> pollWork(Duration wait) {
        var assignment =
                http.executeForBody(
                        Request.builder()
                                .method(HttpMethod.GET)
                                .path(API + "/clients/" + encode(clientId) + "/work")
                                .query(Map.of("waitMs", String.valueOf(wait.toMillis())))
                                .timeout(wait.plus(POLL_GRACE))
                                .build(),
                        WorkAssignment.class);
        return Optional.ofNullable(assignment);
    }

    /**
     * @throws HarnessClientException with status 404 when the dispatch was abandoned by the
     *     harness, typically after a timeout
     */
    public void submitResult(String dispatchId, Measurement measurement) {
        http.executeForBody(
                Request.builder()
                        .method(HttpMethod.POST)
                        .path(API + "/results")
                        .body(new ResultPayload(clientId, dispatchId, measurement))
                        .build(),
                Map.class);
    }

    /** Sends a heartbeat now and then every {@code interval} until the client is closed. */
    public synchronized void startHeartbeats(Duration interval) {
        if (heartbeatScheduler != null) {
            return;
        }
        heartbeat();
        heartbeatScheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "harness-agent-heartbeat");
                            thread.setDaemon(true);
                            return thread;
                        });
        heartbeatScheduler.scheduleWithFixedDelay(
                this::heartbeatSafely,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    private void heartbeatSafely() {
        try {
            heartbeat();
        } catch (HarnessClientException e) {
            log.warn("Heartbeat for client {} failed: {}", clientId, e.getMessage());
        }
    }

    /**
     * Polls, executes and submits until {@link #close()} is called or the thread is interrupted.
     * An unknown-client answer triggers a fresh heartbeat; an executor failure is reported as a
     * failed measurement.
     */
    public void serve(ConfigurationExecutor executor, Duration pollWait) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Client " + clientId + " is already serving");
        }
        log.info("Client {} serving harness work", clientId);
        try {
            serveUntilClosed(executor, pollWait);
        } finally {
            running.set(false);
        }
        log.info("Client {} stopped serving", clientId);
    }

    private void serveUntilClosed(ConfigurationExecutor executor, Duration pollWait) {
        while (!closed.get() && !Thread.currentThread().isInterrupted()) {
            Optional<WorkAssignment> work;
            try {
                work = pollWork(pollWait);
            } catch (HarnessClientException e) {
                if (closed.get()) {
                    break;
                }
                if (e.isNotFound()) {
                    log.info("Client {} unknown to harness, registering again", clientId);
                    heartbeatSafely();
                } else {
                    log.warn("Polling for work failed: {}", e.getMessage());
                    pause(Duration.ofSeconds(1));
                }
                continue;
            }
            work.ifPresent(assignment -> handle(executor, assignment));
        }
    }

    private void handle(ConfigurationExecutor executor, WorkAssignment assignment) {
        var configuration = assignment.configuration();
        Measurement measurement;
        try {
            measurement = executor.execute(configuration);
            if (measurement == null) {
                measurement = Measurement.failed("Executor returned no measurement");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            measurement = Measurement.failed("Interrupted while executing " + configuration.id());
        } catch (Exception e) {
            log.warn("Configuration {} failed on client: {}", configuration.id(), e.getMessage());
            measurement = Measurement.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        try {
            submitResult(assignment.dispatchId(), measurement);
            log.debug(
                    "Submitted result for {} (dispatch {})",
                    configuration.id(),
                    assignment.dispatchId());
        } catch (HarnessClientException e) {
            log.warn(
                    "Result for {} (dispatch {}) rejected: {}",
                    configuration.id(),
                    assignment.dispatchId(),
                    e.getMessage());
        }
    }

    private void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public synchronized void close() {
        closed.set(true);
        if (heartbeatScheduler != null) {
            heartbeatScheduler.shutdownNow();
            heartbeatScheduler = null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
