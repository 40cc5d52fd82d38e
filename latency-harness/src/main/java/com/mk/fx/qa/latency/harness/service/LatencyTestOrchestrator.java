package com.mk.fx.qa.latency.harness.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.latency.harness.analysis.NetworkProjector;
import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import com.mk.fx.qa.latency.harness.client.ClientRegistry;
import com.mk.fx.qa.latency.harness.events.EventPayloads;
import com.mk.fx.qa.latency.harness.events.HarnessEventSink;
import com.mk.fx.qa.latency.harness.events.HarnessEventType;
import com.mk.fx.qa.latency.harness.exception.ClientDisconnectedException;
import com.mk.fx.qa.latency.harness.exception.DispatchException;
import com.mk.fx.qa.latency.harness.exception.DispatchTimeoutException;
import com.mk.fx.qa.latency.harness.exception.NoCapableClientException;
import com.mk.fx.qa.latency.harness.exception.OrchestrationException;
import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.ClientStatus;
import com.mk.fx.qa.latency.harness.model.ClientType;
import com.mk.fx.qa.latency.harness.model.PredefinedSuites;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestConfiguration;
import com.mk.fx.qa.latency.harness.model.TestResult;
import com.mk.fx.qa.latency.harness.model.TestRun;
import com.mk.fx.qa.latency.harness.model.TestSuiteDefinition;
import com.mk.fx.qa.latency.harness.storage.LatencyHarnessStorage;
import com.mk.fx.qa.latency.harness.storage.RunPage;
import com.mk.fx.qa.latency.harness.transport.ClientTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Starts, drives, tracks and cancels latency test runs.
 *
 * <p>Each run owns one worker from a fixed pool and dispatches its configurations to its client
 * strictly one at a time, in expansion order. Waiting on the client is the only blocking step and
 * is bounded by the configuration timeout. After every result the run is persisted and progress
 * and result events are emitted; the completion event is emitted last.
 *
 * <p>Cancellation is cooperative: the flag is checked before each dispatch and once the in-flight
 * configuration returns, whose result is then discarded. The in-flight call itself is not
 * aborted.
 */
@Slf4j
@Service
public class LatencyTestOrchestrator {

  private final HarnessCfg properties;
  private final LatencyHarnessStorage storage;
  private final ClientRegistry registry;
  private final ClientTransport transport;
  private final HarnessEventSink events;
  private final ThreadPoolExecutor executor;
  private final Map<String, RunContext> activeRuns = new ConcurrentHashMap<>();
  private final AtomicBoolean acceptingRuns = new AtomicBoolean(true);

  public LatencyTestOrchestrator(
      HarnessCfg properties,
      LatencyHarnessStorage storage,
      ClientRegistry registry,
      ClientTransport transport,
      HarnessEventSink events) {
    this.properties = properties;
    this.storage = storage;
    this.registry = registry;
    this.transport = transport;
    this.events = events;
    this.executor = createExecutor(properties.getRunConcurrency());
  }

  @PostConstruct
  void initialise() {
    for (TestSuiteDefinition suite : PredefinedSuites.all()) {
      if (storage.getSuite(suite.id()).isEmpty()) {
        storage.saveSuite(suite);
        log.info("Built-in suite {} registered", suite.id());
      }
    }
    failInterruptedRuns();
    log.info(
        "LatencyTestOrchestrator initialised with runConcurrency={} configurationTimeout={}s",
        properties.getRunConcurrency(),
        properties.getConfigurationTimeout().toSeconds());
  }

  /**
   * Runs stored as pending or running belong to a previous process: nothing drives them any more,
   * so they are closed as failed.
   */
  private void failInterruptedRuns() {
    var now = Instant.now();
    for (RunStatus status : List.of(RunStatus.PENDING, RunStatus.RUNNING)) {
      for (TestRun run : storage.listRuns(status, null, Integer.MAX_VALUE, 0).runs()) {
        run.markFailed(now, "Harness restarted while the run was " + status.getValue());
        storage.saveRun(run);
        log.warn(
            "Run {} was {} when the harness stopped, marked failed",
            run.getId(),
            status.getValue());
      }
    }
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("latency-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Run executor is not accepting work");
        });
    return pool;
  }

  // -------------------------------------------------------------------------
  // Runs
  // -------------------------------------------------------------------------

  /**
   * Resolves a client, creates the run and schedules it.
   *
   * @param clientId explicit client to use; takes precedence over {@code clientType}
   * @param clientType restricts automatic selection to this client type, may be null
   * @return the run, already {@code running}
   * @throws ResourceNotFoundException if the suite or the explicit client is unknown
   * @throws NoCapableClientException if no idle client supports every provider of the suite
   * @throws OrchestrationException if the run cannot be persisted or scheduled
   */
  public TestRun startRun(String suiteId, String clientId, ClientType clientType) {
    if (!acceptingRuns.get()) {
      throw new OrchestrationException("Orchestrator is shutting down, no new runs accepted");
    }
    var suite = getSuite(suiteId);
    var configurations = suite.generateConfigurations();
    var resolvedClient = claimClient(suite, clientId, clientType);
    var resolvedType =
        registry.getClient(resolvedClient).map(ClientStatus::clientType).orElse(clientType);

    var run =
        new TestRun(
            UUID.randomUUID().toString(),
            suite.id(),
            suite.name(),
            resolvedClient,
            resolvedType,
            configurations.size());
    run.markRunning(Instant.now());
    var context = new RunContext(run, suite, configurations);

    try {
      storage.saveRun(run);
    } catch (RuntimeException ex) {
      registry.markIdle(resolvedClient);
      run.markFailed(Instant.now(), "Failed to persist run: " + ex.getMessage());
      log.error("Run {} could not be persisted: {}", run.getId(), ex.getMessage(), ex);
      throw new OrchestrationException("Failed to persist run " + run.getId(), ex);
    }

    activeRuns.put(run.getId(), context);
    try {
      executor.submit(() -> drive(context));
    } catch (RejectedExecutionException ex) {
      activeRuns.remove(run.getId());
      registry.markIdle(resolvedClient);
      run.markFailed(Instant.now(), ex.getMessage());
      persistQuietly(run);
      throw new OrchestrationException("Run " + run.getId() + " could not be scheduled", ex);
    }
    log.info(
        "Run {} started for suite {} on client {} ({} configurations)",
        run.getId(),
        suite.id(),
        resolvedClient,
        configurations.size());
    return run;
  }

  private String claimClient(TestSuiteDefinition suite, String clientId, ClientType clientType) {
    var space = suite.parameterSpace();
    if (clientId != null && !clientId.isBlank()) {
      if (!registry.claim(clientId, space)) {
        throw new NoCapableClientException(
            "Client "
                + clientId
                + " is busy or does not support every provider in suite "
                + suite.id());
      }
      return clientId;
    }
    return registry
        .claimCapable(space, clientType)
        .orElseThrow(
            () ->
                new NoCapableClientException(
                    "No idle "
                        + (clientType == null ? "" : clientType.getValue() + " ")
                        + "client supports every provider in suite "
                        + suite.id()));
  }

  private void drive(RunContext context) {
    var run = context.run;
    var runId = run.getId();
    try {
      for (TestConfiguration configuration : context.configurations) {
        if (context.cancelRequested.get()) {
          break;
        }
        var result = execute(context, configuration);
        if (context.cancelRequested.get()) {
          log.info("Run {} cancelled, discarding result of {}", runId, configuration.id());
          break;
        }
        record(run, result);
      }
      if (context.cancelRequested.get()) {
        run.markCancelled(Instant.now());
        log.info(
            "Run {} cancelled after {}/{} configurations",
            runId,
            run.getCompletedConfigurations(),
            run.getTotalConfigurations());
      } else {
        run.markCompleted(Instant.now());
        log.info(
            "Run {} completed ({} configurations, {}s)",
            runId,
            run.getCompletedConfigurations(),
            run.getElapsedTimeSeconds());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      run.markFailed(Instant.now(), "Run interrupted");
      log.warn("Run {} interrupted", runId);
    } catch (RuntimeException ex) {
      run.markFailed(Instant.now(), ex.getMessage());
      log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      registry.markIdle(run.getClientId());
      persistQuietly(run);
      activeRuns.remove(runId);
      events.emit(
          HarnessEventType.RUN_COMPLETE,
          runId,
          new EventPayloads.RunComplete(
              runId,
              run.getStatus(),
              run.getCompletedConfigurations(),
              run.getTotalConfigurations(),
              run.getElapsedTimeSeconds()));
    }
  }

  /**
   * Dispatches one configuration. Configuration-level failures come back as failed results; only a
   * lost client without substitute escapes as {@link OrchestrationException}.
   */
  private TestResult execute(RunContext context, TestConfiguration configuration)
      throws InterruptedException {
    var run = context.run;
    var clientId = ensureClient(context);
    while (true) {
      registry.markBusy(clientId, configuration.id());
      try {
        var result =
            transport.dispatch(
                run.getId(), clientId, configuration, properties.getConfigurationTimeout());
        return complete(result, configuration, run.getClientType());
      } catch (DispatchTimeoutException ex) {
        log.warn(
            "Run {} configuration {} timed out: {}",
            run.getId(),
            configuration.id(),
            ex.getMessage());
        return TestResult.failure(configuration, run.getClientType(), ex.getMessage());
      } catch (ClientDisconnectedException ex) {
        log.warn(
            "Run {} lost client {} during {}", run.getId(), ex.getClientId(), configuration.id());
        clientId = substitute(context);
      } catch (DispatchException ex) {
        log.warn(
            "Run {} configuration {} failed on client {}: {}",
            run.getId(),
            configuration.id(),
            clientId,
            ex.getMessage());
        return TestResult.failure(configuration, run.getClientType(), ex.getMessage());
      }
    }
  }

  private String ensureClient(RunContext context) {
    var clientId = context.run.getClientId();
    if (registry.isConnected(clientId)) {
      return clientId;
    }
    log.warn("Run {} client {} is no longer connected", context.run.getId(), clientId);
    return substitute(context);
  }

  private String substitute(RunContext context) {
    var run = context.run;
    var previous = run.getClientId();
    var replacement =
        registry
            .claimCapable(context.suite.parameterSpace(), run.getClientType())
            .orElseThrow(
                () ->
                    new OrchestrationException(
                        "Client "
                            + previous
                            + " disconnected and no capable substitute is available"));
    run.reassignClient(replacement, run.getClientType());
    log.info("Run {} moved from client {} to {}", run.getId(), previous, replacement);
    return replacement;
  }

  /** Stamps the configuration's identity and settings on the client's measurement. */
  private static TestResult complete(
      TestResult reported, TestConfiguration configuration, ClientType clientType) {
    var result =
        reported.toBuilder()
            .configId(configuration.configId())
            .scenarioName(configuration.scenarioName())
            .repetition(configuration.repetition())
            .networkProfile(configuration.networkProfile())
            .clientType(reported.clientType() != null ? reported.clientType() : clientType)
            .sttConfig(configuration.stt())
            .llmConfig(configuration.llm())
            .ttsConfig(configuration.tts())
            .audioConfig(configuration.audioEngine())
            .build();
    return result.isSuccess() ? NetworkProjector.withProjections(result, configuration) : result;
  }

  private void record(TestRun run, TestResult result) {
    run.recordResult(result);
    if (!result.isSuccess()) {
      log.warn(
          "Run {} configuration {} failed: {}", run.getId(), result.configId(), result.errors());
    }
    try {
      storage.saveResult(run.getId(), result);
      storage.saveRun(run);
    } catch (RuntimeException ex) {
      throw new OrchestrationException("Failed to persist result of run " + run.getId(), ex);
    }
    events.emit(
        HarnessEventType.TEST_PROGRESS,
        run.getId(),
        new EventPayloads.Progress(
            run.getId(),
            run.getCompletedConfigurations(),
            run.getTotalConfigurations(),
            run.getProgressPercent()));
    events.emit(
        HarnessEventType.TEST_RESULT, run.getId(), new EventPayloads.Result(run.getId(), result));
  }

  private void persistQuietly(TestRun run) {
    try {
      storage.saveRun(run);
    } catch (RuntimeException ex) {
      log.error("Run {} final state could not be persisted: {}", run.getId(), ex.getMessage(), ex);
    }
  }

  /**
   * Requests cancellation of a run.
   *
   * @return {@code CANCELLATION_REQUESTED} for an active run, {@code NOT_CANCELLABLE} for a run
   *     that already finished, {@code NOT_FOUND} otherwise
   */
  public CancellationResult cancelRun(String runId) {
    var context = activeRuns.get(runId);
    if (context == null) {
      return storage
          .getRun(runId)
          .map(run -> CancellationResult.notCancellable(run.getStatus()))
          .orElseGet(CancellationResult::notFound);
    }
    var status = context.run.getStatus();
    if (status.isTerminal()) {
      return CancellationResult.notCancellable(status);
    }
    context.cancelRequested.set(true);
    log.info("Run {} cancellation requested", runId);
    return CancellationResult.cancellationRequested(status);
  }

  /**
   * Live state of an active run, otherwise the stored run.
   *
   * @throws ResourceNotFoundException if the run is unknown
   */
  public TestRun getRun(String runId) {
    var context = activeRuns.get(runId);
    if (context != null) {
      return context.run;
    }
    return storage.getRun(runId).orElseThrow(() -> new ResourceNotFoundException("Run", runId));
  }

  public RunPage listRuns(RunStatus status, String suiteId, Integer limit, Integer offset) {
    int pageSize = limit == null ? properties.getRunHistoryLimit() : limit;
    int skip = offset == null ? 0 : offset;
    if (pageSize < 0 || skip < 0) {
      throw new IllegalArgumentException("limit and offset must not be negative");
    }
    return storage.listRuns(status, suiteId, pageSize, skip);
  }

  public List<TestResult> getResults(String runId, String configId, Integer limit) {
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    getRun(runId);
    return storage.getResults(runId, configId, limit);
  }

  @VisibleForTesting
  int activeRunCount() {
    return activeRuns.size();
  }

  // -------------------------------------------------------------------------
  // Suites
  // -------------------------------------------------------------------------

  public List<TestSuiteDefinition> listSuites() {
    return storage.listSuites();
  }

  public TestSuiteDefinition getSuite(String suiteId) {
    return storage
        .getSuite(suiteId)
        .orElseThrow(() -> new ResourceNotFoundException("Suite", suiteId));
  }

  /**
   * Validates and stores an operator-defined suite.
   *
   * @throws IllegalArgumentException if the definition is invalid or replaces a built-in suite
   */
  public TestSuiteDefinition saveSuite(TestSuiteDefinition suite) {
    suite.validate();
    if (PredefinedSuites.isBuiltIn(suite.id())) {
      throw new IllegalArgumentException("Built-in suite " + suite.id() + " cannot be replaced");
    }
    storage.saveSuite(suite);
    log.info("Suite {} saved ({} configurations)", suite.id(), suite.totalTestCount());
    return suite;
  }

  public void deleteSuite(String suiteId) {
    if (PredefinedSuites.isBuiltIn(suiteId)) {
      throw new IllegalArgumentException("Built-in suite " + suiteId + " cannot be deleted");
    }
    if (!storage.deleteSuite(suiteId)) {
      throw new ResourceNotFoundException("Suite", suiteId);
    }
    log.info("Suite {} deleted", suiteId);
  }

  // -------------------------------------------------------------------------
  // Lifecycle
  // -------------------------------------------------------------------------

  /**
   * Stops accepting runs, asks active runs to cancel at their next configuration boundary and
   * waits briefly for them to wind down.
   */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      activeRuns.values().forEach(context -> context.cancelRequested.set(true));
      executor.shutdown();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("{} runs still active at shutdown", activeRuns.size());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }

  private static final class RunContext {
    private final TestRun run;
    private final TestSuiteDefinition suite;
    private final List<TestConfiguration> configurations;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private RunContext(
        TestRun run, TestSuiteDefinition suite, List<TestConfiguration> configurations) {
      this.run = run;
      this.suite = suite;
      this.configurations = configurations;
    }
  }

  /** Describes the outcome of a cancellation attempt for a run. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final RunStatus runStatus;

    private CancellationResult(CancellationState state, RunStatus runStatus) {
      this.state = state;
      this.runStatus = runStatus;
    }

    public static CancellationResult cancellationRequested(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, status);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(RunStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}
