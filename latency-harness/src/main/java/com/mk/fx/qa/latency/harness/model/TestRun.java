package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One execution of a suite against a test client.
 *
 * <p>Status moves {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}. Once terminal the
 * run rejects every further transition and result. Transitions are synchronized so readers on
 * other threads always see a consistent status / completion time pair.
 */
@JsonIgnoreProperties(
    value = {"progressPercent", "elapsedTimeSeconds"},
    allowGetters = true)
public class TestRun {

  private final String id;
  private final String suiteId;
  private final String suiteName;
  private final int totalConfigurations;
  private final CopyOnWriteArrayList<TestResult> results;

  private volatile Instant startedAt;
  private volatile String clientId;
  private volatile ClientType clientType;
  private volatile RunStatus status;
  private volatile Instant completedAt;
  private volatile int completedConfigurations;
  private volatile String errorMessage;

  public TestRun(
      String id,
      String suiteId,
      String suiteName,
      String clientId,
      ClientType clientType,
      int totalConfigurations) {
    this(
        id,
        suiteId,
        suiteName,
        Instant.now(),
        clientId,
        clientType,
        totalConfigurations,
        RunStatus.PENDING,
        null,
        0,
        List.of(),
        null);
  }

  @JsonCreator
  public TestRun(
      @JsonProperty("id") String id,
      @JsonProperty("suiteId") String suiteId,
      @JsonProperty("suiteName") String suiteName,
      @JsonProperty("startedAt") Instant startedAt,
      @JsonProperty("clientId") String clientId,
      @JsonProperty("clientType") ClientType clientType,
      @JsonProperty("totalConfigurations") int totalConfigurations,
      @JsonProperty("status") RunStatus status,
      @JsonProperty("completedAt") Instant completedAt,
      @JsonProperty("completedConfigurations") int completedConfigurations,
      @JsonProperty("results") List<TestResult> results,
      @JsonProperty("errorMessage") String errorMessage) {
    this.id = Objects.requireNonNull(id, "Run id cannot be null");
    this.suiteId = suiteId;
    this.suiteName = suiteName;
    this.startedAt = startedAt;
    this.clientId = clientId;
    this.clientType = clientType;
    this.totalConfigurations = totalConfigurations;
    this.status = status == null ? RunStatus.PENDING : status;
    this.completedAt = completedAt;
    this.completedConfigurations = completedConfigurations;
    this.results = new CopyOnWriteArrayList<>(results == null ? List.of() : results);
    this.errorMessage = errorMessage;
  }

  public synchronized void markRunning(Instant when) {
    requireStatus(RunStatus.PENDING, RunStatus.RUNNING);
    this.startedAt = when;
    this.status = RunStatus.RUNNING;
  }

  public synchronized void markCompleted(Instant when) {
    requireStatus(RunStatus.RUNNING, RunStatus.COMPLETED);
    this.completedAt = when;
    this.status = RunStatus.COMPLETED;
  }

  public synchronized void markCancelled(Instant when) {
    requireStatus(RunStatus.RUNNING, RunStatus.CANCELLED);
    this.completedAt = when;
    this.status = RunStatus.CANCELLED;
  }

  /** Orchestration-level failure. Allowed from PENDING too, when dispatch never got going. */
  public synchronized void markFailed(Instant when, String reason) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          "Run " + id + " is already " + status.getValue() + ", cannot transition to failed");
    }
    this.completedAt = when;
    this.errorMessage = reason;
    this.status = RunStatus.FAILED;
  }

  /** Appends a result and advances the completed counter. */
  public synchronized void recordResult(TestResult result) {
    Objects.requireNonNull(result, "Result cannot be null");
    if (status != RunStatus.RUNNING) {
      throw new IllegalStateException(
          "Run " + id + " is " + status.getValue() + ", results are no longer accepted");
    }
    results.add(result);
    completedConfigurations++;
  }

  /** Moves the run to a substitute client after its original client went away. */
  public synchronized void reassignClient(String newClientId, ClientType newClientType) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Run " + id + " is already " + status.getValue());
    }
    this.clientId = newClientId;
    this.clientType = newClientType;
  }

  private void requireStatus(RunStatus expected, RunStatus target) {
    if (status != expected) {
      throw new IllegalStateException(
          "Run "
              + id
              + " cannot transition from "
              + status.getValue()
              + " to "
              + target.getValue());
    }
  }

  /** Copy of this run whose results are replaced by {@code storedResults}. */
  public synchronized TestRun withResults(List<TestResult> storedResults) {
    return new TestRun(
        id,
        suiteId,
        suiteName,
        startedAt,
        clientId,
        clientType,
        totalConfigurations,
        status,
        completedAt,
        completedConfigurations,
        storedResults,
        errorMessage);
  }

  public double getProgressPercent() {
    if (totalConfigurations == 0) {
      return 0.0;
    }
    return completedConfigurations * 100.0 / totalConfigurations;
  }

  public double getElapsedTimeSeconds() {
    Instant start = startedAt;
    if (start == null) {
      return 0.0;
    }
    Instant end = Optional.ofNullable(completedAt).orElseGet(Instant::now);
    return Duration.between(start, end).toMillis() / 1000.0;
  }

  public String getId() {
    return id;
  }

  public String getSuiteId() {
    return suiteId;
  }

  public String getSuiteName() {
    return suiteName;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public String getClientId() {
    return clientId;
  }

  public ClientType getClientType() {
    return clientType;
  }

  public int getTotalConfigurations() {
    return totalConfigurations;
  }

  public RunStatus getStatus() {
    return status;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getCompletedConfigurations() {
    return completedConfigurations;
  }

  public List<TestResult> getResults() {
    return List.copyOf(results);
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public List<TestResult> successfulResults() {
    return results.stream().filter(TestResult::isSuccess).toList();
  }
}
