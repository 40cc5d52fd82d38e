package com.mk.fx.qa.latency.harness.exception;

/**
 * Failure of the run as a whole, as opposed to a single configuration: lost client with no
 * substitute, storage write failure, or a run that could not be scheduled.
 */
public class OrchestrationException extends RuntimeException {

  public OrchestrationException(String message) {
    super(message);
  }

  public OrchestrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
