package com.mk.fx.qa.latency.harness.exception;

/** A configuration could not be executed on the client it was sent to. */
public class DispatchException extends Exception {

  public DispatchException(String message) {
    super(message);
  }

  public DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
