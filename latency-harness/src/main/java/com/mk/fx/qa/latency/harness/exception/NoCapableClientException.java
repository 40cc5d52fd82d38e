package com.mk.fx.qa.latency.harness.exception;

/** No connected, idle client supports every provider a suite needs. */
public class NoCapableClientException extends RuntimeException {

  public NoCapableClientException(String message) {
    super(message);
  }
}
