package com.mk.fx.qa.latency.harness.exception;

import java.time.Duration;

public class DispatchTimeoutException extends DispatchException {

  public DispatchTimeoutException(String clientId, String configurationId, Duration timeout) {
    super(
        "Timed out after "
            + timeout.toSeconds()
            + "s waiting for client "
            + clientId
            + " to execute "
            + configurationId);
  }
}
