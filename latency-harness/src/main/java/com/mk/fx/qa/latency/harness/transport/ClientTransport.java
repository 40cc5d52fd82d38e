package com.mk.fx.qa.latency.harness.transport;

import com.mk.fx.qa.latency.harness.exception.ClientDisconnectedException;
import com.mk.fx.qa.latency.harness.exception.DispatchException;
import com.mk.fx.qa.latency.harness.exception.DispatchTimeoutException;
import com.mk.fx.qa.latency.harness.model.TestConfiguration;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.time.Duration;

/** Executes one configuration on a remote test client and returns its measurement. */
public interface ClientTransport {

  /**
   * Sends {@code configuration} to {@code clientId} and blocks until the client reports back.
   *
   * @throws DispatchTimeoutException if no result arrives within {@code timeout}
   * @throws ClientDisconnectedException if the client is evicted while the call is pending
   * @throws DispatchException for any other delivery failure
   * @throws InterruptedException if the calling worker is interrupted while waiting
   */
  TestResult dispatch(
      String runId, String clientId, TestConfiguration configuration, Duration timeout)
      throws DispatchException, InterruptedException;
}
