package com.mk.fx.qa.latency.harness.exception;

/** The client holding a dispatched configuration was evicted before answering. */
public class ClientDisconnectedException extends DispatchException {

  private final String clientId;

  public ClientDisconnectedException(String clientId) {
    super("Client " + clientId + " disconnected");
    this.clientId = clientId;
  }

  public String getClientId() {
    return clientId;
  }
}
