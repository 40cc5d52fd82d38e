package com.mk.fx.qa.latency.agent;

/** A call to the harness failed, either on the wire or with an error status. */
public class HarnessClientException extends RuntimeException {

    /** HTTP status of the failed call, or -1 when no response was received. */
    private final int statusCode;

    public HarnessClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public HarnessClientException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
