package com.project.attest.core;

/**
 * A gateway call failed in a way that may succeed on retry (timeout, connection reset, 5xx).
 */
public class TransientNetworkException extends RuntimeException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
