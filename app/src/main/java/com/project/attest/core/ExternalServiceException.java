package com.project.attest.core;

/**
 * The oracle or a ledger answered with an explicit, non-transient error (4xx, JSON-RPC error).
 */
public class ExternalServiceException extends RuntimeException {

    private final String service;

    public ExternalServiceException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public String service() {
        return service;
    }
}
