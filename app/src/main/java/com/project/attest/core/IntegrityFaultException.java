package com.project.attest.core;

/**
 * Raised when the pipeline detects that its own trust assumptions are broken: the same input
 * hashed twice to different values, retrieved content does not match its locator, or an
 * artifact's checksum does not match its body. Never retried.
 */
public class IntegrityFaultException extends RuntimeException {

    private final AttestationFailure failure;

    public IntegrityFaultException(AttestationFailure failure) {
        super(failure.describe());
        if (failure.kind() != ErrorKind.INTEGRITY_FAULT) {
            throw new IllegalArgumentException("failure kind must be INTEGRITY_FAULT but was " + failure.kind());
        }
        this.failure = failure;
    }

    public AttestationFailure failure() {
        return failure;
    }
}
