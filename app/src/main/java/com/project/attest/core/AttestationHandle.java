package com.project.attest.core;

import com.project.attest.net.CancellationSignal;

import java.util.concurrent.CompletableFuture;

/**
 * A running attestation. Cancelling stops oracle and ledger polling promptly; the future then
 * completes with a {@link ErrorKind#CANCELLED} result instead of failing.
 */
public final class AttestationHandle {

    private final CompletableFuture<AttestationResult> result;
    private final CancellationSignal cancellation;

    AttestationHandle(CompletableFuture<AttestationResult> result, CancellationSignal cancellation) {
        this.result = result;
        this.cancellation = cancellation;
    }

    public CompletableFuture<AttestationResult> result() {
        return result;
    }

    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }
}
