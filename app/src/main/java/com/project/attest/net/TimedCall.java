package com.project.attest.net;

import com.project.attest.core.TransientNetworkException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a gateway call with a hard timeout, whatever the gateway implementation does internally.
 * A timeout or I/O failure becomes a {@link TransientNetworkException}; any other runtime
 * exception from the call is rethrown unchanged.
 */
public final class TimedCall {

    private final ExecutorService executor;

    public TimedCall(ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String operation, Duration timeout, Callable<T> call) throws InterruptedException {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientNetworkException(operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException uio) {
                throw new TransientNetworkException(operation + " failed: " + uio.getMessage(), uio.getCause());
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof IOException io) {
                throw new TransientNetworkException(operation + " failed: " + io.getMessage(), io);
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }
}
