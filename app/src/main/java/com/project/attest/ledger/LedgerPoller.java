package com.project.attest.ledger;

import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.TransientNetworkException;
import com.project.attest.net.PollTrigger;
import com.project.attest.net.RetryPolicy;
import com.project.attest.net.TimedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls one ledger for one relay transaction and is the only writer of that ledger's
 * {@link ConfirmationRecord}. Stops on a terminal status, at the deadline or on interrupt.
 */
final class LedgerPoller implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(LedgerPoller.class);

    private final ChainTarget target;
    private final String transactionRef;
    private final ConfirmationRecord record;
    private final TimedCall timedCall;
    private final RetryPolicy retry;
    private final Duration callTimeout;
    private final Instant deadline;
    private final Clock clock;
    private final PollTrigger trigger;
    private final Runnable onUpdate;

    LedgerPoller(ChainTarget target, String transactionRef, ConfirmationRecord record, TimedCall timedCall,
                 RetryPolicy retry, Duration callTimeout, Instant deadline, Clock clock, PollTrigger trigger,
                 Runnable onUpdate) {
        this.target = target;
        this.transactionRef = transactionRef;
        this.record = record;
        this.timedCall = timedCall;
        this.retry = retry;
        this.callTimeout = callTimeout;
        this.deadline = deadline;
        this.clock = clock;
        this.trigger = trigger;
        this.onUpdate = onUpdate;
    }

    @Override
    public void run() {
        String chainId = target.chainId();
        if (transactionRef == null || transactionRef.isBlank()) {
            write(record.snapshot().failed("Oracle reported no relay transaction for this ledger"));
            return;
        }

        Instant started = clock.instant();
        boolean seen = false;
        int failures = 0;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Duration remaining = Duration.between(clock.instant(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    log.warn("Ledger {} not settled before the tracking deadline", chainId);
                    return;
                }

                TransactionStatus status;
                try {
                    status = timedCall.call("ledger " + chainId, min(callTimeout, remaining),
                            () -> target.gateway().getTransactionStatus(transactionRef));
                    failures = 0;
                } catch (TransientNetworkException e) {
                    failures++;
                    if (!retry.allowsRetry(failures)) {
                        write(record.snapshot().failed("Ledger unreachable after " + failures + " attempts: " + e.getMessage()));
                        return;
                    }
                    Duration backoff = retry.delay(failures - 1);
                    log.warn("Ledger {} query failed (attempt {}), retrying in {}ms: {}", chainId, failures,
                            backoff.toMillis(), e.getMessage());
                    trigger.await(min(backoff, remaining));
                    continue;
                } catch (ExternalServiceException e) {
                    write(record.snapshot().failed("Ledger returned an error: " + e.getMessage()));
                    return;
                } catch (RuntimeException e) {
                    log.error("Ledger {} query failed unexpectedly", chainId, e);
                    write(record.snapshot().failed("Ledger query failed unexpectedly: " + e));
                    return;
                }

                ChainConfirmation next = interpret(status, seen, Duration.between(started, clock.instant()));
                seen |= status.found();
                write(next);
                if (next.status().isTerminal()) {
                    return;
                }
                trigger.await(min(target.pollInterval(), Duration.between(clock.instant(), deadline)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    ChainConfirmation interpret(TransactionStatus status, boolean seenBefore, Duration elapsed) {
        ChainConfirmation current = record.snapshot();
        if (!status.found()) {
            if (seenBefore) {
                return current.failed("Transaction was reorganized out of the chain");
            }
            if (elapsed.compareTo(target.notFoundGrace()) >= 0) {
                return current.failed("Transaction not found after grace period of " + target.notFoundGrace());
            }
            return new ChainConfirmation(current.chainId(), transactionRef, null, 0, target.requiredDepth(),
                    ConfirmationStatus.UNCONFIRMED, null);
        }
        if (status.reverted()) {
            return new ChainConfirmation(current.chainId(), transactionRef, status.blockHeight(),
                    status.confirmationCount(), target.requiredDepth(), ConfirmationStatus.FAILED,
                    "Transaction reverted");
        }
        ConfirmationStatus next = status.confirmationCount() >= target.requiredDepth()
                ? ConfirmationStatus.CONFIRMED
                : ConfirmationStatus.PENDING;
        return new ChainConfirmation(current.chainId(), transactionRef, status.blockHeight(),
                status.confirmationCount(), target.requiredDepth(), next, null);
    }

    private void write(ChainConfirmation next) {
        ChainConfirmation previous = record.snapshot();
        if (!record.update(next)) {
            return;
        }
        if (previous.status() != next.status()) {
            if (next.isFailed()) {
                log.warn("Ledger {} FAILED: {}", next.chainId(), next.detail());
            } else {
                log.info("Ledger {} {} ({} of {} confirmations)", next.chainId(), next.status(),
                        next.confirmationCount(), next.requiredDepth());
            }
        }
        onUpdate.run();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
