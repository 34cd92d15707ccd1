package com.project.attest.ledger;

import com.project.attest.core.AttestationFailure;
import com.project.attest.core.ErrorKind;
import com.project.attest.net.CancellationSignal;
import com.project.attest.net.PollTrigger;
import com.project.attest.net.RetryPolicy;
import com.project.attest.net.TimedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Tracks the oracle's relay transactions on every configured ledger at once and decides the
 * aggregate status under a {@link QuorumPolicy}.
 *
 * Each ledger gets its own poller task; a slow or dead ledger never holds up the others. The
 * coordinating thread only reads the per-ledger records and re-evaluates the quorum whenever one
 * of them changes. Tracking ends as soon as the aggregate is decided, when the ceiling passes,
 * or when the caller cancels; ledgers still in flight are recorded with their last status.
 */
public class ConfirmationTracker {
    private static final Logger log = LoggerFactory.getLogger(ConfirmationTracker.class);

    private static final String STAGE = "ledger";
    private static final Duration MAX_COORDINATOR_WAIT = Duration.ofSeconds(1);

    private final ExecutorService executor;
    private final TimedCall timedCall;
    private final RetryPolicy retry;
    private final Duration callTimeout;
    private final Duration ceiling;
    private final Clock clock;
    private final Map<String, Set<PollTrigger>> activeTriggers = new ConcurrentHashMap<>();

    public ConfirmationTracker(ExecutorService executor, TimedCall timedCall, RetryPolicy retry,
                               Duration callTimeout, Duration ceiling, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timedCall = Objects.requireNonNull(timedCall, "timedCall must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        this.ceiling = Objects.requireNonNull(ceiling, "ceiling must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Tracks {@code relayTransactions} on {@code targets} until the aggregate is decided, the
     * ceiling passes or {@code cancellation} fires. Blocks the calling thread.
     */
    public TrackingResult track(List<ChainTarget> targets, Map<String, String> relayTransactions,
                                QuorumPolicy quorum, CancellationSignal cancellation) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("At least one ledger target is required");
        }
        if (quorum.ledgerCount() != targets.size()) {
            throw new IllegalArgumentException(String.format(
                    "Quorum policy is for %d ledgers but %d are configured", quorum.ledgerCount(), targets.size()));
        }

        Set<String> chainIds = new HashSet<>();
        for (ChainTarget target : targets) {
            if (!chainIds.add(target.chainId())) {
                throw new IllegalArgumentException("Duplicate ledger " + target.chainId());
            }
        }

        PollTrigger coordinatorWake = new PollTrigger();
        Instant deadline = clock.instant().plus(ceiling);
        Map<String, ConfirmationRecord> records = new LinkedHashMap<>();
        Map<String, PollTrigger> pollerTriggers = new LinkedHashMap<>();
        List<Future<?>> futures = new ArrayList<>();

        for (ChainTarget target : targets) {
            String chainId = target.chainId();
            String transactionRef = relayTransactions.get(chainId);
            ConfirmationRecord record = new ConfirmationRecord(
                    ChainConfirmation.unconfirmed(chainId, transactionRef, target.requiredDepth()));
            PollTrigger trigger = new PollTrigger();
            records.put(chainId, record);
            pollerTriggers.put(chainId, trigger);
            activeTriggers.computeIfAbsent(chainId, id -> ConcurrentHashMap.newKeySet()).add(trigger);
            cancellation.onCancel(trigger::fire);
        }
        cancellation.onCancel(coordinatorWake::fire);

        for (ChainTarget target : targets) {
            String chainId = target.chainId();
            futures.add(executor.submit(new LedgerPoller(target, relayTransactions.get(chainId), records.get(chainId),
                    timedCall, retry, callTimeout, deadline, clock, pollerTriggers.get(chainId), coordinatorWake::fire)));
        }

        boolean interrupted = false;
        try {
            while (true) {
                AggregateStatus status = quorum.evaluate(snapshot(records).values());
                if (status.isDecided() || cancellation.isCancelled()) {
                    break;
                }
                Duration remaining = Duration.between(clock.instant(), deadline);
                if (remaining.isNegative() || remaining.isZero() || futures.stream().allMatch(Future::isDone)) {
                    break;
                }
                coordinatorWake.await(remaining.compareTo(MAX_COORDINATOR_WAIT) < 0 ? remaining : MAX_COORDINATOR_WAIT);
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            futures.forEach(future -> future.cancel(true));
            pollerTriggers.forEach((chainId, trigger) -> {
                Set<PollTrigger> triggers = activeTriggers.get(chainId);
                if (triggers != null) {
                    triggers.remove(trigger);
                }
            });
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        return conclude(records, quorum, cancellation.isCancelled() || interrupted);
    }

    /**
     * Push hint that {@code chainId} has news: every poller on that ledger queries early.
     */
    public void notifyUpdate(String chainId) {
        Set<PollTrigger> triggers = activeTriggers.get(chainId);
        if (triggers != null) {
            triggers.forEach(PollTrigger::fire);
        }
    }

    private TrackingResult conclude(Map<String, ConfirmationRecord> records, QuorumPolicy quorum, boolean cancelled) {
        Map<String, ChainConfirmation> finalState = snapshot(records);
        AggregateStatus status = quorum.evaluate(finalState.values());
        boolean cutoff = !status.isDecided();

        String stopReason = cutoff
                ? (cancelled ? "Tracking cancelled before this ledger settled" : "Tracking deadline exceeded before this ledger settled")
                : "Tracking stopped once the aggregate status was decided";
        finalState.replaceAll((chainId, confirmation) ->
                confirmation.status().isTerminal() || confirmation.detail() != null
                        ? confirmation
                        : confirmation.withDetail(stopReason));

        AttestationFailure failure = null;
        if (status == AggregateStatus.FAILED) {
            String failedChains = finalState.values().stream()
                    .filter(ChainConfirmation::isFailed)
                    .map(c -> c.chainId() + " (" + c.detail() + ")")
                    .collect(Collectors.joining(", "));
            failure = new AttestationFailure(ErrorKind.QUORUM_UNREACHABLE, STAGE, "aggregateStatus",
                    quorum.quorum() + " confirmed", finalState.values().stream().filter(ChainConfirmation::isConfirmed).count()
                    + " confirmed", "Quorum of " + quorum.quorum() + " of " + quorum.ledgerCount()
                    + " ledgers is unreachable; failed: " + failedChains);
        } else if (cutoff) {
            failure = AttestationFailure.of(cancelled ? ErrorKind.CANCELLED : ErrorKind.TIMEOUT, STAGE,
                    cancelled ? "Confirmation tracking cancelled" : "Quorum not reached within " + ceiling);
        }

        log.info("Aggregate ledger status {} ({} of {} confirmed, quorum {})", status,
                finalState.values().stream().filter(ChainConfirmation::isConfirmed).count(),
                quorum.ledgerCount(), quorum.quorum());
        return new TrackingResult(status, finalState, quorum, cutoff, failure);
    }

    private static Map<String, ChainConfirmation> snapshot(Map<String, ConfirmationRecord> records) {
        Map<String, ChainConfirmation> out = new LinkedHashMap<>();
        records.forEach((chainId, record) -> out.put(chainId, record.snapshot()));
        return out;
    }
}
