package com.project.attest.oracle;

import com.project.attest.core.AttestationFailure;
import com.project.attest.core.ErrorKind;
import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.ReportValidationException;
import com.project.attest.core.TransientNetworkException;
import com.project.attest.crypto.DocumentId;
import com.project.attest.io.ContentLocator;
import com.project.attest.net.CancellationSignal;
import com.project.attest.net.TimedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one {@link AttestationRequest} from submission to a terminal state:
 * {@code CREATED -> SUBMITTED -> POLLING -> FINALIZED | TIMED_OUT | REJECTED | CANCELLED}.
 *
 * Transient errors (timeouts, 5xx) on submit or poll are retried with backoff until either the
 * retry budget or the request's wall-clock ceiling runs out. Explicit refusals and invalid
 * reports reject the request; a rejected request is never resubmitted.
 *
 * The client holds no global state: callers construct it with their gateway and policy.
 */
public class OracleClient {
    private static final Logger log = LoggerFactory.getLogger(OracleClient.class);

    private static final String STAGE = OracleReportValidator.STAGE;

    private final OracleGateway gateway;
    private final OracleReportValidator validator;
    private final OraclePolicy policy;
    private final TimedCall timedCall;
    private final Clock clock;
    private final Map<String, AttestationRequest> inFlight = new ConcurrentHashMap<>();

    public OracleClient(OracleGateway gateway, OracleReportValidator validator, OraclePolicy policy,
                        TimedCall timedCall, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.timedCall = Objects.requireNonNull(timedCall, "timedCall must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs the request to completion on the calling thread.
     */
    public OracleOutcome attest(DocumentId documentId, ContentLocator locator, CancellationSignal cancellation) {
        AttestationRequest request = new AttestationRequest(documentId, locator, clock.instant());
        Instant deadline = request.createdAt().plus(policy.ceiling());
        cancellation.onCancel(request.pollTrigger()::fire);

        try {
            Optional<String> requestId = callWithRetry(request, "oracle submit", deadline, cancellation,
                    () -> gateway.submit(documentId, locator));
            if (requestId.isEmpty()) {
                return request.outcome();
            }
            request.markSubmitted(requestId.get(), clock.instant());
            inFlight.put(requestId.get(), request);
            log.info("Submitted document {} to oracle as request {}", documentId, requestId.get());

            pollUntilTerminal(request, deadline, cancellation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.terminate(RequestState.CANCELLED,
                    AttestationFailure.of(ErrorKind.CANCELLED, STAGE, "Interrupted while waiting for the oracle"));
        } finally {
            if (request.requestId() != null) {
                inFlight.remove(request.requestId());
            }
        }

        OracleOutcome outcome = request.outcome();
        if (outcome.isFinalized()) {
            log.info("Oracle request {} finalized", outcome.requestId());
        } else {
            log.warn("Oracle request for {} ended {}: {}", documentId, outcome.state(),
                    outcome.failureReason().map(AttestationFailure::describe).orElse("no detail"));
        }
        return outcome;
    }

    /**
     * Push hint from a webhook or subscription: polls {@code requestId} early if it is in flight.
     *
     * @return whether a request with that id is currently being polled
     */
    public boolean notifyUpdate(String requestId) {
        AttestationRequest request = inFlight.get(requestId);
        if (request == null) {
            return false;
        }
        request.pollTrigger().fire();
        return true;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void pollUntilTerminal(AttestationRequest request, Instant deadline, CancellationSignal cancellation)
            throws InterruptedException {
        String requestId = request.requestId();
        while (!request.state().isTerminal()) {
            Optional<OraclePoll> poll = callWithRetry(request, "oracle poll", deadline, cancellation,
                    () -> gateway.pollStatus(requestId));
            if (poll.isEmpty()) {
                return;
            }
            Optional<OracleReport> report = poll.get().finalReport();
            if (report.isPresent()) {
                accept(request, report.get());
                return;
            }
            request.markPolling();
            log.debug("Oracle request {} still pending", requestId);

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (!remaining.isNegative() && !remaining.isZero()) {
                request.pollTrigger().await(min(policy.pollInterval(), remaining));
            }
        }
    }

    private void accept(AttestationRequest request, OracleReport report) {
        ReportCheck check = validator.validate(report, request.requestId(), request.documentId());
        if (check.isAccepted()) {
            request.finalizeWith(report, check.warnings());
        } else {
            request.terminate(RequestState.REJECTED, check.rejection());
        }
    }

    /**
     * Calls the gateway until it answers, retrying transient errors. Returns empty after moving
     * the request into a terminal state.
     */
    private <T> Optional<T> callWithRetry(AttestationRequest request, String operation, Instant deadline,
                                          CancellationSignal cancellation, Callable<T> call)
            throws InterruptedException {
        int failures = 0;
        while (true) {
            if (cancellation.isCancelled()) {
                request.terminate(RequestState.CANCELLED,
                        AttestationFailure.of(ErrorKind.CANCELLED, STAGE, "Cancelled by caller"));
                return Optional.empty();
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                request.terminate(RequestState.TIMED_OUT, AttestationFailure.of(ErrorKind.TIMEOUT, STAGE,
                        "No finalized oracle report within " + policy.ceiling()));
                return Optional.empty();
            }

            try {
                return Optional.of(timedCall.call(operation, min(policy.callTimeout(), remaining), call));
            } catch (TransientNetworkException e) {
                failures++;
                if (!policy.retry().allowsRetry(failures)) {
                    request.terminate(RequestState.TIMED_OUT, AttestationFailure.of(ErrorKind.TRANSIENT_NETWORK,
                            STAGE, operation + " failed " + failures + " times in a row: " + e.getMessage()));
                    return Optional.empty();
                }
                Duration backoff = policy.retry().delay(failures - 1);
                log.warn("{} failed (attempt {}), retrying in {}ms: {}", operation, failures, backoff.toMillis(),
                        e.getMessage());
                request.pollTrigger().await(min(backoff, Duration.between(clock.instant(), deadline)));
            } catch (ExternalServiceException e) {
                request.terminate(RequestState.REJECTED,
                        AttestationFailure.of(ErrorKind.VALIDATION, STAGE, "Oracle refused the request: " + e.getMessage()));
                return Optional.empty();
            } catch (ReportValidationException e) {
                request.terminate(RequestState.REJECTED, new AttestationFailure(ErrorKind.VALIDATION, STAGE,
                        e.field(), null, null, "Malformed oracle response: " + e.getMessage()));
                return Optional.empty();
            }
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
