package com.project.attest.ledger;

import com.project.attest.core.AttestationFailure;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Outcome of tracking all ledgers for one report.
 *
 * @param status        aggregate status derived from {@code confirmations}
 * @param confirmations per-ledger records, keyed and ordered by chain id; none omitted
 * @param quorum        policy the status was evaluated with
 * @param cutoff        tracking stopped before a decision (deadline or cancellation)
 * @param failure       why the result is not CONFIRMED, if it is not
 */
public record TrackingResult(
        AggregateStatus status,
        Map<String, ChainConfirmation> confirmations,
        QuorumPolicy quorum,
        boolean cutoff,
        AttestationFailure failure
) {
    public TrackingResult {
        confirmations = Collections.unmodifiableMap(new TreeMap<>(confirmations));
    }

    public Optional<AttestationFailure> failureReason() {
        return Optional.ofNullable(failure);
    }

    public long confirmedCount() {
        return confirmations.values().stream().filter(ChainConfirmation::isConfirmed).count();
    }
}
