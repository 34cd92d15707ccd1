package com.project.attest.ledger;

import java.util.Collection;

/**
 * How many of the configured ledgers must confirm.
 *
 * {@code CONFIRMED} as soon as {@code quorum} ledgers are confirmed; {@code FAILED} as soon as so
 * many have failed that the rest can no longer reach {@code quorum}; {@code PENDING} otherwise.
 */
public record QuorumPolicy(int quorum, int ledgerCount) {

    public QuorumPolicy {
        if (ledgerCount < 1) {
            throw new IllegalArgumentException("At least one ledger is required");
        }
        if (quorum < 1 || quorum > ledgerCount) {
            throw new IllegalArgumentException(
                    String.format("Quorum must be between 1 and %d but was %d", ledgerCount, quorum));
        }
    }

    public static QuorumPolicy majorityOf(int ledgerCount) {
        return new QuorumPolicy(ledgerCount / 2 + 1, ledgerCount);
    }

    public static QuorumPolicy unanimous(int ledgerCount) {
        return new QuorumPolicy(ledgerCount, ledgerCount);
    }

    public AggregateStatus evaluate(Collection<ChainConfirmation> confirmations) {
        long confirmed = confirmations.stream().filter(ChainConfirmation::isConfirmed).count();
        long failed = confirmations.stream().filter(ChainConfirmation::isFailed).count();
        return evaluate(confirmed, failed);
    }

    public AggregateStatus evaluate(long confirmed, long failed) {
        if (confirmed >= quorum) {
            return AggregateStatus.CONFIRMED;
        }
        if (ledgerCount - failed < quorum) {
            return AggregateStatus.FAILED;
        }
        return AggregateStatus.PENDING;
    }

    /**
     * Number of failures that makes the quorum unreachable.
     */
    public int failureTolerance() {
        return ledgerCount - quorum;
    }
}
