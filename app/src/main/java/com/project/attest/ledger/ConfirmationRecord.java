package com.project.attest.ledger;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for one ledger's {@link ChainConfirmation}. Written only by that ledger's poller; once
 * the status is terminal every further write is refused.
 */
final class ConfirmationRecord {

    private final AtomicReference<ChainConfirmation> current;

    ConfirmationRecord(ChainConfirmation initial) {
        this.current = new AtomicReference<>(initial);
    }

    /**
     * @return {@code false} if the record was already terminal and the update was dropped
     */
    boolean update(ChainConfirmation next) {
        if (!next.chainId().equals(current.get().chainId())) {
            throw new IllegalArgumentException("Update for " + next.chainId() + " sent to " + current.get().chainId());
        }
        ChainConfirmation previous = current.get();
        if (previous.status().isTerminal()) {
            return false;
        }
        return current.compareAndSet(previous, next);
    }

    ChainConfirmation snapshot() {
        return current.get();
    }
}
