package com.project.attest.ledger;

public enum ConfirmationStatus {
    /** Transaction not (yet) seen on the ledger. */
    UNCONFIRMED,
    /** Included, but not yet deep enough. */
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }
}
