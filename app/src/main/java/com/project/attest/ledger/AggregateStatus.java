package com.project.attest.ledger;

public enum AggregateStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    public boolean isDecided() {
        return this != PENDING;
    }
}
