package com.project.attest.oracle;

public enum RequestState {
    CREATED,
    SUBMITTED,
    POLLING,
    FINALIZED,
    TIMED_OUT,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FINALIZED || this == TIMED_OUT || this == REJECTED || this == CANCELLED;
    }
}
