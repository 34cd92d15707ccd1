package com.project.attest.ledger;

import java.time.Duration;
import java.util.Objects;

/**
 * One ledger the engine tracks, with its own depth and timing policy.
 *
 * @param chainId       ledger identifier, matched against the oracle's relay map
 * @param gateway       connection to the ledger
 * @param requiredDepth confirmations needed before the relay transaction counts as final
 * @param notFoundGrace how long a transaction may stay unseen before the ledger is failed
 * @param pollInterval  wait between status queries
 */
public record ChainTarget(
        String chainId,
        LedgerGateway gateway,
        int requiredDepth,
        Duration notFoundGrace,
        Duration pollInterval
) {
    public ChainTarget {
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(gateway, "gateway must not be null");
        Objects.requireNonNull(notFoundGrace, "notFoundGrace must not be null");
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (requiredDepth < 1) {
            throw new IllegalArgumentException("requiredDepth must be at least 1 for " + chainId);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive for " + chainId);
        }
    }
}
