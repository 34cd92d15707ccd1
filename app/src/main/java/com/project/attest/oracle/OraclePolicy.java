package com.project.attest.oracle;

import com.project.attest.net.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of the oracle request state machine.
 *
 * @param pollInterval wait between status polls while the report is pending
 * @param ceiling      wall-clock limit for the whole request, submission included
 * @param callTimeout  limit for any single submit or poll call
 * @param retry        backoff for transient errors
 */
public record OraclePolicy(Duration pollInterval, Duration ceiling, Duration callTimeout, RetryPolicy retry) {

    public OraclePolicy {
        Objects.requireNonNull(retry, "retry must not be null");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(ceiling, "ceiling");
        requirePositive(callTimeout, "callTimeout");
    }

    public static OraclePolicy defaults() {
        return new OraclePolicy(Duration.ofSeconds(2), Duration.ofMinutes(5), Duration.ofSeconds(15),
                RetryPolicy.defaultPolicy());
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
