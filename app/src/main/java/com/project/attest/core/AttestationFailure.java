package com.project.attest.core;

import java.util.Objects;

/**
 * Structured description of a failed stage. Expected business failures travel as values of this
 * type instead of exceptions, so callers can branch on {@link #kind()} and still print something
 * useful to a human.
 *
 * @param kind     taxonomy bucket
 * @param stage    pipeline stage that failed (e.g. "oracle", "ledger:sepolia", "hasher")
 * @param field    offending field, or {@code null} when the failure is not about a field
 * @param expected expected value, if applicable
 * @param actual   observed value, if applicable
 * @param message  human readable summary
 */
public record AttestationFailure(
        ErrorKind kind,
        String stage,
        String field,
        String expected,
        String actual,
        String message
) {
    public AttestationFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static AttestationFailure of(ErrorKind kind, String stage, String message) {
        return new AttestationFailure(kind, stage, null, null, null, message);
    }

    public static AttestationFailure mismatch(ErrorKind kind, String stage, String field,
                                              String expected, String actual) {
        return new AttestationFailure(kind, stage, field, expected, actual,
                String.format("%s mismatch in %s: expected %s but was %s", field, stage, expected, actual));
    }

    public String describe() {
        StringBuilder builder = new StringBuilder();
        builder.append('[').append(kind).append("] ").append(stage).append(": ").append(message);
        if (field != null && !message.contains(field)) {
            builder.append(" (field: ").append(field).append(')');
        }
        return builder.toString();
    }
}
