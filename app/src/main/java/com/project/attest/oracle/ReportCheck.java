package com.project.attest.oracle;

import com.project.attest.core.AttestationFailure;

import java.util.List;
import java.util.Optional;

/**
 * Result of validating an oracle report: a rejection, or acceptance with possible warnings.
 */
public record ReportCheck(AttestationFailure rejection, List<String> warnings) {

    public ReportCheck {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ReportCheck accepted(List<String> warnings) {
        return new ReportCheck(null, warnings);
    }

    public static ReportCheck rejected(AttestationFailure failure) {
        return new ReportCheck(failure, List.of());
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public Optional<AttestationFailure> failure() {
        return Optional.ofNullable(rejection);
    }
}
