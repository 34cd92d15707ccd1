package com.project.attest.oracle;

import com.project.attest.core.AttestationFailure;

import java.util.List;
import java.util.Optional;

/**
 * Terminal result of an attestation request.
 */
public record OracleOutcome(
        RequestState state,
        String requestId,
        OracleReport report,
        AttestationFailure failure,
        List<String> warnings
) {
    public OracleOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isFinalized() {
        return state == RequestState.FINALIZED;
    }

    public Optional<OracleReport> acceptedReport() {
        return isFinalized() ? Optional.of(report) : Optional.empty();
    }

    public Optional<AttestationFailure> failureReason() {
        return Optional.ofNullable(failure);
    }
}
