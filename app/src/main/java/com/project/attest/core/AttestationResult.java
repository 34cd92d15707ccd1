package com.project.attest.core;

import com.project.attest.crypto.DocumentIdentity;
import com.project.attest.ledger.AggregateStatus;
import com.project.attest.oracle.OracleOutcome;
import com.project.attest.proof.ProofArtifact;

import java.util.Optional;

/**
 * What one attestation run produced. A run that reached ledger tracking always carries an
 * artifact, positive or negative; a run that stopped at the oracle or was cancelled carries
 * only the failure.
 *
 * @param identity digests derived from the content and metadata
 * @param oracle   terminal state of the oracle request
 * @param artifact sealed proof, {@code null} when none was assembled
 * @param failure  why the run did not end CONFIRMED, {@code null} when it did
 */
public record AttestationResult(
        DocumentIdentity identity,
        OracleOutcome oracle,
        ProofArtifact artifact,
        AttestationFailure failure
) {
    public Optional<ProofArtifact> proof() {
        return Optional.ofNullable(artifact);
    }

    public Optional<AttestationFailure> failureReason() {
        return Optional.ofNullable(failure);
    }

    public boolean isConfirmed() {
        return artifact != null && artifact.aggregateStatus() == AggregateStatus.CONFIRMED;
    }
}
