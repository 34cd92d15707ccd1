package com.project.attest.proof;

import com.project.attest.crypto.Digest;
import com.project.attest.crypto.DocumentId;
import com.project.attest.io.ContentLocator;
import com.project.attest.io.Timestamps;
import com.project.attest.ledger.AggregateStatus;
import com.project.attest.ledger.ChainConfirmation;
import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.oracle.OracleReport;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Self-contained, portable record that a document was attested: identity, oracle report,
 * per-ledger confirmations and the aggregate decision, sealed by {@code artifactChecksum}.
 *
 * An artifact with a {@code null} checksum is unsealed; only {@link ProofAssembler} seals.
 */
public record ProofArtifact(
        int version,
        String digestAlgorithm,
        DocumentId documentId,
        ContentLocator contentLocator,
        Digest metadataDigest,
        OracleReport oracleReport,
        List<ChainConfirmation> chainConfirmations,
        AggregateStatus aggregateStatus,
        QuorumPolicy quorum,
        boolean cutoff,
        Instant createdAt,
        List<String> warnings,
        Digest artifactChecksum
) {
    public static final int FORMAT_VERSION = 1;

    public ProofArtifact {
        Objects.requireNonNull(digestAlgorithm, "digestAlgorithm must not be null");
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(contentLocator, "contentLocator must not be null");
        Objects.requireNonNull(metadataDigest, "metadataDigest must not be null");
        Objects.requireNonNull(oracleReport, "oracleReport must not be null");
        Objects.requireNonNull(aggregateStatus, "aggregateStatus must not be null");
        Objects.requireNonNull(quorum, "quorum must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        chainConfirmations = chainConfirmations.stream()
                .sorted(Comparator.comparing(ChainConfirmation::chainId))
                .toList();
        warnings = warnings == null ? List.of() : warnings.stream().sorted().toList();
        createdAt = Timestamps.normalize(createdAt);
    }

    public boolean isSealed() {
        return artifactChecksum != null;
    }

    public ProofArtifact withChecksum(Digest checksum) {
        return new ProofArtifact(version, digestAlgorithm, documentId, contentLocator, metadataDigest, oracleReport,
                chainConfirmations, aggregateStatus, quorum, cutoff, createdAt, warnings, checksum);
    }

    public Optional<ChainConfirmation> confirmation(String chainId) {
        return chainConfirmations.stream().filter(c -> c.chainId().equals(chainId)).findFirst();
    }
}
