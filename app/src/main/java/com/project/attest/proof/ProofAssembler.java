package com.project.attest.proof;

import com.project.attest.core.AttestationFailure;
import com.project.attest.core.ErrorKind;
import com.project.attest.core.IntegrityFaultException;
import com.project.attest.crypto.Digest;
import com.project.attest.crypto.DocumentId;
import com.project.attest.io.ContentLocator;
import com.project.attest.ledger.AggregateStatus;
import com.project.attest.ledger.TrackingResult;
import com.project.attest.oracle.OracleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Seals already-validated facts into a {@link ProofArtifact}.
 *
 * Deterministic: the same inputs, {@code createdAt} included, always give a byte-identical
 * artifact. Failed aggregates still produce an artifact.
 */
public class ProofAssembler {
    private static final Logger log = LoggerFactory.getLogger(ProofAssembler.class);

    private static final String STAGE = "assembler";

    private final ProofArtifactCodec codec;

    public ProofAssembler(ProofArtifactCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    public ProofArtifact assemble(DocumentId documentId, ContentLocator locator, Digest metadataDigest,
                                  OracleReport report, TrackingResult tracking, Instant createdAt) {
        return assemble(documentId, locator, metadataDigest, report, tracking, List.of(), createdAt);
    }

    /**
     * @param warnings non-fatal findings recorded while validating the oracle report
     * @throws IllegalStateException   if tracking is still undecided without a cutoff
     * @throws IntegrityFaultException if the inputs contradict each other or the sealed artifact
     *                                 does not read back to the same checksum
     */
    public ProofArtifact assemble(DocumentId documentId, ContentLocator locator, Digest metadataDigest,
                                  OracleReport report, TrackingResult tracking, List<String> warnings,
                                  Instant createdAt) {
        Objects.requireNonNull(documentId, "documentId must not be null");
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(metadataDigest, "metadataDigest must not be null");
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(tracking, "tracking must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");

        if (!tracking.status().isDecided() && !tracking.cutoff()) {
            throw new IllegalStateException("Cannot assemble a proof while ledger tracking is still undecided");
        }
        if (!report.reportedDigest().equals(documentId.digest())) {
            throw new IntegrityFaultException(AttestationFailure.mismatch(ErrorKind.INTEGRITY_FAULT, STAGE,
                    "reportedDigest", documentId.hex(), report.reportedDigest().hex()));
        }
        AggregateStatus recomputed = tracking.quorum().evaluate(tracking.confirmations().values());
        if (recomputed != tracking.status()) {
            throw new IntegrityFaultException(AttestationFailure.mismatch(ErrorKind.INTEGRITY_FAULT, STAGE,
                    "aggregateStatus", recomputed.name(), tracking.status().name()));
        }

        ProofArtifact unsealed = new ProofArtifact(
                ProofArtifact.FORMAT_VERSION,
                Digest.SHA_256,
                documentId,
                locator,
                metadataDigest,
                report,
                new ArrayList<>(tracking.confirmations().values()),
                tracking.status(),
                tracking.quorum(),
                tracking.cutoff(),
                createdAt,
                warnings,
                null);
        ProofArtifact sealed = unsealed.withChecksum(codec.computeChecksum(unsealed));

        Digest reread = codec.computeChecksum(codec.fromJson(codec.toJson(sealed)));
        if (!reread.equals(sealed.artifactChecksum())) {
            throw new IntegrityFaultException(AttestationFailure.mismatch(ErrorKind.INTEGRITY_FAULT, STAGE,
                    "artifactChecksum", sealed.artifactChecksum().hex(), reread.hex()));
        }

        log.info("Assembled {} proof for document {} (checksum {})", sealed.aggregateStatus(), documentId,
                sealed.artifactChecksum().hex());
        return sealed;
    }
}
