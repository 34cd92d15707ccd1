package com.project.attest.support;

import com.project.attest.core.AttestationFailure;
import com.project.attest.crypto.Canonicalizer;
import com.project.attest.crypto.DocumentHasher;
import com.project.attest.crypto.DocumentIdentity;
import com.project.attest.io.ContentLocator;
import com.project.attest.ledger.AggregateStatus;
import com.project.attest.ledger.ChainConfirmation;
import com.project.attest.ledger.ConfirmationStatus;
import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.ledger.TrackingResult;
import com.project.attest.oracle.OracleReport;
import com.project.attest.proof.ProofArtifact;
import com.project.attest.proof.ProofArtifactCodec;
import com.project.attest.proof.ProofAssembler;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A complete, consistent attestation of "hello world" confirmed on two of three ledgers.
 */
public final class Fixtures {

    public static final byte[] CONTENT = "hello world".getBytes(StandardCharsets.UTF_8);
    public static final Map<String, Object> METADATA = Map.of("type", "note");
    public static final String LOCATOR_URI = "ipfs://bafkreifzjut3te2nhyekklss27nh3k72ysco7y32koao5eei66wof36n5e";
    public static final Instant ISSUED_AT = Instant.parse("2025-10-30T08:15:00.123Z");
    public static final Instant CREATED_AT = Instant.parse("2025-10-30T08:20:00Z");
    public static final Map<String, String> RELAYS = Map.of(
            "chainA", "0x" + "a".repeat(64),
            "chainB", "0x" + "b".repeat(64),
            "chainC", "0x" + "c".repeat(64));

    public static final Canonicalizer CANONICALIZER = new Canonicalizer();
    public static final DocumentHasher HASHER = new DocumentHasher(CANONICALIZER);
    public static final ProofArtifactCodec CODEC = new ProofArtifactCodec(CANONICALIZER);

    private Fixtures() {
    }

    public static DocumentIdentity identity() {
        return HASHER.deriveIdentity(CONTENT, METADATA);
    }

    public static ContentLocator locator() {
        return new ContentLocator(URI.create(LOCATOR_URI), identity().contentDigest());
    }

    public static OracleReport report() {
        return TestOracle.report("req-1", identity().documentId(), ISSUED_AT, RELAYS);
    }

    public static ChainConfirmation confirmation(String chainId, ConfirmationStatus status, long confirmations) {
        return new ChainConfirmation(chainId, RELAYS.get(chainId), 100L, confirmations, 3, status,
                status == ConfirmationStatus.FAILED ? "Transaction reverted" : null);
    }

    /**
     * chainA and chainB confirmed, chainC still pending: CONFIRMED under a 2-of-3 quorum.
     */
    public static TrackingResult confirmedTracking() {
        Map<String, ChainConfirmation> confirmations = new LinkedHashMap<>();
        confirmations.put("chainA", confirmation("chainA", ConfirmationStatus.CONFIRMED, 5));
        confirmations.put("chainB", confirmation("chainB", ConfirmationStatus.CONFIRMED, 3));
        confirmations.put("chainC", confirmation("chainC", ConfirmationStatus.PENDING, 1)
                .withDetail("Tracking stopped once the aggregate status was decided"));
        return new TrackingResult(AggregateStatus.CONFIRMED, confirmations, new QuorumPolicy(2, 3), false, null);
    }

    public static TrackingResult failedTracking(AttestationFailure failure) {
        Map<String, ChainConfirmation> confirmations = new LinkedHashMap<>();
        confirmations.put("chainA", confirmation("chainA", ConfirmationStatus.FAILED, 0));
        confirmations.put("chainB", confirmation("chainB", ConfirmationStatus.FAILED, 0));
        confirmations.put("chainC", confirmation("chainC", ConfirmationStatus.PENDING, 1));
        return new TrackingResult(AggregateStatus.FAILED, confirmations, new QuorumPolicy(2, 3), false, failure);
    }

    public static ProofArtifact confirmedArtifact() {
        return confirmedArtifact(List.of());
    }

    public static ProofArtifact confirmedArtifact(List<String> warnings) {
        DocumentIdentity identity = identity();
        return new ProofAssembler(CODEC).assemble(identity.documentId(), locator(), identity.metadataDigest(),
                report(), confirmedTracking(), warnings, CREATED_AT);
    }
}
