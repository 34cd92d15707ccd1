package com.project.attest.core;

import com.project.attest.crypto.Digest;
import com.project.attest.crypto.DocumentHasher;
import com.project.attest.crypto.DocumentIdentity;
import com.project.attest.io.ContentLocator;
import com.project.attest.io.ContentStore;
import com.project.attest.io.ProofSink;
import com.project.attest.ledger.ChainTarget;
import com.project.attest.ledger.ConfirmationTracker;
import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.ledger.TrackingResult;
import com.project.attest.net.CancellationSignal;
import com.project.attest.oracle.OracleClient;
import com.project.attest.oracle.OracleOutcome;
import com.project.attest.oracle.OracleReport;
import com.project.attest.proof.ProofArtifact;
import com.project.attest.proof.ProofAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs the attestation pipeline for one document: retrieve and check content, derive the
 * document id, obtain a signed oracle report, track its relay transactions on every ledger,
 * then assemble and persist the proof.
 *
 * Stages run strictly in that order for a given document; independent documents may be
 * attested concurrently through {@link #attestAsync}.
 */
public class AttestationEngine {
    private static final Logger log = LoggerFactory.getLogger(AttestationEngine.class);

    private static final String STORAGE_STAGE = "storage";

    private final ContentStore contentStore;
    private final DocumentHasher hasher;
    private final OracleClient oracleClient;
    private final ConfirmationTracker tracker;
    private final List<ChainTarget> ledgers;
    private final QuorumPolicy quorum;
    private final ProofAssembler assembler;
    private final ProofSink sink;
    private final ExecutorService executor;
    private final Clock clock;

    /**
     * @param sink where sealed artifacts are persisted; {@code null} to keep them in memory only
     */
    public AttestationEngine(ContentStore contentStore, DocumentHasher hasher, OracleClient oracleClient,
                             ConfirmationTracker tracker, List<ChainTarget> ledgers, QuorumPolicy quorum,
                             ProofAssembler assembler, ProofSink sink, ExecutorService executor, Clock clock) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
        this.oracleClient = Objects.requireNonNull(oracleClient, "oracleClient must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.ledgers = List.copyOf(ledgers);
        this.quorum = Objects.requireNonNull(quorum, "quorum must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.sink = sink;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (this.ledgers.isEmpty()) {
            throw new IllegalArgumentException("At least one ledger must be configured");
        }
        if (quorum.ledgerCount() != this.ledgers.size()) {
            throw new IllegalArgumentException(String.format(
                    "Quorum policy is for %d ledgers but %d are configured", quorum.ledgerCount(), this.ledgers.size()));
        }
    }

    public AttestationResult attest(ContentLocator locator, Object metadata) {
        return attest(locator, metadata, new CancellationSignal());
    }

    /**
     * Runs the whole pipeline on the calling thread.
     *
     * @throws IntegrityFaultException if retrieved content does not match its locator or hashing
     *                                 is not deterministic
     * @throws com.project.attest.crypto.CanonicalizationException if the metadata has no
     *                                 canonical JSON form
     */
    public AttestationResult attest(ContentLocator locator, Object metadata, CancellationSignal cancellation) {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        Optional<byte[]> content = contentStore.retrieve(locator);
        if (content.isEmpty()) {
            log.warn("No content stored for {}", locator.uri());
            return new AttestationResult(null, null, null, AttestationFailure.of(ErrorKind.VALIDATION, STORAGE_STAGE,
                    "Content store has nothing for " + locator.uri()));
        }
        checkContent(locator, content.get());

        DocumentIdentity identity = hasher.deriveIdentity(content.get(), metadata);
        log.info("Derived document id {} for {}", identity.documentId(), locator.uri());

        OracleOutcome outcome = oracleClient.attest(identity.documentId(), locator, cancellation);
        Optional<OracleReport> report = outcome.acceptedReport();
        if (report.isEmpty()) {
            return new AttestationResult(identity, outcome, null, outcome.failure());
        }

        TrackingResult tracking = tracker.track(ledgers, report.get().relayTransactions(), quorum, cancellation);
        log.info("Ledger tracking for {} ended {} with {} of {} ledgers confirmed", identity.documentId(),
                tracking.status(), tracking.confirmedCount(), ledgers.size());
        if (tracking.cutoff() && cancellation.isCancelled()) {
            log.info("Attestation of {} cancelled during ledger tracking", identity.documentId());
            return new AttestationResult(identity, outcome, null, tracking.failure());
        }

        ProofArtifact artifact = assembler.assemble(identity.documentId(), locator, identity.metadataDigest(),
                report.get(), tracking, outcome.warnings(), clock.instant());
        persist(artifact);
        return new AttestationResult(identity, outcome, artifact, tracking.failure());
    }

    /**
     * Starts the pipeline on the engine's executor.
     */
    public AttestationHandle attestAsync(ContentLocator locator, Object metadata) {
        CancellationSignal cancellation = new CancellationSignal();
        CompletableFuture<AttestationResult> future =
                CompletableFuture.supplyAsync(() -> attest(locator, metadata, cancellation), executor);
        return new AttestationHandle(future, cancellation);
    }

    /**
     * Push hint that the oracle has news for {@code requestId}.
     */
    public boolean notifyOracleUpdate(String requestId) {
        return oracleClient.notifyUpdate(requestId);
    }

    /**
     * Push hint that ledger {@code chainId} produced a block.
     */
    public void notifyLedgerUpdate(String chainId) {
        tracker.notifyUpdate(chainId);
    }

    private void checkContent(ContentLocator locator, byte[] content) {
        Digest retrieved = hasher.contentDigest(content);
        if (!retrieved.equals(locator.contentDigest())) {
            throw new IntegrityFaultException(AttestationFailure.mismatch(ErrorKind.INTEGRITY_FAULT, STORAGE_STAGE,
                    "contentDigest", locator.contentDigest().hex(), retrieved.hex()));
        }
        Digest stored = contentStore.locatorDigest(locator);
        if (!stored.equals(locator.contentDigest())) {
            throw new IntegrityFaultException(AttestationFailure.mismatch(ErrorKind.INTEGRITY_FAULT, STORAGE_STAGE,
                    "locatorDigest", locator.contentDigest().hex(), stored.hex()));
        }
    }

    private void persist(ProofArtifact artifact) {
        if (sink == null) {
            return;
        }
        try {
            sink.accept(artifact);
        } catch (IOException e) {
            log.error("Failed to persist proof for {}", artifact.documentId(), e);
            throw new UncheckedIOException("Failed to persist proof for " + artifact.documentId(), e);
        }
    }
}
