package com.project.attest.verify;

import com.project.attest.core.ExternalServiceException;
import com.project.attest.core.TransientNetworkException;
import com.project.attest.crypto.CanonicalizationException;
import com.project.attest.crypto.Digest;
import com.project.attest.crypto.DocumentHasher;
import com.project.attest.crypto.DocumentId;
import com.project.attest.crypto.OracleSignatures;
import com.project.attest.io.ContentStore;
import com.project.attest.ledger.ChainConfirmation;
import com.project.attest.ledger.ChainTarget;
import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.ledger.TransactionStatus;
import com.project.attest.net.RetryPolicy;
import com.project.attest.net.TimedCall;
import com.project.attest.oracle.OracleReport;
import com.project.attest.proof.ProofArtifact;
import com.project.attest.proof.ProofArtifactCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Checks a {@link ProofArtifact} without trusting anything the artifact says about itself.
 *
 * Every digest is recomputed from the supplied content and metadata, the oracle signature is
 * checked against this verifier's own key set, and every configured ledger is queried live.
 * Required depths and the quorum come from this verifier's configuration, never from the
 * artifact.
 */
public class Verifier {
    private static final Logger log = LoggerFactory.getLogger(Verifier.class);

    private final DocumentHasher hasher;
    private final ProofArtifactCodec codec;
    private final Set<String> authorizedSigners;
    private final List<ChainTarget> ledgers;
    private final QuorumPolicy quorum;
    private final ContentStore contentStore;
    private final ExecutorService executor;
    private final TimedCall timedCall;
    private final Duration callTimeout;
    private final RetryPolicy retry;

    public Verifier(DocumentHasher hasher, ProofArtifactCodec codec, Collection<String> authorizedSigners,
                    List<ChainTarget> ledgers, QuorumPolicy quorum, ContentStore contentStore,
                    ExecutorService executor, Duration callTimeout) {
        this(hasher, codec, authorizedSigners, ledgers, quorum, contentStore, executor, callTimeout,
                new RetryPolicy(200L, 2_000L, 0.2, 3));
    }

    /**
     * @param quorum       quorum to require; {@code null} for a majority of {@code ledgers}
     * @param contentStore store for {@link #verify(ProofArtifact)}; may be {@code null} when
     *                     content is always supplied by the caller
     * @param executor     unbounded executor; ledger checks submit their own timed calls to it
     */
    public Verifier(DocumentHasher hasher, ProofArtifactCodec codec, Collection<String> authorizedSigners,
                    List<ChainTarget> ledgers, QuorumPolicy quorum, ContentStore contentStore,
                    ExecutorService executor, Duration callTimeout, RetryPolicy retry) {
        if (ledgers.isEmpty()) {
            throw new IllegalArgumentException("At least one ledger is required to verify");
        }
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.authorizedSigners = new TreeSet<>();
        authorizedSigners.forEach(signer -> this.authorizedSigners.add(OracleSignatures.normalizeAddress(signer)));
        this.ledgers = List.copyOf(ledgers);
        this.quorum = quorum != null ? quorum : QuorumPolicy.majorityOf(ledgers.size());
        if (this.quorum.ledgerCount() != ledgers.size()) {
            throw new IllegalArgumentException("Quorum policy does not match the number of ledgers");
        }
        this.contentStore = contentStore;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timedCall = new TimedCall(executor);
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
    }

    /**
     * Verifies against content fetched through the configured {@link ContentStore}. Metadata is
     * not available on this path, so the metadata stage is skipped.
     */
    public VerificationReport verify(ProofArtifact artifact) {
        if (contentStore == null) {
            throw new IllegalStateException("No content store configured; supply the content explicitly");
        }
        Optional<byte[]> content;
        try {
            content = contentStore.retrieve(artifact.contentLocator());
        } catch (TransientNetworkException e) {
            log.warn("Content for {} could not be retrieved: {}", artifact.contentLocator().uri(), e.getMessage());
            content = Optional.empty();
        }
        return run(artifact, content.orElse(null), null);
    }

    public VerificationReport verify(ProofArtifact artifact, byte[] content) {
        return verify(artifact, content, null);
    }

    /**
     * @param metadata original metadata, or {@code null} to skip the metadata stage
     */
    public VerificationReport verify(ProofArtifact artifact, byte[] content, Object metadata) {
        Objects.requireNonNull(content, "content must not be null");
        return run(artifact, content, metadata);
    }

    private VerificationReport run(ProofArtifact artifact, byte[] content, Object metadata) {
        List<StageResult> stages = new ArrayList<>();

        stages.add(checkChecksum(artifact));

        Digest contentDigest;
        if (content == null) {
            stages.add(StageResult.fail(Stage.CONTENT_DIGEST, "Content is not retrievable from "
                    + artifact.contentLocator().uri()));
            contentDigest = artifact.contentLocator().contentDigest();
        } else {
            contentDigest = hasher.contentDigest(content);
            stages.add(StageResult.compare(Stage.CONTENT_DIGEST,
                    artifact.contentLocator().contentDigest().hex(), contentDigest.hex(), "Content digest"));
        }

        Digest metadataDigest = artifact.metadataDigest();
        if (metadata == null) {
            stages.add(StageResult.skipped(Stage.METADATA_DIGEST,
                    "No metadata supplied; using the artifact's checksum-bound metadata digest"));
        } else {
            try {
                metadataDigest = hasher.metadataDigest(metadata);
                stages.add(StageResult.compare(Stage.METADATA_DIGEST,
                        artifact.metadataDigest().hex(), metadataDigest.hex(), "Metadata digest"));
            } catch (CanonicalizationException e) {
                stages.add(StageResult.fail(Stage.METADATA_DIGEST, "Metadata cannot be canonicalized: " + e.getMessage()));
            }
        }

        DocumentId documentId = hasher.assembleDocumentId(contentDigest, metadataDigest);
        stages.add(StageResult.compare(Stage.DOCUMENT_ID, artifact.documentId().hex(), documentId.hex(), "Document id"));

        OracleReport report = artifact.oracleReport();
        stages.add(StageResult.compare(Stage.ORACLE_DIGEST, documentId.hex(), report.reportedDigest().hex(),
                "Oracle reported digest"));
        stages.add(checkSignature(report));

        List<StageResult> ledgerStages = checkLedgers(artifact);
        stages.addAll(ledgerStages);
        stages.add(checkQuorum(ledgerStages));

        VerificationReport result = VerificationReport.of(artifact.documentId().hex(), stages);
        if (result.isVerified()) {
            log.info("Artifact for document {} verified", artifact.documentId());
        } else {
            log.warn("Artifact for document {} failed verification at {}", artifact.documentId(),
                    result.failures().stream().map(StageResult::label).toList());
        }
        return result;
    }

    private StageResult checkChecksum(ProofArtifact artifact) {
        if (artifact.artifactChecksum() == null) {
            return StageResult.fail(Stage.ARTIFACT_CHECKSUM, "Artifact carries no checksum");
        }
        return StageResult.compare(Stage.ARTIFACT_CHECKSUM, artifact.artifactChecksum().hex(),
                codec.computeChecksum(artifact).hex(), "Artifact checksum");
    }

    private StageResult checkSignature(OracleReport report) {
        Optional<String> signer = OracleSignatures.recoverSigner(report.requestId(), report.reportedDigest(),
                report.issuedAt(), report.signature());
        if (signer.isEmpty()) {
            return StageResult.fail(Stage.ORACLE_SIGNATURE, "Signature does not recover to any key");
        }
        if (!authorizedSigners.contains(signer.get())) {
            return new StageResult(Stage.ORACLE_SIGNATURE, null, StageOutcome.FAIL,
                    "one of " + authorizedSigners, signer.get(), "Report signed by an unauthorized key");
        }
        return StageResult.pass(Stage.ORACLE_SIGNATURE, "Signed by authorized oracle " + signer.get());
    }

    /**
     * One stage per configured ledger. A ledger the artifact itself does not claim as confirmed
     * is not held against the artifact when it still does not confirm: it is reported as
     * skipped and simply does not count toward the quorum.
     */
    private List<StageResult> checkLedgers(ProofArtifact artifact) {
        OracleReport report = artifact.oracleReport();
        Map<ChainTarget, Future<StageResult>> pending = new LinkedHashMap<>();
        for (ChainTarget target : ledgers) {
            String transactionRef = report.relayTransactions().get(target.chainId());
            pending.put(target, executor.submit(() -> checkLedger(target, transactionRef)));
        }

        List<StageResult> results = new ArrayList<>();
        boolean interrupted = false;
        for (Map.Entry<ChainTarget, Future<StageResult>> entry : pending.entrySet()) {
            String chainId = entry.getKey().chainId();
            boolean claimed = artifact.confirmation(chainId).map(ChainConfirmation::isConfirmed).orElse(false);
            StageResult result;
            if (interrupted) {
                entry.getValue().cancel(true);
                result = StageResult.fail(Stage.LEDGER_CONFIRMATION, "Verification interrupted").forSubject(chainId);
            } else {
                try {
                    result = entry.getValue().get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    entry.getValue().cancel(true);
                    result = StageResult.fail(Stage.LEDGER_CONFIRMATION, "Verification interrupted").forSubject(chainId);
                } catch (ExecutionException e) {
                    result = StageResult.fail(Stage.LEDGER_CONFIRMATION,
                            "Ledger query failed: " + e.getCause().getMessage()).forSubject(chainId);
                }
            }
            results.add(claimed || !result.failed() ? result : result.skipped("Not claimed by the artifact: "));
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private StageResult checkLedger(ChainTarget target, String transactionRef) throws InterruptedException {
        String chainId = target.chainId();
        if (transactionRef == null || transactionRef.isBlank()) {
            return StageResult.fail(Stage.LEDGER_CONFIRMATION, "Oracle report names no relay transaction")
                    .forSubject(chainId);
        }

        TransactionStatus status;
        int failures = 0;
        while (true) {
            try {
                status = timedCall.call("verify " + chainId, callTimeout,
                        () -> target.gateway().getTransactionStatus(transactionRef));
                break;
            } catch (TransientNetworkException e) {
                failures++;
                if (!retry.allowsRetry(failures)) {
                    return StageResult.fail(Stage.LEDGER_CONFIRMATION, "Ledger unreachable: " + e.getMessage())
                            .forSubject(chainId);
                }
                Thread.sleep(retry.delay(failures - 1).toMillis());
            } catch (ExternalServiceException e) {
                return StageResult.fail(Stage.LEDGER_CONFIRMATION, "Ledger refused the query: " + e.getMessage())
                        .forSubject(chainId);
            }
        }

        String expected = ">= " + target.requiredDepth() + " confirmations";
        if (!status.found()) {
            return new StageResult(Stage.LEDGER_CONFIRMATION, chainId, StageOutcome.FAIL, expected, "not found",
                    "Relay transaction " + transactionRef + " is not on the ledger");
        }
        if (status.reverted()) {
            return new StageResult(Stage.LEDGER_CONFIRMATION, chainId, StageOutcome.FAIL, expected, "reverted",
                    "Relay transaction " + transactionRef + " reverted at height " + status.blockHeight());
        }
        String actual = status.confirmationCount() + " confirmations";
        if (status.confirmationCount() < target.requiredDepth()) {
            return new StageResult(Stage.LEDGER_CONFIRMATION, chainId, StageOutcome.FAIL, expected, actual,
                    "Relay transaction is not yet deep enough");
        }
        return new StageResult(Stage.LEDGER_CONFIRMATION, chainId, StageOutcome.PASS, expected, actual,
                "Relay transaction confirmed at height " + status.blockHeight());
    }

    private StageResult checkQuorum(List<StageResult> ledgerStages) {
        long confirmed = ledgerStages.stream().filter(result -> result.outcome() == StageOutcome.PASS).count();
        String expected = ">= " + quorum.quorum() + " of " + quorum.ledgerCount();
        String actual = confirmed + " of " + quorum.ledgerCount();
        if (confirmed >= quorum.quorum()) {
            return new StageResult(Stage.LEDGER_QUORUM, null, StageOutcome.PASS, expected, actual, "Quorum reached");
        }
        return new StageResult(Stage.LEDGER_QUORUM, null, StageOutcome.FAIL, expected, actual, "Quorum not reached");
    }
}
