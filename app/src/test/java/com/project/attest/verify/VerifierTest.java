package com.project.attest.verify;

import com.project.attest.core.TransientNetworkException;
import com.project.attest.crypto.DocumentId;
import com.project.attest.crypto.DocumentIdentity;
import com.project.attest.ledger.ChainTarget;
import com.project.attest.ledger.LedgerGateway;
import com.project.attest.ledger.QuorumPolicy;
import com.project.attest.net.RetryPolicy;
import com.project.attest.oracle.OracleReport;
import com.project.attest.proof.ProofArtifact;
import com.project.attest.proof.ProofAssembler;
import com.project.attest.support.Fixtures;
import com.project.attest.support.InMemoryContentStore;
import com.project.attest.support.ScriptedLedgerGateway;
import com.project.attest.support.TestOracle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Verifier")
class VerifierTest {

    private ExecutorService executor;
    private ProofArtifact artifact;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        artifact = Fixtures.confirmedArtifact();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("A sound artifact")
    class Sound {

        @Test
        @DisplayName("passes every stage when content and metadata are supplied")
        void verified() {
            VerificationReport report = verifier(liveLedgers()).verify(artifact, Fixtures.CONTENT, Fixtures.METADATA);

            assertThat(report.verdict()).isEqualTo(Verdict.VERIFIED);
            assertThat(report.documentId()).isEqualTo(artifact.documentId().hex());
            assertThat(report.stagesOf(Stage.METADATA_DIGEST)).extracting(StageResult::outcome)
                    .containsExactly(StageOutcome.PASS);
            assertThat(report.stagesOf(Stage.LEDGER_CONFIRMATION)).extracting(StageResult::label)
                    .containsExactly("LEDGER_CONFIRMATION[chainA]", "LEDGER_CONFIRMATION[chainB]",
                            "LEDGER_CONFIRMATION[chainC]");
            assertThat(report.stagesOf(Stage.LEDGER_QUORUM).get(0).actual()).isEqualTo("2 of 3");
        }

        @Test
        @DisplayName("a lagging ledger the artifact never claimed is skipped, not failed")
        void laggingLedgerSkipped() {
            VerificationReport report = verifier(liveLedgers()).verify(artifact, Fixtures.CONTENT);

            StageResult chainC = report.stagesOf(Stage.LEDGER_CONFIRMATION).get(2);
            assertThat(chainC.outcome()).isEqualTo(StageOutcome.SKIPPED);
            assertThat(chainC.actual()).isEqualTo("1 confirmations");
            assertThat(report.isVerified()).isTrue();
        }

        @Test
        @DisplayName("without metadata the metadata stage is skipped")
        void metadataSkipped() {
            VerificationReport report = verifier(liveLedgers()).verify(artifact, Fixtures.CONTENT);

            assertThat(report.stagesOf(Stage.METADATA_DIGEST).get(0).outcome()).isEqualTo(StageOutcome.SKIPPED);
            assertThat(report.isVerified()).isTrue();
        }

        @Test
        @DisplayName("content is re-read through the content store")
        void contentStore() {
            InMemoryContentStore store = new InMemoryContentStore();
            store.put(Fixtures.LOCATOR_URI, Fixtures.CONTENT);

            assertThat(verifier(liveLedgers(), store).verify(artifact).isVerified()).isTrue();
        }
    }

    @Nested
    @DisplayName("Recomputed digests")
    class Digests {

        @Test
        @DisplayName("changed content fails the content digest and the document id")
        void changedContent() {
            VerificationReport report = verifier(liveLedgers())
                    .verify(artifact, "hello world!".getBytes(StandardCharsets.UTF_8), Fixtures.METADATA);

            assertThat(report.verdict()).isEqualTo(Verdict.FAILED);
            assertThat(report.failures()).extracting(StageResult::stage)
                    .contains(Stage.CONTENT_DIGEST, Stage.DOCUMENT_ID, Stage.ORACLE_DIGEST);
            assertThat(report.stagesOf(Stage.CONTENT_DIGEST).get(0).expected())
                    .isEqualTo(artifact.contentLocator().contentDigest().hex());
        }

        @Test
        @DisplayName("different metadata fails the metadata digest")
        void changedMetadata() {
            VerificationReport report = verifier(liveLedgers()).verify(artifact, Fixtures.CONTENT, Map.of("type", "memo"));

            assertThat(report.failures()).extracting(StageResult::stage)
                    .contains(Stage.METADATA_DIGEST, Stage.DOCUMENT_ID);
        }

        @Test
        @DisplayName("content missing from the store fails the content stage")
        void missingContent() {
            VerificationReport report = verifier(liveLedgers(), new InMemoryContentStore()).verify(artifact);

            assertThat(report.stagesOf(Stage.CONTENT_DIGEST).get(0).failed()).isTrue();
            assertThat(report.isVerified()).isFalse();
        }

        @Test
        @DisplayName("an edited artifact fails the checksum")
        void tampered() {
            ProofArtifact edited = new ProofArtifact(artifact.version(), artifact.digestAlgorithm(), artifact.documentId(),
                    artifact.contentLocator(), artifact.metadataDigest(), artifact.oracleReport(),
                    artifact.chainConfirmations(), artifact.aggregateStatus(), new QuorumPolicy(1, 3), artifact.cutoff(),
                    artifact.createdAt(), artifact.warnings(), artifact.artifactChecksum());

            VerificationReport report = verifier(liveLedgers()).verify(edited, Fixtures.CONTENT);

            assertThat(report.failures()).extracting(StageResult::label).containsExactly("ARTIFACT_CHECKSUM");
        }
    }

    @Nested
    @DisplayName("Oracle report")
    class Oracle {

        @Test
        @DisplayName("a report signed by a key the verifier does not trust fails")
        void untrustedSigner() {
            DocumentIdentity identity = Fixtures.identity();
            OracleReport rogue = TestOracle.report("req-1", identity.documentId(), Fixtures.ISSUED_AT, Fixtures.RELAYS,
                    TestOracle.ROGUE_KEY);
            ProofArtifact forged = new ProofAssembler(Fixtures.CODEC).assemble(identity.documentId(), Fixtures.locator(),
                    identity.metadataDigest(), rogue, Fixtures.confirmedTracking(), Fixtures.CREATED_AT);

            VerificationReport report = verifier(liveLedgers()).verify(forged, Fixtures.CONTENT);

            StageResult signature = report.stagesOf(Stage.ORACLE_SIGNATURE).get(0);
            assertThat(signature.failed()).isTrue();
            assertThat(signature.actual()).isEqualTo(TestOracle.ROGUE_ADDRESS);
        }

        @Test
        @DisplayName("a report for another digest fails the oracle digest stage")
        void foreignDigest() {
            DocumentId other = DocumentId.fromHex("4ff1d8bf6bfd7f74e7ebe0e08fb568e0d503fa781d1b43275a1894a943f07d7e");
            OracleReport foreign = TestOracle.report("req-1", other, Fixtures.ISSUED_AT, Fixtures.RELAYS);
            ProofArtifact unsealed = new ProofArtifact(artifact.version(), artifact.digestAlgorithm(),
                    artifact.documentId(), artifact.contentLocator(), artifact.metadataDigest(), foreign,
                    artifact.chainConfirmations(), artifact.aggregateStatus(), artifact.quorum(), artifact.cutoff(),
                    artifact.createdAt(), artifact.warnings(), null);
            ProofArtifact resealed = unsealed.withChecksum(Fixtures.CODEC.computeChecksum(unsealed));

            VerificationReport report = verifier(liveLedgers()).verify(resealed, Fixtures.CONTENT);

            assertThat(report.failures()).extracting(StageResult::label).containsExactly("ORACLE_DIGEST");
        }
    }

    @Nested
    @DisplayName("Live ledger checks")
    class Ledgers {

        @Test
        @DisplayName("a claimed ledger whose transaction vanished fails, and so does the quorum")
        void reorganizedAway() {
            List<ChainTarget> ledgers = List.of(
                    target("chainA", new ScriptedLedgerGateway()),
                    target("chainB", ScriptedLedgerGateway.confirmedAt(100, 3)),
                    target("chainC", ScriptedLedgerGateway.alwaysPending(100)));

            VerificationReport report = verifier(ledgers).verify(artifact, Fixtures.CONTENT);

            assertThat(report.failures()).extracting(StageResult::label)
                    .containsExactly("LEDGER_CONFIRMATION[chainA]", "LEDGER_QUORUM");
            assertThat(report.stagesOf(Stage.LEDGER_CONFIRMATION).get(0).actual()).isEqualTo("not found");
        }

        @Test
        @DisplayName("an unreachable ledger fails after the retries run out")
        void unreachable() {
            ScriptedLedgerGateway dead = ScriptedLedgerGateway.failingWith(new TransientNetworkException("connection refused"));
            List<ChainTarget> ledgers = List.of(
                    target("chainA", dead),
                    target("chainB", ScriptedLedgerGateway.confirmedAt(100, 3)),
                    target("chainC", ScriptedLedgerGateway.confirmedAt(100, 3)));

            VerificationReport report = verifier(ledgers).verify(artifact, Fixtures.CONTENT);

            assertThat(report.stagesOf(Stage.LEDGER_CONFIRMATION).get(0).detail()).contains("unreachable");
            assertThat(dead.calls()).isEqualTo(3);
            assertThat(report.stagesOf(Stage.LEDGER_QUORUM).get(0).failed()).isFalse();
            assertThat(report.isVerified()).isFalse();
        }

        @Test
        @DisplayName("required depth comes from the verifier, not from the artifact")
        void ownDepth() {
            List<ChainTarget> ledgers = List.of(
                    target("chainA", ScriptedLedgerGateway.confirmedAt(100, 5)),
                    new ChainTarget("chainB", ScriptedLedgerGateway.confirmedAt(100, 3), 10,
                            Duration.ofMinutes(1), Duration.ofSeconds(1)),
                    target("chainC", ScriptedLedgerGateway.alwaysPending(100)));

            VerificationReport report = verifier(ledgers).verify(artifact, Fixtures.CONTENT);

            assertThat(report.stagesOf(Stage.LEDGER_CONFIRMATION).get(1).expected()).isEqualTo(">= 10 confirmations");
            assertThat(report.failures()).extracting(StageResult::label)
                    .containsExactly("LEDGER_CONFIRMATION[chainB]", "LEDGER_QUORUM");
        }

        @Test
        @DisplayName("quorum comes from the verifier, not from the artifact")
        void ownQuorum() {
            Verifier unanimous = new Verifier(Fixtures.HASHER, Fixtures.CODEC, List.of(TestOracle.ADDRESS), liveLedgers(),
                    QuorumPolicy.unanimous(3), null, executor, Duration.ofSeconds(1), new RetryPolicy(5, 20, 0.0, 3));

            VerificationReport report = unanimous.verify(artifact, Fixtures.CONTENT);

            assertThat(report.failures()).extracting(StageResult::label).containsExactly("LEDGER_QUORUM");
            assertThat(report.render()).contains("FAILED").contains("LEDGER_QUORUM").contains("expected >= 3 of 3");
        }
    }

    @Test
    @DisplayName("verifying without content needs a content store")
    void requiresContentStore() {
        assertThatThrownBy(() -> verifier(liveLedgers()).verify(artifact)).isInstanceOf(IllegalStateException.class);
    }

    private Verifier verifier(List<ChainTarget> ledgers) {
        return verifier(ledgers, null);
    }

    private Verifier verifier(List<ChainTarget> ledgers, InMemoryContentStore store) {
        return new Verifier(Fixtures.HASHER, Fixtures.CODEC, List.of(TestOracle.ADDRESS), ledgers, null, store,
                executor, Duration.ofSeconds(1), new RetryPolicy(5, 20, 0.0, 3));
    }

    /**
     * What the ledgers show today for the fixture artifact: A and B deep enough, C still shallow.
     */
    private static List<ChainTarget> liveLedgers() {
        return List.of(
                target("chainA", ScriptedLedgerGateway.confirmedAt(100, 5)),
                target("chainB", ScriptedLedgerGateway.confirmedAt(100, 3)),
                target("chainC", ScriptedLedgerGateway.alwaysPending(100)));
    }

    private static ChainTarget target(String chainId, LedgerGateway gateway) {
        return new ChainTarget(chainId, gateway, 3, Duration.ofMinutes(1), Duration.ofSeconds(1));
    }
}
