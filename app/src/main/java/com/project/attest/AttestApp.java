package com.project.attest;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.attest.core.AttestationEngine;
import com.project.attest.core.AttestationFailure;
import com.project.attest.core.AttestationResult;
import com.project.attest.core.EngineConfig;
import com.project.attest.core.EngineRuntime;
import com.project.attest.io.ContentLocator;
import com.project.attest.io.ProofArtifactWriter;
import com.project.attest.ledger.ChainConfirmation;
import com.project.attest.proof.ProofArtifact;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Attests one stored document: derives its id, obtains a signed oracle report, tracks the
 * relay transactions on every configured ledger and writes the proof to the outbox.
 *
 * Usage: java AttestApp attest <locatorUri> <contentDigestHex> <metadata.json>
 * Example: java AttestApp attest ipfs://bafybeib... 9f86d081884c7d65... metadata.json
 *
 * Exit code 0 when the proof is CONFIRMED, 2 when a negative or undecided proof (or none) was
 * produced, 1 on error.
 */
public class AttestApp {
    public static void main(String[] args) {
        if (args.length != 4 || !"attest".equals(args[0])) {
            System.err.println("Usage: java AttestApp attest <locatorUri> <contentDigestHex> <metadata.json>");
            System.err.println("Example: java AttestApp attest ipfs://bafybeib... 9f86d081884c7d65... metadata.json");
            System.exit(1);
        }
        System.exit(run(args[1], args[2], Path.of(args[3])));
    }

    static int run(String locatorUri, String contentDigestHex, Path metadataFile) {
        EngineConfig config;
        try {
            config = EngineConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try (EngineRuntime runtime = new EngineRuntime(config)) {
            System.out.println("[1/3] Reading metadata from " + metadataFile + "...");
            JsonNode metadata = runtime.canonicalizer().parse(Files.readAllBytes(metadataFile));
            ContentLocator locator = ContentLocator.of(locatorUri, contentDigestHex);
            System.out.println("      ✓ Locator: " + locator.uri());

            System.out.println();
            System.out.println("[2/3] Attesting (oracle, then ledger confirmations)...");
            AttestationEngine engine = runtime.engine();
            AttestationResult result = engine.attest(locator, metadata);
            if (result.identity() != null) {
                System.out.println("      ✓ Document id: " + result.identity().documentId());
            }

            System.out.println();
            System.out.println("[3/3] Result");
            result.failureReason().map(AttestationFailure::describe)
                    .ifPresent(reason -> System.out.println("      ✗ " + reason));
            if (result.proof().isEmpty()) {
                System.out.println("      No proof was produced.");
                return 2;
            }

            ProofArtifact artifact = result.proof().get();
            System.out.println("      Aggregate status: " + artifact.aggregateStatus()
                    + " (quorum " + artifact.quorum().quorum() + " of " + artifact.quorum().ledgerCount() + ")");
            for (ChainConfirmation confirmation : artifact.chainConfirmations()) {
                System.out.printf("        %-16s %-11s %d/%d confirmations%s%n",
                        confirmation.chainId(), confirmation.status(), confirmation.confirmationCount(),
                        confirmation.requiredDepth(),
                        confirmation.detail() == null ? "" : " - " + confirmation.detail());
            }
            artifact.warnings().forEach(warning -> System.out.println("      ⚠ " + warning));
            System.out.println("      Proof: " + config.outboxDirectory().resolve(ProofArtifactWriter.fileNameFor(artifact)));
            return result.isConfirmed() ? 0 : 2;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
