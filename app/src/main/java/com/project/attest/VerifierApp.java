package com.project.attest;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.attest.core.EngineConfig;
import com.project.attest.core.EngineRuntime;
import com.project.attest.proof.ProofArtifact;
import com.project.attest.verify.VerificationReport;
import com.project.attest.verify.Verifier;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Independently verifies a proof artifact: recomputes every digest from the supplied content
 * (and metadata), checks the oracle signature and re-queries every configured ledger.
 *
 * Usage: java VerifierApp <artifact.json> <contentFile> [metadata.json]
 *
 * Exit code 0 iff the artifact is VERIFIED.
 */
public class VerifierApp {
    public static void main(String[] args) {
        if (args.length < 2 || args.length > 3) {
            System.err.println("Usage: java VerifierApp <artifact.json> <contentFile> [metadata.json]");
            System.exit(1);
        }
        Path metadata = args.length == 3 ? Path.of(args[2]) : null;
        System.exit(run(Path.of(args[0]), Path.of(args[1]), metadata));
    }

    static int run(Path artifactFile, Path contentFile, Path metadataFile) {
        try (EngineRuntime runtime = new EngineRuntime(EngineConfig.fromEnv())) {
            System.out.println("[1/2] Loading artifact " + artifactFile + "...");
            ProofArtifact artifact = runtime.codec().fromJson(Files.readAllBytes(artifactFile));
            byte[] content = Files.readAllBytes(contentFile);
            JsonNode metadata = metadataFile == null
                    ? null
                    : runtime.canonicalizer().parse(Files.readAllBytes(metadataFile));
            System.out.println("      ✓ Document id: " + artifact.documentId());

            System.out.println();
            System.out.println("[2/2] Verifying...");
            Verifier verifier = runtime.verifier();
            VerificationReport report = verifier.verify(artifact, content, metadata);
            System.out.println();
            System.out.print(report.render());
            return report.isVerified() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
