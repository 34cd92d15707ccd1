package com.project.attest.io;

import com.project.attest.proof.ProofArtifact;
import com.project.attest.proof.ProofArtifactCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes sealed artifacts as canonical JSON, one file per document:
 * {@code <outputDirectory>/<documentId>.json}. Re-attesting a document replaces its file.
 *
 * Each write goes through its own temp file in the output directory, so concurrent writers never
 * share one and a failed write leaves nothing behind.
 */
public class ProofArtifactWriter implements ProofSink {
    private static final Logger log = LoggerFactory.getLogger(ProofArtifactWriter.class);

    private final Path outputDirectory;
    private final ProofArtifactCodec codec;

    public ProofArtifactWriter(Path outputDirectory, ProofArtifactCodec codec) {
        this.outputDirectory = outputDirectory;
        this.codec = codec;
    }

    @Override
    public void accept(ProofArtifact artifact) throws IOException {
        write(artifact);
    }

    public Path write(ProofArtifact artifact) throws IOException {
        if (!artifact.isSealed()) {
            throw new IllegalArgumentException("Refusing to write an unsealed artifact for " + artifact.documentId());
        }
        Files.createDirectories(outputDirectory);

        Path target = outputDirectory.resolve(fileNameFor(artifact));
        Path temp = Files.createTempFile(outputDirectory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, codec.toJson(artifact));
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        log.info("Wrote {} proof to {}", artifact.aggregateStatus(), target);
        return target;
    }

    public static String fileNameFor(ProofArtifact artifact) {
        return artifact.documentId().hex() + ".json";
    }
}
