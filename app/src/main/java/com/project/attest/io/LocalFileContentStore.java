package com.project.attest.io;

import com.project.attest.crypto.Digest;
import com.project.attest.crypto.HashingUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Content store backed by a local directory. The locator's path (CID or file name) is sanitized
 * into a file name under the base directory, optionally with a {@code .bin} suffix.
 */
public class LocalFileContentStore implements ContentStore {

    private final Path baseDirectory;

    public LocalFileContentStore(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public Optional<byte[]> retrieve(ContentLocator locator) {
        return resolve(locator).map(file -> {
            try {
                return Files.readAllBytes(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read stored content for locator " + locator.uri(), e);
            }
        });
    }

    @Override
    public Digest locatorDigest(ContentLocator locator) {
        byte[] bytes = retrieve(locator)
                .orElseThrow(() -> new IllegalStateException("No stored content for locator " + locator.uri()));
        return Digest.sha256(HashingUtils.sha256(bytes));
    }

    private Optional<Path> resolve(ContentLocator locator) {
        String pointer = locator.path();
        if (pointer.isBlank()) {
            return Optional.empty();
        }
        String sanitized = pointer.replaceAll("[^a-zA-Z0-9-_\\.]", "_");
        if (sanitized.matches("\\.+")) {
            return Optional.empty();
        }

        Path candidate = baseDirectory.resolve(sanitized);
        if (Files.notExists(candidate)) {
            candidate = baseDirectory.resolve(sanitized + ".bin");
        }
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }
}
