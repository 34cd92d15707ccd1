package com.project.attest.crypto;

import java.util.Objects;

/**
 * Identity of one (content, metadata) pair: {@code SHA-256(contentDigest || metadataDigest)}.
 * Content-derived only, so any two parties with the same inputs agree on it.
 */
public record DocumentId(Digest digest) {

    public DocumentId {
        Objects.requireNonNull(digest, "digest must not be null");
    }

    public static DocumentId fromHex(String hex) {
        return new DocumentId(Digest.fromHex(hex));
    }

    public String hex() {
        return digest.hex();
    }

    @Override
    public String toString() {
        return hex();
    }
}
