package com.project.attest.crypto;

/**
 * The three digests derived for one attestation.
 */
public record DocumentIdentity(Digest contentDigest, Digest metadataDigest, DocumentId documentId) {
}
