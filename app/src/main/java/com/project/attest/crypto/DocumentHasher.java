package com.project.attest.crypto;

import com.project.attest.core.AttestationFailure;
import com.project.attest.core.ErrorKind;
import com.project.attest.core.IntegrityFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Computes content and metadata digests and assembles the document id from them.
 *
 * The concatenation order {@code contentDigest || metadataDigest} is fixed for the whole
 * system: reversing it would silently change every id ever issued.
 */
public class DocumentHasher {
    private static final Logger log = LoggerFactory.getLogger(DocumentHasher.class);

    private final Canonicalizer canonicalizer;
    private final boolean selfCheck;

    public DocumentHasher(Canonicalizer canonicalizer) {
        this(canonicalizer, true);
    }

    /**
     * @param selfCheck when set, {@link #deriveIdentity} computes everything twice and treats
     *                  any difference as an integrity fault
     */
    public DocumentHasher(Canonicalizer canonicalizer, boolean selfCheck) {
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer must not be null");
        this.selfCheck = selfCheck;
    }

    public Digest hash(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return Digest.sha256(HashingUtils.sha256(bytes));
    }

    public Digest contentDigest(byte[] content) {
        return hash(content);
    }

    public Digest metadataDigest(Object metadata) {
        return hash(canonicalizer.canonicalize(metadata));
    }

    public DocumentId assembleDocumentId(Digest contentDigest, Digest metadataDigest) {
        requireSha256(contentDigest, "contentDigest");
        requireSha256(metadataDigest, "metadataDigest");
        return new DocumentId(Digest.sha256(HashingUtils.sha256(contentDigest.bytes(), metadataDigest.bytes())));
    }

    public DocumentIdentity deriveIdentity(byte[] content, Object metadata) {
        Objects.requireNonNull(content, "content must not be null");
        DocumentIdentity first = derive(content, canonicalizer.canonicalize(metadata));
        if (!selfCheck) {
            return first;
        }

        byte[] canonicalAgain = canonicalizer.canonicalize(metadata);
        DocumentIdentity second = derive(content, canonicalAgain);
        if (!first.equals(second)) {
            log.error("Non-deterministic identity derivation: {} vs {}", first.documentId(), second.documentId());
            throw new IntegrityFaultException(AttestationFailure.mismatch(ErrorKind.INTEGRITY_FAULT,
                    "hasher", "documentId", first.documentId().hex(), second.documentId().hex()));
        }
        return first;
    }

    /**
     * Checks that the canonical bytes of {@code metadata} round-trip through parse unchanged.
     */
    public void verifyCanonicalStability(Object metadata) {
        byte[] canonical = canonicalizer.canonicalize(metadata);
        byte[] reparsed = canonicalizer.canonicalize(canonicalizer.parse(canonical));
        if (!Arrays.equals(canonical, reparsed)) {
            throw new IntegrityFaultException(AttestationFailure.of(ErrorKind.INTEGRITY_FAULT, "canonicalizer",
                    "Canonical form is not stable under re-parsing"));
        }
    }

    public Canonicalizer canonicalizer() {
        return canonicalizer;
    }

    private DocumentIdentity derive(byte[] content, byte[] canonicalMetadata) {
        Digest contentDigest = hash(content);
        Digest metadataDigest = hash(canonicalMetadata);
        return new DocumentIdentity(contentDigest, metadataDigest, assembleDocumentId(contentDigest, metadataDigest));
    }

    private static void requireSha256(Digest digest, String name) {
        Objects.requireNonNull(digest, name + " must not be null");
        if (!Digest.SHA_256.equals(digest.algorithm())) {
            throw new IllegalArgumentException(name + " must be " + Digest.SHA_256 + " but was " + digest.algorithm());
        }
    }
}
