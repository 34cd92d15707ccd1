package com.project.attest.io;

import com.project.attest.crypto.Digest;

import java.util.Optional;

/**
 * Read side of the storage collaborator. Uploads are managed elsewhere.
 */
public interface ContentStore {

    /**
     * Bytes referenced by {@code locator}, empty when the store does not have them.
     */
    Optional<byte[]> retrieve(ContentLocator locator);

    /**
     * The digest the store itself holds for {@code locator}'s bytes.
     */
    Digest locatorDigest(ContentLocator locator);
}
