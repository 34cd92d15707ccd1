package com.project.attest.io;

import com.project.attest.crypto.Digest;

import java.net.URI;
import java.util.Objects;

/**
 * Reference to externally stored bytes, as issued by the storage collaborator
 * (e.g. {@code ipfs://bafy...} plus the SHA-256 of the stored bytes).
 */
public record ContentLocator(URI uri, Digest contentDigest) {

    public ContentLocator {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(contentDigest, "contentDigest must not be null");
        if (uri.getScheme() == null) {
            throw new IllegalArgumentException("Locator URI must be absolute: " + uri);
        }
    }

    public static ContentLocator of(String uri, String contentDigestHex) {
        return new ContentLocator(URI.create(uri), Digest.fromHex(contentDigestHex));
    }

    /**
     * Scheme-specific part without leading slashes: the CID for {@code ipfs://}, the relative
     * file name for {@code file://} locators.
     */
    public String path() {
        String ssp = uri.getSchemeSpecificPart();
        int i = 0;
        while (i < ssp.length() && ssp.charAt(i) == '/') {
            i++;
        }
        return ssp.substring(i);
    }

    @Override
    public String toString() {
        return uri + "#" + contentDigest.hex();
    }
}
