package com.project.attest.ipfs;

import com.project.attest.core.TransientNetworkException;
import com.project.attest.crypto.Digest;
import com.project.attest.crypto.HashingUtils;
import com.project.attest.io.ContentLocator;
import com.project.attest.io.ContentStore;

import java.io.IOException;
import java.util.Optional;

/**
 * Content store for {@code ipfs://<cid>} locators.
 */
public class IPFSContentStore implements ContentStore {
    private final IPFSService ipfsService;

    public IPFSContentStore(IPFSService ipfsService) {
        this.ipfsService = ipfsService;
    }

    @Override
    public Optional<byte[]> retrieve(ContentLocator locator) {
        if (!"ipfs".equalsIgnoreCase(locator.uri().getScheme())) {
            throw new IllegalArgumentException("Not an ipfs:// locator: " + locator.uri());
        }
        String cid = locator.path();
        if (cid.isBlank()) {
            return Optional.empty();
        }
        try {
            return ipfsService.cat(cid);
        } catch (IOException e) {
            throw new TransientNetworkException("IPFS read of " + cid + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Digest locatorDigest(ContentLocator locator) {
        byte[] bytes = retrieve(locator)
                .orElseThrow(() -> new IllegalStateException("IPFS has no content for " + locator.uri()));
        return Digest.sha256(HashingUtils.sha256(bytes));
    }
}
