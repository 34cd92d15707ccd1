package com.project.attest.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * SHA-256 primitives shared by the hasher, the artifact checksum and the oracle signing payload.
 */
public final class HashingUtils {
    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(Digest.SHA_256);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    });

    private HashingUtils() {
    }

    public static byte[] sha256(byte[] input) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        return digest.digest(input);
    }

    public static byte[] sha256(byte[] left, byte[] right) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        digest.update(left);
        digest.update(right);
        return digest.digest();
    }

    /**
     * Hash of fields each prefixed by its 4-byte big-endian length, so that no two different
     * field lists can produce the same byte stream.
     */
    public static byte[] sha256LengthPrefixed(List<byte[]> fields) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        for (byte[] field : fields) {
            digest.update(intToBytes(field.length));
            digest.update(field);
        }
        return digest.digest();
    }

    public static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] intToBytes(int value) {
        return ByteBuffer.allocate(4).putInt(value).array();
    }
}
