package com.project.attest.crypto;

import com.project.attest.io.ByteEncoding;

import java.util.Arrays;
import java.util.Objects;

/**
 * A 256-bit digest tagged with the algorithm that produced it.
 */
public record Digest(String algorithm, byte[] bytes) {

    public static final String SHA_256 = "SHA-256";
    public static final int LENGTH = 32;

    public Digest {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s digest must be %d bytes but was %d", algorithm, LENGTH, bytes.length));
        }
        bytes = bytes.clone();
    }

    public static Digest sha256(byte[] digestBytes) {
        return new Digest(SHA_256, digestBytes);
    }

    public static Digest fromHex(String hex) {
        return fromHex(SHA_256, hex);
    }

    public static Digest fromHex(String algorithm, String hex) {
        byte[] decoded = ByteEncoding.fromHex(hex);
        return new Digest(algorithm, decoded);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public String hex() {
        return ByteEncoding.toHex(bytes);
    }

    public boolean matches(byte[] other) {
        return other != null && Arrays.equals(bytes, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Digest other)) {
            return false;
        }
        return algorithm.equals(other.algorithm) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return algorithm + ":" + hex();
    }
}
