package com.project.attest.crypto;

import com.project.attest.io.ByteEncoding;
import com.project.attest.io.Timestamps;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Oracle report signatures.
 *
 * The signed message is {@code SHA-256(len||requestId, len||reportedDigest, len||issuedAt)} with
 * {@code issuedAt} in {@link Timestamps} format. It is signed as an Ethereum personal message
 * (secp256k1, EIP-191 prefix) and encoded as 65 bytes {@code r || s || v}. Oracle keys are
 * identified by their Ethereum address.
 */
public final class OracleSignatures {

    public static final int SIGNATURE_LENGTH = 65;

    private OracleSignatures() {
    }

    public static byte[] signingPayload(String requestId, Digest reportedDigest, Instant issuedAt) {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(reportedDigest, "reportedDigest must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        return HashingUtils.sha256LengthPrefixed(List.of(
                HashingUtils.utf8(requestId),
                reportedDigest.bytes(),
                HashingUtils.utf8(Timestamps.format(issuedAt))
        ));
    }

    public static byte[] sign(String requestId, Digest reportedDigest, Instant issuedAt, ECKeyPair keyPair) {
        Sign.SignatureData data = Sign.signPrefixedMessage(signingPayload(requestId, reportedDigest, issuedAt), keyPair);
        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(data.getR(), 0, out, 0, 32);
        System.arraycopy(data.getS(), 0, out, 32, 32);
        out[64] = data.getV()[0];
        return out;
    }

    /**
     * Recovers the address that produced {@code signature}. Empty when the signature is
     * malformed or does not recover to any key.
     */
    public static Optional<String> recoverSigner(String requestId, Digest reportedDigest, Instant issuedAt,
                                                 byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return Optional.empty();
        }
        byte v = signature[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            return Optional.empty();
        }
        Sign.SignatureData data = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(
                    signingPayload(requestId, reportedDigest, issuedAt), data);
            return Optional.of(normalizeAddress(Keys.getAddress(publicKey)));
        } catch (SignatureException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static String addressOf(ECKeyPair keyPair) {
        return normalizeAddress(Keys.getAddress(keyPair));
    }

    public static String normalizeAddress(String address) {
        Objects.requireNonNull(address, "address must not be null");
        String trimmed = address.trim().toLowerCase(Locale.ROOT);
        String bare = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (bare.length() != 40) {
            throw new IllegalArgumentException("Not an Ethereum address: " + address);
        }
        ByteEncoding.fromHex(bare);
        return "0x" + bare;
    }
}
