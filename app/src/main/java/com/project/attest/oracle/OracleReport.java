package com.project.attest.oracle;

import com.project.attest.crypto.Digest;
import com.project.attest.io.Timestamps;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Report issued by the oracle for one request. Untrusted until {@link OracleReportValidator}
 * has checked it.
 *
 * @param requestId         identifier the oracle assigned on submission
 * @param reportedDigest    digest the oracle attests to; must equal the submitted document id
 * @param signature         65-byte secp256k1 signature over (requestId, reportedDigest, issuedAt)
 * @param issuedAt          issue time, millisecond precision
 * @param finalized         whether the oracle considers the report final
 * @param relayTransactions per ledger, the transaction that carried the report on-chain
 */
public record OracleReport(
        String requestId,
        Digest reportedDigest,
        byte[] signature,
        Instant issuedAt,
        boolean finalized,
        Map<String, String> relayTransactions
) {
    public OracleReport {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(reportedDigest, "reportedDigest must not be null");
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        signature = signature.clone();
        issuedAt = Timestamps.normalize(issuedAt);
        relayTransactions = relayTransactions == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(relayTransactions));
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OracleReport other)) {
            return false;
        }
        return finalized == other.finalized
                && requestId.equals(other.requestId)
                && reportedDigest.equals(other.reportedDigest)
                && Arrays.equals(signature, other.signature)
                && issuedAt.equals(other.issuedAt)
                && relayTransactions.equals(other.relayTransactions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, reportedDigest, Arrays.hashCode(signature), issuedAt, finalized,
                relayTransactions);
    }
}
