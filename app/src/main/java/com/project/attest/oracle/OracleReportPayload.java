package com.project.attest.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.project.attest.core.ReportValidationException;
import com.project.attest.crypto.Digest;
import com.project.attest.io.ByteEncoding;
import com.project.attest.io.Timestamps;

import java.util.Map;

/**
 * Wire shape of an oracle report. Converted once, at the boundary, into an {@link OracleReport};
 * nothing past {@link #toReport()} sees untyped JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OracleReportPayload {

    @JsonProperty("requestId")
    private String requestId;

    @JsonProperty("reportedDigest")
    private String reportedDigest;

    @JsonProperty("signature")
    private String signature;

    @JsonProperty("issuedAt")
    private String issuedAt;

    @JsonProperty("finalized")
    private Boolean finalized;

    @JsonProperty("relays")
    private Map<String, String> relays;

    public OracleReportPayload() {
    }

    public static OracleReportPayload from(OracleReport report) {
        OracleReportPayload payload = new OracleReportPayload();
        payload.requestId = report.requestId();
        payload.reportedDigest = report.reportedDigest().hex();
        payload.signature = ByteEncoding.toHex(report.signature());
        payload.issuedAt = Timestamps.format(report.issuedAt());
        payload.finalized = report.finalized();
        payload.relays = report.relayTransactions();
        return payload;
    }

    public OracleReport toReport() {
        require(requestId, "requestId");
        require(reportedDigest, "reportedDigest");
        require(signature, "signature");
        require(issuedAt, "issuedAt");
        if (finalized == null) {
            throw new ReportValidationException("finalized", "Missing required field");
        }
        Digest digest;
        try {
            digest = Digest.fromHex(reportedDigest);
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("reportedDigest", "Not a 32-byte hex digest", e);
        }
        byte[] signatureBytes;
        try {
            signatureBytes = ByteEncoding.fromHex(signature);
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("signature", "Not hex", e);
        }
        try {
            return new OracleReport(requestId, digest, signatureBytes, Timestamps.parse(issuedAt), finalized, relays);
        } catch (IllegalArgumentException e) {
            throw new ReportValidationException("issuedAt", "Not an ISO-8601 instant", e);
        }
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ReportValidationException(field, "Missing required field");
        }
    }
}
