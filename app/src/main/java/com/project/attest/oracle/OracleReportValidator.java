package com.project.attest.oracle;

import com.project.attest.core.AttestationFailure;
import com.project.attest.core.ErrorKind;
import com.project.attest.crypto.DocumentId;
import com.project.attest.crypto.OracleSignatures;
import com.project.attest.io.ByteEncoding;
import com.project.attest.io.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a report before it is accepted, in order:
 * request id, reported digest, signature by an authorized oracle key, freshness.
 *
 * The first three are hard failures. Freshness is advisory: a report older than the staleness
 * window (or dated too far in the future) is accepted with a warning.
 */
public class OracleReportValidator {
    private static final Logger log = LoggerFactory.getLogger(OracleReportValidator.class);

    static final String STAGE = "oracle";

    private final Set<String> authorizedSigners;
    private final Duration stalenessWindow;
    private final Duration maxClockSkew;
    private final Clock clock;

    public OracleReportValidator(Collection<String> authorizedSigners, Duration stalenessWindow, Clock clock) {
        this(authorizedSigners, stalenessWindow, Duration.ofMinutes(5), clock);
    }

    public OracleReportValidator(Collection<String> authorizedSigners, Duration stalenessWindow,
                                 Duration maxClockSkew, Clock clock) {
        if (authorizedSigners == null || authorizedSigners.isEmpty()) {
            throw new IllegalArgumentException("At least one authorized oracle key is required");
        }
        if (stalenessWindow == null || stalenessWindow.isNegative() || stalenessWindow.isZero()) {
            throw new IllegalArgumentException("stalenessWindow must be positive");
        }
        this.authorizedSigners = authorizedSigners.stream()
                .map(OracleSignatures::normalizeAddress)
                .collect(Collectors.toUnmodifiableSet());
        this.stalenessWindow = stalenessWindow;
        this.maxClockSkew = maxClockSkew;
        this.clock = clock;
    }

    public ReportCheck validate(OracleReport report, String expectedRequestId, DocumentId expectedDigest) {
        if (!report.requestId().equals(expectedRequestId)) {
            return ReportCheck.rejected(AttestationFailure.mismatch(ErrorKind.VALIDATION, STAGE,
                    "requestId", expectedRequestId, report.requestId()));
        }
        Optional<AttestationFailure> digestFailure = checkDigest(report, expectedDigest);
        if (digestFailure.isPresent()) {
            return ReportCheck.rejected(digestFailure.get());
        }
        Optional<AttestationFailure> signatureFailure = checkSignature(report);
        if (signatureFailure.isPresent()) {
            return ReportCheck.rejected(signatureFailure.get());
        }
        return ReportCheck.accepted(freshnessWarnings(report));
    }

    public Optional<AttestationFailure> checkDigest(OracleReport report, DocumentId expectedDigest) {
        if (report.reportedDigest().equals(expectedDigest.digest())) {
            return Optional.empty();
        }
        return Optional.of(AttestationFailure.mismatch(ErrorKind.VALIDATION, STAGE, "reportedDigest",
                expectedDigest.hex(), report.reportedDigest().hex()));
    }

    public Optional<AttestationFailure> checkSignature(OracleReport report) {
        Optional<String> signer = OracleSignatures.recoverSigner(
                report.requestId(), report.reportedDigest(), report.issuedAt(), report.signature());
        if (signer.isEmpty()) {
            return Optional.of(new AttestationFailure(ErrorKind.VALIDATION, STAGE, "signature",
                    "valid secp256k1 signature", ByteEncoding.toHex(report.signature()),
                    "Oracle report signature is malformed or does not recover to a key"));
        }
        if (!authorizedSigners.contains(signer.get())) {
            return Optional.of(new AttestationFailure(ErrorKind.VALIDATION, STAGE, "signature",
                    "one of " + authorizedSigners, signer.get(),
                    "Oracle report signed by unauthorized key " + signer.get()));
        }
        return Optional.empty();
    }

    public List<String> freshnessWarnings(OracleReport report) {
        List<String> warnings = new ArrayList<>();
        Instant now = clock.instant();
        if (report.issuedAt().isBefore(now.minus(stalenessWindow))) {
            String warning = String.format("Oracle report %s is stale: issued %s, older than %s",
                    report.requestId(), Timestamps.format(report.issuedAt()), stalenessWindow);
            log.warn(warning);
            warnings.add(warning);
        } else if (report.issuedAt().isAfter(now.plus(maxClockSkew))) {
            String warning = String.format("Oracle report %s is dated in the future: issued %s",
                    report.requestId(), Timestamps.format(report.issuedAt()));
            log.warn(warning);
            warnings.add(warning);
        }
        return warnings;
    }

    public Set<String> authorizedSigners() {
        return authorizedSigners;
    }
}
