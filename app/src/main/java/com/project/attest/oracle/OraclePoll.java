package com.project.attest.oracle;

import java.util.Optional;

/**
 * Answer to one status poll: either still pending or a report.
 */
public record OraclePoll(OracleReport report) {

    private static final OraclePoll PENDING = new OraclePoll(null);

    public static OraclePoll pending() {
        return PENDING;
    }

    public static OraclePoll of(OracleReport report) {
        return new OraclePoll(report);
    }

    /**
     * A report the oracle has not yet marked final counts as pending.
     */
    public boolean isPending() {
        return report == null || !report.finalized();
    }

    public Optional<OracleReport> finalReport() {
        return isPending() ? Optional.empty() : Optional.of(report);
    }
}
