package com.project.attest.verify;

import java.util.Objects;

/**
 * Result of one verification stage.
 *
 * @param stage    the stage
 * @param subject  chain id for ledger stages, {@code null} otherwise
 * @param outcome  pass, fail or skipped
 * @param expected value the artifact claims, where the stage compares values
 * @param actual   value recomputed or observed by the verifier
 * @param detail   human readable explanation
 */
public record StageResult(Stage stage, String subject, StageOutcome outcome, String expected, String actual,
                          String detail) {

    public StageResult {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    static StageResult pass(Stage stage, String detail) {
        return new StageResult(stage, null, StageOutcome.PASS, null, null, detail);
    }

    static StageResult skipped(Stage stage, String detail) {
        return new StageResult(stage, null, StageOutcome.SKIPPED, null, null, detail);
    }

    static StageResult fail(Stage stage, String detail) {
        return new StageResult(stage, null, StageOutcome.FAIL, null, null, detail);
    }

    static StageResult compare(Stage stage, String expected, String actual, String what) {
        boolean match = Objects.equals(expected, actual);
        return new StageResult(stage, null, match ? StageOutcome.PASS : StageOutcome.FAIL, expected, actual,
                match ? what + " matches" : what + " mismatch");
    }

    /**
     * The same observation, downgraded to {@link StageOutcome#SKIPPED}.
     */
    StageResult skipped(String reason) {
        return new StageResult(stage, subject, StageOutcome.SKIPPED, expected, actual, reason + detail);
    }

    StageResult forSubject(String newSubject) {
        return new StageResult(stage, newSubject, outcome, expected, actual, detail);
    }

    public boolean failed() {
        return outcome == StageOutcome.FAIL;
    }

    public String label() {
        return subject == null ? stage.name() : stage.name() + "[" + subject + "]";
    }
}
