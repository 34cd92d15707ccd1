package com.project.attest.verify;

import java.util.List;

/**
 * Per-stage outcome of verifying one artifact. The verdict is {@link Verdict#VERIFIED} only if
 * no stage failed.
 */
public record VerificationReport(String documentId, Verdict verdict, List<StageResult> stages) {

    public VerificationReport {
        stages = List.copyOf(stages);
    }

    static VerificationReport of(String documentId, List<StageResult> stages) {
        boolean anyFailed = stages.stream().anyMatch(StageResult::failed);
        return new VerificationReport(documentId, anyFailed ? Verdict.FAILED : Verdict.VERIFIED, stages);
    }

    public boolean isVerified() {
        return verdict == Verdict.VERIFIED;
    }

    public List<StageResult> failures() {
        return stages.stream().filter(StageResult::failed).toList();
    }

    public List<StageResult> stagesOf(Stage stage) {
        return stages.stream().filter(result -> result.stage() == stage).toList();
    }

    /**
     * Multi-line summary for terminals and logs.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        out.append("Document ").append(documentId).append(": ").append(verdict).append(System.lineSeparator());
        for (StageResult result : stages) {
            out.append(String.format("  %-7s %-40s %s", result.outcome(), result.label(),
                    result.detail() == null ? "" : result.detail()));
            if (result.failed() && (result.expected() != null || result.actual() != null)) {
                out.append(String.format(" (expected %s, actual %s)", result.expected(), result.actual()));
            }
            out.append(System.lineSeparator());
        }
        return out.toString();
    }
}
