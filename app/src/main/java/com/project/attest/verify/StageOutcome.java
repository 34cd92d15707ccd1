package com.project.attest.verify;

public enum StageOutcome {
    PASS,
    FAIL,
    SKIPPED
}
