package com.project.attest.verify;

public enum Verdict {
    VERIFIED,
    FAILED
}
