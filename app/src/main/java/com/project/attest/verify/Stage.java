package com.project.attest.verify;

/**
 * Verification stages, in the order they are reported.
 */
public enum Stage {
    ARTIFACT_CHECKSUM,
    CONTENT_DIGEST,
    METADATA_DIGEST,
    DOCUMENT_ID,
    ORACLE_DIGEST,
    ORACLE_SIGNATURE,
    LEDGER_CONFIRMATION,
    LEDGER_QUORUM
}
