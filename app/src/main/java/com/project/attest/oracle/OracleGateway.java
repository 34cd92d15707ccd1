package com.project.attest.oracle;

import com.project.attest.crypto.DocumentId;
import com.project.attest.io.ContentLocator;

/**
 * Contract of the external oracle.
 *
 * Implementations throw {@link com.project.attest.core.TransientNetworkException} for errors
 * worth retrying, {@link com.project.attest.core.ExternalServiceException} for explicit refusals
 * and {@link com.project.attest.core.ReportValidationException} for payloads that cannot be
 * parsed into the data model.
 */
public interface OracleGateway {

    /**
     * Submits an attestation request and returns the identifier the oracle assigned to it.
     */
    String submit(DocumentId documentId, ContentLocator locator);

    OraclePoll pollStatus(String requestId);
}
