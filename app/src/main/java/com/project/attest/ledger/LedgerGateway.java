package com.project.attest.ledger;

/**
 * One independent ledger. Throws {@link com.project.attest.core.TransientNetworkException} for
 * errors worth retrying and {@link com.project.attest.core.ExternalServiceException} for
 * explicit error responses.
 */
public interface LedgerGateway {

    TransactionStatus getTransactionStatus(String transactionRef);
}
