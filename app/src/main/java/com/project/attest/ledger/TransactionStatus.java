package com.project.attest.ledger;

/**
 * What a ledger reports about one transaction at the moment of the query.
 *
 * @param found             whether the transaction is included in a block
 * @param blockHeight       inclusion height, {@code null} when not found
 * @param confirmationCount blocks on top of and including the inclusion block
 * @param reverted          whether execution reverted
 */
public record TransactionStatus(boolean found, Long blockHeight, long confirmationCount, boolean reverted) {

    public TransactionStatus {
        if (confirmationCount < 0) {
            throw new IllegalArgumentException("confirmationCount must not be negative");
        }
        if (found && blockHeight == null) {
            throw new IllegalArgumentException("A found transaction needs a block height");
        }
    }

    public static TransactionStatus notFound() {
        return new TransactionStatus(false, null, 0, false);
    }

    public static TransactionStatus included(long blockHeight, long confirmationCount) {
        return new TransactionStatus(true, blockHeight, confirmationCount, false);
    }

    public static TransactionStatus reverted(long blockHeight, long confirmationCount) {
        return new TransactionStatus(true, blockHeight, confirmationCount, true);
    }
}
