package com.project.attest.ledger;

import java.util.Objects;

/**
 * Confirmation state of the relay transaction on one ledger.
 *
 * @param chainId           ledger identifier
 * @param transactionRef    relay transaction, {@code null} if the oracle reported none
 * @param blockHeight       inclusion height when known
 * @param confirmationCount last observed confirmation count
 * @param requiredDepth     depth this ledger needs for {@link ConfirmationStatus#CONFIRMED}
 * @param status            current status; terminal once CONFIRMED or FAILED
 * @param detail            why the record is in its status, when that is not obvious
 */
public record ChainConfirmation(
        String chainId,
        String transactionRef,
        Long blockHeight,
        long confirmationCount,
        int requiredDepth,
        ConfirmationStatus status,
        String detail
) {
    public ChainConfirmation {
        Objects.requireNonNull(chainId, "chainId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (requiredDepth < 1) {
            throw new IllegalArgumentException("requiredDepth must be at least 1");
        }
    }

    public static ChainConfirmation unconfirmed(String chainId, String transactionRef, int requiredDepth) {
        return new ChainConfirmation(chainId, transactionRef, null, 0, requiredDepth, ConfirmationStatus.UNCONFIRMED, null);
    }

    public ChainConfirmation failed(String reason) {
        return new ChainConfirmation(chainId, transactionRef, blockHeight, confirmationCount, requiredDepth,
                ConfirmationStatus.FAILED, reason);
    }

    public ChainConfirmation withDetail(String newDetail) {
        return new ChainConfirmation(chainId, transactionRef, blockHeight, confirmationCount, requiredDepth,
                status, newDetail);
    }

    public boolean isConfirmed() {
        return status == ConfirmationStatus.CONFIRMED;
    }

    public boolean isFailed() {
        return status == ConfirmationStatus.FAILED;
    }
}
