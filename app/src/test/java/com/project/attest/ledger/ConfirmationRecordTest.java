package com.project.attest.ledger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfirmationRecordTest {

    @Test
    void terminalRecordRefusesFurtherWrites() {
        ConfirmationRecord record = new ConfirmationRecord(ChainConfirmation.unconfirmed("chainA", "0xaa", 3));
        ChainConfirmation confirmed = new ChainConfirmation("chainA", "0xaa", 10L, 3, 3, ConfirmationStatus.CONFIRMED, null);

        assertThat(record.update(confirmed)).isTrue();
        assertThat(record.update(confirmed.failed("late reorg"))).isFalse();
        assertThat(record.snapshot()).isEqualTo(confirmed);
    }

    @Test
    void rejectsUpdatesForAnotherLedger() {
        ConfirmationRecord record = new ConfirmationRecord(ChainConfirmation.unconfirmed("chainA", "0xaa", 3));

        assertThatThrownBy(() -> record.update(ChainConfirmation.unconfirmed("chainB", "0xbb", 3)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
