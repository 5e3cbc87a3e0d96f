package com.stablegate.ingestion.listener;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessedTransactionSetTest {

    @Test
    void mark_isCaseInsensitive() {
        ProcessedTransactionSet set = new ProcessedTransactionSet(10, null);

        set.mark("0xABC");

        assertThat(set.contains("0xabc")).isTrue();
        assertThat(set.contains("0xdef")).isFalse();
        assertThat(set.size()).isEqualTo(1L);
    }

    @Test
    void size_isBounded() {
        ProcessedTransactionSet set = new ProcessedTransactionSet(5, null);

        for (int i = 0; i < 50; i++) {
            set.mark("0x" + i);
        }

        assertThat(set.size()).isLessThanOrEqualTo(5L);
    }
}
