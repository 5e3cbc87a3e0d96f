package com.stablegate.ingestion.decoder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentReferenceTest {

    @Test
    void normalize_stripsPaymentPrefixInAnyCase() {
        assertThat(PaymentReference.normalize("PAYMENT:ord-1")).isEqualTo("ord-1");
        assertThat(PaymentReference.normalize("payment: ord-2 ")).isEqualTo("ord-2");
    }

    @Test
    void normalize_otherMemosAreTrimmedOnly() {
        assertThat(PaymentReference.normalize("  inv-3\n")).isEqualTo("inv-3");
        assertThat(PaymentReference.normalize("PAY:ord-4")).isEqualTo("PAY:ord-4");
    }

    @Test
    void normalize_prefixWithoutId_yieldsEmpty() {
        assertThat(PaymentReference.normalize("PAYMENT:")).isEmpty();
    }
}
