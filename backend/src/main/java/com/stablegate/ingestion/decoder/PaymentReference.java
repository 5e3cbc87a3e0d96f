package com.stablegate.ingestion.decoder;

import java.util.Locale;

/**
 * Turns a recovered memo into a payment id: {@code PAYMENT:<id>} (any case) yields {@code <id>},
 * anything else is used trimmed.
 */
public final class PaymentReference {

    static final String PREFIX = "PAYMENT:";

    private PaymentReference() {
    }

    public static String normalize(String memo) {
        String trimmed = memo.strip();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith(PREFIX)) {
            return trimmed.substring(PREFIX.length()).strip();
        }
        return trimmed;
    }
}
