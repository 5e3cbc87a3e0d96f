package com.stablegate.ingestion.adapter;

import java.util.List;

/**
 * Block with its transactions. {@code timestamp} is in epoch seconds.
 */
public record ChainBlock(long number, long timestamp, List<ChainTransaction> transactions) {

    public ChainBlock {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
