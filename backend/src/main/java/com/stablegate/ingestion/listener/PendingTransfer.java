package com.stablegate.ingestion.listener;

import com.stablegate.domain.TokenDescriptor;
import com.stablegate.ingestion.adapter.ChainTransaction;

/**
 * Backlog entry: a watched transfer still short of its confirmation depth, or whose handler failed.
 */
record PendingTransfer(ChainTransaction transaction, TokenDescriptor token, long blockNumber, long blockTimestamp,
                       int failedAttempts) {

    PendingTransfer withFailure() {
        return new PendingTransfer(transaction, token, blockNumber, blockTimestamp, failedAttempts + 1);
    }
}
