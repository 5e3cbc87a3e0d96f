package com.stablegate.ingestion.adapter;

import java.util.List;

public record TransactionReceipt(String txHash, long blockNumber, boolean successful, List<ReceiptLog> logs) {

    public TransactionReceipt {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
