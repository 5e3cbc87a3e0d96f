package com.stablegate.event;

import java.time.Instant;

/**
 * Pre-finality sighting of a watched transfer, with its current and required confirmation counts.
 */
public record TransactionDetectedEvent(
        String txHash,
        BlockchainType blockchain,
        long confirmations,
        long requiredConfirmations,
        Instant occurredAt) implements Event {

    public static final String NAME = "blockchain.transaction_detected";

    public static TransactionDetectedEvent of(String txHash, BlockchainType blockchain,
                                              long confirmations, long requiredConfirmations) {
        return new TransactionDetectedEvent(txHash, blockchain, confirmations, requiredConfirmations, Instant.now());
    }

    @Override
    public String name() {
        return NAME;
    }
}
