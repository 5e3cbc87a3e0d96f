package com.stablegate.event;

import java.time.Instant;

/**
 * Listener health transition (healthy ↔ unhealthy).
 */
public record BlockchainHealthEvent(
        BlockchainType blockchain,
        boolean healthy,
        long lastProcessedBlock,
        String errorMessage,
        String connectionStatus,
        Instant occurredAt) implements Event {

    public static final String NAME = "blockchain.health_changed";

    public static BlockchainHealthEvent of(BlockchainType blockchain, boolean healthy, long lastProcessedBlock,
                                           String errorMessage, String connectionStatus) {
        return new BlockchainHealthEvent(blockchain, healthy, lastProcessedBlock, errorMessage, connectionStatus,
                Instant.now());
    }

    @Override
    public String name() {
        return NAME;
    }
}
