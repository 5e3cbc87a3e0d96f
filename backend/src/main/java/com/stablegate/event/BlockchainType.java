package com.stablegate.event;

/**
 * Chain vocabulary used in published events.
 */
public enum BlockchainType {
    SOLANA("solana"),
    BSC("bsc"),
    TRON("tron"),
    ETHEREUM("ethereum");

    private final String value;

    BlockchainType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
