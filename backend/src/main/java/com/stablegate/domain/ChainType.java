package com.stablegate.domain;

/**
 * Blockchain a listener watches. Listener-side vocabulary; the event bus has its own
 * {@link com.stablegate.event.BlockchainType}.
 */
public enum ChainType {
    SOLANA,
    BSC,
    TRON,
    ETHEREUM,
    POLYGON
}
