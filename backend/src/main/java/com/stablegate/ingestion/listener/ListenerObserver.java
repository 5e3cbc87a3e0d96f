package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;

/**
 * Side-channel notifications from a polling listener. Called on the polling thread.
 */
public interface ListenerObserver {

    ListenerObserver NOOP = new ListenerObserver() {
    };

    /**
     * A watched transfer was seen below its confirmation depth.
     */
    default void onTransactionDetected(ChainType chainType, String txHash, long confirmations, long requiredConfirmations) {
    }

    /**
     * {@code healthy} flipped. {@code errorMessage} is null on recovery.
     */
    default void onHealthChanged(ChainType chainType, ListenerHealth health, String errorMessage) {
    }
}
