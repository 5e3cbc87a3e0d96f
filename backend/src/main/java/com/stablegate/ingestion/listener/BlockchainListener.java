package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;

import java.util.List;

/**
 * Uniform contract of a chain listener. {@link ListenerManager} supervises listeners only through this port.
 */
public interface BlockchainListener {

    /**
     * @throws ListenerStateException if already running
     */
    void start();

    /**
     * Requests the polling task to stop and waits for it within the listener's stop timeout.
     * The listener is reported stopped afterwards even if the wait timed out.
     *
     * @throws ListenerStateException        if not running
     * @throws ListenerStopTimeoutException if the polling task did not exit in time
     */
    void stop();

    boolean isRunning();

    ChainType getBlockchainType();

    String getWalletAddress();

    void setConfirmationHandler(PaymentConfirmationHandler handler);

    /**
     * @return symbols of the watched tokens
     */
    List<String> getSupportedTokens();

    ListenerHealth getListenerHealth();
}
