package com.stablegate.ingestion.listener;

import com.stablegate.domain.PaymentConfirmation;

/**
 * Receives confirmed payments. A thrown exception leaves the transaction unmarked so it is delivered again;
 * implementations must be idempotent on tx hash or payment id.
 */
@FunctionalInterface
public interface PaymentConfirmationHandler {

    /**
     * Placeholder for listeners created before they are bound to a publisher. Every delivery fails,
     * which keeps the transaction eligible for redelivery.
     */
    PaymentConfirmationHandler UNBOUND = confirmation -> {
        throw new ListenerStateException("No confirmation handler bound for " + confirmation.chainType());
    };

    void handle(PaymentConfirmation confirmation) throws Exception;
}
