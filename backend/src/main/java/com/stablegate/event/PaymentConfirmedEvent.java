package com.stablegate.event;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a transfer to the operator wallet reached its confirmation depth and carried a payment reference.
 * Consumers must be idempotent on {@code txHash}: delivery is at-least-once.
 */
public record PaymentConfirmedEvent(
        String paymentId,
        String txHash,
        BigDecimal amount,
        String tokenSymbol,
        BlockchainType blockchain,
        String sender,
        String recipient,
        long blockNumber,
        long blockTimestamp,
        Instant occurredAt) implements Event {

    public static final String NAME = "payment.confirmed";

    public static PaymentConfirmedEvent of(String paymentId, String txHash, BigDecimal amount, String tokenSymbol,
                                           BlockchainType blockchain, String sender, String recipient,
                                           long blockNumber, long blockTimestamp) {
        return new PaymentConfirmedEvent(paymentId, txHash, amount, tokenSymbol, blockchain, sender, recipient,
                blockNumber, blockTimestamp, Instant.now());
    }

    @Override
    public String name() {
        return NAME;
    }
}
