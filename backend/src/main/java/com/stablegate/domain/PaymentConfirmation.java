package com.stablegate.domain;

import java.math.BigDecimal;

/**
 * A confirmed on-chain transfer attributed to a payment via its memo. Produced once per transfer
 * by a listener and handed to the confirmation handler.
 *
 * @param paymentId      payment reference recovered from the memo
 * @param txHash         transaction hash / id
 * @param amount         transferred amount, already scaled by token decimals
 * @param tokenSymbol    e.g. "USDT"
 * @param chainType      chain the transfer happened on
 * @param sender         sender address
 * @param recipient      watched wallet address
 * @param blockNumber    block containing the transfer
 * @param blockTimestamp block time, epoch seconds
 */
public record PaymentConfirmation(
        String paymentId,
        String txHash,
        BigDecimal amount,
        String tokenSymbol,
        ChainType chainType,
        String sender,
        String recipient,
        long blockNumber,
        long blockTimestamp) {
}
