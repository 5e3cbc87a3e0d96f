package com.stablegate.ingestion.decoder;

import java.math.BigInteger;

/**
 * Decoded Transfer event. {@code rawAmount} is in the token's smallest unit.
 */
public record TokenTransfer(String token, String from, String to, BigInteger rawAmount) {
}
