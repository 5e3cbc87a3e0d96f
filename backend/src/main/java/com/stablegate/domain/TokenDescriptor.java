package com.stablegate.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

/**
 * Watched token: chain-native identifier (contract address or mint), symbol and decimals.
 * Identifier is stored lower-cased so comparisons against decoded log addresses are case-insensitive.
 */
public record TokenDescriptor(String identifier, String symbol, int decimals) {

    public TokenDescriptor {
        Objects.requireNonNull(identifier, "token identifier must not be null");
        Objects.requireNonNull(symbol, "token symbol must not be null");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("token identifier must not be blank");
        }
        if (decimals < 0 || decimals > 255) {
            throw new IllegalArgumentException("token decimals out of range: " + decimals);
        }
        identifier = identifier.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Raw integer amount scaled by 10^decimals.
     */
    public BigDecimal toDecimal(BigInteger rawAmount) {
        return new BigDecimal(rawAmount).movePointLeft(decimals);
    }

    public boolean matches(String address) {
        return address != null && identifier.equalsIgnoreCase(address.strip());
    }
}
