package com.stablegate.ingestion.adapter.tron;

import org.tron.trident.core.ApiWrapper;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * TRON addresses in the 20-byte {@code 0x} hex form that TRC20 logs use. Accepts base58check ({@code T...})
 * addresses and 21-byte {@code 41...} hex with or without {@code 0x}.
 */
public final class TronAddress {

    private static final Pattern HEX_20 = Pattern.compile("[0-9a-f]{40}");

    private TronAddress() {
    }

    public static String toHex(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("TRON address must not be blank");
        }
        String stripped = address.strip();
        if (stripped.startsWith("T")) {
            return fromBase58(stripped);
        }
        String a = stripped.toLowerCase(Locale.ROOT);
        if (a.startsWith("0x")) {
            a = a.substring(2);
        }
        if (a.length() == 42 && a.startsWith("41")) {
            a = a.substring(2);
        }
        if (!HEX_20.matcher(a).matches()) {
            throw new IllegalArgumentException("Unsupported TRON address format (expected base58 or hex): " + address);
        }
        return "0x" + a;
    }

    private static String fromBase58(String address) {
        byte[] raw;
        try {
            raw = ApiWrapper.parseAddress(address).toByteArray();
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid TRON base58 address: " + address, e);
        }
        if (raw.length != 21 || raw[0] != 0x41) {
            throw new IllegalArgumentException("Invalid TRON base58 address: " + address);
        }
        return "0x" + Numeric.toHexStringNoPrefix(raw).substring(2);
    }

    /**
     * Like {@link #toHex(String)} but returns null for null or blank input.
     */
    static String toHexOrNull(String address) {
        return address == null || address.isBlank() ? null : toHex(address);
    }
}
