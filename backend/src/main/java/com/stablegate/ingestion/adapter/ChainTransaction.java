package com.stablegate.ingestion.adapter;

/**
 * Chain-neutral transaction view. Addresses are lower-case 0x hex; {@code to} may be null for
 * contract creation. {@code memoData} is the payload the memo is read from (call data, or the TRON note).
 */
public record ChainTransaction(String hash, String from, String to, String input, String memoData) {

    public boolean isAddressedTo(String address) {
        return to != null && address != null && to.equalsIgnoreCase(address);
    }
}
