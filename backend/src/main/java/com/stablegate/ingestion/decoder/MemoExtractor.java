package com.stablegate.ingestion.decoder;

import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Recovers a payment reference from a transaction payload.
 * <p>
 * For {@code transfer(address,uint256)} call data longer than the fixed 68 bytes, the trailing bytes are tried
 * as an ABI string (offset, length, bytes), then as plain text, then hex-encoded unless they hold nothing but
 * zero padding and control bytes. Any other payload (a TRON
 * note, for instance) is tried as an ABI string and then as plain text. A candidate is accepted only if it is
 * non-empty printable ASCII (tab, CR and LF allowed).
 */
public class MemoExtractor {

    static final byte[] TRANSFER_SELECTOR = {(byte) 0xa9, 0x05, (byte) 0x9c, (byte) 0xbb};
    static final int TRANSFER_CALL_LENGTH = 68;
    private static final int WORD = 32;

    /**
     * @param payloadHex 0x hex payload
     * @throws MemoNotFoundException if no printable memo is present
     */
    public String extract(String payloadHex) {
        byte[] data = toBytes(payloadHex);
        if (data.length == 0) {
            throw new MemoNotFoundException("Empty payload");
        }
        String memo;
        if (isTransferCall(data)) {
            if (data.length <= TRANSFER_CALL_LENGTH) {
                throw new MemoNotFoundException("Transfer call carries no trailing memo");
            }
            memo = decodeTrailing(Arrays.copyOfRange(data, TRANSFER_CALL_LENGTH, data.length));
        } else {
            memo = decodeNote(data);
        }
        if (memo == null) {
            throw new MemoNotFoundException("No printable memo in payload");
        }
        return memo;
    }

    private static String decodeTrailing(byte[] trailing) {
        String memo = decodeNote(trailing);
        if (memo != null) {
            return memo;
        }
        if (isBlank(trailing)) {
            return null;
        }
        return Numeric.toHexStringNoPrefix(trailing);
    }

    private static String decodeNote(byte[] data) {
        String abi = decodeAbiString(data);
        if (abi != null && isPrintable(abi)) {
            return abi;
        }
        String text = new String(stripTrailingZeros(data), StandardCharsets.ISO_8859_1);
        return isPrintable(text) ? text : null;
    }

    /**
     * Reads {@code [offset][length][bytes]}; the offset word is skipped.
     */
    static String decodeAbiString(byte[] data) {
        if (data.length <= 2 * WORD) {
            return null;
        }
        BigInteger length = new BigInteger(1, Arrays.copyOfRange(data, WORD, 2 * WORD));
        if (length.signum() == 0 || length.compareTo(BigInteger.valueOf(data.length - 2L * WORD)) > 0) {
            return null;
        }
        int len = length.intValueExact();
        return new String(data, 2 * WORD, len, StandardCharsets.ISO_8859_1);
    }

    static boolean isPrintable(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 32 || c > 126) && c != '\n' && c != '\r' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(byte[] data) {
        for (byte b : data) {
            int v = b & 0xff;
            if (v >= 32 && v != 127) {
                return false;
            }
        }
        return true;
    }

    private static byte[] stripTrailingZeros(byte[] data) {
        int end = data.length;
        while (end > 0 && data[end - 1] == 0) {
            end--;
        }
        return end == data.length ? data : Arrays.copyOf(data, end);
    }

    private static boolean isTransferCall(byte[] data) {
        return data.length >= TRANSFER_SELECTOR.length
                && Arrays.equals(Arrays.copyOf(data, TRANSFER_SELECTOR.length), TRANSFER_SELECTOR);
    }

    private static byte[] toBytes(String hex) {
        if (hex == null || Numeric.cleanHexPrefix(hex).isEmpty()) {
            return new byte[0];
        }
        try {
            return Numeric.hexStringToByteArray(hex);
        } catch (RuntimeException e) {
            throw new MemoNotFoundException("Payload is not valid hex", e);
        }
    }
}
