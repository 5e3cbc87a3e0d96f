package com.stablegate.ingestion.decoder;

/**
 * No printable payment reference could be recovered from a transaction payload.
 */
public class MemoNotFoundException extends RuntimeException {

    public MemoNotFoundException(String message) {
        super(message);
    }

    public MemoNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
