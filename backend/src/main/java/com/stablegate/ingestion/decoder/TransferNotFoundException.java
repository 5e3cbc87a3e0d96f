package com.stablegate.ingestion.decoder;

/**
 * The receipt holds no Transfer of the watched token to the watched recipient. Not retryable.
 */
public class TransferNotFoundException extends RuntimeException {

    public TransferNotFoundException(String message) {
        super(message);
    }
}
