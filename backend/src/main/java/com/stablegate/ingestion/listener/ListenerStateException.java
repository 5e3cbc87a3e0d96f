package com.stablegate.ingestion.listener;

/**
 * Lifecycle call not valid in the listener's current state (start while running, stop while stopped),
 * or a listener lookup that found nothing.
 */
public class ListenerStateException extends RuntimeException {

    public ListenerStateException(String message) {
        super(message);
    }

    public ListenerStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
