package com.stablegate.event;

/**
 * Thrown synchronously to a publisher when an event could not be dispatched.
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
