package com.stablegate.event;

public class EventBusClosedException extends EventBusException {

    public EventBusClosedException(String eventName) {
        super("Event bus is stopped; cannot publish " + eventName);
    }
}
