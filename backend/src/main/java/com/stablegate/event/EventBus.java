package com.stablegate.event;

import java.time.Duration;

/**
 * In-process publish/subscribe. Publishing is fire-and-forget: handlers run concurrently and their
 * failures are not reported back to the publisher.
 */
public interface EventBus {

    /**
     * Dispatch the event to every handler subscribed to its name and return without waiting for them.
     *
     * @throws EventBusClosedException if the bus has been shut down
     * @throws EventBusException       if a handler task could not be dispatched
     */
    void publish(Event event);

    void subscribe(String eventName, EventHandler handler);

    int handlerCount(String eventName);

    /**
     * Reject further publishes and wait for in-flight handlers, at most {@code timeout}.
     *
     * @return true if every in-flight handler finished before the deadline
     */
    boolean shutdown(Duration timeout);
}
