package com.stablegate.event;

/**
 * Subscriber callback. Runs on the bus executor; a thrown exception is logged by the bus and never
 * reaches the publisher.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;
}
