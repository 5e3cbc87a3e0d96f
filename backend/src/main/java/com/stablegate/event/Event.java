package com.stablegate.event;

import java.time.Instant;

/**
 * Immutable envelope carried by the {@link EventBus}. Subscribers are keyed by {@link #name()}.
 */
public interface Event {

    /**
     * Routing name, e.g. "payment.confirmed".
     */
    String name();

    Instant occurredAt();
}
