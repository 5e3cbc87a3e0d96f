package com.stablegate.event;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Re-publishes blockchain events from the bus as Spring application events so other components
 * can consume them with {@code @EventListener}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventRelay {

    static final String[] RELAYED_EVENTS = {
            PaymentConfirmedEvent.NAME,
            TransactionDetectedEvent.NAME,
            BlockchainHealthEvent.NAME
    };

    private final EventBus eventBus;
    private final ApplicationEventPublisher applicationEventPublisher;

    @PostConstruct
    public void register() {
        for (String name : RELAYED_EVENTS) {
            eventBus.subscribe(name, this::relay);
        }
    }

    void relay(Event event) {
        log.debug("Relaying {} to application context", event.name());
        applicationEventPublisher.publishEvent(event);
    }
}
