package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;
import com.stablegate.event.BlockchainHealthEvent;
import com.stablegate.event.Event;
import com.stablegate.event.EventBus;
import com.stablegate.event.EventBusException;
import com.stablegate.event.TransactionDetectedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes listener sightings and health transitions on the event bus.
 */
@Slf4j
@RequiredArgsConstructor
public class EventPublishingListenerObserver implements ListenerObserver {

    private final EventBus eventBus;

    @Override
    public void onTransactionDetected(ChainType chainType, String txHash, long confirmations, long requiredConfirmations) {
        publish(TransactionDetectedEvent.of(txHash, EventBasedListenerAdapter.toBlockchainType(chainType),
                confirmations, requiredConfirmations));
    }

    @Override
    public void onHealthChanged(ChainType chainType, ListenerHealth health, String errorMessage) {
        publish(BlockchainHealthEvent.of(EventBasedListenerAdapter.toBlockchainType(chainType), health.healthy(),
                health.lastProcessedBlock(), errorMessage, health.connectionStatus()));
    }

    private void publish(Event event) {
        try {
            eventBus.publish(event);
        } catch (EventBusException e) {
            log.warn("Could not publish {}: {}", event.name(), e.getMessage());
        }
    }
}
