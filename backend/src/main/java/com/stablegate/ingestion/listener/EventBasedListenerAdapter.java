package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;
import com.stablegate.domain.PaymentConfirmation;
import com.stablegate.event.BlockchainType;
import com.stablegate.event.EventBus;
import com.stablegate.event.PaymentConfirmedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Publishes every confirmation of the wrapped listener as a {@link PaymentConfirmedEvent}.
 * Wrapping seals the listener: {@link #setConfirmationHandler} is ignored from then on.
 * A publish failure is the handler failure, so the listener keeps the transaction for redelivery.
 */
@Slf4j
public class EventBasedListenerAdapter implements BlockchainListener {

    static final BlockchainType DEFAULT_BLOCKCHAIN = BlockchainType.SOLANA;

    private final BlockchainListener delegate;
    private final EventBus eventBus;

    public EventBasedListenerAdapter(BlockchainListener delegate, EventBus eventBus) {
        this.delegate = Objects.requireNonNull(delegate, "listener must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        delegate.setConfirmationHandler(this::publishConfirmation);
    }

    void publishConfirmation(PaymentConfirmation c) {
        PaymentConfirmedEvent event = PaymentConfirmedEvent.of(
                c.paymentId(), c.txHash(), c.amount(), c.tokenSymbol(), toBlockchainType(c.chainType()),
                c.sender(), c.recipient(), c.blockNumber(), c.blockTimestamp());
        eventBus.publish(event);
        log.debug("Published {} for payment {} ({})", PaymentConfirmedEvent.NAME, c.paymentId(), c.txHash());
    }

    /**
     * Maps listener chain types to the bus vocabulary. Types the bus does not know fall back to
     * {@link #DEFAULT_BLOCKCHAIN} with a warning.
     */
    public static BlockchainType toBlockchainType(ChainType chainType) {
        if (chainType == null) {
            log.warn("Null chain type, publishing as {}", DEFAULT_BLOCKCHAIN);
            return DEFAULT_BLOCKCHAIN;
        }
        switch (chainType) {
            case SOLANA:
                return BlockchainType.SOLANA;
            case BSC:
                return BlockchainType.BSC;
            case TRON:
                return BlockchainType.TRON;
            case ETHEREUM:
                return BlockchainType.ETHEREUM;
            default:
                log.warn("Chain type {} has no event bus equivalent, publishing as {}", chainType, DEFAULT_BLOCKCHAIN);
                return DEFAULT_BLOCKCHAIN;
        }
    }

    @Override
    public void setConfirmationHandler(PaymentConfirmationHandler handler) {
        log.warn("{} listener is bound to the event bus; confirmation handler replacement ignored",
                delegate.getBlockchainType());
    }

    @Override
    public void start() {
        delegate.start();
    }

    @Override
    public void stop() {
        delegate.stop();
    }

    @Override
    public boolean isRunning() {
        return delegate.isRunning();
    }

    @Override
    public ChainType getBlockchainType() {
        return delegate.getBlockchainType();
    }

    @Override
    public String getWalletAddress() {
        return delegate.getWalletAddress();
    }

    @Override
    public List<String> getSupportedTokens() {
        return delegate.getSupportedTokens();
    }

    @Override
    public ListenerHealth getListenerHealth() {
        return delegate.getListenerHealth();
    }

    BlockchainListener getDelegate() {
        return delegate;
    }
}
