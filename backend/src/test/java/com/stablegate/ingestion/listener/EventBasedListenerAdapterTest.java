package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;
import com.stablegate.domain.PaymentConfirmation;
import com.stablegate.event.BlockchainType;
import com.stablegate.event.EventBus;
import com.stablegate.event.EventBusClosedException;
import com.stablegate.event.PaymentConfirmedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventBasedListenerAdapterTest {

    @Mock
    private BlockchainListener delegate;
    @Mock
    private EventBus eventBus;

    private EventBasedListenerAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new EventBasedListenerAdapter(delegate, eventBus);
    }

    @Test
    void constructor_bindsDelegateToPublisher() {
        verify(delegate).setConfirmationHandler(any());
    }

    @Test
    void publishConfirmation_mapsEveryField() {
        adapter.publishConfirmation(confirmation(ChainType.TRON));

        ArgumentCaptor<PaymentConfirmedEvent> captor = ArgumentCaptor.forClass(PaymentConfirmedEvent.class);
        verify(eventBus).publish(captor.capture());
        PaymentConfirmedEvent event = captor.getValue();
        assertThat(event.name()).isEqualTo(PaymentConfirmedEvent.NAME);
        assertThat(event.paymentId()).isEqualTo("pay-1");
        assertThat(event.txHash()).isEqualTo("0xabc");
        assertThat(event.amount()).isEqualByComparingTo("1.00");
        assertThat(event.tokenSymbol()).isEqualTo("USDT");
        assertThat(event.blockchain()).isEqualTo(BlockchainType.TRON);
        assertThat(event.sender()).isEqualTo("0xfrom");
        assertThat(event.recipient()).isEqualTo("0xto");
        assertThat(event.blockNumber()).isEqualTo(42L);
        assertThat(event.blockTimestamp()).isEqualTo(1_700_000_000L);
        assertThat(event.occurredAt()).isNotNull();
    }

    @Test
    void publishConfirmation_busClosed_propagatesSoListenerRetries() {
        doThrow(new EventBusClosedException(PaymentConfirmedEvent.NAME)).when(eventBus).publish(any());

        assertThatThrownBy(() -> adapter.publishConfirmation(confirmation(ChainType.BSC)))
                .isInstanceOf(EventBusClosedException.class);
    }

    @Test
    void boundHandler_publishesThroughBus() throws Exception {
        ArgumentCaptor<PaymentConfirmationHandler> handler = ArgumentCaptor.forClass(PaymentConfirmationHandler.class);
        verify(delegate).setConfirmationHandler(handler.capture());

        handler.getValue().handle(confirmation(ChainType.ETHEREUM));

        verify(eventBus).publish(any(PaymentConfirmedEvent.class));
    }

    @Test
    void setConfirmationHandler_isIgnoredOnceWrapped() {
        adapter.setConfirmationHandler(c -> { });

        verify(delegate, times(1)).setConfirmationHandler(any());
    }

    @ParameterizedTest
    @CsvSource({
            "SOLANA, SOLANA",
            "BSC, BSC",
            "TRON, TRON",
            "ETHEREUM, ETHEREUM",
            "POLYGON, SOLANA"
    })
    void toBlockchainType_mapsKnownTypesAndFallsBack(ChainType chainType, BlockchainType expected) {
        assertThat(EventBasedListenerAdapter.toBlockchainType(chainType)).isEqualTo(expected);
    }

    @Test
    void toBlockchainType_null_fallsBackToDefault() {
        assertThat(EventBasedListenerAdapter.toBlockchainType(null))
                .isEqualTo(EventBasedListenerAdapter.DEFAULT_BLOCKCHAIN);
    }

    @Test
    void lifecycleAndQueries_delegate() {
        ListenerHealth health = ListenerHealth.initial();
        when(delegate.isRunning()).thenReturn(true);
        when(delegate.getBlockchainType()).thenReturn(ChainType.BSC);
        when(delegate.getWalletAddress()).thenReturn("0xwallet");
        when(delegate.getSupportedTokens()).thenReturn(List.of("USDT"));
        when(delegate.getListenerHealth()).thenReturn(health);

        adapter.start();
        adapter.stop();

        verify(delegate).start();
        verify(delegate).stop();
        assertThat(adapter.isRunning()).isTrue();
        assertThat(adapter.getBlockchainType()).isEqualTo(ChainType.BSC);
        assertThat(adapter.getWalletAddress()).isEqualTo("0xwallet");
        assertThat(adapter.getSupportedTokens()).containsExactly("USDT");
        assertThat(adapter.getListenerHealth()).isSameAs(health);
        assertThat(adapter.getDelegate()).isSameAs(delegate);
    }

    @Test
    void constructor_requiresDelegateAndBus() {
        assertThatThrownBy(() -> new EventBasedListenerAdapter(null, eventBus))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new EventBasedListenerAdapter(mock(BlockchainListener.class), null))
                .isInstanceOf(NullPointerException.class);
    }

    private static PaymentConfirmation confirmation(ChainType chainType) {
        return new PaymentConfirmation("pay-1", "0xabc", new BigDecimal("1.00"), "USDT", chainType,
                "0xfrom", "0xto", 42L, 1_700_000_000L);
    }
}
