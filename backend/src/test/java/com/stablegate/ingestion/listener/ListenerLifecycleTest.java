package com.stablegate.ingestion.listener;

import com.stablegate.config.EventBusProperties;
import com.stablegate.domain.ChainType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListenerLifecycleTest {

    @Mock
    private ListenerManager listenerManager;

    @Test
    void onApplicationReady_startFailureIsReportedNotThrown() {
        ListenerLifecycle lifecycle = new ListenerLifecycle(listenerManager, new EventBusProperties());
        when(listenerManager.getListenerCount()).thenReturn(2);
        doThrow(new ListenerOperationException("startAll", Map.of(ChainType.TRON, new IllegalStateException("down"))))
                .when(listenerManager).startAll();

        assertThatCode(lifecycle::onApplicationReady).doesNotThrowAnyException();
        verify(listenerManager).startAll();
    }

    @Test
    void onApplicationReady_noListeners_startsNothing() {
        ListenerLifecycle lifecycle = new ListenerLifecycle(listenerManager, new EventBusProperties());
        when(listenerManager.getListenerCount()).thenReturn(0);

        lifecycle.onApplicationReady();

        verify(listenerManager, never()).startAll();
    }

    @Test
    void onContextClosed_shutsDownWithConfiguredTimeout() {
        EventBusProperties properties = new EventBusProperties();
        properties.setShutdownTimeoutSeconds(7);
        ListenerLifecycle lifecycle = new ListenerLifecycle(listenerManager, properties);
        when(listenerManager.shutdown(Duration.ofSeconds(7))).thenReturn(false);

        lifecycle.onContextClosed();

        verify(listenerManager).shutdown(Duration.ofSeconds(7));
    }
}
