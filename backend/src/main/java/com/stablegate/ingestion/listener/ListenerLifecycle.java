package com.stablegate.ingestion.listener;

import com.stablegate.config.EventBusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts all listeners once the application is ready and shuts them down with the context. A chain that fails to
 * start is logged and left stopped; the others keep running.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListenerLifecycle {

    private final ListenerManager listenerManager;
    private final EventBusProperties eventBusProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (listenerManager.getListenerCount() == 0) {
            log.warn("No chain listeners configured");
            return;
        }
        try {
            listenerManager.startAll();
        } catch (ListenerOperationException e) {
            log.error("Some listeners failed to start: {}", e.getFailures().keySet());
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        Duration timeout = Duration.ofSeconds(eventBusProperties.getShutdownTimeoutSeconds());
        if (!listenerManager.shutdown(timeout)) {
            log.warn("Event bus did not drain within {}", timeout);
        }
    }
}
