package com.stablegate.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablegate.domain.ChainType;
import com.stablegate.event.EventBus;
import com.stablegate.ingestion.adapter.evm.EvmRpcClient;
import com.stablegate.ingestion.adapter.evm.WebClientEvmRpcClient;
import com.stablegate.ingestion.adapter.tron.TronHttpClient;
import com.stablegate.ingestion.adapter.tron.WebClientTronHttpClient;
import com.stablegate.ingestion.listener.EventPublishingListenerObserver;
import com.stablegate.ingestion.listener.ListenerManager;
import com.stablegate.ingestion.listener.ListenerObserver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Wires chain clients and listeners from {@code stablegate.ingestion.*} and registers them with the manager.
 */
@Configuration
@EnableConfigurationProperties({ ListenerProperties.class, IngestionRetryProperties.class, IngestionRpcProperties.class })
@Slf4j
public class IngestionListenerConfig {

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(rpcProperties.getRequestTimeoutMs()));
    }

    @Bean
    public TronHttpClient tronHttpClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientTronHttpClient(webClientBuilder, Duration.ofMillis(rpcProperties.getRequestTimeoutMs()));
    }

    @Bean
    public ListenerObserver listenerObserver(EventBus eventBus) {
        return new EventPublishingListenerObserver(eventBus);
    }

    @Bean
    public ChainListenerFactory chainListenerFactory(EvmRpcClient evmRpcClient, TronHttpClient tronHttpClient,
                                                     ObjectMapper objectMapper,
                                                     IngestionRetryProperties retryProperties,
                                                     IngestionRpcProperties rpcProperties,
                                                     ListenerObserver listenerObserver) {
        return new ChainListenerFactory(evmRpcClient, tronHttpClient, objectMapper, retryProperties, rpcProperties,
                listenerObserver);
    }

    @Bean
    public ListenerManager listenerManager(EventBus eventBus, ListenerProperties properties,
                                           ChainListenerFactory factory) {
        ListenerManager manager = new ListenerManager(eventBus);
        for (Map.Entry<String, ListenerProperties.ChainEntry> e : properties.getChains().entrySet()) {
            ChainType chainType = ChainType.valueOf(e.getKey().toUpperCase(Locale.ROOT));
            if (!e.getValue().isEnabled()) {
                log.info("{} listener disabled by configuration", chainType);
                continue;
            }
            manager.addListener(factory.create(chainType, e.getValue()));
        }
        return manager;
    }
}
