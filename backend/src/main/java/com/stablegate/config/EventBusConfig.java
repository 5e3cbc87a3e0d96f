package com.stablegate.config;

import com.stablegate.event.EventBus;
import com.stablegate.event.InMemoryEventBus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class EventBusConfig {

    @Bean
    public EventBus eventBus(@Qualifier(AsyncConfig.EVENT_BUS_EXECUTOR) ThreadPoolTaskExecutor executor) {
        return new InMemoryEventBus(executor);
    }
}
