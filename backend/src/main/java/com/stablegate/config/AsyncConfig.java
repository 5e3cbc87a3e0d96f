package com.stablegate.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pool for event bus handler tasks. Listener polling threads are owned by each listener.
 */
@Configuration
@EnableConfigurationProperties(EventBusProperties.class)
public class AsyncConfig {

    public static final String EVENT_BUS_EXECUTOR = "event-bus-executor";

    @Bean(name = EVENT_BUS_EXECUTOR)
    public ThreadPoolTaskExecutor eventBusExecutor(EventBusProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, properties.getCorePoolSize()));
        e.setMaxPoolSize(Math.max(properties.getCorePoolSize(), properties.getMaxPoolSize()));
        e.setThreadNamePrefix("event-bus-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds((int) Math.max(1, properties.getShutdownTimeoutSeconds()));
        e.initialize();
        return e;
    }
}
