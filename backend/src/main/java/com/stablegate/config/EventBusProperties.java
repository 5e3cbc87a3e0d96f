package com.stablegate.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Event bus worker pool and shutdown drain deadline.
 */
@ConfigurationProperties(prefix = "stablegate.event-bus")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class EventBusProperties {

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 16;

    /** Max time to wait for in-flight handlers on shutdown. */
    @Min(1)
    private long shutdownTimeoutSeconds = 15;
}
