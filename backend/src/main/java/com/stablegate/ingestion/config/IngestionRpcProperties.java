package com.stablegate.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chain RPC throttling. The request budget applies per chain client.
 */
@ConfigurationProperties(prefix = "stablegate.ingestion.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    @Min(1)
    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a limiter permit before failing. */
    @Min(0)
    private long localLimiterTimeoutMs = 2_000;

    /** Per-request HTTP timeout. */
    @Min(1)
    private long requestTimeoutMs = 10_000;
}
