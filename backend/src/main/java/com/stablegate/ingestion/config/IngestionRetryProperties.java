package com.stablegate.ingestion.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for chain RPC calls within one poll tick (exponential backoff ± jitter).
 */
@ConfigurationProperties(prefix = "stablegate.ingestion.retry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    @Min(0)
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.2;

    /** Attempts per call, including the first. */
    @Min(1)
    private int maxAttempts = 3;
}
