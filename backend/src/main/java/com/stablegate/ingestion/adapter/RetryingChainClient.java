package com.stablegate.ingestion.adapter;

import com.stablegate.domain.ChainType;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.function.Function;

/**
 * Base for chain clients: every call takes a rate-limiter permit, runs against the next endpoint and is
 * retried with backoff on failure. The last failure is rethrown as {@link RpcException}.
 */
@Slf4j
public abstract class RetryingChainClient implements ChainClient {

    private final ChainType chainType;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;

    protected RetryingChainClient(ChainType chainType, RpcEndpointRotator rotator, RateLimiter rateLimiter) {
        this.chainType = Objects.requireNonNull(chainType, "chainType must not be null");
        this.rotator = Objects.requireNonNull(rotator, "rotator must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
    }

    @Override
    public ChainType chainType() {
        return chainType;
    }

    /**
     * Runs {@code call} with an endpoint URL until it succeeds or attempts run out.
     */
    protected <T> T withRetry(String method, Function<String, T> call) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.next();
            try {
                acquirePermit(method, endpoint);
                return call.apply(endpoint);
            } catch (RuntimeException e) {
                last = e;
                log.warn("{} {} failed on {} (attempt {}/{}): {}",
                        chainType, method, endpoint, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        String msg = chainType + " " + method + " failed after " + rotator.getMaxAttempts() + " attempts";
        if (last != null && last.getMessage() != null && !last.getMessage().isBlank()) {
            msg += ": " + last.getMessage();
        }
        throw new RpcException(msg, last);
    }

    private void acquirePermit(String method, String endpoint) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }
}
