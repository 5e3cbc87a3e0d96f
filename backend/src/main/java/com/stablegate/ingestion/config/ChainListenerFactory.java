package com.stablegate.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablegate.common.RetryPolicy;
import com.stablegate.domain.ChainType;
import com.stablegate.domain.TokenDescriptor;
import com.stablegate.ingestion.adapter.ChainClient;
import com.stablegate.ingestion.adapter.RpcEndpointRotator;
import com.stablegate.ingestion.adapter.evm.EvmChainClient;
import com.stablegate.ingestion.adapter.evm.EvmRpcClient;
import com.stablegate.ingestion.adapter.tron.TronAddress;
import com.stablegate.ingestion.adapter.tron.TronChainClient;
import com.stablegate.ingestion.adapter.tron.TronHttpClient;
import com.stablegate.ingestion.listener.ListenerConfig;
import com.stablegate.ingestion.listener.ListenerObserver;
import com.stablegate.ingestion.listener.PaymentConfirmationHandler;
import com.stablegate.ingestion.listener.TransactionListener;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a chain client and a {@link TransactionListener} from one {@code stablegate.ingestion.listener.chains}
 * entry. The listener starts with {@link PaymentConfirmationHandler#UNBOUND}; registering it with the
 * listener manager binds it to the event bus.
 */
@RequiredArgsConstructor
public class ChainListenerFactory {

    private final EvmRpcClient evmRpcClient;
    private final TronHttpClient tronHttpClient;
    private final ObjectMapper objectMapper;
    private final IngestionRetryProperties retryProperties;
    private final IngestionRpcProperties rpcProperties;
    private final ListenerObserver observer;

    public TransactionListener create(ChainType chainType, ListenerProperties.ChainEntry entry) {
        ChainClient client = createClient(chainType, entry);
        ListenerConfig.Builder builder = ListenerConfig.builder(chainType)
                .client(client)
                .walletAddress(normalizeAddress(chainType, entry.getWalletAddress()))
                .walletPrivateKey(entry.getWalletPrivateKey());
        for (Map.Entry<String, ListenerProperties.TokenEntry> token : entry.getTokens().entrySet()) {
            builder.token(new TokenDescriptor(
                    normalizeAddress(chainType, token.getValue().getAddress()),
                    token.getKey().toUpperCase(Locale.ROOT),
                    token.getValue().getDecimals()));
        }
        if (entry.getPollIntervalSeconds() != null) {
            builder.pollInterval(Duration.ofSeconds(entry.getPollIntervalSeconds()));
        }
        if (entry.getRequiredConfirmations() != null) {
            builder.requiredConfirmations(entry.getRequiredConfirmations());
        }
        if (entry.getMaxRetries() != null) {
            builder.maxRetries(entry.getMaxRetries());
        }
        if (entry.getMaxBlocksPerIteration() != null) {
            builder.maxBlocksPerIteration(entry.getMaxBlocksPerIteration());
        }
        if (entry.getProcessedCacheSize() != null) {
            builder.processedCacheSize(entry.getProcessedCacheSize());
        }
        if (entry.getProcessedExpiryHours() != null) {
            builder.processedExpiry(Duration.ofHours(entry.getProcessedExpiryHours()));
        }
        if (entry.getStopTimeoutSeconds() != null) {
            builder.stopTimeout(Duration.ofSeconds(entry.getStopTimeoutSeconds()));
        }
        return new TransactionListener(builder.build(), PaymentConfirmationHandler.UNBOUND, observer);
    }

    ChainClient createClient(ChainType chainType, ListenerProperties.ChainEntry entry) {
        RpcEndpointRotator rotator = new RpcEndpointRotator(entry.getRpcUrls(), retryPolicy());
        RateLimiter rateLimiter = rateLimiter(chainType);
        switch (chainType) {
            case BSC:
            case ETHEREUM:
            case POLYGON:
                return new EvmChainClient(chainType, evmRpcClient, rotator, rateLimiter, objectMapper);
            case TRON:
                return new TronChainClient(tronHttpClient, rotator, rateLimiter, objectMapper);
            default:
                throw new IllegalArgumentException("No chain client available for " + chainType);
        }
    }

    static String normalizeAddress(ChainType chainType, String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException(chainType + ": address must not be blank");
        }
        return chainType == ChainType.TRON ? TronAddress.toHex(address) : address.strip().toLowerCase(Locale.ROOT);
    }

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    private RateLimiter rateLimiter(ChainType chainType) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpcProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("rpc-" + chainType.name().toLowerCase(Locale.ROOT), config);
    }
}
