package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.TokenDescriptor;
import com.stablegate.ingestion.adapter.ChainClient;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Construction-time settings of one {@link TransactionListener}. Unset values fall back to chain defaults:
 * faster-finality chains poll more often with a lower confirmation depth.
 */
@Getter
public final class ListenerConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_MAX_BLOCKS_PER_ITERATION = 100;
    public static final long DEFAULT_PROCESSED_CACHE_SIZE = 100_000L;
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    private final ChainType chainType;
    private final ChainClient client;
    private final String walletAddress;
    /** Symbol to token. */
    private final Map<String, TokenDescriptor> tokens;
    private final Duration pollInterval;
    private final int requiredConfirmations;
    private final int maxRetries;
    private final int maxBlocksPerIteration;
    private final long processedCacheSize;
    /** Null means processed hashes are evicted by size only. */
    private final Duration processedExpiry;
    private final Duration stopTimeout;
    @Getter(AccessLevel.NONE)
    private final String walletPrivateKey;

    private ListenerConfig(Builder b) {
        this.chainType = Objects.requireNonNull(b.chainType, "chainType must not be null");
        this.client = Objects.requireNonNull(b.client, "chain client must not be null");
        if (b.walletAddress == null || b.walletAddress.isBlank()) {
            throw new IllegalArgumentException("wallet address must not be blank");
        }
        if (b.client.chainType() != b.chainType) {
            throw new IllegalArgumentException("chain client is for " + b.client.chainType() + ", not " + b.chainType);
        }
        if (b.tokens.isEmpty()) {
            throw new IllegalArgumentException("at least one token required for " + b.chainType);
        }
        this.walletAddress = b.walletAddress.strip().toLowerCase(Locale.ROOT);
        this.tokens = Collections.unmodifiableMap(new LinkedHashMap<>(b.tokens));
        this.pollInterval = b.pollInterval != null ? b.pollInterval : defaultPollInterval(b.chainType);
        this.requiredConfirmations = b.requiredConfirmations != null
                ? b.requiredConfirmations : defaultRequiredConfirmations(b.chainType);
        this.maxRetries = b.maxRetries != null ? b.maxRetries : DEFAULT_MAX_RETRIES;
        this.maxBlocksPerIteration = b.maxBlocksPerIteration != null
                ? b.maxBlocksPerIteration : DEFAULT_MAX_BLOCKS_PER_ITERATION;
        this.processedCacheSize = b.processedCacheSize != null ? b.processedCacheSize : DEFAULT_PROCESSED_CACHE_SIZE;
        this.processedExpiry = b.processedExpiry;
        this.stopTimeout = b.stopTimeout != null ? b.stopTimeout : DEFAULT_STOP_TIMEOUT;
        this.walletPrivateKey = b.walletPrivateKey;

        requirePositive(pollInterval.toMillis(), "pollInterval");
        requirePositive(requiredConfirmations, "requiredConfirmations");
        requirePositive(maxRetries, "maxRetries");
        requirePositive(maxBlocksPerIteration, "maxBlocksPerIteration");
        requirePositive(processedCacheSize, "processedCacheSize");
        requirePositive(stopTimeout.toMillis(), "stopTimeout");
    }

    public static Builder builder(ChainType chainType) {
        return new Builder(chainType);
    }

    public static Duration defaultPollInterval(ChainType chainType) {
        return switch (chainType) {
            case TRON -> Duration.ofSeconds(3);
            case SOLANA -> Duration.ofSeconds(5);
            case BSC -> Duration.ofSeconds(10);
            case ETHEREUM -> Duration.ofSeconds(15);
            default -> Duration.ofSeconds(10);
        };
    }

    public static int defaultRequiredConfirmations(ChainType chainType) {
        return switch (chainType) {
            case TRON -> 19;
            case SOLANA -> 32;
            case BSC -> 15;
            case ETHEREUM -> 12;
            default -> 12;
        };
    }

    /**
     * Reserved for future write paths. Never logged.
     */
    public boolean hasWalletPrivateKey() {
        return walletPrivateKey != null && !walletPrivateKey.isBlank();
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    @Override
    public String toString() {
        return "ListenerConfig{chain=" + chainType + ", wallet=" + walletAddress + ", tokens=" + tokens.keySet()
                + ", pollInterval=" + pollInterval + ", requiredConfirmations=" + requiredConfirmations + "}";
    }

    public static final class Builder {

        private final ChainType chainType;
        private final Map<String, TokenDescriptor> tokens = new LinkedHashMap<>();
        private ChainClient client;
        private String walletAddress;
        private String walletPrivateKey;
        private Duration pollInterval;
        private Integer requiredConfirmations;
        private Integer maxRetries;
        private Integer maxBlocksPerIteration;
        private Long processedCacheSize;
        private Duration processedExpiry;
        private Duration stopTimeout;

        private Builder(ChainType chainType) {
            this.chainType = chainType;
        }

        public Builder client(ChainClient client) {
            this.client = client;
            return this;
        }

        public Builder walletAddress(String walletAddress) {
            this.walletAddress = walletAddress;
            return this;
        }

        public Builder walletPrivateKey(String walletPrivateKey) {
            this.walletPrivateKey = walletPrivateKey;
            return this;
        }

        public Builder token(TokenDescriptor token) {
            Objects.requireNonNull(token, "token must not be null");
            if (tokens.putIfAbsent(token.symbol(), token) != null) {
                throw new IllegalArgumentException("duplicate token symbol " + token.symbol());
            }
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder requiredConfirmations(int requiredConfirmations) {
            this.requiredConfirmations = requiredConfirmations;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxBlocksPerIteration(int maxBlocksPerIteration) {
            this.maxBlocksPerIteration = maxBlocksPerIteration;
            return this;
        }

        public Builder processedCacheSize(long processedCacheSize) {
            this.processedCacheSize = processedCacheSize;
            return this;
        }

        public Builder processedExpiry(Duration processedExpiry) {
            this.processedExpiry = processedExpiry;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public ListenerConfig build() {
            return new ListenerConfig(this);
        }
    }
}
