package com.stablegate.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain listener config. Key = ChainType name (BSC, TRON, ETHEREUM). Unset numeric values fall back to
 * the chain defaults in {@link com.stablegate.ingestion.listener.ListenerConfig}.
 */
@ConfigurationProperties(prefix = "stablegate.ingestion.listener")
@NoArgsConstructor
@Getter
@Setter
public class ListenerProperties {

    private Map<String, ChainEntry> chains = new LinkedHashMap<>();

    public void setChains(Map<String, ChainEntry> chains) {
        this.chains = chains != null ? chains : new LinkedHashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    @ToString(exclude = "walletPrivateKey")
    public static class ChainEntry {

        private boolean enabled = true;
        private List<String> rpcUrls = new ArrayList<>();
        private String walletAddress;
        /** Reserved for future write paths; never logged. */
        private String walletPrivateKey;
        /** Key = token symbol (USDT, USDC). */
        private Map<String, TokenEntry> tokens = new LinkedHashMap<>();
        private Long pollIntervalSeconds;
        private Integer requiredConfirmations;
        private Integer maxRetries;
        private Integer maxBlocksPerIteration;
        private Long processedCacheSize;
        /** Optional age limit for processed hashes, in hours. */
        private Long processedExpiryHours;
        private Long stopTimeoutSeconds;

        public void setRpcUrls(List<String> rpcUrls) {
            this.rpcUrls = rpcUrls != null ? rpcUrls : new ArrayList<>();
        }

        public void setTokens(Map<String, TokenEntry> tokens) {
            this.tokens = tokens != null ? tokens : new LinkedHashMap<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    @ToString
    public static class TokenEntry {

        /** Contract address. TRON accepts 41-prefixed or 0x hex. */
        private String address;
        private int decimals;
    }
}
