package com.stablegate.ingestion.listener;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Locale;

/**
 * Hashes already delivered to the confirmation handler. Bounded by size (and optionally age);
 * in-memory only, so the guarantee does not survive a restart.
 */
public class ProcessedTransactionSet {

    private final Cache<String, Boolean> hashes;

    public ProcessedTransactionSet(long maximumSize, Duration expireAfterWrite) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().maximumSize(maximumSize);
        if (expireAfterWrite != null) {
            builder.expireAfterWrite(expireAfterWrite);
        }
        this.hashes = builder.build();
    }

    public boolean contains(String txHash) {
        return hashes.getIfPresent(key(txHash)) != null;
    }

    public void mark(String txHash) {
        hashes.put(key(txHash), Boolean.TRUE);
    }

    public long size() {
        hashes.cleanUp();
        return hashes.estimatedSize();
    }

    private static String key(String txHash) {
        return txHash.toLowerCase(Locale.ROOT);
    }
}
