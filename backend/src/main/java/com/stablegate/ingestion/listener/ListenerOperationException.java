package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated failure of a best-effort operation over several listeners. Every per-chain cause is kept in
 * {@link #getFailures()} and also attached as a suppressed exception.
 */
public class ListenerOperationException extends RuntimeException {

    private final Map<ChainType, RuntimeException> failures;

    public ListenerOperationException(String operation, Map<ChainType, RuntimeException> failures) {
        super(operation + " failed for " + failures.keySet());
        Map<ChainType, RuntimeException> copy = new EnumMap<>(ChainType.class);
        copy.putAll(failures);
        this.failures = Collections.unmodifiableMap(copy);
        failures.values().forEach(this::addSuppressed);
    }

    public Map<ChainType, RuntimeException> getFailures() {
        return failures;
    }
}
