package com.stablegate.ingestion.listener;

import com.stablegate.domain.ChainType;
import com.stablegate.domain.ListenerHealth;
import com.stablegate.event.EventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of one listener per chain. Every registered listener is wrapped in an
 * {@link EventBasedListenerAdapter} bound to the manager's bus.
 * <p>
 * {@link #startAll()} and {@link #stopAll()} are best-effort: every listener is attempted and failures are
 * reported together in one {@link ListenerOperationException}, so one chain's outage does not block the others.
 */
@Slf4j
public class ListenerManager {

    private final EventBus eventBus;
    private final Map<ChainType, BlockchainListener> listeners = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ListenerManager(EventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
    }

    /**
     * @return the registered (wrapped) listener
     * @throws IllegalArgumentException if a listener for the same chain is already registered
     */
    public BlockchainListener addListener(BlockchainListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        ChainType chainType = Objects.requireNonNull(listener.getBlockchainType(), "listener chain type must not be null");
        lock.writeLock().lock();
        try {
            if (listeners.containsKey(chainType)) {
                throw new IllegalArgumentException("Listener for " + chainType + " already registered");
            }
            BlockchainListener wrapped = listener instanceof EventBasedListenerAdapter
                    ? listener
                    : new EventBasedListenerAdapter(listener, eventBus);
            listeners.put(chainType, wrapped);
            log.info("Registered {} listener for wallet {}", chainType, listener.getWalletAddress());
            return wrapped;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stops the listener if it is running, then unregisters it. The listener is removed even if stopping failed.
     */
    public void removeListener(ChainType chainType) {
        BlockchainListener listener;
        lock.writeLock().lock();
        try {
            listener = listeners.remove(chainType);
        } finally {
            lock.writeLock().unlock();
        }
        if (listener == null) {
            throw new ListenerStateException("No listener registered for " + chainType);
        }
        if (listener.isRunning()) {
            listener.stop();
        }
        log.info("Removed {} listener", chainType);
    }

    public BlockchainListener getListener(ChainType chainType) {
        lock.readLock().lock();
        try {
            BlockchainListener listener = listeners.get(chainType);
            if (listener == null) {
                throw new ListenerStateException("No listener registered for " + chainType);
            }
            return listener;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<BlockchainListener> getAllListeners() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(listeners.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getListenerCount() {
        lock.readLock().lock();
        try {
            return listeners.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Starts every listener that is not running yet.
     *
     * @throws ListenerOperationException if any listener failed to start; the others are running
     */
    public void startAll() {
        Map<ChainType, RuntimeException> failures = new EnumMap<>(ChainType.class);
        int started = 0;
        for (BlockchainListener listener : getAllListeners()) {
            if (listener.isRunning()) {
                continue;
            }
            try {
                listener.start();
                started++;
            } catch (RuntimeException e) {
                log.error("Failed to start {} listener: {}", listener.getBlockchainType(), e.getMessage(), e);
                failures.put(listener.getBlockchainType(), e);
            }
        }
        log.info("Started {} listener(s), {} failed", started, failures.size());
        if (!failures.isEmpty()) {
            throw new ListenerOperationException("startAll", failures);
        }
    }

    /**
     * Stops every running listener.
     *
     * @throws ListenerOperationException if any listener failed to stop cleanly; all are marked stopped
     */
    public void stopAll() {
        Map<ChainType, RuntimeException> failures = new EnumMap<>(ChainType.class);
        for (BlockchainListener listener : getAllListeners()) {
            if (!listener.isRunning()) {
                continue;
            }
            try {
                listener.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop {} listener: {}", listener.getBlockchainType(), e.getMessage());
                failures.put(listener.getBlockchainType(), e);
            }
        }
        if (!failures.isEmpty()) {
            throw new ListenerOperationException("stopAll", failures);
        }
    }

    public Map<ChainType, ListenerHealth> getHealthStatus() {
        Map<ChainType, ListenerHealth> status = new EnumMap<>(ChainType.class);
        for (BlockchainListener listener : getAllListeners()) {
            status.put(listener.getBlockchainType(), listener.getListenerHealth());
        }
        return status;
    }

    public boolean isAllHealthy() {
        return getAllListeners().stream().allMatch(l -> l.getListenerHealth().healthy());
    }

    /**
     * Stops all listeners, then drains the event bus with whatever remains of {@code timeout}.
     *
     * @return true if the bus drained in time
     */
    public boolean shutdown(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        log.info("Shutting down {} listener(s)", getListenerCount());
        try {
            stopAll();
        } catch (ListenerOperationException e) {
            log.warn("Listeners not stopped cleanly: {}", e.getFailures().keySet());
        }
        Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
        return eventBus.shutdown(remaining);
    }
}
