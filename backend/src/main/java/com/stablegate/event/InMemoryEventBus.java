package com.stablegate.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link EventBus} that runs every subscribed handler as its own task on the given executor.
 * In-flight tasks are counted so {@link #shutdown(Duration)} can drain them against a deadline.
 */
@Slf4j
public class InMemoryEventBus implements EventBus {

    private final Executor executor;
    private final Map<String, List<EventHandler>> handlers = new HashMap<>();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final Lock drainLock = new ReentrantLock();
    private final Condition drained = drainLock.newCondition();
    private int inFlight;
    private boolean stopped;

    public InMemoryEventBus(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public void publish(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        stateLock.readLock().lock();
        try {
            if (stopped) {
                throw new EventBusClosedException(event.name());
            }
            List<EventHandler> subscribers = handlers.getOrDefault(event.name(), List.of());
            if (subscribers.isEmpty()) {
                log.debug("No handlers registered for event {}", event.name());
                return;
            }
            log.debug("Publishing event {} to {} handler(s)", event.name(), subscribers.size());
            for (int i = 0; i < subscribers.size(); i++) {
                dispatch(event, subscribers.get(i), i);
            }
        } finally {
            stateLock.readLock().unlock();
        }
    }

    private void dispatch(Event event, EventHandler handler, int index) {
        taskStarted();
        try {
            executor.execute(() -> runHandler(event, handler, index));
        } catch (RejectedExecutionException e) {
            taskFinished();
            throw new EventBusException("Failed to dispatch " + event.name() + " to handler " + index, e);
        }
    }

    private void runHandler(Event event, EventHandler handler, int index) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            log.error("Event handler {} failed for {}: {}", index, event.name(), e.getMessage(), e);
        } finally {
            taskFinished();
        }
    }

    @Override
    public void subscribe(String eventName, EventHandler handler) {
        Objects.requireNonNull(eventName, "eventName must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        stateLock.writeLock().lock();
        try {
            if (stopped) {
                log.warn("Cannot subscribe to {} on a stopped event bus", eventName);
                return;
            }
            List<EventHandler> current = handlers.getOrDefault(eventName, List.of());
            List<EventHandler> updated = new ArrayList<>(current.size() + 1);
            updated.addAll(current);
            updated.add(handler);
            handlers.put(eventName, List.copyOf(updated));
            log.info("Subscribed handler to {} ({} total)", eventName, updated.size());
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    @Override
    public int handlerCount(String eventName) {
        stateLock.readLock().lock();
        try {
            return handlers.getOrDefault(eventName, List.of()).size();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    @Override
    public boolean shutdown(Duration timeout) {
        stateLock.writeLock().lock();
        try {
            stopped = true;
        } finally {
            stateLock.writeLock().unlock();
        }
        log.info("Shutting down event bus, waiting up to {} for in-flight handlers", timeout);

        long remainingNanos = timeout.toNanos();
        drainLock.lock();
        try {
            while (inFlight > 0) {
                if (remainingNanos <= 0) {
                    log.warn("Event bus shutdown timed out with {} handler(s) still running", inFlight);
                    return false;
                }
                remainingNanos = drained.awaitNanos(remainingNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining event bus");
            return false;
        } finally {
            drainLock.unlock();
        }
        log.info("Event bus shutdown complete");
        return true;
    }

    boolean isStopped() {
        stateLock.readLock().lock();
        try {
            return stopped;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    int inFlightCount() {
        drainLock.lock();
        try {
            return inFlight;
        } finally {
            drainLock.unlock();
        }
    }

    private void taskStarted() {
        drainLock.lock();
        try {
            inFlight++;
        } finally {
            drainLock.unlock();
        }
    }

    private void taskFinished() {
        drainLock.lock();
        try {
            inFlight--;
            if (inFlight == 0) {
                drained.signalAll();
            }
        } finally {
            drainLock.unlock();
        }
    }
}
