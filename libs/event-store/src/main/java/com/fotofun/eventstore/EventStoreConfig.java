package com.fotofun.eventstore;

import java.time.Duration;

/**
 * Configuration for an {@link EventStore}.
 *
 * @param maxEvents          retention ceiling; the oldest events are pruned beyond it
 * @param cleanupInterval    period of the background retention sweep, or {@code null} to
 *                           enforce retention on every append instead
 * @param persistenceEnabled whether appended events are handed to the persistence adapter
 */
public record EventStoreConfig(int maxEvents, Duration cleanupInterval, boolean persistenceEnabled) {

    public static final int DEFAULT_MAX_EVENTS = 10_000;

    public EventStoreConfig {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive, got " + maxEvents);
        }
        if (cleanupInterval != null && (cleanupInterval.isNegative() || cleanupInterval.isZero())) {
            throw new IllegalArgumentException("cleanupInterval must be positive, got " + cleanupInterval);
        }
    }

    public static EventStoreConfig defaults() {
        return new EventStoreConfig(DEFAULT_MAX_EVENTS, null, true);
    }

    public EventStoreConfig withMaxEvents(int newMaxEvents) {
        return new EventStoreConfig(newMaxEvents, cleanupInterval, persistenceEnabled);
    }

    public boolean hasCleanupTimer() {
        return cleanupInterval != null;
    }
}
