package com.fotofun.eventstore;

/**
 * Handle returned by a subscribe call. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
