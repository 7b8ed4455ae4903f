package com.fotofun.eventstore;

import com.fotofun.eventmodel.Event;

/**
 * Callback for events appended to an {@link EventStore}.
 * <p>
 * Handlers run synchronously on the appending thread. An exception thrown by a handler
 * is logged by the store and does not reach the caller of {@code append}.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event);
}
