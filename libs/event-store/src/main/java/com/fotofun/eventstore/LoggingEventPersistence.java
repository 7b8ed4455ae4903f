package com.fotofun.eventstore;

import com.fotofun.eventmodel.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default persistence: writes a debug line per event and snapshot and stores nothing.
 */
public final class LoggingEventPersistence implements EventPersistence {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPersistence.class);

    @Override
    public void persist(Event event) {
        log.debug("Persisting event {} {}", event.type(), event.id());
    }

    @Override
    public void persistSnapshot(StoreSnapshot snapshot) {
        log.debug("Persisting snapshot {} with {} events", snapshot.id(), snapshot.eventCount());
    }
}
