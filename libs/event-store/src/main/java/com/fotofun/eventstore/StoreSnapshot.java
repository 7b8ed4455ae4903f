package com.fotofun.eventstore;

import com.fotofun.eventmodel.Event;

import java.time.Instant;
import java.util.List;

/**
 * The events of a store up to a point in time. Restoring a snapshot replays these
 * events; the snapshot never holds materialized canvas state.
 *
 * @param id        snapshot id ({@code snapshot-<epochMillis>})
 * @param timestamp inclusive upper bound of the captured events
 * @param events    captured events in timeline order
 */
public record StoreSnapshot(String id, Instant timestamp, List<Event> events) {

    public StoreSnapshot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    public int eventCount() {
        return events.size();
    }
}
