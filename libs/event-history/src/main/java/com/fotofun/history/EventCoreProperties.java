package com.fotofun.history;

import com.fotofun.eventbus.EventBusConfig;
import com.fotofun.eventstore.EventStoreConfig;

import java.nio.file.Path;

/**
 * Settings for one {@link EditorEventCore}, bound from the {@code fotofun.events}
 * section of {@code fotofun-events.yml}.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * fotofun:
 *   events:
 *     store:
 *       max-events: 5000
 *       cleanup-interval: PT1M
 *       persistence-enabled: true
 *     bus:
 *       max-listeners-per-type: 50
 *       error-policy: log
 *       metrics-enabled: true
 *     snapshots:
 *       directory: /var/lib/fotofun/snapshots
 * }</pre>
 *
 * @param store             event store settings
 * @param bus               event bus settings
 * @param snapshotDirectory where snapshots are written as JSON, or {@code null} to keep
 *                          them in memory
 */
public record EventCoreProperties(EventStoreConfig store, EventBusConfig bus, Path snapshotDirectory) {

    public EventCoreProperties {
        if (store == null || bus == null) {
            throw new IllegalArgumentException("store and bus settings must not be null");
        }
    }

    public static EventCoreProperties defaults() {
        return new EventCoreProperties(EventStoreConfig.defaults(), EventBusConfig.defaults(), null);
    }

    public boolean hasSnapshotDirectory() {
        return snapshotDirectory != null;
    }
}
