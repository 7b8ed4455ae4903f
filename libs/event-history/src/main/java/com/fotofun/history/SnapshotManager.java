package com.fotofun.history;

import com.fotofun.eventbus.BusEvents;
import com.fotofun.eventbus.BusEvents.SnapshotMessage;
import com.fotofun.eventbus.TypedEventBus;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventstore.EventQuery;
import com.fotofun.eventstore.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Named checkpoints over the event history.
 * <p>
 * A snapshot only remembers an event id. Loading one publishes
 * {@code history.snapshot.loaded} on the bus; {@link HistoryStore} reacts by time
 * travelling to that event, so this class never touches canvas content.
 */
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    private final TypedEventBus bus;
    private final SnapshotStorage storage;
    private final Supplier<Optional<String>> currentEvent;
    private final Map<String, Snapshot> snapshots = new LinkedHashMap<>();

    /**
     * Creates a manager whose snapshots point at the newest event in {@code store}.
     */
    public SnapshotManager(EventStore store, TypedEventBus bus, SnapshotStorage storage) {
        this(bus, storage, () -> newestEvent(store));
    }

    /**
     * Creates a manager whose snapshots point at whatever {@code currentEvent} reports,
     * typically {@link HistoryStore#currentEventId()}.
     */
    public SnapshotManager(TypedEventBus bus, SnapshotStorage storage, Supplier<Optional<String>> currentEvent) {
        if (bus == null || storage == null || currentEvent == null) {
            throw new IllegalArgumentException("bus, storage and currentEvent must not be null");
        }
        this.bus = bus;
        this.storage = storage;
        this.currentEvent = currentEvent;
        preload();
    }

    private void preload() {
        try {
            for (Snapshot snapshot : storage.list()) {
                snapshots.put(snapshot.id(), snapshot);
            }
            log.debug("Loaded {} snapshots from storage", snapshots.size());
        } catch (RuntimeException e) {
            log.error("Failed to load snapshots from storage: {}", e.getMessage(), e);
        }
    }

    private static Optional<String> newestEvent(EventStore store) {
        List<Event> events = store.query(EventQuery.all());
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1).id());
    }

    /**
     * Records a checkpoint at the current event.
     *
     * @throws IllegalStateException if there is no event to point at
     */
    public synchronized Snapshot createSnapshot(String name, String description) {
        String eventId = currentEvent.get()
                .orElseThrow(() -> new IllegalStateException("No events to snapshot"));
        Snapshot snapshot = new Snapshot(UUID.randomUUID().toString(), name, description, eventId,
                Instant.now(), null);
        storage.save(snapshot);
        snapshots.put(snapshot.id(), snapshot);
        log.info("Created snapshot {} '{}' at event {}", snapshot.id(), name, eventId);
        bus.emit(BusEvents.SNAPSHOT_CREATED, new SnapshotMessage(snapshot.id(), name, eventId));
        return snapshot;
    }

    /**
     * Asks the history to return to the snapshot's event.
     *
     * @throws IllegalArgumentException if the snapshot is unknown
     */
    public void loadSnapshot(String snapshotId) {
        Snapshot snapshot = require(snapshotId);
        log.info("Loading snapshot {} at event {}", snapshotId, snapshot.eventId());
        bus.emit(BusEvents.SNAPSHOT_LOADED, new SnapshotMessage(snapshot.id(), snapshot.name(), snapshot.eventId()));
    }

    /**
     * @throws IllegalArgumentException if the snapshot is unknown
     */
    public synchronized void deleteSnapshot(String snapshotId) {
        Snapshot snapshot = require(snapshotId);
        storage.delete(snapshotId);
        snapshots.remove(snapshotId);
        bus.emit(BusEvents.SNAPSHOT_DELETED, new SnapshotMessage(snapshot.id(), snapshot.name(), snapshot.eventId()));
    }

    /**
     * Renames or re-describes a snapshot; {@code null} keeps the current value.
     *
     * @throws IllegalArgumentException if the snapshot is unknown
     */
    public synchronized Snapshot updateSnapshot(String snapshotId, String name, String description) {
        Snapshot updated = require(snapshotId).withDetails(name, description);
        storage.save(updated);
        snapshots.put(snapshotId, updated);
        return updated;
    }

    /** All snapshots, newest first. */
    public synchronized List<Snapshot> getSnapshots() {
        List<Snapshot> sorted = new ArrayList<>(snapshots.values());
        sorted.sort(Comparator.comparing(Snapshot::timestamp).reversed());
        return sorted;
    }

    public synchronized Optional<Snapshot> getSnapshot(String snapshotId) {
        return Optional.ofNullable(snapshots.get(snapshotId));
    }

    private synchronized Snapshot require(String snapshotId) {
        Snapshot snapshot = snapshots.get(snapshotId);
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot " + snapshotId + " not found");
        }
        return snapshot;
    }
}
