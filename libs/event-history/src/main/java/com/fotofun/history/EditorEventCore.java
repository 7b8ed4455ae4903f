package com.fotofun.history;

import com.fotofun.eventbus.EventStoreBridge;
import com.fotofun.eventbus.EventStoreBridgeRegistry;
import com.fotofun.eventbus.TypedEventBus;
import com.fotofun.eventstore.EventPersistence;
import com.fotofun.eventstore.EventStore;
import com.fotofun.eventstore.LoggingEventPersistence;
import com.fotofun.eventstore.execution.ExecutionContext;
import com.fotofun.eventstore.legacy.CommandAdapter;
import com.fotofun.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One isolated editor session: a store, a bus, the bridge between them, the history and
 * the snapshot manager, wired together.
 * <p>
 * Nothing here is global. Each document (or test) builds its own core, and two cores
 * never see each other's events.
 */
public class EditorEventCore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EditorEventCore.class);

    private final EventStore store;
    private final TypedEventBus bus;
    private final EventStoreBridgeRegistry bridges;
    private final EventStoreBridge bridge;
    private final HistoryStore history;
    private final SnapshotManager snapshots;
    private final CommandAdapter commandAdapter;

    private boolean closed;

    /** Builds a core from {@code fotofun-events.yml}, or defaults when it is absent. */
    public static EditorEventCore create() {
        return new EditorEventCore(EventCorePropertiesLoader.load(), new LoggingEventPersistence(),
                new MetricFactory(new SimpleMeterRegistry(), "editor"), new EventStoreBridgeRegistry());
    }

    public EditorEventCore(EventCoreProperties properties, EventPersistence persistence, MetricFactory metrics,
                           EventStoreBridgeRegistry bridges) {
        this.store = new EventStore(properties.store(), persistence, metrics);
        this.bus = new TypedEventBus(properties.bus(), metrics);
        this.bridges = bridges;
        this.bridge = bridges.bridgeFor(store, bus);
        this.history = new HistoryStore(store, bus);
        SnapshotStorage storage = properties.hasSnapshotDirectory()
                ? new JsonFileSnapshotStorage(properties.snapshotDirectory())
                : new InMemorySnapshotStorage();
        this.snapshots = new SnapshotManager(bus, storage, history::currentEventId);
        this.commandAdapter = new CommandAdapter();
        log.debug("Editor event core ready (maxEvents={}, errorPolicy={})", properties.store().maxEvents(),
                properties.bus().errorPolicy());
    }

    /** Starts a context on {@code canvasId}; finish it with commit or rollback. */
    public ExecutionContext.Builder contextFor(String canvasId) {
        return ExecutionContext.builder(store, canvasId);
    }

    public EventStore store() {
        return store;
    }

    public TypedEventBus bus() {
        return bus;
    }

    public EventStoreBridge bridge() {
        return bridge;
    }

    public HistoryStore history() {
        return history;
    }

    public SnapshotManager snapshots() {
        return snapshots;
    }

    public CommandAdapter commandAdapter() {
        return commandAdapter;
    }

    /** Disconnects and disposes every component. Safe to call twice. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        history.dispose();
        bridges.release(store, bus);
        store.dispose();
        bus.dispose();
        log.debug("Editor event core closed");
    }
}
