package com.fotofun.eventstore;

import com.fotofun.eventmodel.AggregateType;
import com.fotofun.eventmodel.CanvasState;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventType;
import com.fotofun.eventmodel.LifecycleException;
import com.fotofun.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only, versioned and queryable log of editor events.
 * <p>
 * The store is the single source of truth for state changes. It keeps four indices over
 * the same events: by id, by aggregate ({@code type:id} to ids in append order), a global
 * timeline ordered by timestamp, and a per-aggregate version table. Versions are owned by
 * the store: {@link #append(Event)} stores a copy of the event carrying
 * {@code currentVersion + 1}, whatever version the caller supplied.
 * <p>
 * Appends are synchronous. Each one updates every index, then notifies type-specific
 * handlers followed by wildcard handlers, then hands the event to the
 * {@link EventPersistence} on a background thread without waiting. Handler and
 * persistence failures are logged and counted, never thrown. Operations on a disposed
 * store throw {@link LifecycleException}.
 * <p>
 * The store is meant to be driven by one owning thread. Its methods are synchronized
 * only so that the optional retention sweep cannot interleave with that thread.
 */
public class EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    /** Subscription key matching every event type. */
    public static final String WILDCARD = "*";

    static final String COMPONENT = "event-store";

    private final EventStoreConfig config;
    private final EventPersistence persistence;

    private final Map<String, Event> events = new HashMap<>();
    private final Map<String, List<String>> eventsByAggregate = new HashMap<>();
    private final List<Event> timeline = new ArrayList<>();
    private final Map<String, Integer> aggregateVersions = new HashMap<>();
    private final Map<String, StoreSnapshot> snapshots = new LinkedHashMap<>();

    private final Map<EventType, List<EventHandler>> handlers = new EnumMap<>(EventType.class);
    private final List<EventHandler> globalHandlers = new ArrayList<>();

    private final ExecutorService persistenceExecutor;
    private final ScheduledExecutorService cleanupTimer;

    private final Map<AggregateType, Counter> appendedCounters = new EnumMap<>(AggregateType.class);
    private final Counter handlerErrors;
    private final Counter persistenceFailures;
    private final Counter pruned;
    private final AtomicLong storedGauge;

    private boolean disposed;

    /**
     * Creates a store with default configuration, logging persistence and a private
     * meter registry.
     */
    public EventStore() {
        this(EventStoreConfig.defaults(), new LoggingEventPersistence(), MetricFactory.standalone(COMPONENT));
    }

    public EventStore(EventStoreConfig config) {
        this(config, new LoggingEventPersistence(), MetricFactory.standalone(COMPONENT));
    }

    public EventStore(EventStoreConfig config, EventPersistence persistence, MetricFactory metrics) {
        if (config == null || persistence == null || metrics == null) {
            throw new IllegalArgumentException("config, persistence and metrics must not be null");
        }
        this.config = config;
        this.persistence = persistence;

        MetricFactory storeMetrics = metrics.forComponent(COMPONENT);
        for (AggregateType type : AggregateType.values()) {
            appendedCounters.put(type, storeMetrics.counter("editor.events.appended",
                    "Events appended to the store", "aggregate_type", type.value()));
        }
        this.handlerErrors = storeMetrics.counter("editor.events.handler.errors",
                "Subscriber exceptions caught during fan-out");
        this.persistenceFailures = storeMetrics.counter("editor.events.persistence.failures",
                "Failed background persistence writes");
        this.pruned = storeMetrics.counter("editor.events.pruned",
                "Events evicted by the retention ceiling");
        this.storedGauge = storeMetrics.gauge("editor.events.stored", "Events currently held in memory");

        this.persistenceExecutor = config.persistenceEnabled()
                ? Executors.newSingleThreadExecutor(daemon("event-store-persistence"))
                : null;
        if (config.hasCleanupTimer()) {
            this.cleanupTimer = Executors.newSingleThreadScheduledExecutor(daemon("event-store-cleanup"));
            long periodMillis = config.cleanupInterval().toMillis();
            cleanupTimer.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        } else {
            this.cleanupTimer = null;
        }
    }

    // ---------------------------------------------------------------- writes

    /**
     * Appends one event and returns the stored copy with its assigned version.
     *
     * @throws LifecycleException       if the store has been disposed
     * @throws IllegalArgumentException if the event is null or its id is already stored
     */
    public synchronized Event append(Event event) {
        ensureOpen();
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (events.containsKey(event.id())) {
            throw new IllegalArgumentException("Event already appended: " + event.id());
        }

        int expectedVersion = aggregateVersions.getOrDefault(event.aggregateId(), 0) + 1;
        Event stored = event.version() == expectedVersion ? event : event.withVersion(expectedVersion);
        if (event.version() != Event.UNVERSIONED && event.version() != expectedVersion) {
            log.debug("Overriding version {} of {} {} with {}", event.version(), stored.type(), stored.id(),
                    expectedVersion);
        }

        events.put(stored.id(), stored);
        eventsByAggregate.computeIfAbsent(aggregateKey(stored.aggregateType(), stored.aggregateId()),
                k -> new ArrayList<>()).add(stored.id());
        timeline.add(insertIndex(stored.timestamp()), stored);
        aggregateVersions.put(stored.aggregateId(), expectedVersion);

        appendedCounters.get(stored.aggregateType()).increment();
        storedGauge.set(events.size());
        log.debug("Appended {} {} to {}:{} at version {}", stored.type(), stored.id(),
                stored.aggregateType().value(), stored.aggregateId(), expectedVersion);

        notifyHandlers(stored);
        persistAsync(stored);

        if (!config.hasCleanupTimer()) {
            enforceRetention();
        }
        return stored;
    }

    /**
     * Appends events one by one in list order. The whole batch is checked first, so a
     * null event or a repeated id rejects it before anything is stored.
     *
     * @return the stored copies, in the same order
     * @throws LifecycleException       if the store has been disposed
     * @throws IllegalArgumentException if an event is null, or its id repeats in the batch
     *                                  or is already stored
     */
    public synchronized List<Event> appendBatch(List<Event> batch) {
        ensureOpen();
        if (batch == null) {
            throw new IllegalArgumentException("batch must not be null");
        }
        Set<String> ids = new HashSet<>();
        for (Event event : batch) {
            if (event == null) {
                throw new IllegalArgumentException("batch must not contain null events");
            }
            if (!ids.add(event.id())) {
                throw new IllegalArgumentException("Event repeated in batch: " + event.id());
            }
            if (events.containsKey(event.id())) {
                throw new IllegalArgumentException("Event already appended: " + event.id());
            }
        }
        List<Event> stored = new ArrayList<>(batch.size());
        for (Event event : batch) {
            stored.add(append(event));
        }
        return stored;
    }

    // ---------------------------------------------------------------- reads

    /**
     * Returns the events matching {@code query}, sorted by timestamp (ties keep append
     * order) and paginated.
     */
    public synchronized List<Event> query(EventQuery query) {
        ensureOpen();
        List<Event> candidates;
        if (query.usesAggregateIndex()) {
            candidates = new ArrayList<>();
            for (String id : eventsByAggregate.getOrDefault(
                    aggregateKey(query.aggregateType(), query.aggregateId()), List.of())) {
                Event event = events.get(id);
                if (event != null) {
                    candidates.add(event);
                }
            }
        } else {
            candidates = timeline;
        }

        Set<String> afterCursor = query.fromEventId() == null ? null : idsAfter(query.fromEventId());
        List<Event> results = new ArrayList<>();
        for (Event event : candidates) {
            if (query.matches(event) && (afterCursor == null || afterCursor.contains(event.id()))) {
                results.add(event);
            }
        }
        results.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));

        int from = Math.min(query.offset(), results.size());
        int to = query.limit() == null ? results.size() : (int) Math.min(results.size(), (long) from + query.limit());
        return List.copyOf(results.subList(from, to));
    }

    public List<Event> getAggregateEvents(AggregateType aggregateType, String aggregateId) {
        return query(EventQuery.forAggregate(aggregateType, aggregateId));
    }

    public synchronized Optional<Event> getEvent(String eventId) {
        ensureOpen();
        return Optional.ofNullable(events.get(eventId));
    }

    /** Current version of an aggregate, 0 if nothing was ever appended to it. */
    public synchronized int getAggregateVersion(String aggregateId) {
        ensureOpen();
        return aggregateVersions.getOrDefault(aggregateId, 0);
    }

    /**
     * The reversible events among the {@code limit} most recent ones, newest first.
     */
    public synchronized List<Event> getUndoableEvents(int limit) {
        ensureOpen();
        List<Event> result = new ArrayList<>();
        for (int i = timeline.size() - 1; i >= Math.max(0, timeline.size() - limit); i--) {
            Event event = timeline.get(i);
            if (event.reverse().isPresent()) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * Folds the events matching {@code query} over {@code initialState}.
     */
    public CanvasState replay(EventQuery query, CanvasState initialState) {
        CanvasState state = initialState;
        for (Event event : query(query)) {
            state = event.apply(state);
        }
        return state;
    }

    public synchronized int size() {
        ensureOpen();
        return events.size();
    }

    // ---------------------------------------------------------------- subscriptions

    /**
     * Subscribes to one event type, given by its canonical value, or to every type with
     * {@link #WILDCARD}.
     *
     * @throws IllegalArgumentException if the type is unknown
     */
    public Subscription subscribe(String eventType, EventHandler handler) {
        if (WILDCARD.equals(eventType)) {
            return subscribeAll(handler);
        }
        EventType type = EventType.fromValue(eventType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + eventType));
        return subscribe(type, handler);
    }

    public synchronized Subscription subscribe(EventType eventType, EventHandler handler) {
        ensureOpen();
        requireHandler(handler);
        List<EventHandler> typeHandlers = handlers.computeIfAbsent(eventType, k -> new ArrayList<>());
        typeHandlers.add(handler);
        return () -> {
            synchronized (this) {
                List<EventHandler> current = handlers.get(eventType);
                if (current != null) {
                    current.remove(handler);
                    if (current.isEmpty()) {
                        handlers.remove(eventType);
                    }
                }
            }
        };
    }

    public synchronized Subscription subscribeAll(EventHandler handler) {
        ensureOpen();
        requireHandler(handler);
        globalHandlers.add(handler);
        return () -> {
            synchronized (this) {
                globalHandlers.remove(handler);
            }
        };
    }

    /** Number of handlers registered for a type, wildcard handlers excluded. */
    public synchronized int handlerCount(EventType eventType) {
        return handlers.getOrDefault(eventType, List.of()).size();
    }

    public synchronized int wildcardHandlerCount() {
        return globalHandlers.size();
    }

    // ---------------------------------------------------------------- snapshots

    public StoreSnapshot createSnapshot() {
        return createSnapshot(Instant.now());
    }

    /**
     * Captures every event with a timestamp at or before {@code timestamp}.
     */
    public synchronized StoreSnapshot createSnapshot(Instant timestamp) {
        ensureOpen();
        List<Event> captured = new ArrayList<>();
        for (Event event : timeline) {
            if (event.timestamp().isAfter(timestamp)) {
                break;
            }
            captured.add(event);
        }
        StoreSnapshot snapshot = new StoreSnapshot("snapshot-" + timestamp.toEpochMilli(), timestamp, captured);
        snapshots.put(snapshot.id(), snapshot);
        log.info("Created store snapshot {} with {} events", snapshot.id(), snapshot.eventCount());

        if (persistenceExecutor != null) {
            submitPersistence(() -> persistence.persistSnapshot(snapshot), "snapshot " + snapshot.id());
        }
        return snapshot;
    }

    public synchronized Optional<StoreSnapshot> getSnapshot(String snapshotId) {
        ensureOpen();
        return Optional.ofNullable(snapshots.get(snapshotId));
    }

    /**
     * Rebuilds state by replaying the snapshot's events over {@code initialState}.
     *
     * @throws IllegalArgumentException if no snapshot has that id
     */
    public CanvasState restoreFromSnapshot(String snapshotId, CanvasState initialState) {
        StoreSnapshot snapshot = getSnapshot(snapshotId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown snapshot: " + snapshotId));
        log.info("Restoring from snapshot {} ({} events)", snapshotId, snapshot.eventCount());
        CanvasState state = initialState;
        for (Event event : snapshot.events()) {
            state = event.apply(state);
        }
        return state;
    }

    // ---------------------------------------------------------------- maintenance

    /**
     * Evicts the oldest events until the store holds at most {@code maxEvents}.
     * Version counters are left untouched.
     *
     * @return the number of evicted events
     */
    public synchronized int enforceRetention() {
        ensureOpen();
        int excess = timeline.size() - config.maxEvents();
        if (excess <= 0) {
            return 0;
        }
        List<Event> oldest = new ArrayList<>(timeline.subList(0, excess));
        timeline.subList(0, excess).clear();
        for (Event event : oldest) {
            events.remove(event.id());
            String key = aggregateKey(event.aggregateType(), event.aggregateId());
            List<String> ids = eventsByAggregate.get(key);
            if (ids != null) {
                ids.remove(event.id());
                if (ids.isEmpty()) {
                    eventsByAggregate.remove(key);
                }
            }
        }
        pruned.increment(excess);
        storedGauge.set(events.size());
        log.info("Pruned {} events beyond retention ceiling of {}", excess, config.maxEvents());
        return excess;
    }

    /**
     * Removes every event, version counter and snapshot. Subscriptions stay in place.
     */
    public synchronized void clear() {
        ensureOpen();
        events.clear();
        eventsByAggregate.clear();
        timeline.clear();
        aggregateVersions.clear();
        snapshots.clear();
        storedGauge.set(0);
        log.info("Event store cleared");
    }

    /**
     * Releases the store: cancels the retention sweep, stops the persistence thread and
     * drops all state. Later calls are no-ops; any other operation then throws.
     */
    public synchronized void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        if (cleanupTimer != null) {
            cleanupTimer.shutdownNow();
        }
        if (persistenceExecutor != null) {
            persistenceExecutor.shutdown();
        }
        events.clear();
        eventsByAggregate.clear();
        timeline.clear();
        aggregateVersions.clear();
        snapshots.clear();
        handlers.clear();
        globalHandlers.clear();
        storedGauge.set(0);
        log.info("Event store disposed");
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    public EventStoreConfig config() {
        return config;
    }

    // ---------------------------------------------------------------- internals

    private void notifyHandlers(Event event) {
        List<EventHandler> specific = handlers.getOrDefault(event.eventType(), List.of());
        for (EventHandler handler : List.copyOf(specific)) {
            invoke(handler, event);
        }
        for (EventHandler handler : List.copyOf(globalHandlers)) {
            invoke(handler, event);
        }
    }

    private void invoke(EventHandler handler, Event event) {
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            handlerErrors.increment();
            log.error("Handler error for event {} {}", event.type(), event.id(), e);
        }
    }

    private void persistAsync(Event event) {
        if (persistenceExecutor != null) {
            submitPersistence(() -> persistence.persist(event), "event " + event.id());
        }
    }

    private void submitPersistence(PersistenceCall call, String what) {
        try {
            persistenceExecutor.execute(() -> {
                try {
                    call.run();
                } catch (Exception e) {
                    persistenceFailures.increment();
                    log.warn("Failed to persist {}", what, e);
                }
            });
        } catch (RejectedExecutionException e) {
            persistenceFailures.increment();
            log.warn("Persistence rejected {}", what, e);
        }
    }

    private synchronized void sweep() {
        if (disposed) {
            return;
        }
        try {
            enforceRetention();
        } catch (RuntimeException e) {
            log.error("Retention sweep failed", e);
        }
    }

    /** First index whose timestamp is after {@code timestamp}, so ties keep append order. */
    private int insertIndex(Instant timestamp) {
        int low = 0;
        int high = timeline.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (!timeline.get(mid).timestamp().isAfter(timestamp)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /** Ids positioned after the cursor on the timeline, or null when the cursor is unknown. */
    private Set<String> idsAfter(String cursorId) {
        if (!events.containsKey(cursorId)) {
            return null;
        }
        Set<String> ids = new HashSet<>();
        boolean seen = false;
        for (Event event : timeline) {
            if (seen) {
                ids.add(event.id());
            } else if (event.id().equals(cursorId)) {
                seen = true;
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    private void ensureOpen() {
        if (disposed) {
            throw new LifecycleException("EventStore has been disposed");
        }
    }

    private static void requireHandler(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
    }

    private static String aggregateKey(AggregateType type, String id) {
        return type.value() + ":" + id;
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface PersistenceCall {
        void run() throws Exception;
    }
}
