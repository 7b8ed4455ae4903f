package com.fotofun.history;

import com.fotofun.eventbus.BusEvents;
import com.fotofun.eventbus.BusEvents.HistoryNavigatedMessage;
import com.fotofun.eventbus.BusEvents.HistoryStateMessage;
import com.fotofun.eventbus.TypedEventBus;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventFactory;
import com.fotofun.eventmodel.EventMetadata;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventstore.EventStore;
import com.fotofun.eventstore.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Undo/redo derived from the event stream.
 * <p>
 * Every non-history event appended to the store becomes a new undoable action and
 * discards the redo stack. Undo never rewrites the log: it appends the reverse of the
 * newest action, and redo appends a fresh copy of the undone action whose
 * {@code causationId} is the original's id. Both also append a {@code history.undo} or
 * {@code history.redo} bookkeeping event. Appends made by this class are not recorded
 * as new actions.
 * <p>
 * The stacks always hold the originally recorded events. A redone action keeps its
 * original id in the history, so snapshots and time travel targets taken before an undo
 * stay reachable after the redo.
 * <p>
 * Instances are not thread-safe; drive them from the thread that owns the store.
 */
public class HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private final EventStore store;
    private final TypedEventBus bus;

    private final List<Event> undoStack = new ArrayList<>();
    private final List<Event> redoStack = new ArrayList<>();
    private int totalEvents;
    private boolean applyingHistory;

    private final Subscription storeSubscription;
    private final Subscription snapshotSubscription;

    public HistoryStore(EventStore store, TypedEventBus bus) {
        if (store == null || bus == null) {
            throw new IllegalArgumentException("store and bus must not be null");
        }
        this.store = store;
        this.bus = bus;
        this.storeSubscription = store.subscribeAll(this::record);
        this.snapshotSubscription = bus.on(BusEvents.SNAPSHOT_LOADED, m -> timeTravel(m.data().eventId()));
    }

    private void record(Event event) {
        if (event.eventType().isHistoryEvent() || applyingHistory) {
            return;
        }
        undoStack.add(event);
        redoStack.clear();
        totalEvents++;
        emitStateChange();
    }

    // ---------------------------------------------------------------- navigation

    /**
     * Reverts the newest action.
     *
     * @return false if there is nothing to undo or the newest action cannot be reversed
     */
    public boolean undo() {
        if (undoStack.isEmpty()) {
            return false;
        }
        Event target = undoStack.get(undoStack.size() - 1);
        Optional<Event> reverse = target.reverse();
        if (reverse.isEmpty()) {
            log.warn("Event {} ({}) cannot be undone", target.id(), target.type());
            return false;
        }

        appendOwn(reverse.get());
        undoStack.remove(undoStack.size() - 1);
        redoStack.add(target);
        appendOwn(bookkeeping(target, new EventPayload.HistoryUndo(target.id())));
        log.debug("Undid {} {}", target.type(), target.id());

        emitStateChange();
        return true;
    }

    /**
     * Re-applies the most recently undone action.
     *
     * @return false if there is nothing to redo
     */
    public boolean redo() {
        if (redoStack.isEmpty()) {
            return false;
        }
        Event original = redoStack.remove(redoStack.size() - 1);
        Event stored = appendOwn(EventFactory.createChild(original, original.payload()));
        undoStack.add(original);
        appendOwn(bookkeeping(original, new EventPayload.HistoryRedo(original.id())));
        log.debug("Redid {} {} as {}", original.type(), original.id(), stored.id());

        emitStateChange();
        return true;
    }

    /**
     * Undoes or redoes step by step until {@code targetEventId} is the newest undoable
     * action. Stops early if an action on the way cannot be undone.
     *
     * @return false if the event is not part of the history or the target was not reached
     */
    public boolean timeTravel(String targetEventId) {
        List<Event> timeline = new ArrayList<>(undoStack);
        List<Event> pending = new ArrayList<>(redoStack);
        Collections.reverse(pending);
        timeline.addAll(pending);

        int target = -1;
        for (int i = 0; i < timeline.size(); i++) {
            if (timeline.get(i).id().equals(targetEventId)) {
                target = i;
                break;
            }
        }
        if (target < 0) {
            log.warn("Event {} is not part of the history", targetEventId);
            return false;
        }

        int distance = (undoStack.size() - 1) - target;
        int taken = 0;
        if (distance > 0) {
            while (taken < distance && undo()) {
                taken++;
            }
        } else {
            while (taken < -distance && redo()) {
                taken++;
            }
        }
        boolean reached = taken == Math.abs(distance);
        if (!reached) {
            log.warn("Time travel to {} stopped after {} of {} steps", targetEventId, taken, Math.abs(distance));
        }
        bus.emit(BusEvents.HISTORY_NAVIGATED, new HistoryNavigatedMessage(targetEventId,
                distance > 0 ? -taken : taken));
        return reached;
    }

    // ---------------------------------------------------------------- state

    public boolean canUndo() {
        return !undoStack.isEmpty() && undoStack.get(undoStack.size() - 1).reverse().isPresent();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public HistoryState getState() {
        return new HistoryState(canUndo(), canRedo(), undoStack, redoStack, currentEventId().orElse(null),
                totalEvents);
    }

    /** Undoable actions, oldest first. */
    public List<Event> getHistory() {
        return List.copyOf(undoStack);
    }

    /** Id of the newest undoable action, if any. */
    public Optional<String> currentEventId() {
        return undoStack.isEmpty() ? Optional.empty() : Optional.of(undoStack.get(undoStack.size() - 1).id());
    }

    /** Forgets both stacks. The store is untouched. */
    public void clear() {
        undoStack.clear();
        redoStack.clear();
        totalEvents = 0;
        emitStateChange();
    }

    /** Stops listening to the store and the bus. */
    public void dispose() {
        storeSubscription.unsubscribe();
        snapshotSubscription.unsubscribe();
    }

    // ---------------------------------------------------------------- internals

    private Event appendOwn(Event event) {
        applyingHistory = true;
        try {
            return store.append(event);
        } finally {
            applyingHistory = false;
        }
    }

    private static Event bookkeeping(Event subject, EventPayload payload) {
        return EventFactory.create(payload, EventMetadata.of(EventSource.SYSTEM), subject.sessionId(),
                subject.userId());
    }

    private void emitStateChange() {
        Event head = undoStack.isEmpty() ? null : undoStack.get(undoStack.size() - 1);
        bus.emit(BusEvents.HISTORY_STATE_CHANGED, new HistoryStateMessage(canUndo(), canRedo(),
                undoStack.size(), redoStack.size(), head == null ? null : head.id()));
    }
}
