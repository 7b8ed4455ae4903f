package com.fotofun.eventbus;

import com.fotofun.eventbus.BusEvents.BackgroundChangedMessage;
import com.fotofun.eventbus.BusEvents.CanvasResizedMessage;
import com.fotofun.eventbus.BusEvents.HistoryStepMessage;
import com.fotofun.eventbus.BusEvents.LayerCreatedMessage;
import com.fotofun.eventbus.BusEvents.LayerModifiedMessage;
import com.fotofun.eventbus.BusEvents.LayerRemovedMessage;
import com.fotofun.eventbus.BusEvents.LayersReorderedMessage;
import com.fotofun.eventbus.BusEvents.ObjectAddedMessage;
import com.fotofun.eventbus.BusEvents.ObjectModifiedMessage;
import com.fotofun.eventbus.BusEvents.ObjectRemovedMessage;
import com.fotofun.eventbus.BusEvents.ObjectsBatchModifiedMessage;
import com.fotofun.eventbus.BusEvents.SelectionChangedMessage;
import com.fotofun.eventbus.BusEvents.SelectionClearedMessage;
import com.fotofun.eventbus.BusEvents.ToolActivatedMessage;
import com.fotofun.eventbus.BusEvents.ToolOptionChangedMessage;
import com.fotofun.eventbus.BusEvents.WorkflowCompletedMessage;
import com.fotofun.eventbus.BusEvents.WorkflowFailedMessage;
import com.fotofun.eventbus.BusEvents.WorkflowStartedMessage;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventstore.EventStore;
import com.fotofun.eventstore.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Republishes every event appended to an {@link EventStore} as a UI message on a
 * {@link TypedEventBus}.
 * <p>
 * Each recognised event kind produces exactly one bus emission. Kinds with no UI
 * channel are logged and skipped. A failure while translating or dispatching one event
 * is logged and never reaches the appending caller.
 * <p>
 * Obtain bridges through {@link EventStoreBridgeRegistry} so that a store and bus pair
 * is never connected twice.
 */
public class EventStoreBridge {

    private static final Logger log = LoggerFactory.getLogger(EventStoreBridge.class);

    private final EventStore store;
    private final TypedEventBus bus;

    private Subscription subscription;

    public EventStoreBridge(EventStore store, TypedEventBus bus) {
        if (store == null || bus == null) {
            throw new IllegalArgumentException("store and bus must not be null");
        }
        this.store = store;
        this.bus = bus;
    }

    /** Subscribes to the store's wildcard channel. A second call only warns. */
    public synchronized void start() {
        if (subscription != null) {
            log.warn("Event store bridge already started");
            return;
        }
        subscription = store.subscribeAll(this::forward);
        log.debug("Event store bridge started");
    }

    public synchronized void stop() {
        if (subscription == null) {
            return;
        }
        subscription.unsubscribe();
        subscription = null;
        log.debug("Event store bridge stopped");
    }

    public synchronized boolean isStarted() {
        return subscription != null;
    }

    private void forward(Event event) {
        try {
            translate(event);
        } catch (RuntimeException e) {
            log.error("Failed to bridge {} {}: {}", event.type(), event.id(), e.getMessage(), e);
        }
    }

    void translate(Event event) {
        EventPayload payload = event.payload();
        switch (event.eventType()) {
            case OBJECT_ADDED: {
                EventPayload.ObjectAdded p = (EventPayload.ObjectAdded) payload;
                bus.emit(BusEvents.OBJECT_ADDED,
                        new ObjectAddedMessage(p.canvasId(), p.object(), p.object().layerId()));
                break;
            }
            case OBJECT_REMOVED: {
                EventPayload.ObjectRemoved p = (EventPayload.ObjectRemoved) payload;
                bus.emit(BusEvents.OBJECT_REMOVED, new ObjectRemovedMessage(p.canvasId(), p.object().id()));
                break;
            }
            case OBJECT_MODIFIED: {
                EventPayload.ObjectModified p = (EventPayload.ObjectModified) payload;
                bus.emit(BusEvents.OBJECT_MODIFIED,
                        new ObjectModifiedMessage(p.canvasId(), p.objectId(), p.previousState(), p.newState()));
                break;
            }
            case OBJECTS_BATCH_MODIFIED: {
                EventPayload.ObjectsBatchModified p = (EventPayload.ObjectsBatchModified) payload;
                bus.emit(BusEvents.OBJECTS_BATCH_MODIFIED,
                        new ObjectsBatchModifiedMessage(p.canvasId(), p.modifications()));
                break;
            }
            case LAYER_CREATED:
                bus.emit(BusEvents.LAYER_CREATED,
                        new LayerCreatedMessage(((EventPayload.LayerCreated) payload).layer()));
                break;
            case LAYER_REMOVED:
                bus.emit(BusEvents.LAYER_REMOVED,
                        new LayerRemovedMessage(((EventPayload.LayerRemoved) payload).layer().id()));
                break;
            case LAYER_MODIFIED: {
                EventPayload.LayerModified p = (EventPayload.LayerModified) payload;
                bus.emit(BusEvents.LAYER_MODIFIED, new LayerModifiedMessage(p.layerId(), p.modifications()));
                break;
            }
            case LAYERS_REORDERED: {
                EventPayload.LayersReordered p = (EventPayload.LayersReordered) payload;
                bus.emit(BusEvents.LAYER_REORDERED, new LayersReorderedMessage(p.layerIds(), p.previousOrder()));
                break;
            }
            case SELECTION_CHANGED: {
                EventPayload.SelectionChanged p = (EventPayload.SelectionChanged) payload;
                bus.emit(BusEvents.SELECTION_CHANGED,
                        new SelectionChangedMessage(p.selection(), p.previousSelection()));
                break;
            }
            case SELECTION_CLEARED:
                bus.emit(BusEvents.SELECTION_CLEARED,
                        new SelectionClearedMessage(((EventPayload.SelectionCleared) payload).previousSelection()));
                break;
            case CANVAS_RESIZED: {
                EventPayload.CanvasResized p = (EventPayload.CanvasResized) payload;
                bus.emit(BusEvents.CANVAS_RESIZED, new CanvasResizedMessage(p.width(), p.height(),
                        p.previousWidth(), p.previousHeight()));
                break;
            }
            case CANVAS_BACKGROUND_CHANGED: {
                EventPayload.CanvasBackgroundChanged p = (EventPayload.CanvasBackgroundChanged) payload;
                bus.emit(BusEvents.CANVAS_BACKGROUND_CHANGED,
                        new BackgroundChangedMessage(p.backgroundColor(), p.previousColor()));
                break;
            }
            case TOOL_ACTIVATED: {
                EventPayload.ToolActivated p = (EventPayload.ToolActivated) payload;
                bus.emit(BusEvents.TOOL_ACTIVATED, new ToolActivatedMessage(p.toolId(), p.previousToolId()));
                break;
            }
            case TOOL_OPTION_CHANGED: {
                EventPayload.ToolOptionChanged p = (EventPayload.ToolOptionChanged) payload;
                bus.emit(BusEvents.TOOL_OPTION_CHANGED,
                        new ToolOptionChangedMessage(p.toolId(), p.optionId(), p.value(), p.previousValue()));
                break;
            }
            case WORKFLOW_STARTED: {
                EventPayload.WorkflowStarted p = (EventPayload.WorkflowStarted) payload;
                bus.emit(BusEvents.WORKFLOW_STARTED, new WorkflowStartedMessage(p.workflowId(), p.description()));
                break;
            }
            case WORKFLOW_COMPLETED: {
                EventPayload.WorkflowCompleted p = (EventPayload.WorkflowCompleted) payload;
                bus.emit(BusEvents.WORKFLOW_COMPLETED,
                        new WorkflowCompletedMessage(p.workflowId(), p.success(), p.resultCount()));
                break;
            }
            case WORKFLOW_FAILED: {
                EventPayload.WorkflowFailed p = (EventPayload.WorkflowFailed) payload;
                bus.emit(BusEvents.WORKFLOW_FAILED, new WorkflowFailedMessage(p.workflowId(), p.error()));
                break;
            }
            case HISTORY_UNDO:
                bus.emit(BusEvents.HISTORY_UNDO,
                        new HistoryStepMessage(((EventPayload.HistoryUndo) payload).undoneEventId()));
                break;
            case HISTORY_REDO:
                bus.emit(BusEvents.HISTORY_REDO,
                        new HistoryStepMessage(((EventPayload.HistoryRedo) payload).redoneEventId()));
                break;
            default:
                log.debug("No UI channel for {} {}", event.type(), event.id());
                break;
        }
    }
}
