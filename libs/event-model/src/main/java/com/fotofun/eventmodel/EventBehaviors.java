package com.fotofun.eventmodel;

import com.fotofun.eventmodel.EventPayload.CanvasBackgroundChanged;
import com.fotofun.eventmodel.EventPayload.CanvasResized;
import com.fotofun.eventmodel.EventPayload.DocumentLoaded;
import com.fotofun.eventmodel.EventPayload.HistoryRedo;
import com.fotofun.eventmodel.EventPayload.HistoryUndo;
import com.fotofun.eventmodel.EventPayload.LayerCreated;
import com.fotofun.eventmodel.EventPayload.LayerModified;
import com.fotofun.eventmodel.EventPayload.LayerRemoved;
import com.fotofun.eventmodel.EventPayload.LayersReordered;
import com.fotofun.eventmodel.EventPayload.ObjectAdded;
import com.fotofun.eventmodel.EventPayload.ObjectModification;
import com.fotofun.eventmodel.EventPayload.ObjectModified;
import com.fotofun.eventmodel.EventPayload.ObjectRemoved;
import com.fotofun.eventmodel.EventPayload.ObjectsBatchModified;
import com.fotofun.eventmodel.EventPayload.SelectionChanged;
import com.fotofun.eventmodel.EventPayload.SelectionCleared;
import com.fotofun.eventmodel.EventPayload.ToolActivated;
import com.fotofun.eventmodel.EventPayload.ToolOptionChanged;
import com.fotofun.eventmodel.EventPayload.WorkflowCompleted;
import com.fotofun.eventmodel.EventPayload.WorkflowFailed;
import com.fotofun.eventmodel.EventPayload.WorkflowStarted;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Dispatch table mapping every {@link EventType} to its {@link EventBehavior}.
 * <p>
 * {@link #of(EventType)} is a switch expression without a default branch, so adding a
 * constant to {@code EventType} does not compile until its behaviour is registered here.
 */
public final class EventBehaviors {

    private EventBehaviors() {
        // utility class
    }

    // ---------------------------------------------------------------- canvas objects

    private static final EventBehavior<ObjectAdded> OBJECT_ADDED = EventBehavior.reversible(
            ObjectAdded.class,
            (state, p) -> state.withObjects(CanvasState.insertAt(state.objects(), p.object(), p.index())),
            p -> new ObjectRemoved(p.canvasId(), p.object(), p.index()),
            (state, p) -> !state.hasObject(p.object().id()),
            p -> "Add " + p.object().type() + " to canvas");

    private static final EventBehavior<ObjectRemoved> OBJECT_REMOVED = EventBehavior.reversible(
            ObjectRemoved.class,
            (state, p) -> state.withObjects(state.objects().stream()
                    .filter(o -> !o.id().equals(p.object().id()))
                    .toList()),
            p -> new ObjectAdded(p.canvasId(), p.object(), p.index()),
            (state, p) -> state.hasObject(p.object().id()),
            p -> "Remove " + p.object().type() + " from canvas");

    private static final EventBehavior<ObjectModified> OBJECT_MODIFIED = EventBehavior.reversible(
            ObjectModified.class,
            (state, p) -> modifyObject(state, p.objectId(), p.newState()),
            p -> new ObjectModified(p.canvasId(), p.objectId(), p.newState(), p.previousState()),
            (state, p) -> state.hasObject(p.objectId()),
            p -> "Modify object: " + String.join(", ", p.newState().keySet()));

    private static final EventBehavior<ObjectsBatchModified> OBJECTS_BATCH_MODIFIED = EventBehavior.reversible(
            ObjectsBatchModified.class,
            (state, p) -> {
                CanvasState next = state;
                for (ObjectModification m : p.modifications()) {
                    next = modifyObject(next, m.objectId(), m.newState());
                }
                return next;
            },
            p -> {
                List<ObjectModification> reversed = new ArrayList<>();
                for (ObjectModification m : p.modifications()) {
                    reversed.add(0, new ObjectModification(m.objectId(), m.newState(), m.previousState()));
                }
                return new ObjectsBatchModified(p.canvasId(), reversed);
            },
            (state, p) -> p.modifications().stream().allMatch(m -> state.hasObject(m.objectId())),
            p -> "Batch modify " + p.modifications().size() + " objects");

    // ---------------------------------------------------------------- layers

    private static final EventBehavior<LayerCreated> LAYER_CREATED = EventBehavior.reversible(
            LayerCreated.class,
            (state, p) -> state.withLayers(CanvasState.insertAt(state.layers(), p.layer(), p.index())),
            p -> new LayerRemoved(p.layer(), p.index()),
            (state, p) -> state.findLayer(p.layer().id()).isEmpty(),
            p -> "Created layer \"" + p.layer().name() + "\"");

    private static final EventBehavior<LayerRemoved> LAYER_REMOVED = EventBehavior.reversible(
            LayerRemoved.class,
            (state, p) -> state.withLayers(state.layers().stream()
                    .filter(l -> !l.id().equals(p.layer().id()))
                    .toList()),
            p -> new LayerCreated(p.layer(), p.index()),
            (state, p) -> state.findLayer(p.layer().id()).isPresent(),
            p -> "Removed layer \"" + p.layer().name() + "\"");

    private static final EventBehavior<LayerModified> LAYER_MODIFIED = EventBehavior.reversible(
            LayerModified.class,
            (state, p) -> state.withLayers(replaceLayer(state.layers(), p.layerId(),
                    layer -> layer.withProperties(p.modifications()))),
            p -> new LayerModified(p.layerId(), p.previousState(), p.modifications()),
            (state, p) -> state.findLayer(p.layerId()).isPresent(),
            p -> "Modified layer properties: " + String.join(", ", p.modifications().keySet()));

    private static final EventBehavior<LayersReordered> LAYERS_REORDERED = EventBehavior.reversible(
            LayersReordered.class,
            (state, p) -> state.withLayers(reorder(state.layers(), p.layerIds())),
            p -> new LayersReordered(p.canvasId(), p.previousOrder(), p.layerIds()),
            (state, p) -> new HashSet<>(p.layerIds()).equals(layerIds(state)),
            p -> "Reorder " + p.layerIds().size() + " layers");

    // ---------------------------------------------------------------- selection

    private static final EventBehavior<SelectionChanged> SELECTION_CHANGED = EventBehavior.reversible(
            SelectionChanged.class,
            (state, p) -> state.withSelection(p.selection()),
            p -> new SelectionChanged(p.canvasId(), p.previousSelection(), p.selection()),
            (state, p) -> p.selection().stream().allMatch(state::hasObject),
            p -> p.selection().isEmpty() ? "Deselect all" : "Select " + p.selection().size() + " objects");

    private static final EventBehavior<SelectionCleared> SELECTION_CLEARED = EventBehavior.reversible(
            SelectionCleared.class,
            (state, p) -> state.withSelection(Set.of()),
            p -> new SelectionChanged(p.canvasId(), p.previousSelection(), Set.of()),
            (state, p) -> !state.selectedObjectIds().isEmpty(),
            p -> "Clear selection");

    // ---------------------------------------------------------------- canvas / document

    private static final EventBehavior<CanvasResized> CANVAS_RESIZED = EventBehavior.reversible(
            CanvasResized.class,
            (state, p) -> state.withSize(p.width(), p.height()),
            p -> new CanvasResized(p.canvasId(), p.previousWidth(), p.previousHeight(), p.width(), p.height()),
            (state, p) -> p.width() > 0 && p.height() > 0,
            p -> "Resized canvas from " + p.previousWidth() + "x" + p.previousHeight()
                    + " to " + p.width() + "x" + p.height());

    private static final EventBehavior<CanvasBackgroundChanged> CANVAS_BACKGROUND_CHANGED =
            EventBehavior.reversible(
                    CanvasBackgroundChanged.class,
                    (state, p) -> state.withBackgroundColor(p.backgroundColor()),
                    p -> new CanvasBackgroundChanged(p.canvasId(), p.previousColor(), p.backgroundColor()),
                    (state, p) -> p.backgroundColor() != null,
                    p -> "Changed background color from " + p.previousColor() + " to " + p.backgroundColor());

    private static final EventBehavior<DocumentLoaded> DOCUMENT_LOADED = EventBehavior.irreversible(
            DocumentLoaded.class,
            (state, p) -> CanvasState.blank(p.documentId())
                    .withSize(p.width(), p.height())
                    .withBackgroundColor(p.backgroundColor()),
            p -> "Load document \"" + p.name() + "\"");

    // ---------------------------------------------------------------- tools

    private static final EventBehavior<ToolActivated> TOOL_ACTIVATED = EventBehavior.irreversible(
            ToolActivated.class,
            (state, p) -> state.withActiveTool(p.toolId()),
            p -> "Activate " + p.toolId() + " tool");

    private static final EventBehavior<ToolOptionChanged> TOOL_OPTION_CHANGED = EventBehavior.reversible(
            ToolOptionChanged.class,
            (state, p) -> state.withToolOption(p.aggregateId(), p.value()),
            p -> new ToolOptionChanged(p.toolId(), p.optionId(), p.previousValue(), p.value()),
            (state, p) -> true,
            p -> "Change " + p.optionId() + " to " + p.value());

    // ---------------------------------------------------------------- workflows and history

    private static final EventBehavior<WorkflowStarted> WORKFLOW_STARTED = EventBehavior.tracking(
            WorkflowStarted.class, p -> "Start workflow: " + p.description());

    private static final EventBehavior<WorkflowCompleted> WORKFLOW_COMPLETED = EventBehavior.tracking(
            WorkflowCompleted.class, p -> "Complete workflow: " + (p.success() ? "Success" : "Failed"));

    private static final EventBehavior<WorkflowFailed> WORKFLOW_FAILED = EventBehavior.tracking(
            WorkflowFailed.class, p -> "Workflow failed: " + p.error());

    private static final EventBehavior<HistoryUndo> HISTORY_UNDO = EventBehavior.tracking(
            HistoryUndo.class, p -> "Undo event " + p.undoneEventId());

    private static final EventBehavior<HistoryRedo> HISTORY_REDO = EventBehavior.tracking(
            HistoryRedo.class, p -> "Redo event " + p.redoneEventId());

    /**
     * Returns the behaviour registered for an event type.
     */
    public static EventBehavior<? extends EventPayload> of(EventType type) {
        return switch (type) {
            case OBJECT_ADDED -> OBJECT_ADDED;
            case OBJECT_REMOVED -> OBJECT_REMOVED;
            case OBJECT_MODIFIED -> OBJECT_MODIFIED;
            case OBJECTS_BATCH_MODIFIED -> OBJECTS_BATCH_MODIFIED;
            case LAYER_CREATED -> LAYER_CREATED;
            case LAYER_REMOVED -> LAYER_REMOVED;
            case LAYER_MODIFIED -> LAYER_MODIFIED;
            case LAYERS_REORDERED -> LAYERS_REORDERED;
            case SELECTION_CHANGED -> SELECTION_CHANGED;
            case SELECTION_CLEARED -> SELECTION_CLEARED;
            case CANVAS_RESIZED -> CANVAS_RESIZED;
            case CANVAS_BACKGROUND_CHANGED -> CANVAS_BACKGROUND_CHANGED;
            case DOCUMENT_LOADED -> DOCUMENT_LOADED;
            case TOOL_ACTIVATED -> TOOL_ACTIVATED;
            case TOOL_OPTION_CHANGED -> TOOL_OPTION_CHANGED;
            case WORKFLOW_STARTED -> WORKFLOW_STARTED;
            case WORKFLOW_COMPLETED -> WORKFLOW_COMPLETED;
            case WORKFLOW_FAILED -> WORKFLOW_FAILED;
            case HISTORY_UNDO -> HISTORY_UNDO;
            case HISTORY_REDO -> HISTORY_REDO;
        };
    }

    /** Applies a payload to a state. Does not consult {@link #canApply}. */
    public static CanvasState apply(EventPayload payload, CanvasState state) {
        return of(payload.type()).applyTo(state, payload);
    }

    /**
     * Applies a payload only if its precondition holds.
     *
     * @throws EventStateException if {@code canApply} is false for this state
     */
    public static CanvasState applyStrict(EventPayload payload, CanvasState state) {
        if (!canApply(payload, state)) {
            throw new EventStateException(payload.type(), describe(payload));
        }
        return apply(payload, state);
    }

    public static Optional<EventPayload> reverse(EventPayload payload) {
        return of(payload.type()).reverseOf(payload);
    }

    public static boolean canApply(EventPayload payload, CanvasState state) {
        return of(payload.type()).canApplyTo(state, payload);
    }

    public static String describe(EventPayload payload) {
        return of(payload.type()).describe(payload);
    }

    private static CanvasState modifyObject(CanvasState state, String objectId, Map<String, Object> changes) {
        List<CanvasObject> objects = state.objects().stream()
                .map(o -> o.id().equals(objectId) ? o.withProperties(changes) : o)
                .toList();
        return state.withObjects(objects);
    }

    private static List<Layer> replaceLayer(List<Layer> layers, String layerId, UnaryOperator<Layer> change) {
        return layers.stream()
                .map(l -> l.id().equals(layerId) ? change.apply(l) : l)
                .toList();
    }

    /** Orders layers by {@code order}; layers not named keep their relative order at the end. */
    private static List<Layer> reorder(List<Layer> layers, List<String> order) {
        Map<String, Layer> byId = new LinkedHashMap<>();
        layers.forEach(l -> byId.put(l.id(), l));
        List<Layer> result = new ArrayList<>();
        for (String id : order) {
            Layer layer = byId.remove(id);
            if (layer != null) {
                result.add(layer);
            }
        }
        result.addAll(byId.values());
        return Collections.unmodifiableList(result);
    }

    private static Set<String> layerIds(CanvasState state) {
        Set<String> ids = new HashSet<>();
        state.layers().forEach(l -> ids.add(l.id()));
        return ids;
    }
}
