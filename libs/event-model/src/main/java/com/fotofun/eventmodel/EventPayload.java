package com.fotofun.eventmodel;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-kind data of an {@link Event}: the {@code data} block of the wire format.
 * <p>
 * This is a closed sum type. Each record is tagged by {@link #type()}; all behaviour
 * (apply, reverse, precondition, description) is looked up in {@link EventBehaviors}.
 * Payloads only know which aggregate they target.
 */
public sealed interface EventPayload {

    /** The tag of this payload. */
    EventType type();

    /** Id of the aggregate instance this payload changes. */
    String aggregateId();

    // ---------------------------------------------------------------- canvas objects

    /**
     * An object was added to the canvas.
     *
     * @param index z-order position, or {@code null} to append on top
     */
    record ObjectAdded(String canvasId, CanvasObject object, Integer index) implements EventPayload {
        public ObjectAdded {
            requireId(canvasId, "canvasId");
            requireValue(object, "object");
        }

        @Override
        public EventType type() {
            return EventType.OBJECT_ADDED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    /**
     * An object was removed from the canvas.
     *
     * @param index z-order position the object held, used to restore it on reversal
     */
    record ObjectRemoved(String canvasId, CanvasObject object, Integer index) implements EventPayload {
        public ObjectRemoved {
            requireId(canvasId, "canvasId");
            requireValue(object, "object");
        }

        @Override
        public EventType type() {
            return EventType.OBJECT_REMOVED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    /** Object properties changed from {@code previousState} to {@code newState}. */
    record ObjectModified(String canvasId, String objectId,
                          Map<String, Object> previousState,
                          Map<String, Object> newState) implements EventPayload {
        public ObjectModified {
            requireId(canvasId, "canvasId");
            requireId(objectId, "objectId");
            previousState = PropertyMaps.freeze(previousState);
            newState = PropertyMaps.freeze(newState);
        }

        @Override
        public EventType type() {
            return EventType.OBJECT_MODIFIED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    /** One entry of a batch modification. */
    record ObjectModification(String objectId, Map<String, Object> previousState,
                              Map<String, Object> newState) {
        public ObjectModification {
            requireId(objectId, "objectId");
            previousState = PropertyMaps.freeze(previousState);
            newState = PropertyMaps.freeze(newState);
        }
    }

    /** Several objects changed as one step (multi-selection transform, batch filter). */
    record ObjectsBatchModified(String canvasId, List<ObjectModification> modifications)
            implements EventPayload {
        public ObjectsBatchModified {
            requireId(canvasId, "canvasId");
            modifications = modifications == null ? List.of() : List.copyOf(modifications);
        }

        @Override
        public EventType type() {
            return EventType.OBJECTS_BATCH_MODIFIED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    // ---------------------------------------------------------------- layers

    record LayerCreated(Layer layer, Integer index) implements EventPayload {
        public LayerCreated {
            requireValue(layer, "layer");
        }

        @Override
        public EventType type() {
            return EventType.LAYER_CREATED;
        }

        @Override
        public String aggregateId() {
            return layer.id();
        }
    }

    record LayerRemoved(Layer layer, Integer index) implements EventPayload {
        public LayerRemoved {
            requireValue(layer, "layer");
        }

        @Override
        public EventType type() {
            return EventType.LAYER_REMOVED;
        }

        @Override
        public String aggregateId() {
            return layer.id();
        }
    }

    record LayerModified(String layerId, Map<String, Object> modifications,
                         Map<String, Object> previousState) implements EventPayload {
        public LayerModified {
            requireId(layerId, "layerId");
            modifications = PropertyMaps.freeze(modifications);
            previousState = PropertyMaps.freeze(previousState);
        }

        @Override
        public EventType type() {
            return EventType.LAYER_MODIFIED;
        }

        @Override
        public String aggregateId() {
            return layerId;
        }
    }

    record LayersReordered(String canvasId, List<String> layerIds, List<String> previousOrder)
            implements EventPayload {
        public LayersReordered {
            requireId(canvasId, "canvasId");
            layerIds = layerIds == null ? List.of() : List.copyOf(layerIds);
            previousOrder = previousOrder == null ? List.of() : List.copyOf(previousOrder);
        }

        @Override
        public EventType type() {
            return EventType.LAYERS_REORDERED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    // ---------------------------------------------------------------- selection

    record SelectionChanged(String canvasId, Set<String> selection, Set<String> previousSelection)
            implements EventPayload {
        public SelectionChanged {
            requireId(canvasId, "canvasId");
            selection = selection == null ? Set.of() : Set.copyOf(selection);
            previousSelection = previousSelection == null ? Set.of() : Set.copyOf(previousSelection);
        }

        @Override
        public EventType type() {
            return EventType.SELECTION_CHANGED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    record SelectionCleared(String canvasId, Set<String> previousSelection) implements EventPayload {
        public SelectionCleared {
            requireId(canvasId, "canvasId");
            previousSelection = previousSelection == null ? Set.of() : Set.copyOf(previousSelection);
        }

        @Override
        public EventType type() {
            return EventType.SELECTION_CLEARED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    // ---------------------------------------------------------------- canvas / document

    record CanvasResized(String canvasId, int width, int height, int previousWidth, int previousHeight)
            implements EventPayload {
        public CanvasResized {
            requireId(canvasId, "canvasId");
        }

        @Override
        public EventType type() {
            return EventType.CANVAS_RESIZED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    record CanvasBackgroundChanged(String canvasId, String backgroundColor, String previousColor)
            implements EventPayload {
        public CanvasBackgroundChanged {
            requireId(canvasId, "canvasId");
        }

        @Override
        public EventType type() {
            return EventType.CANVAS_BACKGROUND_CHANGED;
        }

        @Override
        public String aggregateId() {
            return canvasId;
        }
    }

    /** A document replaced the canvas contents. Cannot be undone. */
    record DocumentLoaded(String documentId, String name, int width, int height, String backgroundColor)
            implements EventPayload {
        public DocumentLoaded {
            requireId(documentId, "documentId");
        }

        @Override
        public EventType type() {
            return EventType.DOCUMENT_LOADED;
        }

        @Override
        public String aggregateId() {
            return documentId;
        }
    }

    // ---------------------------------------------------------------- tools

    record ToolActivated(String toolId, String previousToolId) implements EventPayload {
        public ToolActivated {
            requireId(toolId, "toolId");
        }

        @Override
        public EventType type() {
            return EventType.TOOL_ACTIVATED;
        }

        @Override
        public String aggregateId() {
            return toolId;
        }
    }

    record ToolOptionChanged(String toolId, String optionId, Object value, Object previousValue)
            implements EventPayload {
        public ToolOptionChanged {
            requireId(toolId, "toolId");
            requireId(optionId, "optionId");
        }

        @Override
        public EventType type() {
            return EventType.TOOL_OPTION_CHANGED;
        }

        /** Each option is its own aggregate: {@code toolId.optionId}. */
        @Override
        public String aggregateId() {
            return toolId + "." + optionId;
        }
    }

    // ---------------------------------------------------------------- workflows

    record WorkflowStarted(String workflowId, String description, List<String> steps)
            implements EventPayload {
        public WorkflowStarted {
            requireId(workflowId, "workflowId");
            steps = steps == null ? List.of() : List.copyOf(steps);
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_STARTED;
        }

        @Override
        public String aggregateId() {
            return workflowId;
        }
    }

    record WorkflowCompleted(String workflowId, boolean success, int resultCount) implements EventPayload {
        public WorkflowCompleted {
            requireId(workflowId, "workflowId");
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_COMPLETED;
        }

        @Override
        public String aggregateId() {
            return workflowId;
        }
    }

    record WorkflowFailed(String workflowId, String error) implements EventPayload {
        public WorkflowFailed {
            requireId(workflowId, "workflowId");
        }

        @Override
        public EventType type() {
            return EventType.WORKFLOW_FAILED;
        }

        @Override
        public String aggregateId() {
            return workflowId;
        }
    }

    // ---------------------------------------------------------------- history

    record HistoryUndo(String undoneEventId) implements EventPayload {
        public HistoryUndo {
            requireId(undoneEventId, "undoneEventId");
        }

        @Override
        public EventType type() {
            return EventType.HISTORY_UNDO;
        }

        @Override
        public String aggregateId() {
            return undoneEventId;
        }
    }

    record HistoryRedo(String redoneEventId) implements EventPayload {
        public HistoryRedo {
            requireId(redoneEventId, "redoneEventId");
        }

        @Override
        public EventType type() {
            return EventType.HISTORY_REDO;
        }

        @Override
        public String aggregateId() {
            return redoneEventId;
        }
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    private static void requireValue(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
