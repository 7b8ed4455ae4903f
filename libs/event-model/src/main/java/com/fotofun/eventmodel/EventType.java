package com.fotofun.eventmodel;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * All known event kinds of the editor.
 *
 * <p>This enum is the tag of the {@link EventPayload} sum type. Each constant names the
 * canonical wire string, the aggregate the event belongs to, and the payload record used
 * to read its {@code data} block back from JSON. Behaviour per kind lives in
 * {@link EventBehaviors}, which switches over this enum exhaustively.
 */
public enum EventType {

    // ---- Canvas object events ----
    OBJECT_ADDED("canvas.object.added", AggregateType.CANVAS, EventPayload.ObjectAdded.class),
    OBJECT_REMOVED("canvas.object.removed", AggregateType.CANVAS, EventPayload.ObjectRemoved.class),
    OBJECT_MODIFIED("canvas.object.modified", AggregateType.CANVAS, EventPayload.ObjectModified.class),
    OBJECTS_BATCH_MODIFIED("canvas.objects.batch.modified", AggregateType.CANVAS,
            EventPayload.ObjectsBatchModified.class),

    // ---- Layer events ----
    LAYER_CREATED("layer.created", AggregateType.LAYER, EventPayload.LayerCreated.class),
    LAYER_REMOVED("layer.removed", AggregateType.LAYER, EventPayload.LayerRemoved.class),
    LAYER_MODIFIED("layer.modified", AggregateType.LAYER, EventPayload.LayerModified.class),
    LAYERS_REORDERED("layers.reordered", AggregateType.CANVAS, EventPayload.LayersReordered.class),

    // ---- Selection events ----
    SELECTION_CHANGED("selection.changed", AggregateType.SELECTION, EventPayload.SelectionChanged.class),
    SELECTION_CLEARED("selection.cleared", AggregateType.SELECTION, EventPayload.SelectionCleared.class),

    // ---- Canvas / document events ----
    CANVAS_RESIZED("canvas.resized", AggregateType.CANVAS, EventPayload.CanvasResized.class),
    CANVAS_BACKGROUND_CHANGED("canvas.background.changed", AggregateType.CANVAS,
            EventPayload.CanvasBackgroundChanged.class),
    DOCUMENT_LOADED("document.loaded", AggregateType.CANVAS, EventPayload.DocumentLoaded.class),

    // ---- Tool events ----
    TOOL_ACTIVATED("tool.activated", AggregateType.TOOL, EventPayload.ToolActivated.class),
    TOOL_OPTION_CHANGED("tool.option.changed", AggregateType.TOOL, EventPayload.ToolOptionChanged.class),

    // ---- Workflow events ----
    WORKFLOW_STARTED("workflow.started", AggregateType.WORKFLOW, EventPayload.WorkflowStarted.class),
    WORKFLOW_COMPLETED("workflow.completed", AggregateType.WORKFLOW, EventPayload.WorkflowCompleted.class),
    WORKFLOW_FAILED("workflow.failed", AggregateType.WORKFLOW, EventPayload.WorkflowFailed.class),

    // ---- History bookkeeping ----
    HISTORY_UNDO("history.undo", AggregateType.WORKFLOW, EventPayload.HistoryUndo.class),
    HISTORY_REDO("history.redo", AggregateType.WORKFLOW, EventPayload.HistoryRedo.class);

    /** Prefix shared by the bookkeeping events that history tracking ignores. */
    public static final String HISTORY_PREFIX = "history.";

    private final String value;
    private final AggregateType aggregateType;
    private final Class<? extends EventPayload> payloadClass;

    EventType(String value, AggregateType aggregateType, Class<? extends EventPayload> payloadClass) {
        this.value = value;
        this.aggregateType = aggregateType;
        this.payloadClass = payloadClass;
    }

    /** The canonical string representation used in JSON (e.g. "canvas.object.added"). */
    @JsonValue
    public String value() {
        return value;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public Class<? extends EventPayload> payloadClass() {
        return payloadClass;
    }

    /** True for {@code history.*} bookkeeping events. */
    public boolean isHistoryEvent() {
        return value.startsWith(HISTORY_PREFIX);
    }

    /**
     * Looks up an event type by its canonical string value.
     *
     * @param value the string value (e.g. "layer.created")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
