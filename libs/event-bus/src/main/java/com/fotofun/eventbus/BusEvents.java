package com.fotofun.eventbus;

import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.EventPayload.ObjectModification;
import com.fotofun.eventmodel.Layer;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalogue of UI channels and the message records they carry.
 * <p>
 * Messages are shaped for panels and toolbars, not for replay: a removal names the
 * object id only, a resize carries plain numbers.
 */
public final class BusEvents {

    private BusEvents() {
        // utility class
    }

    // ---------------------------------------------------------------- canvas objects

    public record ObjectAddedMessage(String canvasId, CanvasObject object, String layerId) {
    }

    public record ObjectModifiedMessage(String canvasId, String objectId,
                                        Map<String, Object> previousState, Map<String, Object> newState) {
    }

    public record ObjectRemovedMessage(String canvasId, String objectId) {
    }

    public record ObjectsBatchModifiedMessage(String canvasId, List<ObjectModification> modifications) {
    }

    public static final BusEventType<ObjectAddedMessage> OBJECT_ADDED =
            BusEventType.of("canvas.object.added", ObjectAddedMessage.class);
    public static final BusEventType<ObjectModifiedMessage> OBJECT_MODIFIED =
            BusEventType.of("canvas.object.modified", ObjectModifiedMessage.class);
    public static final BusEventType<ObjectRemovedMessage> OBJECT_REMOVED =
            BusEventType.of("canvas.object.removed", ObjectRemovedMessage.class);
    public static final BusEventType<ObjectsBatchModifiedMessage> OBJECTS_BATCH_MODIFIED =
            BusEventType.of("canvas.objects.batch.modified", ObjectsBatchModifiedMessage.class);

    // ---------------------------------------------------------------- layers

    public record LayerCreatedMessage(Layer layer) {
    }

    public record LayerRemovedMessage(String layerId) {
    }

    public record LayerModifiedMessage(String layerId, Map<String, Object> modifications) {
    }

    public record LayersReorderedMessage(List<String> layerIds, List<String> previousOrder) {
    }

    public static final BusEventType<LayerCreatedMessage> LAYER_CREATED =
            BusEventType.of("layer.created", LayerCreatedMessage.class);
    public static final BusEventType<LayerRemovedMessage> LAYER_REMOVED =
            BusEventType.of("layer.removed", LayerRemovedMessage.class);
    public static final BusEventType<LayerModifiedMessage> LAYER_MODIFIED =
            BusEventType.of("layer.modified", LayerModifiedMessage.class);
    public static final BusEventType<LayersReorderedMessage> LAYER_REORDERED =
            BusEventType.of("layer.reordered", LayersReorderedMessage.class);

    // ---------------------------------------------------------------- selection

    public record SelectionChangedMessage(Set<String> selection, Set<String> previousSelection) {
    }

    public record SelectionClearedMessage(Set<String> previousSelection) {
    }

    public static final BusEventType<SelectionChangedMessage> SELECTION_CHANGED =
            BusEventType.of("selection.changed", SelectionChangedMessage.class);
    public static final BusEventType<SelectionClearedMessage> SELECTION_CLEARED =
            BusEventType.of("selection.cleared", SelectionClearedMessage.class);

    // ---------------------------------------------------------------- canvas state

    public record CanvasResizedMessage(int width, int height, int previousWidth, int previousHeight) {
    }

    public record BackgroundChangedMessage(String backgroundColor, String previousColor) {
    }

    public static final BusEventType<CanvasResizedMessage> CANVAS_RESIZED =
            BusEventType.of("canvas.resized", CanvasResizedMessage.class);
    public static final BusEventType<BackgroundChangedMessage> CANVAS_BACKGROUND_CHANGED =
            BusEventType.of("canvas.background.changed", BackgroundChangedMessage.class);

    // ---------------------------------------------------------------- tools

    public record ToolActivatedMessage(String toolId, String previousToolId) {
    }

    public record ToolOptionChangedMessage(String toolId, String optionId, Object value, Object previousValue) {
    }

    public static final BusEventType<ToolActivatedMessage> TOOL_ACTIVATED =
            BusEventType.of("tool.activated", ToolActivatedMessage.class);
    public static final BusEventType<ToolOptionChangedMessage> TOOL_OPTION_CHANGED =
            BusEventType.of("tool.option.changed", ToolOptionChangedMessage.class);

    // ---------------------------------------------------------------- workflows

    public record WorkflowStartedMessage(String workflowId, String name) {
    }

    public record WorkflowCompletedMessage(String workflowId, boolean success, int resultCount) {
    }

    public record WorkflowFailedMessage(String workflowId, String error) {
    }

    public static final BusEventType<WorkflowStartedMessage> WORKFLOW_STARTED =
            BusEventType.of("workflow.started", WorkflowStartedMessage.class);
    public static final BusEventType<WorkflowCompletedMessage> WORKFLOW_COMPLETED =
            BusEventType.of("workflow.completed", WorkflowCompletedMessage.class);
    public static final BusEventType<WorkflowFailedMessage> WORKFLOW_FAILED =
            BusEventType.of("workflow.failed", WorkflowFailedMessage.class);

    // ---------------------------------------------------------------- history

    /** An undo or redo; {@code eventId} is the event that was undone or redone. */
    public record HistoryStepMessage(String eventId) {
    }

    /**
     * Undo/redo availability after any history change.
     *
     * @param currentEventId newest event on the undo stack, or null
     */
    public record HistoryStateMessage(boolean canUndo, boolean canRedo, int undoCount, int redoCount,
                                      String currentEventId) {
    }

    /** Completed time travel to {@code targetEventId}; {@code steps} is negative when undoing. */
    public record HistoryNavigatedMessage(String targetEventId, int steps) {
    }

    /** A named snapshot was created, loaded or deleted. */
    public record SnapshotMessage(String snapshotId, String name, String eventId) {
    }

    public static final BusEventType<HistoryStepMessage> HISTORY_UNDO =
            BusEventType.of("history.undo", HistoryStepMessage.class);
    public static final BusEventType<HistoryStepMessage> HISTORY_REDO =
            BusEventType.of("history.redo", HistoryStepMessage.class);
    public static final BusEventType<HistoryStateMessage> HISTORY_STATE_CHANGED =
            BusEventType.of("history.state.changed", HistoryStateMessage.class);
    public static final BusEventType<HistoryNavigatedMessage> HISTORY_NAVIGATED =
            BusEventType.of("history.navigated", HistoryNavigatedMessage.class);
    public static final BusEventType<SnapshotMessage> SNAPSHOT_CREATED =
            BusEventType.of("history.snapshot.created", SnapshotMessage.class);
    public static final BusEventType<SnapshotMessage> SNAPSHOT_LOADED =
            BusEventType.of("history.snapshot.loaded", SnapshotMessage.class);
    public static final BusEventType<SnapshotMessage> SNAPSHOT_DELETED =
            BusEventType.of("history.snapshot.deleted", SnapshotMessage.class);
}
