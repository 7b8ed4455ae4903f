package com.fotofun.eventstore.execution;

import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventstore.EventStore;

import java.util.List;

/**
 * Creates execution contexts bound to a canvas and a frozen selection.
 */
public final class ExecutionContextFactory {

    private ExecutionContextFactory() {
        // utility class
    }

    /** Context targeting the objects currently selected on the canvas. */
    public static ExecutionContext fromCanvas(CanvasObjectSource canvas, EventStore store, EventSource source,
                                              String workflowId) {
        return fromSnapshot(canvas, SelectionSnapshot.fromCanvas(canvas), store, source, workflowId);
    }

    /** Context targeting an explicit list of objects. */
    public static ExecutionContext fromSelection(CanvasObjectSource canvas, List<CanvasObject> objects,
                                                 EventStore store, EventSource source, String workflowId) {
        return fromSnapshot(canvas, SelectionSnapshot.of(objects), store, source, workflowId);
    }

    /** Context reusing a selection captured earlier. */
    public static ExecutionContext fromSnapshot(CanvasObjectSource canvas, SelectionSnapshot snapshot,
                                                EventStore store, EventSource source, String workflowId) {
        return ExecutionContext.builder(store, canvas.canvasId())
                .source(source)
                .workflowId(workflowId)
                .selection(snapshot)
                .build();
    }
}
