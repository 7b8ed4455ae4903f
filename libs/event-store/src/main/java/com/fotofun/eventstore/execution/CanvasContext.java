package com.fotofun.eventstore.execution;

import com.fotofun.eventmodel.CanvasObject;

import java.util.List;
import java.util.Set;

/**
 * What a tool needs to know about the canvas when it runs inside an execution context.
 *
 * @param targetImages      images from the frozen selection that still exist
 * @param targetingMode     how the targets were chosen
 * @param width             canvas width
 * @param height            canvas height
 * @param selectedObjectIds the canvas selection at the time the context was read
 */
public record CanvasContext(
        List<CanvasObject> targetImages,
        TargetingMode targetingMode,
        int width,
        int height,
        Set<String> selectedObjectIds) {

    public CanvasContext {
        targetImages = List.copyOf(targetImages);
        selectedObjectIds = Set.copyOf(selectedObjectIds);
    }
}
