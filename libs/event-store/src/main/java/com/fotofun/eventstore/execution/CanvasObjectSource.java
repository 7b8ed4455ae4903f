package com.fotofun.eventstore.execution;

import com.fotofun.eventmodel.CanvasObject;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the canvas layer. The event core reads objects and the current
 * selection through it and never mutates the canvas.
 */
public interface CanvasObjectSource {

    String canvasId();

    /** Objects in z-order. */
    List<CanvasObject> objects();

    Set<String> selectedObjectIds();

    int width();

    int height();

    default Optional<CanvasObject> findObject(String objectId) {
        return objects().stream().filter(o -> o.id().equals(objectId)).findFirst();
    }
}
