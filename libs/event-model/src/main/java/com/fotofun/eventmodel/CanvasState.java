package com.fotofun.eventmodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the document state that events are applied to.
 * <p>
 * Every {@code with*} method returns a new instance; event application never mutates
 * the state it is given.
 *
 * @param canvasId          document / canvas id
 * @param width             canvas width in pixels
 * @param height            canvas height in pixels
 * @param backgroundColor   background colour
 * @param objects           objects in z-order (bottom first)
 * @param layers            layers in z-order (bottom first)
 * @param selectedObjectIds currently selected object ids
 * @param activeToolId      active tool (nullable)
 * @param toolOptions       tool option values keyed by {@code toolId.optionId}
 */
public record CanvasState(
        String canvasId,
        int width,
        int height,
        String backgroundColor,
        List<CanvasObject> objects,
        List<Layer> layers,
        Set<String> selectedObjectIds,
        String activeToolId,
        Map<String, Object> toolOptions) {

    public static final int DEFAULT_WIDTH = 1920;
    public static final int DEFAULT_HEIGHT = 1080;
    public static final String DEFAULT_BACKGROUND = "#ffffff";

    public CanvasState {
        objects = objects == null ? List.of() : List.copyOf(objects);
        layers = layers == null ? List.of() : List.copyOf(layers);
        selectedObjectIds = selectedObjectIds == null ? Set.of() : Set.copyOf(selectedObjectIds);
        toolOptions = PropertyMaps.freeze(toolOptions);
    }

    /** An empty canvas of the default size. */
    public static CanvasState blank(String canvasId) {
        return new CanvasState(canvasId, DEFAULT_WIDTH, DEFAULT_HEIGHT, DEFAULT_BACKGROUND,
                List.of(), List.of(), Set.of(), null, Map.of());
    }

    public Optional<CanvasObject> findObject(String objectId) {
        return objects.stream().filter(o -> o.id().equals(objectId)).findFirst();
    }

    public boolean hasObject(String objectId) {
        return findObject(objectId).isPresent();
    }

    /** Position of the object in z-order, or -1. */
    public int indexOfObject(String objectId) {
        for (int i = 0; i < objects.size(); i++) {
            if (objects.get(i).id().equals(objectId)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Layer> findLayer(String layerId) {
        return layers.stream().filter(l -> l.id().equals(layerId)).findFirst();
    }

    public int indexOfLayer(String layerId) {
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i).id().equals(layerId)) {
                return i;
            }
        }
        return -1;
    }

    public CanvasState withObjects(List<CanvasObject> newObjects) {
        return new CanvasState(canvasId, width, height, backgroundColor, newObjects, layers,
                selectedObjectIds, activeToolId, toolOptions);
    }

    public CanvasState withLayers(List<Layer> newLayers) {
        return new CanvasState(canvasId, width, height, backgroundColor, objects, newLayers,
                selectedObjectIds, activeToolId, toolOptions);
    }

    public CanvasState withSelection(Set<String> selection) {
        return new CanvasState(canvasId, width, height, backgroundColor, objects, layers,
                selection, activeToolId, toolOptions);
    }

    public CanvasState withSize(int newWidth, int newHeight) {
        return new CanvasState(canvasId, newWidth, newHeight, backgroundColor, objects, layers,
                selectedObjectIds, activeToolId, toolOptions);
    }

    public CanvasState withBackgroundColor(String color) {
        return new CanvasState(canvasId, width, height, color, objects, layers,
                selectedObjectIds, activeToolId, toolOptions);
    }

    public CanvasState withActiveTool(String toolId) {
        return new CanvasState(canvasId, width, height, backgroundColor, objects, layers,
                selectedObjectIds, toolId, toolOptions);
    }

    /** Sets (or, for a {@code null} value, removes) one tool option. */
    public CanvasState withToolOption(String key, Object value) {
        var options = new LinkedHashMap<>(toolOptions);
        if (value == null) {
            options.remove(key);
        } else {
            options.put(key, value);
        }
        return new CanvasState(canvasId, width, height, backgroundColor, objects, layers,
                selectedObjectIds, activeToolId, Collections.unmodifiableMap(options));
    }

    /** Inserts at {@code index}, or appends when the index is null or out of range. */
    static <T> List<T> insertAt(List<T> list, T item, Integer index) {
        var copy = new ArrayList<>(list);
        if (index == null || index < 0 || index > copy.size()) {
            copy.add(item);
        } else {
            copy.add(index, item);
        }
        return copy;
    }
}
