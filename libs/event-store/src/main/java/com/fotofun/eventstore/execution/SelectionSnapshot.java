package com.fotofun.eventstore.execution;

import com.fotofun.eventmodel.CanvasObject;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Frozen set of target objects captured when an execution context is created.
 * <p>
 * Later selection changes on the canvas do not affect it, so every step of a workflow
 * works on the same targets.
 */
public final class SelectionSnapshot {

    public static final String IMAGE_TYPE = "image";

    private final String id;
    private final Instant createdAt;
    private final List<CanvasObject> objects;
    private final Set<String> objectIds;
    private final Set<String> types;

    private SelectionSnapshot(List<CanvasObject> objects) {
        this.id = UUID.randomUUID().toString();
        this.createdAt = Instant.now();
        this.objects = List.copyOf(objects);
        var ids = new LinkedHashSet<String>();
        var kinds = new LinkedHashSet<String>();
        for (CanvasObject object : objects) {
            ids.add(object.id());
            kinds.add(object.type());
        }
        this.objectIds = Set.copyOf(ids);
        this.types = Set.copyOf(kinds);
    }

    public static SelectionSnapshot empty() {
        return new SelectionSnapshot(List.of());
    }

    public static SelectionSnapshot of(List<CanvasObject> objects) {
        return new SelectionSnapshot(objects == null ? List.of() : objects);
    }

    /** Captures the objects currently selected on the canvas, in z-order. */
    public static SelectionSnapshot fromCanvas(CanvasObjectSource canvas) {
        Set<String> selected = canvas.selectedObjectIds();
        return new SelectionSnapshot(canvas.objects().stream()
                .filter(o -> selected.contains(o.id()))
                .toList());
    }

    /**
     * Captures the current selection, or every object of {@code fallbackType} when
     * nothing is selected.
     */
    public static SelectionSnapshot fromCanvasWithFallback(CanvasObjectSource canvas, String fallbackType) {
        SelectionSnapshot selection = fromCanvas(canvas);
        if (!selection.isEmpty() || fallbackType == null) {
            return selection;
        }
        return new SelectionSnapshot(canvas.objects().stream()
                .filter(o -> fallbackType.equals(o.type()))
                .toList());
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<CanvasObject> objects() {
        return objects;
    }

    public Set<String> objectIds() {
        return objectIds;
    }

    public Set<String> types() {
        return types;
    }

    public boolean isEmpty() {
        return objects.isEmpty();
    }

    public int count() {
        return objects.size();
    }

    public boolean contains(String objectId) {
        return objectIds.contains(objectId);
    }

    public List<CanvasObject> getObjectsByType(String type) {
        return objects.stream().filter(o -> type.equals(o.type())).toList();
    }

    public List<CanvasObject> getImages() {
        return getObjectsByType(IMAGE_TYPE);
    }

    /** Snapshot objects that still exist on the canvas, in their current state. */
    public List<CanvasObject> getValidObjects(CanvasObjectSource canvas) {
        return objects.stream()
                .map(o -> canvas.findObject(o.id()))
                .flatMap(Optional::stream)
                .toList();
    }

    /** True when every captured object still exists on the canvas. */
    public boolean verifyIntegrity(CanvasObjectSource canvas) {
        return objects.stream().allMatch(o -> canvas.findObject(o.id()).isPresent());
    }

    @Override
    public String toString() {
        return "SelectionSnapshot[" + id + ", " + objects.size() + " objects]";
    }
}
