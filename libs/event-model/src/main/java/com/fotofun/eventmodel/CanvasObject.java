package com.fotofun.eventmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * Description of one object on the canvas, as carried by event payloads.
 * The canvas layer owns the live object; this is the value the core reasons about.
 *
 * @param id         stable object id
 * @param type       object kind ({@code image}, {@code text}, {@code path}, ...)
 * @param layerId    owning layer (nullable)
 * @param properties free-form visual properties
 */
public record CanvasObject(String id, String type, String layerId, Map<String, Object> properties) {

    public CanvasObject {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        type = type == null ? "object" : type;
        properties = PropertyMaps.freeze(properties);
    }

    public static CanvasObject of(String id, String type) {
        return new CanvasObject(id, type, null, Map.of());
    }

    @JsonIgnore
    public boolean isImage() {
        return "image".equals(type);
    }

    /** Returns a copy with {@code changes} merged in; {@code null} values remove keys. */
    public CanvasObject withProperties(Map<String, Object> changes) {
        return new CanvasObject(id, type, layerId, PropertyMaps.merge(properties, changes));
    }
}
