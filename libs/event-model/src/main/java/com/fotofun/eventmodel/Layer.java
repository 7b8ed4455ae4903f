package com.fotofun.eventmodel;

import java.util.Map;

/**
 * A layer of the document.
 *
 * @param id         stable layer id
 * @param name       display name
 * @param properties visibility, opacity, blend mode and similar settings
 */
public record Layer(String id, String name, Map<String, Object> properties) {

    public Layer {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        properties = PropertyMaps.freeze(properties);
    }

    public static Layer of(String id, String name) {
        return new Layer(id, name, Map.of());
    }

    public Layer withProperties(Map<String, Object> changes) {
        return new Layer(id, name, PropertyMaps.merge(properties, changes));
    }
}
