package com.fotofun.eventmodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the free-form property maps carried by objects, layers and
 * modification events. A {@code null} value in a change set removes the key.
 */
final class PropertyMaps {

    private PropertyMaps() {
        // utility class
    }

    static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> changes) {
        var merged = new LinkedHashMap<>(base);
        changes.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return Collections.unmodifiableMap(merged);
    }
}
