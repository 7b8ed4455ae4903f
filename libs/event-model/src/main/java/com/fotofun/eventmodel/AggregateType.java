package com.fotofun.eventmodel;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** Entity groups whose histories are versioned independently. */
public enum AggregateType {
    CANVAS("canvas"),
    LAYER("layer"),
    SELECTION("selection"),
    TOOL("tool"),
    WORKFLOW("workflow");

    private final String value;

    AggregateType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Looks up an aggregate type by its canonical string.
     */
    public static Optional<AggregateType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
