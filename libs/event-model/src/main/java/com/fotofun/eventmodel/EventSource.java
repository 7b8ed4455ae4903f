package com.fotofun.eventmodel;

import com.fasterxml.jackson.annotation.JsonValue;

/** Who originated an event. */
public enum EventSource {
    USER("user"),
    AI("ai"),
    SYSTEM("system");

    private final String value;

    EventSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
