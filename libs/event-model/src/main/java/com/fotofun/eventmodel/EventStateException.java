package com.fotofun.eventmodel;

/**
 * Thrown by strict application when an event's precondition does not hold for the
 * state it is applied to. The store itself never raises this.
 */
public class EventStateException extends RuntimeException {

    private final EventType eventType;

    public EventStateException(EventType eventType, String description) {
        super("Event " + eventType.value() + " cannot be applied: " + description);
        this.eventType = eventType;
    }

    public EventType eventType() {
        return eventType;
    }
}
