package com.fotofun.eventmodel;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable record of one state change in the editor.
 *
 * <p>Events are created by tool and workflow code (usually through {@link EventFactory}),
 * buffered by an execution context and become permanent once appended to the store.
 * The store assigns {@link #version()}; until then it is {@link #UNVERSIONED}.
 *
 * @param id            unique event id (UUID)
 * @param timestamp     creation time
 * @param aggregateId   aggregate instance the event changes
 * @param aggregateType aggregate group, always {@code payload.type().aggregateType()}
 * @param userId        authenticated user (nullable)
 * @param sessionId     editor session that produced the event
 * @param version       1-based position within the aggregate's history, assigned at append
 * @param metadata      correlation and audit metadata
 * @param payload       per-kind data
 */
public record Event(
        String id,
        Instant timestamp,
        String aggregateId,
        AggregateType aggregateType,
        String userId,
        String sessionId,
        int version,
        EventMetadata metadata,
        EventPayload payload) {

    /** Version carried by events that have not been appended yet. */
    public static final int UNVERSIONED = 0;

    /** The canonical type string, e.g. {@code canvas.object.added}. */
    public String type() {
        return payload.type().value();
    }

    public EventType eventType() {
        return payload.type();
    }

    /**
     * Produces the state after this event. Pure: {@code state} is left untouched.
     */
    public CanvasState apply(CanvasState state) {
        return EventBehaviors.apply(payload, state);
    }

    /**
     * Returns the event that undoes this one, or empty when the event is irreversible.
     * The reverse event is new (fresh id and timestamp) and carries this event's metadata.
     */
    public Optional<Event> reverse() {
        return EventBehaviors.reverse(payload).map(reversed -> EventFactory.reverseOf(this, reversed));
    }

    /** Advisory precondition check. */
    public boolean canApply(CanvasState state) {
        return EventBehaviors.canApply(payload, state);
    }

    /** Human-readable audit label. */
    public String description() {
        return EventBehaviors.describe(payload);
    }

    public Event withVersion(int newVersion) {
        return new Event(id, timestamp, aggregateId, aggregateType, userId, sessionId, newVersion, metadata, payload);
    }

    public Event withMetadata(EventMetadata newMetadata) {
        return new Event(id, timestamp, aggregateId, aggregateType, userId, sessionId, version, newMetadata, payload);
    }
}
