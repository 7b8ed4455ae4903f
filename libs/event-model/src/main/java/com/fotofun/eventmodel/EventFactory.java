package com.fotofun.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link Event} instances.
 * <p>
 * Encapsulates default value logic (UUID generation, current timestamp, aggregate
 * derivation from the payload, unassigned version) so callers don't repeat boilerplate.
 */
public final class EventFactory {

    /** Session id used when the caller runs outside an interactive editor session. */
    public static final String DEFAULT_SESSION_ID = "server-session";

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a new, unversioned event in the default session.
     */
    public static Event create(EventPayload payload, EventMetadata metadata) {
        return create(payload, metadata, DEFAULT_SESSION_ID, null, Instant.now());
    }

    /**
     * Creates a new event with an explicit session and user.
     */
    public static Event create(EventPayload payload, EventMetadata metadata, String sessionId, String userId) {
        return create(payload, metadata, sessionId, userId, Instant.now());
    }

    /**
     * Creates a new event with an explicit timestamp (replays, imports and tests).
     */
    public static Event create(EventPayload payload, EventMetadata metadata, String sessionId, String userId,
                               Instant timestamp) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        return new Event(
                UUID.randomUUID().toString(),
                timestamp,
                payload.aggregateId(),
                payload.type().aggregateType(),
                userId,
                sessionId,
                Event.UNVERSIONED,
                metadata == null ? EventMetadata.of(EventSource.SYSTEM) : metadata,
                payload);
    }

    /**
     * Creates a child event that inherits correlation context from a parent event.
     * The child's causationId is set to the parent's id.
     */
    public static Event createChild(Event parent, EventPayload payload) {
        EventMetadata metadata = parent.metadata().withCausationId(parent.id());
        return create(payload, metadata, parent.sessionId(), parent.userId(), Instant.now());
    }

    /**
     * Creates the event that undoes {@code original}, carrying the original's metadata.
     */
    static Event reverseOf(Event original, EventPayload reversed) {
        return create(reversed, original.metadata(), original.sessionId(), original.userId(), Instant.now());
    }
}
