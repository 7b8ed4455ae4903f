package com.fotofun.history;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A named checkpoint pointing at one event of the history.
 *
 * @param id          snapshot id
 * @param name        display name
 * @param description optional free text
 * @param eventId     event that was current when the snapshot was taken
 * @param timestamp   creation time
 * @param thumbnail   optional preview image reference
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Snapshot(String id, String name, String description, String eventId, Instant timestamp,
                       String thumbnail) {

    public Snapshot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
    }

    /** Returns a copy with the given name and description; {@code null} keeps the current value. */
    public Snapshot withDetails(String newName, String newDescription) {
        return new Snapshot(id, newName == null ? name : newName,
                newDescription == null ? description : newDescription, eventId, timestamp, thumbnail);
    }
}
