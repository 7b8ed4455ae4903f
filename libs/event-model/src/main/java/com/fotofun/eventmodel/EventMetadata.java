package com.fotofun.eventmodel;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Audit and correlation metadata carried by every event.
 *
 * @param source              who originated the event
 * @param correlationId       id of the execution context that produced the event
 * @param causationId         id of the parent context (or event) that caused it
 * @param workflowId          workflow the event belongs to
 * @param selectionSnapshotId frozen selection the event was targeted at
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventMetadata(
        EventSource source,
        String correlationId,
        String causationId,
        String workflowId,
        String selectionSnapshotId) {

    public EventMetadata {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
    }

    /** Metadata with only a source set. */
    public static EventMetadata of(EventSource source) {
        return new EventMetadata(source, null, null, null, null);
    }

    public EventMetadata withCorrelationId(String id) {
        return new EventMetadata(source, id, causationId, workflowId, selectionSnapshotId);
    }

    public EventMetadata withCausationId(String id) {
        return new EventMetadata(source, correlationId, id, workflowId, selectionSnapshotId);
    }

    public EventMetadata withWorkflowId(String id) {
        return new EventMetadata(source, correlationId, causationId, id, selectionSnapshotId);
    }

    public EventMetadata withSelectionSnapshotId(String id) {
        return new EventMetadata(source, correlationId, causationId, workflowId, id);
    }
}
