package com.fotofun.eventstore;

import com.fotofun.eventmodel.AggregateType;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventmodel.EventType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Filter for {@link EventStore#query(EventQuery)}. Every criterion is optional; absent
 * criteria match everything. Results are sorted by timestamp, then paginated.
 *
 * @param aggregateId   aggregate instance id
 * @param aggregateType aggregate group
 * @param eventTypes    accepted event types (empty = any)
 * @param fromTimestamp inclusive lower time bound
 * @param toTimestamp   inclusive upper time bound
 * @param fromEventId   cursor: only events after this event on the timeline
 * @param workflowId    metadata workflow id
 * @param sessionId     editor session id
 * @param source        metadata source
 * @param offset        number of matches to skip
 * @param limit         maximum number of results, or {@code null} for no limit
 */
public record EventQuery(
        String aggregateId,
        AggregateType aggregateType,
        Set<EventType> eventTypes,
        Instant fromTimestamp,
        Instant toTimestamp,
        String fromEventId,
        String workflowId,
        String sessionId,
        EventSource source,
        int offset,
        Integer limit) {

    public EventQuery {
        eventTypes = eventTypes == null || eventTypes.isEmpty() ? Set.of() : Set.copyOf(eventTypes);
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
    }

    /** Matches every event. */
    public static EventQuery all() {
        return builder().build();
    }

    /** All events of one aggregate instance. */
    public static EventQuery forAggregate(AggregateType aggregateType, String aggregateId) {
        return builder().aggregate(aggregateType, aggregateId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True when the aggregate index can answer the query directly. */
    boolean usesAggregateIndex() {
        return aggregateId != null && aggregateType != null;
    }

    /** Checks every criterion except the cursor and pagination. */
    boolean matches(Event event) {
        if (aggregateId != null && !aggregateId.equals(event.aggregateId())) {
            return false;
        }
        if (aggregateType != null && aggregateType != event.aggregateType()) {
            return false;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.eventType())) {
            return false;
        }
        if (fromTimestamp != null && event.timestamp().isBefore(fromTimestamp)) {
            return false;
        }
        if (toTimestamp != null && event.timestamp().isAfter(toTimestamp)) {
            return false;
        }
        if (workflowId != null && !workflowId.equals(event.metadata().workflowId())) {
            return false;
        }
        if (sessionId != null && !sessionId.equals(event.sessionId())) {
            return false;
        }
        return source == null || source == event.metadata().source();
    }

    public static final class Builder {

        private String aggregateId;
        private AggregateType aggregateType;
        private final Set<EventType> eventTypes = EnumSet.noneOf(EventType.class);
        private Instant fromTimestamp;
        private Instant toTimestamp;
        private String fromEventId;
        private String workflowId;
        private String sessionId;
        private EventSource source;
        private int offset;
        private Integer limit;

        private Builder() {
        }

        public Builder aggregate(AggregateType type, String id) {
            this.aggregateType = type;
            this.aggregateId = id;
            return this;
        }

        public Builder aggregateId(String id) {
            this.aggregateId = id;
            return this;
        }

        public Builder aggregateType(AggregateType type) {
            this.aggregateType = type;
            return this;
        }

        public Builder eventTypes(EventType... types) {
            Collections.addAll(this.eventTypes, types);
            return this;
        }

        public Builder eventTypes(Set<EventType> types) {
            this.eventTypes.addAll(types);
            return this;
        }

        public Builder from(Instant timestamp) {
            this.fromTimestamp = timestamp;
            return this;
        }

        public Builder to(Instant timestamp) {
            this.toTimestamp = timestamp;
            return this;
        }

        public Builder afterEvent(String eventId) {
            this.fromEventId = eventId;
            return this;
        }

        public Builder workflowId(String id) {
            this.workflowId = id;
            return this;
        }

        public Builder sessionId(String id) {
            this.sessionId = id;
            return this;
        }

        public Builder source(EventSource eventSource) {
            this.source = eventSource;
            return this;
        }

        public Builder offset(int value) {
            this.offset = value;
            return this;
        }

        public Builder limit(int value) {
            this.limit = value;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(aggregateId, aggregateType, eventTypes, fromTimestamp, toTimestamp,
                    fromEventId, workflowId, sessionId, source, offset, limit);
        }
    }
}
