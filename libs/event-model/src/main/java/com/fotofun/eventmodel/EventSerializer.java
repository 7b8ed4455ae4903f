package com.fotofun.eventmodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * JSON serialization and deserialization for {@link Event}.
 * <p>
 * Wire shape: {@code {id, timestamp, type, aggregateId, aggregateType, userId?, sessionId,
 * version, metadata, data}}. {@code data} is the payload record; on read the {@code type}
 * field selects the payload class through {@link EventType#payloadClass()}.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<Map<String, Object>> DATA_MAP = new TypeReference<>() {};

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // null properties are omitted; null map values mean "key absent" and are kept
                .setDefaultPropertyInclusion(
                        JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.ALWAYS));
    }

    /**
     * Builds the JSON tree of an event.
     */
    public static ObjectNode toTree(Event event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", event.id());
        node.set("timestamp", MAPPER.valueToTree(event.timestamp()));
        node.put("type", event.type());
        node.put("aggregateId", event.aggregateId());
        node.put("aggregateType", event.aggregateType().value());
        if (event.userId() != null) {
            node.put("userId", event.userId());
        }
        node.put("sessionId", event.sessionId());
        node.put("version", event.version());
        node.set("metadata", MAPPER.valueToTree(event.metadata()));
        node.set("data", MAPPER.valueToTree(event.payload()));
        return node;
    }

    /**
     * Serializes an event to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(Event event) {
        try {
            return MAPPER.writeValueAsString(toTree(event));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.id(), e);
        }
    }

    /**
     * The per-kind {@code data} block as a plain map.
     */
    public static Map<String, Object> eventData(Event event) {
        return MAPPER.convertValue(event.payload(), DATA_MAP);
    }

    /**
     * Deserializes a JSON string to an event.
     *
     * @throws EventSerializationException if the JSON is malformed, names an unknown type
     *                                     or describes an invalid event
     */
    public static Event deserialize(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /**
     * Reads an event back from its JSON tree.
     */
    public static Event fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new EventSerializationException("Event JSON must be an object", null);
        }
        String typeValue = node.path("type").asText(null);
        EventType type = EventType.fromValue(typeValue)
                .orElseThrow(() -> new EventSerializationException("Unknown event type: " + typeValue, null));
        try {
            EventPayload payload = MAPPER.treeToValue(node.path("data"), type.payloadClass());
            EventMetadata metadata = MAPPER.treeToValue(node.path("metadata"), EventMetadata.class);
            Instant timestamp = MAPPER.treeToValue(node.path("timestamp"), Instant.class);
            Event event = new Event(
                    node.path("id").asText(null),
                    timestamp,
                    node.path("aggregateId").asText(null),
                    AggregateType.fromValue(node.path("aggregateType").asText()).orElse(null),
                    node.hasNonNull("userId") ? node.get("userId").asText() : null,
                    node.path("sessionId").asText(null),
                    node.path("version").asInt(Event.UNVERSIONED),
                    metadata,
                    payload);
            ValidationResult result = EventValidator.validate(event);
            if (!result.valid()) {
                throw new EventSerializationException("Invalid event: " + result.summary(), null);
            }
            return event;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize " + typeValue + " event", e);
        }
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static Optional<Event> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
