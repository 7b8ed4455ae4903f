package com.fotofun.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fotofun.eventbus.ErrorPolicy;
import com.fotofun.eventbus.EventBusConfig;
import com.fotofun.eventstore.EventStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads {@link EventCoreProperties} from YAML. Missing keys keep their defaults; enum
 * values are matched case-insensitively.
 */
public final class EventCorePropertiesLoader {

    private static final Logger log = LoggerFactory.getLogger(EventCorePropertiesLoader.class);

    /** Classpath resource read by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "fotofun-events.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private EventCorePropertiesLoader() {
        // utility class
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults when it
     * is absent.
     */
    public static EventCoreProperties load() {
        InputStream in = EventCorePropertiesLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            log.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
            return EventCoreProperties.defaults();
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static EventCoreProperties load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + file, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not valid YAML or holds invalid
     *                                  values
     */
    public static EventCoreProperties load(InputStream in) {
        JsonNode root;
        try {
            root = YAML.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed event core configuration", e);
        }
        if (root == null) {
            return EventCoreProperties.defaults();
        }
        JsonNode events = root.path("fotofun").path("events");
        return new EventCoreProperties(storeConfig(events.path("store")), busConfig(events.path("bus")),
                snapshotDirectory(events.path("snapshots")));
    }

    private static EventStoreConfig storeConfig(JsonNode node) {
        EventStoreConfig defaults = EventStoreConfig.defaults();
        return new EventStoreConfig(
                node.path("max-events").asInt(defaults.maxEvents()),
                duration(node.path("cleanup-interval"), defaults.cleanupInterval()),
                node.path("persistence-enabled").asBoolean(defaults.persistenceEnabled()));
    }

    private static EventBusConfig busConfig(JsonNode node) {
        EventBusConfig defaults = EventBusConfig.defaults();
        return new EventBusConfig(
                node.path("max-listeners-per-type").asInt(defaults.maxListenersPerType()),
                errorPolicy(node.path("error-policy"), defaults.errorPolicy()),
                node.path("metrics-enabled").asBoolean(defaults.metricsEnabled()));
    }

    private static Path snapshotDirectory(JsonNode node) {
        String directory = node.path("directory").asText(null);
        return directory == null || directory.isBlank() ? null : Path.of(directory);
    }

    private static Duration duration(JsonNode node, Duration fallback) {
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return Duration.ofMillis(node.asLong());
        }
        try {
            return Duration.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: " + node.asText(), e);
        }
    }

    private static ErrorPolicy errorPolicy(JsonNode node, ErrorPolicy fallback) {
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        try {
            return ErrorPolicy.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown error policy: " + node.asText(), e);
        }
    }
}
