package com.fotofun.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for creating Micrometer metrics tagged with the emitting component.
 * <p>
 * Every metric created through this factory carries a {@code component} tag (for example
 * {@code event-store} or {@code event-bus}) so that several isolated editor sessions
 * sharing one registry remain distinguishable by component. Additional tags can be
 * supplied per metric.
 */
public final class MetricFactory {

    /** Tag key for the emitting component. */
    public static final String TAG_COMPONENT = "component";

    private final MeterRegistry registry;
    private final String component;

    /**
     * Creates a MetricFactory bound to the given registry and component name.
     *
     * @param registry  the Micrometer meter registry
     * @param component logical component name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String component) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.registry = registry;
        this.component = component;
    }

    /**
     * Creates a factory backed by a private {@link SimpleMeterRegistry}. Used when the
     * caller does not wire a registry of its own.
     */
    public static MetricFactory standalone(String component) {
        return new MetricFactory(new SimpleMeterRegistry(), component);
    }

    /**
     * Returns a factory sharing this registry but tagging a different component.
     */
    public MetricFactory forComponent(String otherComponent) {
        return new MetricFactory(registry, otherComponent);
    }

    /**
     * Creates a counter with the component tag.
     *
     * @param name        metric name (e.g., "editor.events.appended")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates a timer with the component tag.
     *
     * @param name        metric name (e.g., "editor.context.commit")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by an {@link AtomicLong}, with the component tag.
     *
     * @param name        metric name (e.g., "editor.events.stored")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return an AtomicLong that can be used to update the gauge value
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the component name used as a default tag.
     */
    public String component() {
        return component;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_COMPONENT, component);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
