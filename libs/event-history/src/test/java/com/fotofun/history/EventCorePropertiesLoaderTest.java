package com.fotofun.history;

import com.fotofun.eventbus.ErrorPolicy;
import com.fotofun.eventbus.EventBusConfig;
import com.fotofun.eventstore.EventStoreConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventCorePropertiesLoader")
class EventCorePropertiesLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("reads the classpath resource, keeping defaults for absent keys")
    void classpathResource() {
        EventCoreProperties properties = EventCorePropertiesLoader.load();

        assertThat(properties.store()).isEqualTo(new EventStoreConfig(500, null, false));
        assertThat(properties.bus().maxListenersPerType()).isEqualTo(25);
        assertThat(properties.bus().errorPolicy()).isEqualTo(ErrorPolicy.THROW);
        assertThat(properties.bus().metricsEnabled()).isTrue();
        assertThat(properties.hasSnapshotDirectory()).isFalse();
    }

    @Test
    @DisplayName("binds every key of the fotofun.events section")
    void fullDocument() {
        EventCoreProperties properties = EventCorePropertiesLoader.load(yaml("""
                fotofun:
                  events:
                    store:
                      max-events: 200
                      cleanup-interval: PT30S
                      persistence-enabled: true
                    bus:
                      max-listeners-per-type: 0
                      error-policy: ignore
                      metrics-enabled: false
                    snapshots:
                      directory: /tmp/fotofun-snapshots
                """));

        assertThat(properties.store().maxEvents()).isEqualTo(200);
        assertThat(properties.store().cleanupInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.bus()).isEqualTo(new EventBusConfig(0, ErrorPolicy.IGNORE, false));
        assertThat(properties.snapshotDirectory()).isEqualTo(Path.of("/tmp/fotofun-snapshots"));
    }

    @Test
    @DisplayName("reads a numeric cleanup interval as milliseconds")
    void numericInterval() {
        EventCoreProperties properties = EventCorePropertiesLoader.load(yaml("""
                fotofun:
                  events:
                    store:
                      cleanup-interval: 1500
                """));

        assertThat(properties.store().cleanupInterval()).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("an empty or unrelated document yields the defaults")
    void defaults() {
        assertThat(EventCorePropertiesLoader.load(yaml(""))).isEqualTo(EventCoreProperties.defaults());
        assertThat(EventCorePropertiesLoader.load(yaml("other: true"))).isEqualTo(EventCoreProperties.defaults());
    }

    @Test
    @DisplayName("rejects invalid values")
    void invalidValues() {
        assertThatThrownBy(() -> EventCorePropertiesLoader.load(yaml("""
                fotofun:
                  events:
                    bus:
                      error-policy: explode
                """))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("explode");
        assertThatThrownBy(() -> EventCorePropertiesLoader.load(yaml("""
                fotofun:
                  events:
                    store:
                      max-events: -1
                """))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EventCorePropertiesLoader.load(yaml("""
                fotofun:
                  events:
                    store:
                      cleanup-interval: soon
                """))).isInstanceOf(IllegalArgumentException.class);
    }
}
