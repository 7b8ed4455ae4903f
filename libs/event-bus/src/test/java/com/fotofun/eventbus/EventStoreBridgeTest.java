package com.fotofun.eventbus;

import com.fotofun.eventbus.BusEvents.HistoryStepMessage;
import com.fotofun.eventbus.BusEvents.LayersReorderedMessage;
import com.fotofun.eventbus.BusEvents.ObjectAddedMessage;
import com.fotofun.eventbus.BusEvents.ObjectRemovedMessage;
import com.fotofun.eventbus.BusEvents.ToolOptionChangedMessage;
import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventmodel.EventPayload.ObjectModification;
import com.fotofun.eventmodel.Layer;
import com.fotofun.eventmodel.testing.TestEvents;
import com.fotofun.eventstore.EventStore;
import com.fotofun.eventstore.EventStoreConfig;
import com.fotofun.eventstore.LoggingEventPersistence;
import com.fotofun.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static com.fotofun.eventmodel.testing.TestEvents.CANVAS_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("EventStoreBridge")
class EventStoreBridgeTest {

    private EventStore store;
    private TypedEventBus bus;
    private EventStoreBridge bridge;

    @BeforeEach
    void setUp() {
        MetricFactory metrics = new MetricFactory(new SimpleMeterRegistry(), "test");
        store = new EventStore(new EventStoreConfig(1000, null, false), new LoggingEventPersistence(), metrics);
        bus = new TypedEventBus(EventBusConfig.defaults(), metrics);
        bridge = new EventStoreBridge(store, bus);
        bridge.start();
    }

    @AfterEach
    void tearDown() {
        bridge.stop();
        store.dispose();
        bus.dispose();
    }

    static Stream<Arguments> recognisedPayloads() {
        CanvasObject image = TestEvents.image("o1");
        Layer layer = Layer.of("l1", "Background");
        return Stream.of(
                Arguments.of(new EventPayload.ObjectAdded(CANVAS_ID, image, null), BusEvents.OBJECT_ADDED),
                Arguments.of(new EventPayload.ObjectRemoved(CANVAS_ID, image, 0), BusEvents.OBJECT_REMOVED),
                Arguments.of(new EventPayload.ObjectModified(CANVAS_ID, "o1", Map.of("left", 0),
                        Map.of("left", 10)), BusEvents.OBJECT_MODIFIED),
                Arguments.of(new EventPayload.ObjectsBatchModified(CANVAS_ID, List.of(
                        new ObjectModification("o1", Map.of("left", 0), Map.of("left", 5)))),
                        BusEvents.OBJECTS_BATCH_MODIFIED),
                Arguments.of(new EventPayload.LayerCreated(layer, null), BusEvents.LAYER_CREATED),
                Arguments.of(new EventPayload.LayerRemoved(layer, 0), BusEvents.LAYER_REMOVED),
                Arguments.of(new EventPayload.LayerModified("l1", Map.of("opacity", 0.5), Map.of("opacity", 1.0)),
                        BusEvents.LAYER_MODIFIED),
                Arguments.of(new EventPayload.LayersReordered(CANVAS_ID, List.of("l2", "l1"), List.of("l1", "l2")),
                        BusEvents.LAYER_REORDERED),
                Arguments.of(new EventPayload.SelectionChanged(CANVAS_ID, Set.of("o1"), Set.of()),
                        BusEvents.SELECTION_CHANGED),
                Arguments.of(new EventPayload.SelectionCleared(CANVAS_ID, Set.of("o1")), BusEvents.SELECTION_CLEARED),
                Arguments.of(new EventPayload.CanvasResized(CANVAS_ID, 800, 600, 1920, 1080),
                        BusEvents.CANVAS_RESIZED),
                Arguments.of(new EventPayload.CanvasBackgroundChanged(CANVAS_ID, "#000000", "#ffffff"),
                        BusEvents.CANVAS_BACKGROUND_CHANGED),
                Arguments.of(new EventPayload.ToolActivated("brush", "move"), BusEvents.TOOL_ACTIVATED),
                Arguments.of(new EventPayload.ToolOptionChanged("brush", "size", 24, 10),
                        BusEvents.TOOL_OPTION_CHANGED),
                Arguments.of(new EventPayload.WorkflowStarted("wf-1", "Enhance", List.of("brightness")),
                        BusEvents.WORKFLOW_STARTED),
                Arguments.of(new EventPayload.WorkflowCompleted("wf-1", true, 1), BusEvents.WORKFLOW_COMPLETED),
                Arguments.of(new EventPayload.WorkflowFailed("wf-1", "boom"), BusEvents.WORKFLOW_FAILED),
                Arguments.of(new EventPayload.HistoryUndo("e-1"), BusEvents.HISTORY_UNDO),
                Arguments.of(new EventPayload.HistoryRedo("e-1"), BusEvents.HISTORY_REDO));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("recognisedPayloads")
    @DisplayName("publishes exactly one message per recognised event")
    void publishesOneMessage(EventPayload payload, BusEventType<?> channel) {
        List<Object> received = new ArrayList<>();
        collect(channel, received);

        store.append(TestEvents.of(payload));

        assertThat(received).hasSize(1);
        assertThat(received.get(0)).isInstanceOf(channel.dataType());
    }

    private <T> void collect(BusEventType<T> channel, List<Object> sink) {
        bus.on(channel, m -> sink.add(m.data()));
    }

    @Test
    @DisplayName("carries the identifying fields of the event")
    void carriesIdentifyingFields() {
        List<ObjectAddedMessage> added = new ArrayList<>();
        List<ObjectRemovedMessage> removed = new ArrayList<>();
        List<ToolOptionChangedMessage> options = new ArrayList<>();
        bus.on(BusEvents.OBJECT_ADDED, m -> added.add(m.data()));
        bus.on(BusEvents.OBJECT_REMOVED, m -> removed.add(m.data()));
        bus.on(BusEvents.TOOL_OPTION_CHANGED, m -> options.add(m.data()));

        store.append(TestEvents.objectAdded("o1"));
        store.append(TestEvents.of(new EventPayload.ObjectRemoved(CANVAS_ID, TestEvents.image("o1"), 0)));
        store.append(TestEvents.of(new EventPayload.ToolOptionChanged("brush", "size", 24, 10)));

        assertThat(added).singleElement().satisfies(m -> {
            assertThat(m.canvasId()).isEqualTo(CANVAS_ID);
            assertThat(m.object().id()).isEqualTo("o1");
        });
        assertThat(removed).singleElement().satisfies(m -> assertThat(m.objectId()).isEqualTo("o1"));
        assertThat(options).singleElement().satisfies(m -> {
            assertThat(m.toolId()).isEqualTo("brush");
            assertThat(m.optionId()).isEqualTo("size");
            assertThat(m.value()).isEqualTo(24);
            assertThat(m.previousValue()).isEqualTo(10);
        });
    }

    @Test
    @DisplayName("publishes layer reorders on the layer.reordered channel")
    void layerReorderChannel() {
        List<LayersReorderedMessage> received = new ArrayList<>();
        bus.on(BusEvents.LAYER_REORDERED, m -> received.add(m.data()));

        store.append(TestEvents.of(new EventPayload.LayersReordered(CANVAS_ID, List.of("l2", "l1"),
                List.of("l1", "l2"))));

        assertThat(BusEvents.LAYER_REORDERED.name()).isEqualTo("layer.reordered");
        assertThat(received).singleElement()
                .satisfies(m -> assertThat(m.layerIds()).containsExactly("l2", "l1"));
    }

    @Test
    @DisplayName("skips document loads without failing the append")
    void skipsDocumentLoaded() {
        assertThatCode(() -> store.append(TestEvents.of(
                new EventPayload.DocumentLoaded("doc-1", "Untitled", 800, 600, "#ffffff"))))
                .doesNotThrowAnyException();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("a failing UI handler never reaches the appending caller")
    void bridgeFailuresAreContained() {
        TypedEventBus strict = new TypedEventBus(EventBusConfig.defaults().withErrorPolicy(ErrorPolicy.THROW));
        EventStoreBridge strictBridge = new EventStoreBridge(store, strict);
        strictBridge.start();
        strict.on(BusEvents.HISTORY_UNDO, m -> {
            throw new IllegalStateException("ui exploded");
        });

        assertThatCode(() -> store.append(TestEvents.of(new EventPayload.HistoryUndo("e-1"))))
                .doesNotThrowAnyException();
        assertThat(store.size()).isEqualTo(1);
        strictBridge.stop();
    }

    @Test
    @DisplayName("start is idempotent and stop disconnects")
    void startStop() {
        List<HistoryStepMessage> received = new ArrayList<>();
        bus.on(BusEvents.HISTORY_REDO, m -> received.add(m.data()));

        bridge.start();
        assertThat(store.wildcardHandlerCount()).isEqualTo(1);

        bridge.stop();
        assertThat(bridge.isStarted()).isFalse();
        store.append(TestEvents.of(new EventPayload.HistoryRedo("e-1")));

        assertThat(received).isEmpty();
    }
}
