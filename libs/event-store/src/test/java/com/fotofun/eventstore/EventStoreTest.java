package com.fotofun.eventstore;

import com.fotofun.eventmodel.AggregateType;
import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.CanvasState;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventMetadata;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventmodel.EventType;
import com.fotofun.eventmodel.Layer;
import com.fotofun.eventmodel.LifecycleException;
import com.fotofun.eventmodel.testing.TestEvents;
import com.fotofun.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventStore")
class EventStoreTest {

    private SimpleMeterRegistry registry;
    private EventStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new EventStore(EventStoreConfig.defaults(), new LoggingEventPersistence(),
                new MetricFactory(registry, "test"));
    }

    @AfterEach
    void tearDown() {
        store.dispose();
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("numbers events per aggregate starting at 1")
        void versionsPerAggregate() {
            List<Event> stored = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                stored.add(store.append(TestEvents.objectAdded("o" + i)));
            }
            store.append(TestEvents.layerCreated("l1"));

            assertThat(store.getAggregateVersion(TestEvents.CANVAS_ID)).isEqualTo(5);
            assertThat(stored).extracting(Event::version).containsExactly(1, 2, 3, 4, 5);
            assertThat(store.getAggregateVersion("l1")).isEqualTo(1);
            assertThat(store.getAggregateVersion("unknown")).isZero();
        }

        @Test
        @DisplayName("overrides a caller-supplied version")
        void overridesVersion() {
            store.append(TestEvents.objectAdded("o1"));

            Event stored = store.append(TestEvents.objectAdded("o2").withVersion(42));

            assertThat(stored.version()).isEqualTo(2);
            assertThat(store.getEvent(stored.id())).contains(stored);
        }

        @Test
        @DisplayName("appendBatch keeps list order")
        void batchOrder() {
            var batch = List.of(TestEvents.objectAdded("a"), TestEvents.objectAdded("b"),
                    TestEvents.objectAdded("c"));

            List<Event> stored = store.appendBatch(batch);

            assertThat(stored).extracting(Event::version).containsExactly(1, 2, 3);
            assertThat(stored).extracting(Event::id).containsExactlyElementsOf(batch.stream().map(Event::id).toList());
        }

        @Test
        @DisplayName("appendBatch rejects a repeated id without storing any of the batch")
        void batchWithRepeatedId() {
            Event first = TestEvents.objectAdded("a");
            Event repeated = TestEvents.objectAdded("b");
            List<Event> seen = new ArrayList<>();
            store.subscribeAll(seen::add);

            assertThatThrownBy(() -> store.appendBatch(List.of(first, repeated, repeated)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(repeated.id());

            assertThat(store.size()).isZero();
            assertThat(store.getAggregateVersion(TestEvents.CANVAS_ID)).isZero();
            assertThat(seen).isEmpty();
        }

        @Test
        @DisplayName("appendBatch rejects a batch holding an already stored event")
        void batchWithStoredId() {
            Event existing = store.append(TestEvents.objectAdded("a"));

            assertThatThrownBy(() -> store.appendBatch(List.of(TestEvents.objectAdded("b"), existing)))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects an event id that is already stored")
        void duplicateId() {
            Event event = TestEvents.objectAdded("o1");
            store.append(event);

            assertThatThrownBy(() -> store.append(event)).isInstanceOf(IllegalArgumentException.class);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("does not check canApply before storing")
        void canApplyNotEnforced() {
            var state = CanvasState.blank(TestEvents.CANVAS_ID);
            Event removal = TestEvents.of(new EventPayload.ObjectRemoved(TestEvents.CANVAS_ID,
                    TestEvents.image("ghost"), null));
            assertThat(removal.canApply(state)).isFalse();

            Event stored = store.append(removal);

            assertThat(stored.version()).isEqualTo(1);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("counts appended events per aggregate type")
        void appendedMetric() {
            store.append(TestEvents.objectAdded("o1"));
            store.append(TestEvents.layerCreated("l1"));
            store.append(TestEvents.layerCreated("l2"));

            assertThat(registry.get("editor.events.appended").tag("aggregate_type", "layer").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get("editor.events.appended").tag("aggregate_type", "canvas").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("query")
    class Query {

        @Test
        @DisplayName("aggregate query returns exactly the matching subset sorted by timestamp")
        void aggregateSubset() {
            Event e1 = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("a"), null), 10);
            Event e2 = TestEvents.at(new EventPayload.ObjectAdded("c2", TestEvents.image("b"), null), 20);
            Event e3 = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("c"), null), 30);
            Event e4 = TestEvents.at(new EventPayload.LayerCreated(Layer.of("c1", "L"), null), 40);
            Event e5 = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("d"), null), 50);
            store.appendBatch(List.of(e1, e2, e3, e4, e5));

            List<Event> result = store.query(EventQuery.forAggregate(AggregateType.CANVAS, "c1"));

            assertThat(result).extracting(Event::id).containsExactly(e1.id(), e3.id(), e5.id());
        }

        @Test
        @DisplayName("sorts by timestamp even when appended out of order")
        void timelineOrder() {
            Event late = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("late"), null), 500);
            Event early = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("early"), null), 100);
            store.append(late);
            store.append(early);

            assertThat(store.query(EventQuery.all())).extracting(Event::id).containsExactly(early.id(), late.id());
            assertThat(store.getAggregateEvents(AggregateType.CANVAS, "c1")).extracting(Event::id)
                    .containsExactly(early.id(), late.id());
        }

        @Test
        @DisplayName("events with equal timestamps keep append order")
        void ties() {
            Event a = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("a"), null), 0);
            Event b = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("b"), null), 0);
            Event c = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("c"), null), 0);
            store.appendBatch(List.of(a, b, c));

            assertThat(store.query(EventQuery.all())).extracting(Event::id).containsExactly(a.id(), b.id(), c.id());
        }

        @Test
        @DisplayName("filters by type, time range, workflow, session and source")
        void filters() {
            Event added = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("a"), null), 0);
            Event moved = TestEvents.at(new EventPayload.ObjectModified("c1", "a", Map.of("left", 0),
                    Map.of("left", 5)), 100);
            Event aiMove = TestEvents.at(new EventPayload.ObjectModified("c1", "a", Map.of("left", 5),
                    Map.of("left", 9)), 200);
            aiMove = aiMove.withMetadata(EventMetadata.of(EventSource.AI).withWorkflowId("wf-1"));
            store.appendBatch(List.of(added, moved, aiMove));

            assertThat(store.query(EventQuery.builder().eventTypes(EventType.OBJECT_MODIFIED).build()))
                    .extracting(Event::id).containsExactly(moved.id(), aiMove.id());
            assertThat(store.query(EventQuery.builder()
                    .from(TestEvents.BASE_TIME.plusMillis(50))
                    .to(TestEvents.BASE_TIME.plusMillis(150)).build()))
                    .extracting(Event::id).containsExactly(moved.id());
            assertThat(store.query(EventQuery.builder().workflowId("wf-1").build()))
                    .extracting(Event::id).containsExactly(aiMove.id());
            assertThat(store.query(EventQuery.builder().source(EventSource.USER).build())).hasSize(2);
            assertThat(store.query(EventQuery.builder().sessionId("other").build())).isEmpty();
        }

        @Test
        @DisplayName("paginates with offset and limit")
        void pagination() {
            List<Event> events = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                events.add(TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("o" + i), null), i));
            }
            store.appendBatch(events);

            List<Event> page = store.query(EventQuery.builder().offset(2).limit(3).build());

            assertThat(page).extracting(Event::id)
                    .containsExactly(events.get(2).id(), events.get(3).id(), events.get(4).id());
            assertThat(store.query(EventQuery.builder().offset(10).build())).isEmpty();
        }

        @Test
        @DisplayName("an unbounded limit after an offset returns the rest")
        void unboundedLimit() {
            List<Event> events = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                events.add(TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("o" + i), null), i));
            }
            store.appendBatch(events);

            List<Event> rest = store.query(EventQuery.builder().offset(1).limit(Integer.MAX_VALUE).build());

            assertThat(rest).extracting(Event::id).containsExactly(events.get(1).id(), events.get(2).id());
        }

        @Test
        @DisplayName("a type listed twice filters like a type listed once")
        void repeatedEventType() {
            store.append(TestEvents.objectAdded("o1"));
            store.append(TestEvents.objectMoved("o1", 0, 10));

            EventQuery query = EventQuery.builder()
                    .eventTypes(EventType.OBJECT_ADDED, EventType.OBJECT_ADDED)
                    .build();

            assertThat(store.query(query)).extracting(Event::eventType).containsExactly(EventType.OBJECT_ADDED);
        }

        @Test
        @DisplayName("a cursor returns only events after it, an unknown cursor is ignored")
        void cursor() {
            Event a = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("a"), null), 0);
            Event b = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("b"), null), 10);
            Event c = TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("c"), null), 20);
            store.appendBatch(List.of(a, b, c));

            assertThat(store.query(EventQuery.builder().afterEvent(a.id()).build()))
                    .extracting(Event::id).containsExactly(b.id(), c.id());
            assertThat(store.query(EventQuery.builder().afterEvent("missing").build())).hasSize(3);
        }

        @Test
        @DisplayName("replay folds the matching events over a state")
        void replay() {
            store.append(TestEvents.objectAdded("o1"));
            store.append(TestEvents.objectAdded("o2"));
            store.append(TestEvents.objectMoved("o1", 0, 30));

            CanvasState state = store.replay(EventQuery.forAggregate(AggregateType.CANVAS, TestEvents.CANVAS_ID),
                    CanvasState.blank(TestEvents.CANVAS_ID));

            assertThat(state.objects()).extracting(CanvasObject::id).containsExactly("o1", "o2");
            assertThat(state.findObject("o1").orElseThrow().properties()).containsEntry("left", 30);
        }

        @Test
        @DisplayName("getUndoableEvents skips irreversible events, newest first")
        void undoable() {
            Event added = store.append(TestEvents.objectAdded("o1"));
            store.append(TestEvents.toolActivated("brush"));
            Event moved = store.append(TestEvents.objectMoved("o1", 0, 10));

            assertThat(store.getUndoableEvents(3)).extracting(Event::id).containsExactly(moved.id(), added.id());
            assertThat(store.getUndoableEvents(1)).extracting(Event::id).containsExactly(moved.id());
        }
    }

    @Nested
    @DisplayName("subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("notifies type handlers before wildcard handlers")
        void order() {
            List<String> calls = new ArrayList<>();
            store.subscribe(EventStore.WILDCARD, e -> calls.add("all:" + e.type()));
            store.subscribe("canvas.object.added", e -> calls.add("typed:" + e.type()));

            store.append(TestEvents.objectAdded("o1"));
            store.append(TestEvents.layerCreated("l1"));

            assertThat(calls).containsExactly("typed:canvas.object.added", "all:canvas.object.added",
                    "all:layer.created");
        }

        @Test
        @DisplayName("handlers receive the versioned copy")
        void versionedCopy() {
            List<Event> seen = new ArrayList<>();
            store.subscribeAll(seen::add);

            store.append(TestEvents.objectAdded("o1"));

            assertThat(seen).singleElement().extracting(Event::version).isEqualTo(1);
        }

        @Test
        @DisplayName("a failing handler does not stop the others or the append")
        void handlerIsolation() {
            List<String> calls = new ArrayList<>();
            store.subscribe(EventType.OBJECT_ADDED, e -> {
                throw new IllegalStateException("boom");
            });
            store.subscribe(EventType.OBJECT_ADDED, e -> calls.add("second"));
            store.subscribeAll(e -> calls.add("global"));

            Event stored = store.append(TestEvents.objectAdded("o1"));

            assertThat(stored.version()).isEqualTo(1);
            assertThat(calls).containsExactly("second", "global");
            assertThat(registry.get("editor.events.handler.errors").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("unsubscribe removes the handler and drops empty sets")
        void unsubscribe() {
            List<Event> seen = new ArrayList<>();
            Subscription subscription = store.subscribe(EventType.OBJECT_ADDED, seen::add);
            assertThat(store.handlerCount(EventType.OBJECT_ADDED)).isEqualTo(1);

            subscription.unsubscribe();
            subscription.unsubscribe();
            store.append(TestEvents.objectAdded("o1"));

            assertThat(seen).isEmpty();
            assertThat(store.handlerCount(EventType.OBJECT_ADDED)).isZero();
        }

        @Test
        @DisplayName("rejects unknown type names")
        void unknownType() {
            assertThatThrownBy(() -> store.subscribe("canvas.object.teleported", e -> { }))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("retention")
    class Retention {

        @Test
        @DisplayName("prunes the oldest events from every index beyond the ceiling")
        void prunesOldest() {
            store.dispose();
            store = new EventStore(EventStoreConfig.defaults().withMaxEvents(3), new LoggingEventPersistence(),
                    new MetricFactory(registry, "test"));
            List<Event> events = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                events.add(store.append(TestEvents.at(
                        new EventPayload.ObjectAdded("c1", TestEvents.image("o" + i), null), i * 10L)));
            }

            assertThat(store.size()).isEqualTo(3);
            assertThat(store.query(EventQuery.forAggregate(AggregateType.CANVAS, "c1")))
                    .extracting(Event::id)
                    .containsExactly(events.get(2).id(), events.get(3).id(), events.get(4).id());
            assertThat(store.getEvent(events.get(0).id())).isEmpty();
            assertThat(store.getAggregateVersion("c1")).isEqualTo(5);
            assertThat(registry.get("editor.events.pruned").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("with a cleanup timer, pruning waits for the sweep")
        void timerSweep() {
            store.dispose();
            store = new EventStore(new EventStoreConfig(2, Duration.ofMillis(20), false));
            for (int i = 0; i < 4; i++) {
                store.append(TestEvents.objectAdded("o" + i));
            }

            awaitTrue(() -> store.size() == 2);
            assertThat(store.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("persistence")
    class Persistence {

        @Test
        @DisplayName("writes every appended event in the background")
        void writesBehind() throws InterruptedException {
            List<String> persisted = new CopyOnWriteArrayList<>();
            CountDownLatch latch = new CountDownLatch(2);
            store.dispose();
            store = new EventStore(EventStoreConfig.defaults(), new EventPersistence() {
                @Override
                public void persist(Event event) {
                    persisted.add(event.id());
                    latch.countDown();
                }

                @Override
                public void persistSnapshot(StoreSnapshot snapshot) {
                }
            }, new MetricFactory(registry, "test"));

            Event a = store.append(TestEvents.objectAdded("a"));
            Event b = store.append(TestEvents.objectAdded("b"));

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(persisted).containsExactly(a.id(), b.id());
        }

        @Test
        @DisplayName("a persistence failure is logged and never reaches the caller")
        void failureIsolated() {
            store.dispose();
            store = new EventStore(EventStoreConfig.defaults(), new EventPersistence() {
                @Override
                public void persist(Event event) throws Exception {
                    throw new IOException("disk full");
                }

                @Override
                public void persistSnapshot(StoreSnapshot snapshot) {
                }
            }, new MetricFactory(registry, "test"));

            assertThatCode(() -> store.append(TestEvents.objectAdded("a"))).doesNotThrowAnyException();
            assertThat(store.size()).isEqualTo(1);
            awaitTrue(() -> registry.get("editor.events.persistence.failures").counter().count() >= 1.0);
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        @DisplayName("captures events up to a timestamp and restores by replaying them")
        void captureAndRestore() {
            store.append(TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("a"), null), 0));
            store.append(TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("b"), null), 100));
            store.append(TestEvents.at(new EventPayload.ObjectAdded("c1", TestEvents.image("c"), null), 200));

            StoreSnapshot snapshot = store.createSnapshot(TestEvents.BASE_TIME.plusMillis(100));
            CanvasState restored = store.restoreFromSnapshot(snapshot.id(), CanvasState.blank("c1"));

            assertThat(snapshot.id()).isEqualTo("snapshot-" + TestEvents.BASE_TIME.plusMillis(100).toEpochMilli());
            assertThat(snapshot.eventCount()).isEqualTo(2);
            assertThat(restored.objects()).extracting(CanvasObject::id).containsExactly("a", "b");
        }

        @Test
        @DisplayName("restoring an unknown snapshot fails")
        void unknownSnapshot() {
            assertThatThrownBy(() -> store.restoreFromSnapshot("snapshot-1", CanvasState.blank("c1")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("disposal")
    class Disposal {

        @Test
        @DisplayName("every operation throws after dispose")
        void throwsAfterDispose() {
            store.append(TestEvents.objectAdded("o1"));

            store.dispose();

            assertThat(store.isDisposed()).isTrue();
            assertThatThrownBy(() -> store.append(TestEvents.objectAdded("o2"))).isInstanceOf(LifecycleException.class);
            assertThatThrownBy(() -> store.query(EventQuery.all())).isInstanceOf(LifecycleException.class);
            assertThatThrownBy(() -> store.getAggregateVersion("c1")).isInstanceOf(LifecycleException.class);
            assertThatThrownBy(() -> store.subscribeAll(e -> { })).isInstanceOf(LifecycleException.class);
            assertThatThrownBy(() -> store.createSnapshot()).isInstanceOf(LifecycleException.class);
        }

        @Test
        @DisplayName("dispose is idempotent")
        void idempotent() {
            store.dispose();

            assertThatCode(store::dispose).doesNotThrowAnyException();
            assertThat(store.isDisposed()).isTrue();
        }

        @Test
        @DisplayName("clear drops events and versions but keeps the store usable")
        void clear() {
            store.append(TestEvents.objectAdded("o1"));

            store.clear();

            assertThat(store.size()).isZero();
            assertThat(store.getAggregateVersion(TestEvents.CANVAS_ID)).isZero();
            assertThat(store.append(TestEvents.objectAdded("o2")).version()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("appending an object and its reverse yields two canvas events at version 2")
    void addThenReverseScenario() {
        Event added = store.append(TestEvents.of(
                new EventPayload.ObjectAdded("c1", CanvasObject.of("o1", "rect"), null)));

        List<Event> first = store.query(EventQuery.builder()
                .aggregateType(AggregateType.CANVAS).aggregateId("c1").build());
        assertThat(first).singleElement().extracting(Event::type).isEqualTo("canvas.object.added");

        Event reverse = added.reverse().orElseThrow();
        assertThat(reverse.payload()).isInstanceOfSatisfying(EventPayload.ObjectRemoved.class,
                removed -> assertThat(removed.object().id()).isEqualTo("o1"));
        store.append(reverse);

        assertThat(store.query(EventQuery.forAggregate(AggregateType.CANVAS, "c1"))).hasSize(2);
        assertThat(store.getAggregateVersion("c1")).isEqualTo(2);
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted", e);
            }
        }
    }
}
