package com.fotofun.eventmodel.testing;

import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventFactory;
import com.fotofun.eventmodel.EventMetadata;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventmodel.Layer;

import java.time.Instant;
import java.util.Map;

/**
 * Test factory for events with deterministic defaults.
 * <p>
 * Placed in {@code src/main/java} so the store, bus and history modules can reuse it
 * in their tests.
 */
public final class TestEvents {

    /** Default canvas id for tests. */
    public static final String CANVAS_ID = "c1";

    /** Default session id for tests. */
    public static final String SESSION_ID = "session-test-001";

    /** Fixed base instant; {@link #at(EventPayload, long)} offsets from it. */
    public static final Instant BASE_TIME = Instant.parse("2024-05-01T10:00:00Z");

    private TestEvents() {
        // utility class
    }

    public static EventMetadata userMetadata() {
        return EventMetadata.of(EventSource.USER);
    }

    /** An event for {@code payload} created now by a user. */
    public static Event of(EventPayload payload) {
        return EventFactory.create(payload, userMetadata(), SESSION_ID, null);
    }

    /** An event for {@code payload} stamped {@code offsetMillis} after {@link #BASE_TIME}. */
    public static Event at(EventPayload payload, long offsetMillis) {
        return EventFactory.create(payload, userMetadata(), SESSION_ID, null, BASE_TIME.plusMillis(offsetMillis));
    }

    public static CanvasObject image(String id) {
        return new CanvasObject(id, "image", null, Map.of("left", 0, "top", 0));
    }

    public static Event objectAdded(String canvasId, String objectId) {
        return of(new EventPayload.ObjectAdded(canvasId, image(objectId), null));
    }

    public static Event objectAdded(String objectId) {
        return objectAdded(CANVAS_ID, objectId);
    }

    public static Event objectMoved(String objectId, int fromLeft, int toLeft) {
        return of(new EventPayload.ObjectModified(CANVAS_ID, objectId,
                Map.of("left", fromLeft), Map.of("left", toLeft)));
    }

    public static Event layerCreated(String layerId) {
        return of(new EventPayload.LayerCreated(Layer.of(layerId, "Layer " + layerId), null));
    }

    public static Event toolActivated(String toolId) {
        return of(new EventPayload.ToolActivated(toolId, null));
    }
}
