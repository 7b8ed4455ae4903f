package com.fotofun.eventbus;

import com.fotofun.eventstore.EventStore;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out one started {@link EventStoreBridge} per store and bus pair. Pairs are
 * keyed by instance identity, so two equal-looking stores get separate bridges.
 */
public class EventStoreBridgeRegistry {

    private final Map<Key, EventStoreBridge> bridges = new HashMap<>();

    /** Returns the bridge for this pair, creating and starting it on first use. */
    public synchronized EventStoreBridge bridgeFor(EventStore store, TypedEventBus bus) {
        return bridges.computeIfAbsent(new Key(store, bus), key -> {
            EventStoreBridge bridge = new EventStoreBridge(store, bus);
            bridge.start();
            return bridge;
        });
    }

    /** Stops and forgets the bridge for this pair, if any. */
    public synchronized void release(EventStore store, TypedEventBus bus) {
        EventStoreBridge bridge = bridges.remove(new Key(store, bus));
        if (bridge != null) {
            bridge.stop();
        }
    }

    public synchronized int size() {
        return bridges.size();
    }

    private record Key(EventStore store, TypedEventBus bus) {

        @Override
        public boolean equals(Object o) {
            return o instanceof Key other && store == other.store && bus == other.bus;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(store) + System.identityHashCode(bus);
        }
    }
}
