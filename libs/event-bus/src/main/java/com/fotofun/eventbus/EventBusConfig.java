package com.fotofun.eventbus;

/**
 * Configuration for a {@link TypedEventBus}.
 *
 * @param maxListenersPerType registration ceiling per channel; 0 disables the ceiling
 * @param errorPolicy         handling of handler failures and refused registrations
 * @param metricsEnabled      whether emissions are counted
 */
public record EventBusConfig(int maxListenersPerType, ErrorPolicy errorPolicy, boolean metricsEnabled) {

    public static final int DEFAULT_MAX_LISTENERS = 100;

    public EventBusConfig {
        if (maxListenersPerType < 0) {
            throw new IllegalArgumentException("maxListenersPerType must be >= 0, got " + maxListenersPerType);
        }
        if (errorPolicy == null) {
            throw new IllegalArgumentException("errorPolicy must not be null");
        }
    }

    public static EventBusConfig defaults() {
        return new EventBusConfig(DEFAULT_MAX_LISTENERS, ErrorPolicy.LOG, true);
    }

    public EventBusConfig withErrorPolicy(ErrorPolicy policy) {
        return new EventBusConfig(maxListenersPerType, policy, metricsEnabled);
    }

    public EventBusConfig withMaxListenersPerType(int max) {
        return new EventBusConfig(max, errorPolicy, metricsEnabled);
    }
}
