package com.fotofun.eventbus;

/**
 * A typed channel on the {@link TypedEventBus}. Two channels are equal when their names
 * are equal.
 *
 * @param <T> message data carried on this channel
 */
public final class BusEventType<T> {

    private final String name;
    private final Class<T> dataType;

    private BusEventType(String name, Class<T> dataType) {
        this.name = name;
        this.dataType = dataType;
    }

    public static <T> BusEventType<T> of(String name, Class<T> dataType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (dataType == null) {
            throw new IllegalArgumentException("dataType must not be null");
        }
        return new BusEventType<>(name, dataType);
    }

    public String name() {
        return name;
    }

    public Class<T> dataType() {
        return dataType;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof BusEventType<?> other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
