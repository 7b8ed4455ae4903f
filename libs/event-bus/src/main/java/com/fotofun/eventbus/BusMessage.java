package com.fotofun.eventbus;

import java.time.Instant;

/**
 * What a bus handler receives: the emitted data and the time of emission.
 */
public record BusMessage<T>(T data, Instant timestamp) {
}
