package com.fotofun.eventbus;

import java.time.Instant;

/**
 * Emission statistics of one bus channel.
 *
 * @param emitCount   number of emissions
 * @param lastEmitted time of the latest emission
 */
public record ChannelMetrics(long emitCount, Instant lastEmitted) {

    ChannelMetrics next(Instant at) {
        return new ChannelMetrics(emitCount + 1, at);
    }
}
