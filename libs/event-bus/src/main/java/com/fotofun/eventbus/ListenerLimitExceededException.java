package com.fotofun.eventbus;

/**
 * Thrown under {@link ErrorPolicy#THROW} when a channel already holds the maximum number
 * of handlers.
 */
public class ListenerLimitExceededException extends RuntimeException {

    private final String channel;
    private final int limit;

    public ListenerLimitExceededException(String channel, int limit) {
        super("Listener limit of " + limit + " reached for " + channel);
        this.channel = channel;
        this.limit = limit;
    }

    public String channel() {
        return channel;
    }

    public int limit() {
        return limit;
    }
}
