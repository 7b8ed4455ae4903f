package com.fotofun.eventbus;

/**
 * Thrown by {@link TypedEventBus#emit} under {@link ErrorPolicy#THROW} once every
 * handler has run, if any of them failed. The first failure is the cause; later ones
 * are attached as suppressed exceptions.
 */
public class HandlerInvocationException extends RuntimeException {

    private final String channel;

    public HandlerInvocationException(String channel, Throwable cause) {
        super("Handler failed for " + channel + ": " + cause.getMessage(), cause);
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }
}
