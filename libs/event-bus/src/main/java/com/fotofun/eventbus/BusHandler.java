package com.fotofun.eventbus;

@FunctionalInterface
public interface BusHandler<T> {

    void handle(BusMessage<T> message);
}
