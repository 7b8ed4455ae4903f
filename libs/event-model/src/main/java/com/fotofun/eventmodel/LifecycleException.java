package com.fotofun.eventmodel;

/**
 * Thrown when an operation targets a component that is no longer usable: a disposed
 * store or bus, or an execution context that was already committed or rolled back.
 */
public class LifecycleException extends IllegalStateException {

    public LifecycleException(String message) {
        super(message);
    }
}
