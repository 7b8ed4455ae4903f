package com.fotofun.eventstore.execution;

/** Introspection-only status of the work done through one execution context. */
public enum WorkflowStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
