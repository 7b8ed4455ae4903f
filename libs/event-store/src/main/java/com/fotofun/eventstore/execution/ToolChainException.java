package com.fotofun.eventstore.execution;

/**
 * Thrown by {@link ToolChain#execute()} when a step fails without
 * {@code continueOnError}. Nothing emitted by the chain's steps was committed.
 */
public class ToolChainException extends RuntimeException {

    private final String workflowId;

    public ToolChainException(String workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }

    public String workflowId() {
        return workflowId;
    }
}
