package com.fotofun.eventstore.execution;

/**
 * Outcome of one {@link ToolStep}.
 *
 * @param toolId  tool that ran
 * @param success whether it succeeded
 * @param data    tool result (nullable)
 * @param error   failure message (nullable)
 */
public record StepResult(String toolId, boolean success, Object data, String error) {

    public static StepResult succeeded(String toolId, Object data) {
        return new StepResult(toolId, true, data, null);
    }

    public static StepResult failed(String toolId, String error) {
        return new StepResult(toolId, false, null, error);
    }
}
