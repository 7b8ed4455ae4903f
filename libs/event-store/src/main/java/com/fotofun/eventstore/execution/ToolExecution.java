package com.fotofun.eventstore.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool run tracked by an {@link ExecutionContext}. Not persisted as an event.
 *
 * @param toolId    tool identifier
 * @param startTime when the tool started
 * @param endTime   when it finished (null while running)
 * @param params    invocation parameters
 * @param result    tool result (nullable)
 * @param error     failure message (nullable)
 * @param status    current status
 */
public record ToolExecution(
        String toolId,
        Instant startTime,
        Instant endTime,
        Map<String, Object> params,
        Object result,
        String error,
        WorkflowStatus status) {

    public ToolExecution {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    static ToolExecution started(String toolId, Map<String, Object> params) {
        return new ToolExecution(toolId, Instant.now(), null, params, null, null, WorkflowStatus.RUNNING);
    }

    ToolExecution completed(boolean success, Object toolResult) {
        return new ToolExecution(toolId, startTime, Instant.now(), params, toolResult, error,
                success ? WorkflowStatus.COMPLETED : WorkflowStatus.FAILED);
    }

    ToolExecution failed(String message) {
        return new ToolExecution(toolId, startTime, Instant.now(), params, result, message, WorkflowStatus.FAILED);
    }

    public boolean isRunning() {
        return status == WorkflowStatus.RUNNING;
    }
}
