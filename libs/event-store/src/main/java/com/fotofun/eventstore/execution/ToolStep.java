package com.fotofun.eventstore.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a {@link ToolChain}.
 *
 * @param toolId          registered tool to run
 * @param params          tool parameters
 * @param continueOnError whether the chain goes on when this step fails
 */
public record ToolStep(String toolId, Map<String, Object> params, boolean continueOnError) {

    public ToolStep {
        if (toolId == null || toolId.isBlank()) {
            throw new IllegalArgumentException("toolId must not be null or blank");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static ToolStep of(String toolId, Map<String, Object> params) {
        return new ToolStep(toolId, params, false);
    }
}
