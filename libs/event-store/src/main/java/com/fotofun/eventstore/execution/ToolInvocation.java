package com.fotofun.eventstore.execution;

import java.util.Map;

/**
 * A tool as seen by a {@link ToolChain}: it describes its changes by emitting events into
 * the step context it is given and returns a result.
 */
@FunctionalInterface
public interface ToolInvocation {

    Object invoke(Map<String, Object> params, CanvasContext canvasContext, ExecutionContext stepContext)
            throws Exception;
}
