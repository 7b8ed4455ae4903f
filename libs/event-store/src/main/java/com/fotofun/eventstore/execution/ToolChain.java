package com.fotofun.eventstore.execution;

import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventFactory;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventmodel.LifecycleException;
import com.fotofun.eventstore.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs an ordered list of tool steps as one workflow.
 * <p>
 * All steps share the selection captured when the chain was created. Each step runs in a
 * child context whose events are folded into the chain's context, so the whole workflow
 * ({@code workflow.started}, every step's events, {@code workflow.completed}) reaches the
 * store in a single commit. When a step fails without {@code continueOnError} the chain
 * rolls back and records a standalone {@code workflow.failed} event instead.
 */
public class ToolChain {

    private static final Logger log = LoggerFactory.getLogger(ToolChain.class);

    private final String id;
    private final String description;
    private final EventStore store;
    private final CanvasObjectSource canvas;
    private final Map<String, ToolInvocation> tools;
    private final ExecutionContext context;

    private final List<ToolStep> steps = new ArrayList<>();
    private final List<StepResult> results = new ArrayList<>();
    private List<Event> committedEvents = List.of();
    private boolean executed;
    private boolean completed;

    public ToolChain(EventStore store, CanvasObjectSource canvas, SelectionSnapshot selection,
                     Map<String, ToolInvocation> tools, String description) {
        this.id = UUID.randomUUID().toString();
        this.description = description == null ? "Tool Chain Execution" : description;
        this.store = store;
        this.canvas = canvas;
        this.tools = Map.copyOf(tools);
        this.context = ExecutionContextFactory.fromSnapshot(canvas, selection, store, EventSource.AI, id);
    }

    /** Chain targeting the objects currently selected on the canvas. */
    public static ToolChain fromCanvas(EventStore store, CanvasObjectSource canvas,
                                       Map<String, ToolInvocation> tools, String description) {
        return new ToolChain(store, canvas, SelectionSnapshot.fromCanvas(canvas), tools, description);
    }

    public ToolChain addStep(ToolStep step) {
        if (executed) {
            throw new LifecycleException("Cannot add steps to an executed chain " + id);
        }
        steps.add(step);
        return this;
    }

    /**
     * Runs every step and commits the workflow.
     *
     * @return one result per step
     * @throws ToolChainException if a step fails without {@code continueOnError}
     * @throws LifecycleException if the chain was already executed
     */
    public List<StepResult> execute() {
        if (executed) {
            throw new LifecycleException("Chain already executed " + id);
        }
        executed = true;
        log.info("Tool chain {} starting with {} steps", id, steps.size());

        context.emit(new EventPayload.WorkflowStarted(id, description,
                steps.stream().map(ToolStep::toolId).toList()));
        try {
            for (int i = 0; i < steps.size(); i++) {
                runStep(i, steps.get(i));
            }
        } catch (ToolChainException e) {
            fail(e);
            throw e;
        }

        context.emit(new EventPayload.WorkflowCompleted(id, true, results.size()));
        context.completeWorkflow();
        committedEvents = context.commit();
        completed = true;
        log.info("Tool chain {} completed, {} events committed", id, committedEvents.size());
        return getResults();
    }

    private void runStep(int index, ToolStep step) {
        log.debug("Tool chain {} step {}/{}: {}", id, index + 1, steps.size(), step.toolId());
        ExecutionContext stepContext = context.createChildContext();
        context.startTool(step.toolId(), step.params());
        try {
            ToolInvocation tool = tools.get(step.toolId());
            if (tool == null) {
                throw new IllegalArgumentException("Tool not found: " + step.toolId());
            }
            Object data = tool.invoke(step.params(), stepContext.getCanvasContext(canvas), stepContext);
            context.adopt(stepContext);
            context.completeTool(step.toolId(), true, data);
            results.add(StepResult.succeeded(step.toolId(), data));
        } catch (Exception e) {
            if (stepContext.isOpen()) {
                stepContext.rollback();
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            context.failTool(step.toolId(), message);
            results.add(StepResult.failed(step.toolId(), message));
            if (!step.continueOnError()) {
                throw new ToolChainException(id, "Step " + (index + 1) + " (" + step.toolId() + ") failed: "
                        + message, e);
            }
            log.warn("Tool chain {} step {} failed, continuing: {}", id, step.toolId(), message);
        }
    }

    private void fail(ToolChainException e) {
        log.error("Tool chain {} failed", id, e);
        context.failWorkflow(e.getMessage());
        context.rollback();
        Event failed = EventFactory.create(new EventPayload.WorkflowFailed(id, e.getMessage()),
                context.getMetadata(), context.sessionId(), null);
        store.append(failed);
    }

    public String id() {
        return id;
    }

    public ExecutionContext context() {
        return context;
    }

    public List<StepResult> getResults() {
        return List.copyOf(results);
    }

    /** Events stored by the successful commit, empty until then. */
    public List<Event> committedEvents() {
        return committedEvents;
    }

    /** True when the chain committed and every step succeeded. */
    public boolean isSuccessful() {
        return completed && results.stream().allMatch(StepResult::success);
    }
}
