package com.fotofun.eventstore.execution;

import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventFactory;
import com.fotofun.eventmodel.EventMetadata;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventmodel.EventSource;
import com.fotofun.eventmodel.LifecycleException;
import com.fotofun.eventstore.EventStore;
import com.fotofun.observability.CorrelationContext;
import com.fotofun.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Transactional buffer over an {@link EventStore} for one user gesture or one workflow
 * step.
 * <p>
 * {@link #emit(Event)} stamps an event with this context's correlation metadata and
 * buffers it. Nothing reaches the store until {@link #commit()}, which appends the
 * buffer in emission order; {@link #rollback()} discards it. Either call finishes the
 * context for good: every later emit, commit or rollback throws
 * {@link LifecycleException}.
 * <p>
 * The context is bound to a {@link SelectionSnapshot} taken at creation, so its targets
 * do not move when the user changes the selection mid-operation.
 */
public class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private enum State { OPEN, COMMITTED, ROLLED_BACK }

    private final String id;
    private final Instant createdAt;
    private final EventStore store;
    private final String canvasId;
    private final EventSource source;
    private final String workflowId;
    private final String parentContextId;
    private final String sessionId;
    private final String userId;
    private final SelectionSnapshot selection;

    private final List<Event> buffer = new ArrayList<>();
    private final Map<String, ToolExecution> toolExecutions = new LinkedHashMap<>();
    private State state = State.OPEN;
    private WorkflowStatus workflowStatus = WorkflowStatus.RUNNING;
    private String workflowError;

    private ExecutionContext(Builder builder) {
        this.id = UUID.randomUUID().toString();
        this.createdAt = Instant.now();
        this.store = builder.store;
        this.canvasId = builder.canvasId;
        this.source = builder.source;
        this.workflowId = builder.workflowId;
        this.parentContextId = builder.parentContextId;
        this.sessionId = builder.sessionId;
        this.userId = builder.userId;
        this.selection = builder.selection;
    }

    public static Builder builder(EventStore store, String canvasId) {
        return new Builder(store, canvasId);
    }

    // ---------------------------------------------------------------- events

    /**
     * Stamps {@code event} with this context's metadata and buffers it.
     *
     * @return the stamped event as buffered
     * @throws LifecycleException if the context was committed or rolled back
     */
    public Event emit(Event event) {
        ensureOpen("emit to");
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        EventMetadata metadata = event.metadata()
                .withCorrelationId(id)
                .withWorkflowId(workflowId)
                .withSelectionSnapshotId(selection.id());
        if (parentContextId != null) {
            metadata = metadata.withCausationId(parentContextId);
        }
        Event stamped = event.withMetadata(metadata);
        buffer.add(stamped);
        return stamped;
    }

    /** Creates an event for {@code payload} in this context's session and buffers it. */
    public Event emit(EventPayload payload) {
        ensureOpen("emit to");
        return emit(EventFactory.create(payload, EventMetadata.of(source), sessionId, userId));
    }

    /**
     * Appends the buffered events to the store in emission order and finishes the context.
     * While the events are appended the correlation keys are in the logging MDC.
     * <p>
     * The buffer is appended as one batch. If the store rejects it (a repeated or already
     * stored id, or a disposed store) nothing is stored and the context stays open with
     * its buffer intact, so the caller can still roll back.
     *
     * @return the stored events, carrying their assigned versions
     * @throws LifecycleException       if the context was already committed or rolled back,
     *                                  or the store has been disposed
     * @throws IllegalArgumentException if the store rejects the buffered events
     */
    public List<Event> commit() {
        ensureOpen("commit");
        List<Event> stored = CorrelationContextHolder.callWithContext(correlationContext(), () -> {
            List<Event> appended = store.appendBatch(List.copyOf(buffer));
            log.debug("Committed {} events", appended.size());
            return appended;
        });
        state = State.COMMITTED;
        buffer.clear();
        return Collections.unmodifiableList(stored);
    }

    /**
     * Discards the buffered events and finishes the context.
     *
     * @throws LifecycleException if the context was already committed or rolled back
     */
    public void rollback() {
        ensureOpen("roll back");
        log.debug("Rolling back context {} with {} buffered events", id, buffer.size());
        buffer.clear();
        state = State.ROLLED_BACK;
    }

    /**
     * Creates a context for a nested tool invocation. It shares this context's selection,
     * store and session; its events carry this context's id as causation id.
     */
    public ExecutionContext createChildContext() {
        return createChildContext(null, null);
    }

    /**
     * @param childSource     source override, or null to inherit
     * @param childWorkflowId workflow override, or null to inherit
     */
    public ExecutionContext createChildContext(EventSource childSource, String childWorkflowId) {
        return builder(store, canvasId)
                .source(childSource != null ? childSource : source)
                .workflowId(childWorkflowId != null ? childWorkflowId : workflowId)
                .selection(selection)
                .sessionId(sessionId)
                .userId(userId)
                .parentContextId(id)
                .build();
    }

    /**
     * Moves the events buffered by an open child into this context's buffer and finishes
     * the child, so that they are committed together with this context.
     */
    void adopt(ExecutionContext child) {
        ensureOpen("adopt into");
        if (child.state != State.OPEN) {
            return;
        }
        buffer.addAll(child.buffer);
        child.buffer.clear();
        child.state = State.COMMITTED;
    }

    /** Metadata that events emitted through this context carry. */
    public EventMetadata getMetadata() {
        return new EventMetadata(source, id, parentContextId, workflowId, selection.id());
    }

    public List<Event> bufferedEvents() {
        return List.copyOf(buffer);
    }

    // ---------------------------------------------------------------- targets

    public SelectionSnapshot getSelection() {
        return selection;
    }

    /** Objects of the frozen selection that still exist on the canvas. */
    public List<CanvasObject> getTargetObjects(CanvasObjectSource canvas) {
        return selection.getValidObjects(canvas);
    }

    /** Images of the frozen selection that still exist on the canvas. */
    public List<CanvasObject> getTargetImages(CanvasObjectSource canvas) {
        return getTargetObjects(canvas).stream()
                .filter(CanvasObject::isImage)
                .toList();
    }

    public boolean hasTargets() {
        return !selection.isEmpty();
    }

    public CanvasContext getCanvasContext(CanvasObjectSource canvas) {
        List<CanvasObject> targetImages = getTargetImages(canvas);
        var selectedIds = canvas.selectedObjectIds();

        TargetingMode mode = TargetingMode.NONE;
        if (!targetImages.isEmpty()) {
            if (!selectedIds.isEmpty() && !selection.isEmpty()) {
                mode = TargetingMode.SELECTION;
            } else if (targetImages.size() == 1) {
                mode = TargetingMode.AUTO_SINGLE;
            } else {
                mode = TargetingMode.ALL;
            }
        }
        return new CanvasContext(targetImages, mode, canvas.width(), canvas.height(), selectedIds);
    }

    // ---------------------------------------------------------------- tool tracking

    public void startTool(String toolId, Map<String, Object> params) {
        toolExecutions.put(toolId, ToolExecution.started(toolId, params));
    }

    public void completeTool(String toolId, boolean success, Object result) {
        toolExecutions.computeIfPresent(toolId, (k, execution) -> execution.completed(success, result));
    }

    public void failTool(String toolId, String error) {
        toolExecutions.computeIfPresent(toolId, (k, execution) -> execution.failed(error));
    }

    public List<ToolExecution> getToolExecutions() {
        return List.copyOf(toolExecutions.values());
    }

    public void completeWorkflow() {
        workflowStatus = WorkflowStatus.COMPLETED;
    }

    public void failWorkflow(String error) {
        workflowStatus = WorkflowStatus.FAILED;
        workflowError = error;
    }

    public WorkflowStatus getWorkflowStatus() {
        return workflowStatus;
    }

    public String getWorkflowError() {
        return workflowError;
    }

    // ---------------------------------------------------------------- accessors

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String canvasId() {
        return canvasId;
    }

    public EventSource source() {
        return source;
    }

    public String workflowId() {
        return workflowId;
    }

    public String parentContextId() {
        return parentContextId;
    }

    public String sessionId() {
        return sessionId;
    }

    public EventStore store() {
        return store;
    }

    public boolean isCommitted() {
        return state == State.COMMITTED;
    }

    public boolean isRolledBack() {
        return state == State.ROLLED_BACK;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    private CorrelationContext correlationContext() {
        return new CorrelationContext(id, workflowId, source.value(), parentContextId, selection.id(), sessionId);
    }

    private void ensureOpen(String action) {
        if (state == State.COMMITTED) {
            throw new LifecycleException("Cannot " + action + " a committed context " + id);
        }
        if (state == State.ROLLED_BACK) {
            throw new LifecycleException("Cannot " + action + " a rolled back context " + id);
        }
    }

    /**
     * Builder for {@link ExecutionContext}. Defaults: source {@code SYSTEM}, empty
     * selection, no workflow, default session.
     */
    public static final class Builder {

        private final EventStore store;
        private final String canvasId;
        private EventSource source = EventSource.SYSTEM;
        private String workflowId;
        private String parentContextId;
        private String sessionId = EventFactory.DEFAULT_SESSION_ID;
        private String userId;
        private SelectionSnapshot selection = SelectionSnapshot.empty();

        private Builder(EventStore store, String canvasId) {
            if (store == null) {
                throw new IllegalArgumentException("store must not be null");
            }
            if (canvasId == null || canvasId.isBlank()) {
                throw new IllegalArgumentException("canvasId must not be null or blank");
            }
            this.store = store;
            this.canvasId = canvasId;
        }

        public Builder source(EventSource value) {
            this.source = value;
            return this;
        }

        public Builder workflowId(String value) {
            this.workflowId = value;
            return this;
        }

        public Builder parentContextId(String value) {
            this.parentContextId = value;
            return this;
        }

        public Builder sessionId(String value) {
            this.sessionId = value;
            return this;
        }

        public Builder userId(String value) {
            this.userId = value;
            return this;
        }

        public Builder selection(SelectionSnapshot value) {
            this.selection = value;
            return this;
        }

        public ExecutionContext build() {
            if (source == null) {
                throw new IllegalArgumentException("source must not be null");
            }
            if (selection == null) {
                throw new IllegalArgumentException("selection must not be null");
            }
            return new ExecutionContext(this);
        }
    }
}
