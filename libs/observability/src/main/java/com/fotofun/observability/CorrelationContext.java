package com.fotofun.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable correlation context describing the edit that is currently being processed.
 * <p>
 * An execution context (one user gesture or one workflow step) establishes a
 * {@code CorrelationContext} while it flushes its events, so that everything logged
 * during store fan-out, bridge translation and history bookkeeping can be traced
 * back to the originating edit.
 *
 * @param correlationId       id of the execution context that groups the events
 * @param workflowId          workflow the edit belongs to (nullable for direct user edits)
 * @param source              origin of the edit ({@code user}, {@code ai} or {@code system})
 * @param causationId         id of the parent execution context (nullable)
 * @param selectionSnapshotId id of the frozen selection the edit targets (nullable)
 * @param sessionId           editor session id (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String workflowId,
        String source,
        String causationId,
        String selectionSnapshotId,
        String sessionId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for workflow ID.
     */
    public static final String MDC_WORKFLOW_ID = "workflowId";

    /**
     * MDC key for event source.
     */
    public static final String MDC_SOURCE = "source";

    public static final String MDC_CAUSATION_ID = "causationId";

    public static final String MDC_SELECTION_SNAPSHOT_ID = "selectionSnapshotId";

    public static final String MDC_SESSION_ID = "sessionId";

    /** Every MDC key a context writes, in log-pattern order. */
    public static final List<String> MDC_KEYS = List.of(MDC_CORRELATION_ID, MDC_WORKFLOW_ID, MDC_SOURCE,
            MDC_CAUSATION_ID, MDC_SELECTION_SNAPSHOT_ID, MDC_SESSION_ID);

    /**
     * Compact constructor; ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * MDC key to value for every key in {@link #MDC_KEYS}. Absent fields map to null so
     * that installing this context also removes a previous context's value.
     */
    public Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        entries.put(MDC_WORKFLOW_ID, workflowId);
        entries.put(MDC_SOURCE, source);
        entries.put(MDC_CAUSATION_ID, causationId);
        entries.put(MDC_SELECTION_SNAPSHOT_ID, selectionSnapshotId);
        entries.put(MDC_SESSION_ID, sessionId);
        return entries;
    }
}
