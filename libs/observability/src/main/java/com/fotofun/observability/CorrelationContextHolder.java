package com.fotofun.observability;

import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keeps the {@link CorrelationContext} of the edit being flushed on the current thread
 * and mirrors its ids into the SLF4J MDC.
 * <p>
 * The event core runs on the thread that owns the store, so a context opened around a
 * commit covers the whole synchronous fan-out of that commit: store handlers, the
 * bridge to the UI bus and history bookkeeping all log with the edit's ids. Scopes nest;
 * closing one reinstates the context of the enclosing commit, or clears the keys.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Installs {@code context} on the current thread, replacing any previous one.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        for (Map.Entry<String, String> entry : context.mdcEntries().entrySet()) {
            if (entry.getValue() != null) {
                MDC.put(entry.getKey(), entry.getValue());
            } else {
                MDC.remove(entry.getKey());
            }
        }
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys from the current thread. */
    public static void clear() {
        CONTEXT.remove();
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }

    /**
     * Installs {@code context} until the returned scope is closed.
     *
     * <pre>{@code
     * try (var scope = CorrelationContextHolder.open(context)) {
     *     store.appendBatch(events);
     * }
     * }</pre>
     */
    public static Scope open(CorrelationContext context) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        return new Scope(previous);
    }

    /** Runs {@code work} inside a scope for {@code context}. */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        try (Scope scope = open(context)) {
            work.run();
        }
    }

    /** Computes {@code work} inside a scope for {@code context} and returns its result. */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        try (Scope scope = open(context)) {
            return work.get();
        }
    }

    /** Restores the enclosing context when closed. Closing twice has no further effect. */
    public static final class Scope implements AutoCloseable {

        private final CorrelationContext previous;
        private boolean closed;

        private Scope(CorrelationContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }
}
