package com.fotofun.eventbus;

import com.fotofun.eventmodel.LifecycleException;
import com.fotofun.eventstore.Subscription;
import com.fotofun.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Synchronous, in-memory publish/subscribe keyed by {@link BusEventType}.
 * <p>
 * Nothing emitted here is persisted; the bus only tells UI code that something
 * happened. Dispatch works on a copy of the handler list taken when {@link #emit} is
 * called: a handler registered while a dispatch is running first hears the next
 * emission, and a handler removed mid-dispatch still receives the current one.
 * <p>
 * Handler failures and refused registrations are routed through the configured
 * {@link ErrorPolicy}. A failing handler never prevents its siblings from running.
 */
public class TypedEventBus {

    private static final Logger log = LoggerFactory.getLogger(TypedEventBus.class);

    static final String COMPONENT = "event-bus";

    private static final Subscription REFUSED = () -> { };

    private final EventBusConfig config;
    private final MetricFactory metrics;

    private final Map<String, List<Registration>> registrations = new HashMap<>();
    private final Map<String, ChannelMetrics> channelMetrics = new HashMap<>();
    private final Map<String, Counter> emitCounters = new HashMap<>();
    private final Counter handlerErrors;

    private boolean disposed;

    public TypedEventBus() {
        this(EventBusConfig.defaults(), MetricFactory.standalone(COMPONENT));
    }

    public TypedEventBus(EventBusConfig config) {
        this(config, MetricFactory.standalone(COMPONENT));
    }

    public TypedEventBus(EventBusConfig config, MetricFactory metrics) {
        if (config == null || metrics == null) {
            throw new IllegalArgumentException("config and metrics must not be null");
        }
        this.config = config;
        this.metrics = metrics.forComponent(COMPONENT);
        this.handlerErrors = this.metrics.counter("editor.bus.handler.errors",
                "Bus handler exceptions caught during dispatch");
    }

    // ---------------------------------------------------------------- registration

    /**
     * Registers {@code handler} on {@code type}.
     *
     * @return a subscription removing exactly this registration; a no-op subscription if
     *         the registration was refused by the listener ceiling
     * @throws ListenerLimitExceededException if the ceiling is reached under
     *                                        {@link ErrorPolicy#THROW}
     */
    public <T> Subscription on(BusEventType<T> type, BusHandler<T> handler) {
        return register(type, handler, false);
    }

    /**
     * Registers {@code handler} for the next emission on {@code type} only. The
     * registration is removed before the handler runs.
     */
    public <T> Subscription once(BusEventType<T> type, BusHandler<T> handler) {
        return register(type, handler, true);
    }

    /**
     * Removes every registration of {@code handler} on {@code type}, including ones made
     * through {@link #once}.
     */
    public synchronized <T> void off(BusEventType<T> type, BusHandler<T> handler) {
        ensureOpen();
        List<Registration> channel = registrations.get(type.name());
        if (channel != null) {
            channel.removeIf(r -> r.handler == handler);
            if (channel.isEmpty()) {
                registrations.remove(type.name());
            }
        }
    }

    private synchronized <T> Subscription register(BusEventType<T> type, BusHandler<T> handler, boolean once) {
        ensureOpen();
        if (type == null || handler == null) {
            throw new IllegalArgumentException("type and handler must not be null");
        }
        List<Registration> channel = registrations.computeIfAbsent(type.name(), k -> new ArrayList<>());
        int limit = config.maxListenersPerType();
        if (limit > 0 && channel.size() >= limit) {
            refuse(type.name(), limit);
            if (channel.isEmpty()) {
                registrations.remove(type.name());
            }
            return REFUSED;
        }
        Registration registration = new Registration(handler, once);
        channel.add(registration);
        return () -> remove(type.name(), registration);
    }

    private void refuse(String channel, int limit) {
        switch (config.errorPolicy()) {
            case THROW:
                throw new ListenerLimitExceededException(channel, limit);
            case LOG:
                log.warn("Listener limit of {} reached for {}; registration refused", limit, channel);
                break;
            default:
                log.debug("Listener limit of {} reached for {}; registration refused silently", limit, channel);
                break;
        }
    }

    private synchronized void remove(String channel, Registration registration) {
        List<Registration> list = registrations.get(channel);
        if (list != null) {
            list.remove(registration);
            if (list.isEmpty()) {
                registrations.remove(channel);
            }
        }
    }

    // ---------------------------------------------------------------- dispatch

    /**
     * Delivers {@code data} to every handler registered on {@code type} when the call
     * starts.
     *
     * @throws HandlerInvocationException if a handler failed under {@link ErrorPolicy#THROW}
     * @throws LifecycleException         if the bus has been disposed
     */
    public <T> void emit(BusEventType<T> type, T data) {
        List<Registration> targets;
        BusMessage<T> message;
        synchronized (this) {
            ensureOpen();
            message = new BusMessage<>(data, Instant.now());
            if (config.metricsEnabled()) {
                record(type.name(), message.timestamp());
            }
            List<Registration> channel = registrations.get(type.name());
            targets = channel == null ? List.of() : new ArrayList<>(channel);
        }

        RuntimeException failure = null;
        for (Registration registration : targets) {
            if (registration.once && !registration.claim(this, type.name())) {
                continue;
            }
            try {
                registration.<T>typed().handle(message);
            } catch (RuntimeException e) {
                failure = onHandlerError(type.name(), e, failure);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private RuntimeException onHandlerError(String channel, RuntimeException error, RuntimeException pending) {
        handlerErrors.increment();
        switch (config.errorPolicy()) {
            case THROW:
                if (pending == null) {
                    return new HandlerInvocationException(channel, error);
                }
                pending.addSuppressed(error);
                return pending;
            case LOG:
                log.error("Handler failed for {}: {}", channel, error.getMessage(), error);
                return pending;
            default:
                log.debug("Ignoring handler failure for {}: {}", channel, error.getMessage());
                return pending;
        }
    }

    private void record(String channel, Instant at) {
        channelMetrics.merge(channel, new ChannelMetrics(1, at), (previous, ignored) -> previous.next(at));
        emitCounters.computeIfAbsent(channel, name -> metrics.counter("editor.bus.emitted",
                "Messages emitted on the bus", "channel", name)).increment();
    }

    // ---------------------------------------------------------------- housekeeping

    /** Removes every handler on {@code type}. */
    public synchronized void clear(BusEventType<?> type) {
        ensureOpen();
        registrations.remove(type.name());
    }

    /** Removes every handler on every channel. */
    public synchronized void clear() {
        ensureOpen();
        registrations.clear();
    }

    public synchronized int listenerCount(BusEventType<?> type) {
        ensureOpen();
        List<Registration> channel = registrations.get(type.name());
        return channel == null ? 0 : channel.size();
    }

    /**
     * Emission statistics for {@code type}; empty until the first emission or when
     * metrics are disabled.
     */
    public synchronized Optional<ChannelMetrics> getMetrics(BusEventType<?> type) {
        return Optional.ofNullable(channelMetrics.get(type.name()));
    }

    public EventBusConfig config() {
        return config;
    }

    /** Drops all handlers and statistics. Safe to call twice. */
    public synchronized void dispose() {
        if (disposed) {
            return;
        }
        registrations.clear();
        channelMetrics.clear();
        disposed = true;
        log.debug("Event bus disposed");
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    private void ensureOpen() {
        if (disposed) {
            throw new LifecycleException("Event bus has been disposed");
        }
    }

    private static final class Registration {
        private final BusHandler<?> handler;
        private final boolean once;
        private final AtomicBoolean fired = new AtomicBoolean();

        private Registration(BusHandler<?> handler, boolean once) {
            this.handler = handler;
            this.once = once;
        }

        /** Wins the single delivery of a once-registration and unregisters it. */
        private boolean claim(TypedEventBus bus, String channel) {
            if (!fired.compareAndSet(false, true)) {
                return false;
            }
            bus.remove(channel, this);
            return true;
        }

        @SuppressWarnings("unchecked")
        private <T> BusHandler<T> typed() {
            return (BusHandler<T>) handler;
        }
    }
}
