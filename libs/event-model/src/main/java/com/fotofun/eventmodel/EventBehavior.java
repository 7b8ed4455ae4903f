package com.fotofun.eventmodel;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * The pure functions that give one event kind its meaning.
 *
 * @param payloadType payload record this behaviour accepts
 * @param apply       produces the next state; must not mutate its inputs
 * @param reverse     the payload that undoes this one, or empty when irreversible
 * @param canApply    advisory precondition
 * @param describe    human-readable audit label
 * @param <P>         payload record type
 */
public record EventBehavior<P extends EventPayload>(
        Class<P> payloadType,
        BiFunction<CanvasState, P, CanvasState> apply,
        Function<P, Optional<EventPayload>> reverse,
        BiPredicate<CanvasState, P> canApply,
        Function<P, String> describe) {

    static <P extends EventPayload> EventBehavior<P> reversible(
            Class<P> payloadType,
            BiFunction<CanvasState, P, CanvasState> apply,
            Function<P, EventPayload> reverse,
            BiPredicate<CanvasState, P> canApply,
            Function<P, String> describe) {
        return new EventBehavior<>(payloadType, apply, p -> Optional.of(reverse.apply(p)), canApply, describe);
    }

    static <P extends EventPayload> EventBehavior<P> irreversible(
            Class<P> payloadType,
            BiFunction<CanvasState, P, CanvasState> apply,
            Function<P, String> describe) {
        return new EventBehavior<>(payloadType, apply, p -> Optional.empty(), (s, p) -> true, describe);
    }

    /** Bookkeeping kinds that leave the state untouched and cannot be undone. */
    static <P extends EventPayload> EventBehavior<P> tracking(Class<P> payloadType, Function<P, String> describe) {
        return irreversible(payloadType, (state, p) -> state, describe);
    }

    CanvasState applyTo(CanvasState state, EventPayload payload) {
        return apply.apply(state, payloadType.cast(payload));
    }

    Optional<EventPayload> reverseOf(EventPayload payload) {
        return reverse.apply(payloadType.cast(payload));
    }

    boolean canApplyTo(CanvasState state, EventPayload payload) {
        return canApply.test(state, payloadType.cast(payload));
    }

    String describe(EventPayload payload) {
        return describe.apply(payloadType.cast(payload));
    }
}
