package com.fotofun.eventstore.legacy;

import com.fotofun.eventmodel.CanvasObject;

import java.util.Map;
import java.util.Optional;

/**
 * Imperative command from the pre-event editor. Commands expose whatever shape they have
 * through the optional accessors; {@link CommandAdapter} derives an event from it where
 * it can.
 */
public interface LegacyCommand {

    String description();

    void execute();

    /** Object the command targets, if any. */
    default Optional<CanvasObject> object() {
        return Optional.empty();
    }

    default Optional<String> layerId() {
        return Optional.empty();
    }

    /** Properties of the object before the command. */
    default Map<String, Object> previousState() {
        return Map.of();
    }

    /** Properties the command changes. */
    default Map<String, Object> modifications() {
        return Map.of();
    }
}
