package com.fotofun.eventstore.legacy;

import com.fotofun.eventmodel.CanvasObject;
import com.fotofun.eventmodel.Event;
import com.fotofun.eventmodel.EventPayload;
import com.fotofun.eventstore.execution.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Migration shim from legacy commands to events.
 * <p>
 * A command is matched on its class name, then on keywords in its description. The
 * derived event is emitted through the supplied context and the command is executed
 * either way, so no user action is dropped. The audit trail is best effort: commands
 * whose shape is not recognized run without an event.
 */
public class CommandAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandAdapter.class);

    private volatile boolean enabled = true;

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Emits the event derived from {@code command} into {@code context}, then executes the
     * command.
     *
     * @return the buffered event, or empty when the adapter is disabled or the command
     *         is not recognized
     */
    public Optional<Event> interceptCommand(LegacyCommand command, ExecutionContext context) {
        if (!enabled) {
            command.execute();
            return Optional.empty();
        }

        Optional<EventPayload> payload = toPayload(command, context.canvasId());
        Optional<Event> emitted = payload.map(context::emit);
        if (emitted.isEmpty()) {
            log.warn("Unknown command type: {} ({})", command.getClass().getSimpleName(), command.description());
        }
        command.execute();
        return emitted;
    }

    /**
     * Derives the event payload for a command, if its shape is recognized.
     */
    Optional<EventPayload> toPayload(LegacyCommand command, String canvasId) {
        String commandName = command.getClass().getSimpleName();
        switch (commandName) {
            case "AddObjectCommand":
                return addObject(command, canvasId);
            case "RemoveObjectCommand":
                return removeObject(command, canvasId);
            case "ModifyCommand":
            case "TransformCommand":
            case "CropCommand":
                return modifyObject(command, canvasId);
            default:
                break;
        }

        String description = command.description() == null
                ? ""
                : command.description().toLowerCase(Locale.ROOT);
        if (description.contains("add") && description.contains("object")) {
            return addObject(command, canvasId);
        }
        if (description.contains("remove") && description.contains("object")) {
            return removeObject(command, canvasId);
        }
        if (description.contains("modify") || description.contains("change")) {
            return modifyObject(command, canvasId);
        }
        return Optional.empty();
    }

    private Optional<EventPayload> addObject(LegacyCommand command, String canvasId) {
        return convert(command, "add", () -> command.object().map(object -> {
            CanvasObject placed = command.layerId()
                    .map(layerId -> new CanvasObject(object.id(), object.type(), layerId, object.properties()))
                    .orElse(object);
            return new EventPayload.ObjectAdded(canvasId, placed, null);
        }));
    }

    private Optional<EventPayload> removeObject(LegacyCommand command, String canvasId) {
        return convert(command, "remove", () -> command.object()
                .map(object -> new EventPayload.ObjectRemoved(canvasId, object, null)));
    }

    private Optional<EventPayload> modifyObject(LegacyCommand command, String canvasId) {
        return convert(command, "modify", () -> command.object()
                .map(object -> new EventPayload.ObjectModified(canvasId, object.id(),
                        command.previousState(), command.modifications())));
    }

    private Optional<EventPayload> convert(LegacyCommand command, String kind,
                                           Supplier<Optional<? extends EventPayload>> factory) {
        try {
            return factory.get().map(EventPayload.class::cast);
        } catch (RuntimeException e) {
            log.error("Failed to derive {} event from {}", kind, command.getClass().getSimpleName(), e);
            return Optional.empty();
        }
    }
}
