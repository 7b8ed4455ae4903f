package com.fotofun.eventmodel;

import java.util.ArrayList;

/**
 * Validates {@link Event} instances for required fields and internal consistency.
 *
 * <p>Structural checks only. Whether an event makes sense for a particular canvas state
 * is {@link Event#canApply}'s concern.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates that all required fields of the event are present and consistent.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(Event event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.id())) {
            errors.add("id must not be null or blank");
        }
        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        if (isBlank(event.aggregateId())) {
            errors.add("aggregateId must not be null or blank");
        }
        if (isBlank(event.sessionId())) {
            errors.add("sessionId must not be null or blank");
        }
        if (event.version() < Event.UNVERSIONED) {
            errors.add("version must be >= 0");
        }
        if (event.metadata() == null) {
            errors.add("metadata must not be null");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        } else {
            if (event.aggregateType() != event.payload().type().aggregateType()) {
                errors.add("aggregateType " + event.aggregateType()
                        + " does not match " + event.type() + " (expected "
                        + event.payload().type().aggregateType() + ")");
            }
            if (!event.payload().aggregateId().equals(event.aggregateId())) {
                errors.add("aggregateId does not match payload aggregate " + event.payload().aggregateId());
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
