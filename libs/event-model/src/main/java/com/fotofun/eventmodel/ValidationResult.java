package com.fotofun.eventmodel;

import java.util.List;

/**
 * Result of validating an {@link Event}.
 *
 * @param valid  true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** All errors joined into one line, or an empty string when valid. */
    public String summary() {
        return String.join("; ", errors);
    }
}
