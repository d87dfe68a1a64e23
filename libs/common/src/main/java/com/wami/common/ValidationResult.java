package com.wami.common;

import java.util.List;

/**
 * Result of a collect-all-errors validation.
 *
 * @param valid  whether the value passed every check
 * @param errors validation error messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Creates a passing result when {@code errors} is empty, otherwise a failing one. */
    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? ok() : fail(errors);
    }
}
