package io.luascript.core.ir;

import java.util.List;

/**
 * Outcome of checking an IR document: {@code ok} is {@code true} iff {@code errors} is empty.
 *
 * @param ok     whether the document passed every check
 * @param errors human-readable violations, in discovery order
 */
public record ValidationResult(boolean ok, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
        if (ok != errors.isEmpty()) {
            throw new IllegalArgumentException("ok must be true exactly when errors is empty");
        }
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, List.of());
    }
}
