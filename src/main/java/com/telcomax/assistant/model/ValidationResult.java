package com.telcomax.assistant.model;

import java.util.List;

/**
 * Validator outcome. {@code reasons} is empty exactly when {@code approved} is true.
 */
public record ValidationResult(boolean approved, List<String> reasons) {

    public ValidationResult {
        reasons = List.copyOf(reasons);
        if (approved != reasons.isEmpty()) {
            throw new IllegalArgumentException("approved must match an empty reason list");
        }
    }

    public static ValidationResult of(List<String> reasons) {
        return new ValidationResult(reasons.isEmpty(), reasons);
    }
}
