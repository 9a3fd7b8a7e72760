package com.gpsr.registry.error;

import java.util.List;
import java.util.Map;

/**
 * Raised on a business-rule violation, optionally with field-level detail.
 */
public class ValidationException extends RegistryException {

    private final Map<String, List<String>> fieldErrors;

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, List<String>> fieldErrors) {
        super(message);
        this.fieldErrors = fieldErrors != null ? Map.copyOf(fieldErrors) : Map.of();
    }

    /**
     * Creates a validation error carrying a single field message.
     */
    public static ValidationException forField(String message, String field, String fieldMessage) {
        return new ValidationException(message, Map.of(field, List.of(fieldMessage)));
    }

    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
