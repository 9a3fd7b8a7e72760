package com.gpsr.registry.error;

/**
 * Raised when a unique-constraint race could not be resolved, either because the
 * operation is not retried or because its retries were exhausted.
 */
public class ConflictException extends RegistryException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CONFLICT;
    }
}
