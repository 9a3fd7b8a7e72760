package com.gpsr.registry.error;

/**
 * Category of a registry failure, with the HTTP status the API layer maps it to.
 */
public enum ErrorCategory {
    NOT_FOUND(404),
    VALIDATION(400),
    CONFLICT(409),
    INTERNAL(500);

    private final int httpStatus;

    ErrorCategory(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Categorizes any throwable. Anything that is not a {@link RegistryException}
     * is an internal failure whose detail must stay server side.
     */
    public static ErrorCategory of(Throwable error) {
        if (error instanceof RegistryException registryException) {
            return registryException.getCategory();
        }
        return INTERNAL;
    }
}
