package com.gpsr.registry.error;

/**
 * Base class of every typed failure raised by the registry core.
 */
public abstract class RegistryException extends RuntimeException {

    protected RegistryException(String message) {
        super(message);
    }

    protected RegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory getCategory();
}
