package com.gpsr.registry.error;

/**
 * Raised when a referenced aggregate, version, source or row does not exist.
 * Never retried.
 */
public class NotFoundException extends RegistryException {

    private final String resource;
    private final String resourceId;

    public NotFoundException(String resource, String resourceId) {
        super(resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public String getResource() {
        return resource;
    }

    public String getResourceId() {
        return resourceId;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
