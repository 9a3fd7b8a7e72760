package com.gpsr.registry.contact;

/**
 * Kind of aggregate an electronic contact belongs to.
 */
public enum ContactOwnerType {
    ENTITY("Entity"),
    BRAND("Brand");

    private final String resource;

    ContactOwnerType(String resource) {
        this.resource = resource;
    }

    public String resource() {
        return resource;
    }
}
