package com.gpsr.registry.entity;

/**
 * Filters for listing entities. Null filters match everything, except
 * {@code active} which defaults to active entities only.
 *
 * @param search case-insensitive fragment of the normalized name
 */
public record EntityQuery(String search, String country, RoleType role, Boolean active) {

    public static EntityQuery all() {
        return new EntityQuery(null, null, null, null);
    }

    public static EntityQuery search(String search) {
        return new EntityQuery(search, null, null, null);
    }

    public boolean activeOnly() {
        return active == null || active;
    }
}
