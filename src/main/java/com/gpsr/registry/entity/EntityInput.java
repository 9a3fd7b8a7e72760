package com.gpsr.registry.entity;

/**
 * Raw entity data as submitted by a caller. On update, null fields keep their
 * current value.
 *
 * @param role          optional role created together with a new entity
 * @param marketContext market of that role, {@code GLOBAL} when null
 */
public record EntityInput(
        String name,
        String address,
        String city,
        String country,
        String vatId,
        String email,
        String phone,
        String website,
        RoleType role,
        String marketContext
) {
    public static EntityInput of(String name, String country) {
        return new EntityInput(name, null, null, country, null, null, null, null, null, null);
    }

    public EntityInput withVatId(String vatId) {
        return new EntityInput(name, address, city, country, vatId, email, phone, website, role, marketContext);
    }

    public EntityInput withAddress(String address, String city) {
        return new EntityInput(name, address, city, country, vatId, email, phone, website, role, marketContext);
    }

    public EntityInput withContact(String email, String phone, String website) {
        return new EntityInput(name, address, city, country, vatId, email, phone, website, role, marketContext);
    }

    public EntityInput withRole(RoleType role, String marketContext) {
        return new EntityInput(name, address, city, country, vatId, email, phone, website, role, marketContext);
    }
}
