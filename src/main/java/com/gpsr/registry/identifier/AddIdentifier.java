package com.gpsr.registry.identifier;

import java.util.Objects;

/**
 * Request to attach an identifier to an entity.
 *
 * @param primary null keeps the existing flag on re-add, false on a new identifier
 */
public record AddIdentifier(IdentifierType type, String value, String countryCode, String sourceId, Boolean primary) {

    public AddIdentifier {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
    }

    public static AddIdentifier of(IdentifierType type, String value, String sourceId) {
        return new AddIdentifier(type, value, null, sourceId, null);
    }

    public static AddIdentifier primary(IdentifierType type, String value, String sourceId) {
        return new AddIdentifier(type, value, null, sourceId, true);
    }
}
