package com.gpsr.registry.address;

import java.time.Instant;
import java.util.Objects;

/**
 * A postal address of an entity.
 *
 * @param normalizedFull lower-case single line used for search
 */
public record Address(
        String id,
        String entityId,
        AddressType addressType,
        String streetLine1,
        String streetLine2,
        String city,
        String postalCode,
        String region,
        String countryCode,
        String normalizedFull,
        String sourceId,
        Instant createdAt,
        Instant updatedAt
) {
    public Address {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(addressType, "addressType is required");
        Objects.requireNonNull(streetLine1, "streetLine1 is required");
        Objects.requireNonNull(city, "city is required");
        Objects.requireNonNull(countryCode, "countryCode is required");
    }
}
