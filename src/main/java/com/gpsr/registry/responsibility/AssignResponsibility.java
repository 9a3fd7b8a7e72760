package com.gpsr.registry.responsibility;

import com.gpsr.registry.entity.RoleType;

import java.time.Instant;
import java.util.Objects;

/**
 * Request to make an entity responsible for a product in a country.
 *
 * @param confidence null for the configured default
 * @param validFrom  null for now
 */
public record AssignResponsibility(
        String productId,
        String countryCode,
        String entityId,
        RoleType role,
        String sourceId,
        Integer confidence,
        Instant validFrom,
        Instant validTo
) {
    public AssignResponsibility {
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(countryCode, "countryCode is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
    }

    public static AssignResponsibility of(String productId, String countryCode, String entityId,
                                          RoleType role, String sourceId, int confidence) {
        return new AssignResponsibility(productId, countryCode, entityId, role, sourceId, confidence, null, null);
    }
}
