package com.gpsr.registry.responsibility;

import com.gpsr.registry.entity.RoleType;

import java.time.Instant;
import java.util.Objects;

/**
 * Assigns a role for a product in a country to an entity, for the validity
 * window {@code [validFrom, validTo)}.
 *
 * @param confidence 0-100, how strongly the source supports this assignment
 * @param validTo    exclusive end of validity, null while open-ended
 */
public record ProductResponsibility(
        String id,
        String productId,
        String countryCode,
        String entityId,
        RoleType role,
        String sourceId,
        int confidence,
        ResponsibilityStatus status,
        Instant validFrom,
        Instant validTo,
        Instant createdAt,
        Instant updatedAt
) {
    public ProductResponsibility {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(countryCode, "countryCode is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(validFrom, "validFrom is required");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
    }

    public boolean isActive() {
        return status == ResponsibilityStatus.ACTIVE;
    }

    /**
     * Returns true if {@code instant} falls in {@code [validFrom, validTo)}.
     */
    public boolean isValidAt(Instant instant) {
        return !validFrom.isAfter(instant) && (validTo == null || validTo.isAfter(instant));
    }

    public ProductResponsibility withStatus(ResponsibilityStatus newStatus, Instant newValidTo, Instant now) {
        return new ProductResponsibility(id, productId, countryCode, entityId, role, sourceId, confidence,
                newStatus, validFrom, newValidTo, createdAt, now);
    }
}
