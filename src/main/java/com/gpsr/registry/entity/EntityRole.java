package com.gpsr.registry.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * A role an entity plays in a market, e.g. IMPORTER for the EU.
 *
 * @param marketContext market the role applies to, {@code GLOBAL} when unrestricted
 * @param productScope  free-text product scope, may be null
 */
public record EntityRole(
        String id,
        String entityId,
        RoleType roleType,
        String marketContext,
        String productScope,
        Instant validFrom,
        Instant validTo,
        boolean active,
        Instant createdAt
) {
    public static final String GLOBAL_MARKET = "GLOBAL";

    public EntityRole {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(roleType, "roleType is required");
        if (marketContext == null || marketContext.isBlank()) {
            marketContext = GLOBAL_MARKET;
        }
        Objects.requireNonNull(validFrom, "validFrom is required");
    }
}
