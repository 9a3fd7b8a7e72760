package com.gpsr.registry.brand;

import java.time.Instant;
import java.util.Objects;

/**
 * Link between a brand and an entity acting for it in a market.
 *
 * @param marketContext market the link applies to, {@code GLOBAL} when unrestricted
 * @param productScope  free-text product scope, may be null
 * @param validTo       exclusive end of validity, null while open-ended
 */
public record BrandLink(
        String id,
        String brandId,
        String entityId,
        BrandLinkType linkType,
        String marketContext,
        String productScope,
        Instant validFrom,
        Instant validTo,
        boolean active,
        Instant createdAt
) {
    public static final String GLOBAL_MARKET = "GLOBAL";

    public BrandLink {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(brandId, "brandId is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(linkType, "linkType is required");
        if (marketContext == null || marketContext.isBlank()) {
            marketContext = GLOBAL_MARKET;
        }
        Objects.requireNonNull(validFrom, "validFrom is required");
    }
}
