package com.gpsr.registry.brand;

import java.time.Instant;
import java.util.Objects;

/**
 * Request to link an entity to a brand.
 *
 * @param marketContext null for {@code GLOBAL}
 * @param validFrom     null for now
 */
public record CreateBrandLink(
        String entityId,
        BrandLinkType linkType,
        String marketContext,
        String productScope,
        Instant validFrom,
        Instant validTo
) {
    public CreateBrandLink {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(linkType, "linkType is required");
    }

    public static CreateBrandLink of(String entityId, BrandLinkType linkType) {
        return new CreateBrandLink(entityId, linkType, null, null, null, null);
    }

    public CreateBrandLink inMarket(String marketContext) {
        return new CreateBrandLink(entityId, linkType, marketContext, productScope, validFrom, validTo);
    }
}
