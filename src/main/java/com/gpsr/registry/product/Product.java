package com.gpsr.registry.product;

import java.time.Instant;
import java.util.Objects;

/**
 * A product reference sold under a brand. Not versioned; every change is audited.
 */
public record Product(
        String id,
        String brandId,
        String productName,
        String ean,
        String gtin,
        String mpn,
        String modelNumber,
        String sku,
        String productCategory,
        String imageUrl,
        String productUrl,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public Product {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(brandId, "brandId is required");
        Objects.requireNonNull(productName, "productName is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    /**
     * Returns true if the EAN, GTIN or MPN equals the given code.
     */
    public boolean hasCode(String code) {
        return code.equals(ean) || code.equals(gtin) || code.equals(mpn);
    }
}
