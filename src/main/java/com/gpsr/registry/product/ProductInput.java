package com.gpsr.registry.product;

/**
 * Product reference data. On update, null fields keep their current value.
 */
public record ProductInput(
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
        Boolean active
) {
    public static ProductInput of(String brandId, String productName) {
        return new ProductInput(brandId, productName, null, null, null, null, null, null, null, null, null);
    }

    public ProductInput withEan(String ean) {
        return new ProductInput(brandId, productName, ean, gtin, mpn, modelNumber, sku, productCategory,
                imageUrl, productUrl, active);
    }
}
