package com.gpsr.registry.brand;

/**
 * Raw brand data. On update, null fields keep their current value.
 */
public record BrandInput(
        String tradeName,
        String tradeMarkNumber,
        String tradeMarkOffice,
        String logoUrl,
        String description,
        Boolean verified
) {
    public static BrandInput of(String tradeName) {
        return new BrandInput(tradeName, null, null, null, null, null);
    }
}
