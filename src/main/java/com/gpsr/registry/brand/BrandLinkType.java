package com.gpsr.registry.brand;

/**
 * How an entity relates to a brand.
 */
public enum BrandLinkType {
    OWNER,
    MANUFACTURER,
    IMPORTER,
    RESPONSIBLE_PERSON,
    AUTHORIZED_REP,
    DISTRIBUTOR,
    LICENSEE;

    /**
     * Link types whose entities are reachable about safety issues of the brand's products.
     */
    public boolean isSafetyContactRole() {
        return this == MANUFACTURER || this == RESPONSIBLE_PERSON || this == IMPORTER;
    }
}
