package com.gpsr.registry.source;

/**
 * Kind of provenance a piece of data comes from, with a fixed trust rank.
 * A higher rank wins ties when competing claims carry the same confidence.
 */
public enum SourceType {
    COMMUNITY(10),
    MANUAL_ENTRY(20),
    WEBSITE(30),
    API_IMPORT(40),
    PRODUCT_LABEL(50),
    SAFETY_GATE(60),
    PRIMARY_SOURCE(70),
    OFFICIAL_REGISTRY(80);

    private final int trustRank;

    SourceType(int trustRank) {
        this.trustRank = trustRank;
    }

    public int trustRank() {
        return trustRank;
    }
}
