package com.gpsr.registry.responsibility;

/**
 * How a resolved responsibility view was computed.
 */
public enum ResolutionMode {
    /**
     * From the ACTIVE rows only.
     */
    CURRENT,
    /**
     * From every row whose validity window contains the target date.
     */
    HISTORICAL
}
