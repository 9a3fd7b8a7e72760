package com.gpsr.registry.responsibility;

public enum ResponsibilityStatus {
    ACTIVE,
    HISTORICAL,
    DISPUTED
}
