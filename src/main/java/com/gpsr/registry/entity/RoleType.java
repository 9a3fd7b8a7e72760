package com.gpsr.registry.entity;

/**
 * Economic operator roles recognised by GPSR.
 */
public enum RoleType {
    MANUFACTURER,
    IMPORTER,
    RESPONSIBLE_PERSON,
    AUTHORIZED_REP,
    DISTRIBUTOR,
    FULFILLMENT_PROVIDER
}
