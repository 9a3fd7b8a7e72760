package com.gpsr.registry.address;

public enum AddressType {
    REGISTERED,
    OPERATING,
    RETURN,
    SAFETY_CONTACT
}
