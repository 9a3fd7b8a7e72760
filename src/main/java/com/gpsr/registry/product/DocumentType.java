package com.gpsr.registry.product;

public enum DocumentType {
    MANUAL,
    SAFETY_SHEET,
    DECLARATION,
    OTHER
}
