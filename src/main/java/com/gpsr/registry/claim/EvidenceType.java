package com.gpsr.registry.claim;

public enum EvidenceType {
    URL,
    FILE,
    IMAGE,
    PDF,
    TEXT_SNAPSHOT,
    LABEL_PHOTO,
    REGISTRY_EXTRACT
}
