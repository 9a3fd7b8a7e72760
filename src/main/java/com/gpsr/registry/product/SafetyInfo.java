package com.gpsr.registry.product;

import com.gpsr.registry.version.Versioned;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Safety information thread of one product in one country and language.
 * There is exactly one row per {@code (productId, countryCode, languageCode)};
 * each change appends a version and moves {@code currentVersionId}.
 */
public final class SafetyInfo implements Versioned<SafetyInfo> {
    private final String id;
    private final String productId;
    private final String countryCode;
    private final String languageCode;
    private final SafetyContent content;
    private final String currentVersionId;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    public SafetyInfo(String id, String productId, String countryCode, String languageCode,
                      SafetyContent content, String currentVersionId, boolean active,
                      Instant createdAt, Instant updatedAt) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.productId = Objects.requireNonNull(productId, "productId is required");
        this.countryCode = Objects.requireNonNull(countryCode, "countryCode is required");
        this.languageCode = Objects.requireNonNull(languageCode, "languageCode is required");
        this.content = Objects.requireNonNull(content, "content is required");
        this.currentVersionId = currentVersionId;
        this.active = active;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    public static SafetyInfo create(String productId, String countryCode, String languageCode,
                                    SafetyContent content, Instant now) {
        return new SafetyInfo(null, productId, countryCode, languageCode, content, null, true, now, now);
    }

    @Override
    public String getId() {
        return id;
    }

    public String getProductId() {
        return productId;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getLanguageCode() {
        return languageCode;
    }

    public SafetyContent getContent() {
        return content;
    }

    public String getWarningText() {
        return content.warningText();
    }

    public List<String> getHazardSymbols() {
        return content.hazardSymbols() != null ? content.hazardSymbols() : List.of();
    }

    @Override
    public String getCurrentVersionId() {
        return currentVersionId;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public SafetyInfo withContent(SafetyContent newContent, Instant now) {
        return new SafetyInfo(id, productId, countryCode, languageCode, newContent, currentVersionId, active,
                createdAt, now);
    }

    @Override
    public SafetyInfo withCurrentVersion(String versionId, Instant now) {
        return new SafetyInfo(id, productId, countryCode, languageCode, content, versionId, active, createdAt, now);
    }

    @Override
    public SafetyInfo withActive(boolean newActive, Instant now) {
        return new SafetyInfo(id, productId, countryCode, languageCode, content, currentVersionId, newActive,
                createdAt, now);
    }

    @Override
    public Map<String, Object> normalizedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("productId", productId);
        data.put("countryCode", countryCode);
        data.put("languageCode", languageCode);
        data.put("warningText", content.warningText());
        data.put("safetyInstructions", content.safetyInstructions());
        data.put("ageRestriction", content.ageRestriction());
        data.put("hazardSymbols", getHazardSymbols());
        data.put("documentUrl", content.documentUrl());
        data.put("documentType", content.documentType());
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((SafetyInfo) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SafetyInfo{id='" + id + "', productId='" + productId + "', market=" + countryCode + "/"
                + languageCode + '}';
    }
}
