package com.gpsr.registry.brand;

import com.gpsr.registry.version.Versioned;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A trade name or trademark under which products are placed on the market.
 */
public final class Brand implements Versioned<Brand> {
    private final String id;
    private final String tradeName;
    private final String tradeMarkNumber;
    private final String tradeMarkOffice;
    private final String logoUrl;
    private final String description;
    private final boolean verified;
    private final String currentVersionId;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Brand(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tradeName = Objects.requireNonNull(builder.tradeName, "tradeName is required");
        this.tradeMarkNumber = builder.tradeMarkNumber;
        this.tradeMarkOffice = builder.tradeMarkOffice;
        this.logoUrl = builder.logoUrl;
        this.description = builder.description;
        this.verified = builder.verified;
        this.currentVersionId = builder.currentVersionId;
        this.active = builder.active;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getTradeName() {
        return tradeName;
    }

    public String getTradeMarkNumber() {
        return tradeMarkNumber;
    }

    public String getTradeMarkOffice() {
        return tradeMarkOffice;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public String getDescription() {
        return description;
    }

    public boolean isVerified() {
        return verified;
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

    @Override
    public Brand withCurrentVersion(String versionId, Instant updatedAt) {
        return builder(this).currentVersionId(versionId).updatedAt(updatedAt).build();
    }

    @Override
    public Brand withActive(boolean active, Instant updatedAt) {
        return builder(this).active(active).updatedAt(updatedAt).build();
    }

    @Override
    public Map<String, Object> normalizedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tradeName", tradeName);
        data.put("tradeMarkNumber", tradeMarkNumber);
        data.put("tradeMarkOffice", tradeMarkOffice);
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Brand) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Brand{id='" + id + "', tradeName='" + tradeName + "', active=" + active + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Brand brand) {
        return new Builder()
                .id(brand.id)
                .tradeName(brand.tradeName)
                .tradeMarkNumber(brand.tradeMarkNumber)
                .tradeMarkOffice(brand.tradeMarkOffice)
                .logoUrl(brand.logoUrl)
                .description(brand.description)
                .verified(brand.verified)
                .currentVersionId(brand.currentVersionId)
                .active(brand.active)
                .createdAt(brand.createdAt)
                .updatedAt(brand.updatedAt);
    }

    public static class Builder {
        private String id;
        private String tradeName;
        private String tradeMarkNumber;
        private String tradeMarkOffice;
        private String logoUrl;
        private String description;
        private boolean verified;
        private String currentVersionId;
        private boolean active = true;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tradeName(String tradeName) {
            this.tradeName = tradeName;
            return this;
        }

        public Builder tradeMarkNumber(String tradeMarkNumber) {
            this.tradeMarkNumber = tradeMarkNumber;
            return this;
        }

        public Builder tradeMarkOffice(String tradeMarkOffice) {
            this.tradeMarkOffice = tradeMarkOffice;
            return this;
        }

        public Builder logoUrl(String logoUrl) {
            this.logoUrl = logoUrl;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder currentVersionId(String currentVersionId) {
            this.currentVersionId = currentVersionId;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Brand build() {
            return new Brand(this);
        }
    }
}
