package com.gpsr.registry.entity;

import com.gpsr.registry.version.Versioned;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A regulatory entity: manufacturer, importer, responsible person or any other
 * economic operator. Holds the normalized current state; history lives in the
 * entity's version chain.
 */
public final class Entity implements Versioned<Entity> {
    private final String id;
    private final String name;
    private final String normalizedName;
    private final String address;
    private final String city;
    private final String country;
    private final String vatId;
    private final String email;
    private final String phone;
    private final String website;
    private final String currentVersionId;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.normalizedName = builder.normalizedName != null ? builder.normalizedName : builder.name;
        this.address = builder.address;
        this.city = builder.city;
        this.country = Objects.requireNonNull(builder.country, "country is required");
        this.vatId = builder.vatId;
        this.email = builder.email;
        this.phone = builder.phone;
        this.website = builder.website;
        this.currentVersionId = builder.currentVersionId;
        this.active = builder.active;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getAddress() {
        return address;
    }

    public String getCity() {
        return city;
    }

    public String getCountry() {
        return country;
    }

    public String getVatId() {
        return vatId;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getWebsite() {
        return website;
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
    public Entity withCurrentVersion(String versionId, Instant updatedAt) {
        return builder(this).currentVersionId(versionId).updatedAt(updatedAt).build();
    }

    @Override
    public Entity withActive(boolean active, Instant updatedAt) {
        return builder(this).active(active).updatedAt(updatedAt).build();
    }

    @Override
    public Map<String, Object> normalizedData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("normalizedName", normalizedName);
        data.put("address", address);
        data.put("city", city);
        data.put("country", country);
        data.put("vatId", vatId);
        data.put("email", email);
        data.put("phone", phone);
        data.put("website", website);
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                ", country='" + country + '\'' +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .normalizedName(entity.normalizedName)
                .address(entity.address)
                .city(entity.city)
                .country(entity.country)
                .vatId(entity.vatId)
                .email(entity.email)
                .phone(entity.phone)
                .website(entity.website)
                .currentVersionId(entity.currentVersionId)
                .active(entity.active)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
    }

    public static class Builder {
        private String id;
        private String name;
        private String normalizedName;
        private String address;
        private String city;
        private String country;
        private String vatId;
        private String email;
        private String phone;
        private String website;
        private String currentVersionId;
        private boolean active = true;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder vatId(String vatId) {
            this.vatId = vatId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
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

        public Entity build() {
            return new Entity(this);
        }
    }
}
