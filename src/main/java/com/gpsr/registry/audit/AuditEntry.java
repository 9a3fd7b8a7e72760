package com.gpsr.registry.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation with before/after snapshots.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String entityType,
        String entityId,
        JsonNode previousData,
        JsonNode newData,
        String performedBy,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String entityType;
        private String entityId;
        private JsonNode previousData;
        private JsonNode newData;
        private String performedBy;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder previousData(JsonNode previousData) {
            this.previousData = previousData;
            return this;
        }

        public Builder newData(JsonNode newData) {
            this.newData = newData;
            return this;
        }

        public Builder performedBy(String performedBy) {
            this.performedBy = performedBy;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, entityType, entityId, previousData, newData, performedBy, timestamp);
        }
    }
}
