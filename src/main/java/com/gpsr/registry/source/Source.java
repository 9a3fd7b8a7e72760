package com.gpsr.registry.source;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A provenance record describing where a piece of data originated.
 * Sources are never deleted; only their descriptive fields may be edited.
 */
public final class Source {
    private final String id;
    private final SourceType sourceType;
    private final String sourceIdentifier;
    private final String sourceName;
    private final String description;
    private final String sourceUrl;
    private final String trustNote;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Source(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sourceType = Objects.requireNonNull(builder.sourceType, "sourceType is required");
        this.sourceIdentifier = builder.sourceIdentifier;
        this.sourceName = builder.sourceName;
        this.description = builder.description;
        this.sourceUrl = builder.sourceUrl;
        this.trustNote = builder.trustNote;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public String getSourceIdentifier() {
        return sourceIdentifier;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getDescription() {
        return description;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getTrustNote() {
        return trustNote;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Source source = (Source) o;
        return Objects.equals(id, source.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Source{" +
                "id='" + id + '\'' +
                ", sourceType=" + sourceType +
                ", sourceIdentifier='" + sourceIdentifier + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Source source) {
        return new Builder()
                .id(source.id)
                .sourceType(source.sourceType)
                .sourceIdentifier(source.sourceIdentifier)
                .sourceName(source.sourceName)
                .description(source.description)
                .sourceUrl(source.sourceUrl)
                .trustNote(source.trustNote)
                .createdAt(source.createdAt)
                .updatedAt(source.updatedAt);
    }

    public static class Builder {
        private String id;
        private SourceType sourceType;
        private String sourceIdentifier;
        private String sourceName;
        private String description;
        private String sourceUrl;
        private String trustNote;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceType(SourceType sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder sourceIdentifier(String sourceIdentifier) {
            this.sourceIdentifier = sourceIdentifier;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder trustNote(String trustNote) {
            this.trustNote = trustNote;
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

        public Source build() {
            return new Source(this);
        }
    }
}
