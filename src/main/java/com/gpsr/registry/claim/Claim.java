package com.gpsr.registry.claim;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An attribute-level assertion about a subject, attributed to a source.
 * Claims are never edited in content; review decisions replace the row with a
 * copy in the new status.
 */
public final class Claim {
    private final String id;
    private final ClaimSubject subject;
    private final String subjectId;
    private final String attribute;
    private final String value;
    private final String sourceId;
    private final int confidence;
    private final ClaimStatus status;
    private final String supersededById;
    private final String reviewedBy;
    private final Instant reviewedAt;
    private final String reviewNotes;
    private final Instant createdAt;

    private Claim(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.subject = Objects.requireNonNull(builder.subject, "subject is required");
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId is required");
        this.attribute = Objects.requireNonNull(builder.attribute, "attribute is required");
        this.value = Objects.requireNonNull(builder.value, "value is required");
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId is required");
        if (builder.confidence < 0 || builder.confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
        this.confidence = builder.confidence;
        this.status = builder.status != null ? builder.status : ClaimStatus.PROPOSED;
        if (this.status == ClaimStatus.SUPERSEDED && builder.supersededById == null) {
            throw new IllegalArgumentException("a superseded claim requires supersededById");
        }
        this.supersededById = builder.supersededById;
        this.reviewedBy = builder.reviewedBy;
        this.reviewedAt = builder.reviewedAt;
        this.reviewNotes = builder.reviewNotes;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public ClaimSubject getSubject() {
        return subject;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getValue() {
        return value;
    }

    public String getSourceId() {
        return sourceId;
    }

    public int getConfidence() {
        return confidence;
    }

    public ClaimStatus getStatus() {
        return status;
    }

    /**
     * Id of the claim that replaced this one; set only when SUPERSEDED.
     */
    public String getSupersededById() {
        return supersededById;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewNotes() {
        return reviewNotes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isAbout(ClaimSubject otherSubject, String otherSubjectId, String otherAttribute) {
        return subject == otherSubject && subjectId.equals(otherSubjectId) && attribute.equals(otherAttribute);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Claim) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Claim{" +
                "id='" + id + '\'' +
                ", subject=" + subject + ":" + subjectId +
                ", attribute='" + attribute + '\'' +
                ", status=" + status +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Claim claim) {
        return new Builder()
                .id(claim.id)
                .subject(claim.subject)
                .subjectId(claim.subjectId)
                .attribute(claim.attribute)
                .value(claim.value)
                .sourceId(claim.sourceId)
                .confidence(claim.confidence)
                .status(claim.status)
                .supersededById(claim.supersededById)
                .reviewedBy(claim.reviewedBy)
                .reviewedAt(claim.reviewedAt)
                .reviewNotes(claim.reviewNotes)
                .createdAt(claim.createdAt);
    }

    public static class Builder {
        private String id;
        private ClaimSubject subject;
        private String subjectId;
        private String attribute;
        private String value;
        private String sourceId;
        private int confidence = 50;
        private ClaimStatus status;
        private String supersededById;
        private String reviewedBy;
        private Instant reviewedAt;
        private String reviewNotes;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder subject(ClaimSubject subject) {
            this.subject = subject;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder attribute(String attribute) {
            this.attribute = attribute;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder status(ClaimStatus status) {
            this.status = status;
            return this;
        }

        public Builder supersededById(String supersededById) {
            this.supersededById = supersededById;
            return this;
        }

        public Builder reviewedBy(String reviewedBy) {
            this.reviewedBy = reviewedBy;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder reviewNotes(String reviewNotes) {
            this.reviewNotes = reviewNotes;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Claim build() {
            return new Claim(this);
        }
    }
}
