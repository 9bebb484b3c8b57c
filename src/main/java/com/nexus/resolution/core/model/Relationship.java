package com.nexus.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Typed edge between two canonical entities.
 *
 * <p>Edges are repointed, never dropped, when one of their endpoints is merged away.</p>
 */
public final class Relationship {

    private final String id;
    private final String subjectId;
    private final String predicate;
    private final String objectId;
    private final double confidence;
    private final String provenance;
    private final Instant createdAt;

    private Relationship(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId is required");
        this.predicate = Objects.requireNonNull(builder.predicate, "predicate is required");
        this.objectId = Objects.requireNonNull(builder.objectId, "objectId is required");
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        this.confidence = builder.confidence;
        this.provenance = builder.provenance;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getPredicate() {
        return predicate;
    }

    public String getObjectId() {
        return objectId;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getProvenance() {
        return provenance;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * True if both edges connect the same endpoints with the same predicate.
     */
    public boolean sameEdge(String subject, String predicateLabel, String object) {
        return subjectId.equals(subject) && predicate.equals(predicateLabel) && objectId.equals(object);
    }

    /**
     * Copy with every occurrence of {@code fromId} replaced by {@code toId}.
     */
    public Relationship repoint(String fromId, String toId) {
        return toBuilder()
                .subjectId(subjectId.equals(fromId) ? toId : subjectId)
                .objectId(objectId.equals(fromId) ? toId : objectId)
                .build();
    }

    public Relationship withConfidence(double newConfidence) {
        return toBuilder().confidence(newConfidence).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .subjectId(subjectId)
                .predicate(predicate)
                .objectId(objectId)
                .confidence(confidence)
                .provenance(provenance)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", subjectId='" + subjectId + '\'' +
                ", predicate='" + predicate + '\'' +
                ", objectId='" + objectId + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String subjectId;
        private String predicate;
        private String objectId;
        private double confidence = 1.0;
        private String provenance;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder predicate(String predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder objectId(String objectId) {
            this.objectId = objectId;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder provenance(String provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
