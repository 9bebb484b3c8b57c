package com.nexus.resolution.relationship;

import java.util.Objects;

/**
 * An edge proposed by an extractor, not yet gated or stored.
 */
public record RelationshipCandidate(String subjectId, String predicate, String objectId, double confidence) {

    public RelationshipCandidate {
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(objectId, "objectId is required");
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("predicate is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        predicate = predicate.trim();
    }
}
