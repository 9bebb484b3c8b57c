package com.nexus.resolution.core.model;

import java.time.Instant;

/**
 * A required attribute whose incoming value disagrees with the stored one.
 * The stored value is kept and the disagreement is flagged for review.
 */
public record AttributeConflict(
        String attribute,
        Object existingValue,
        Object incomingValue,
        String source,
        Instant detectedAt
) {
    public static AttributeConflict of(String attribute, Object existingValue, Object incomingValue, String source) {
        return new AttributeConflict(attribute, existingValue, incomingValue, source, Instant.now());
    }
}
