package com.nexus.resolution.core.model;

import java.time.Instant;

/**
 * Record of a single-valued attribute being overwritten during a merge.
 * The prior value is retained here so that most-recent-wins never loses data.
 */
public record AttributeProvenance(
        String attribute,
        Object priorValue,
        Object newValue,
        String source,
        Instant recordedAt
) {
    public static AttributeProvenance of(String attribute, Object priorValue, Object newValue, String source) {
        return new AttributeProvenance(attribute, priorValue, newValue, source, Instant.now());
    }
}
