package com.nexus.resolution.review;

/**
 * Lifecycle of a review item. Items leave {@code PENDING} only through an explicit resolution.
 */
public enum ReviewStatus {
    PENDING,
    RESOLVED_MERGE,
    RESOLVED_DISTINCT
}
