package com.nexus.resolution.review;

/**
 * A reviewer's answer. For entity items {@code MERGE} means "same as the target canonical";
 * for relationship items it means "create the edge".
 */
public enum ReviewResolution {
    MERGE,
    DISTINCT
}
