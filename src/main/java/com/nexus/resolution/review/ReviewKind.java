package com.nexus.resolution.review;

/**
 * What a review item asks about: a candidate entity or a proposed relationship edge.
 */
public enum ReviewKind {
    ENTITY,
    RELATIONSHIP
}
