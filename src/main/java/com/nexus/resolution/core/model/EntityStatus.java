package com.nexus.resolution.core.model;

/**
 * Lifecycle status of a canonical entity.
 */
public enum EntityStatus {
    /**
     * The entity is the surviving canonical for its referent.
     */
    ACTIVE,

    /**
     * The entity was merged into another canonical and only survives as a redirect.
     */
    MERGED
}
