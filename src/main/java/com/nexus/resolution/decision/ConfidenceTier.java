package com.nexus.resolution.decision;

/**
 * Three-way gate shared by entity decisions and relationship edges.
 */
public enum ConfidenceTier {
    /** At or above the upper threshold. */
    ACCEPT,
    /** At or below the lower threshold. */
    REJECT,
    /** Strictly between the thresholds. */
    UNDECIDED
}
