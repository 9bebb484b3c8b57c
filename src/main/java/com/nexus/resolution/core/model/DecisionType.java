package com.nexus.resolution.core.model;

/**
 * Outcome kinds produced by the decision engine.
 */
public enum DecisionType {
    /**
     * The top canonical is a confident, unique match.
     */
    AUTO_MERGE,

    /**
     * No canonical is close enough; the candidate is a new referent.
     */
    AUTO_DISTINCT,

    /**
     * Between thresholds, or tied leaders above the upper threshold.
     */
    AMBIGUOUS
}
