package com.nexus.resolution.adjudication;

/**
 * Minimum verdict confidences the gateway acts on.
 *
 * @param merge    a match verdict at or above this merges
 * @param distinct non-match verdicts at or above this make the candidate distinct
 */
public record AdjudicationFloors(double merge, double distinct) {

    public AdjudicationFloors {
        if (merge < 0.0 || merge > 1.0 || distinct < 0.0 || distinct > 1.0) {
            throw new IllegalArgumentException("Confidence floors must be between 0.0 and 1.0");
        }
    }

    public static AdjudicationFloors defaults() {
        return new AdjudicationFloors(0.85, 0.85);
    }
}
