package com.nexus.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of the decision policy.
 *
 * @param type        the outcome kind
 * @param canonicalId the merge target, set only for {@link DecisionType#AUTO_MERGE}
 * @param contenders  the top-k scores carried forward for {@link DecisionType#AMBIGUOUS}
 * @param tiedLeaders true when ambiguity was forced by near-equal leaders above the upper threshold
 */
public record ResolutionDecision(
        DecisionType type,
        String canonicalId,
        List<SimilarityScore> contenders,
        boolean tiedLeaders
) {
    public ResolutionDecision {
        Objects.requireNonNull(type, "type is required");
        if (type == DecisionType.AUTO_MERGE && canonicalId == null) {
            throw new IllegalArgumentException("AUTO_MERGE requires a canonicalId");
        }
        if (type != DecisionType.AUTO_MERGE && canonicalId != null) {
            throw new IllegalArgumentException(type + " must not carry a canonicalId");
        }
        contenders = contenders != null ? List.copyOf(contenders) : List.of();
    }

    public static ResolutionDecision autoMerge(String canonicalId) {
        return new ResolutionDecision(DecisionType.AUTO_MERGE, canonicalId, List.of(), false);
    }

    public static ResolutionDecision autoDistinct() {
        return new ResolutionDecision(DecisionType.AUTO_DISTINCT, null, List.of(), false);
    }

    public static ResolutionDecision ambiguous(List<SimilarityScore> contenders) {
        return new ResolutionDecision(DecisionType.AMBIGUOUS, null, contenders, false);
    }

    public static ResolutionDecision tied(List<SimilarityScore> contenders) {
        return new ResolutionDecision(DecisionType.AMBIGUOUS, null, contenders, true);
    }

    public boolean isAutoMerge() {
        return type == DecisionType.AUTO_MERGE;
    }

    public boolean isAutoDistinct() {
        return type == DecisionType.AUTO_DISTINCT;
    }

    public boolean isAmbiguous() {
        return type == DecisionType.AMBIGUOUS;
    }
}
