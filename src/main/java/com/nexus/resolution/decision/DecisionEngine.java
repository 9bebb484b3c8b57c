package com.nexus.resolution.decision;

import com.nexus.resolution.core.model.ResolutionDecision;
import com.nexus.resolution.core.model.SimilarityScore;

import java.util.List;

/**
 * Deterministic policy mapping ordered similarity scores to a {@link ResolutionDecision}.
 *
 * <ul>
 *   <li>top &ge; upper with no runner-up within {@code tieEpsilon}: auto-merge into the top canonical</li>
 *   <li>top &ge; upper with a runner-up within {@code tieEpsilon}: ambiguous (tied leaders)</li>
 *   <li>top &le; lower, or nothing scored: auto-distinct</li>
 *   <li>otherwise: ambiguous, carrying the top-k scores</li>
 * </ul>
 *
 * <p>Stateless and side-effect free; instances are safe to share between threads.</p>
 */
public class DecisionEngine {

    private final double upperThreshold;
    private final double lowerThreshold;
    private final double tieEpsilon;
    private final int topK;

    public DecisionEngine(double upperThreshold, double lowerThreshold, double tieEpsilon, int topK) {
        if (lowerThreshold <= 0.0 || upperThreshold >= 1.0 || lowerThreshold >= upperThreshold) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 < lower < upper < 1, got lower=" + lowerThreshold
                            + " upper=" + upperThreshold);
        }
        if (tieEpsilon < 0.0) {
            throw new IllegalArgumentException("tieEpsilon must be non-negative");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
        this.upperThreshold = upperThreshold;
        this.lowerThreshold = lowerThreshold;
        this.tieEpsilon = tieEpsilon;
        this.topK = topK;
    }

    /**
     * @param scores scores ordered highest first, as produced by the similarity scorer
     */
    public ResolutionDecision decide(List<SimilarityScore> scores) {
        if (scores == null || scores.isEmpty()) {
            return ResolutionDecision.autoDistinct();
        }
        SimilarityScore top = scores.get(0);
        double aggregate = top.aggregate();

        if (aggregate >= upperThreshold) {
            if (scores.size() > 1 && aggregate - scores.get(1).aggregate() <= tieEpsilon) {
                return ResolutionDecision.tied(leading(scores, Math.max(topK, 2)));
            }
            return ResolutionDecision.autoMerge(top.canonicalId());
        }
        if (aggregate <= lowerThreshold) {
            return ResolutionDecision.autoDistinct();
        }
        return ResolutionDecision.ambiguous(leading(scores, topK));
    }

    /**
     * Classifies a single confidence against the same thresholds.
     */
    public ConfidenceTier classify(double confidence) {
        if (confidence >= upperThreshold) {
            return ConfidenceTier.ACCEPT;
        }
        if (confidence <= lowerThreshold) {
            return ConfidenceTier.REJECT;
        }
        return ConfidenceTier.UNDECIDED;
    }

    public double getUpperThreshold() {
        return upperThreshold;
    }

    public double getLowerThreshold() {
        return lowerThreshold;
    }

    public double getTieEpsilon() {
        return tieEpsilon;
    }

    public int getTopK() {
        return topK;
    }

    // tied leaders always carry at least both leaders forward
    private static List<SimilarityScore> leading(List<SimilarityScore> scores, int count) {
        return List.copyOf(scores.subList(0, Math.min(count, scores.size())));
    }
}
