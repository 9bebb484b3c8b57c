package com.nexus.resolution.similarity;

import com.nexus.resolution.core.model.SignalType;

/**
 * Relative weights of the similarity signals. Weights need not sum to 1; the aggregate is
 * renormalized over whichever signals are available for a pair.
 */
public record ScorerWeights(
        double string,
        double phonetic,
        double alias,
        double embedding
) {
    public ScorerWeights {
        if (string < 0 || phonetic < 0 || alias < 0 || embedding < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (string + phonetic + alias + embedding <= 0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
    }

    /**
     * Illustrative defaults favouring string and embedding evidence.
     */
    public static ScorerWeights defaults() {
        return new ScorerWeights(0.35, 0.15, 0.2, 0.3);
    }

    /**
     * Lexical-only weighting, for deployments without an embedding service.
     */
    public static ScorerWeights lexicalOnly() {
        return new ScorerWeights(0.5, 0.2, 0.3, 0.0);
    }

    public double weightOf(SignalType signal) {
        return switch (signal) {
            case STRING -> string;
            case PHONETIC -> phonetic;
            case ALIAS -> alias;
            case EMBEDDING -> embedding;
        };
    }
}
