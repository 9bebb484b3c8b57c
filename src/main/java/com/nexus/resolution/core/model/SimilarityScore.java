package com.nexus.resolution.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multi-signal similarity between one candidate and one canonical entity.
 * Produced and consumed within a single resolution attempt.
 *
 * <p>Signals that could not be computed are absent from {@link #components()} and listed in
 * {@link #missingSignals()}; the aggregate is renormalized over the remaining ones.</p>
 */
public record SimilarityScore(
        String candidateId,
        String canonicalId,
        Map<SignalType, Double> components,
        double aggregate,
        Set<SignalType> missingSignals
) {
    public SimilarityScore {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        if (Double.isNaN(aggregate) || aggregate < 0.0 || aggregate > 1.0) {
            throw new IllegalArgumentException("Aggregate must be between 0.0 and 1.0, got " + aggregate);
        }
        components = components == null || components.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(components));
        missingSignals = missingSignals == null || missingSignals.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(missingSignals));
    }

    /**
     * Convenience factory for a score with every signal available.
     */
    public static SimilarityScore of(String candidateId, String canonicalId, double aggregate) {
        return new SimilarityScore(candidateId, canonicalId, Map.of(), aggregate, Set.of());
    }

    /**
     * True when at least one signal was unavailable.
     */
    public boolean degraded() {
        return !missingSignals.isEmpty();
    }

    public Double component(SignalType signal) {
        return components.get(signal);
    }
}
