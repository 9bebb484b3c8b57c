package com.nexus.resolution.metrics;

import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.SignalType;

import java.time.Duration;

/**
 * Records resolution metrics. {@link NoOpMetricsService} is the default so the library
 * runs without a metrics backend.
 */
public interface MetricsService {

    void recordResolutionDuration(String outcome, Duration duration);

    void incrementCanonicalCreated(EntityType type);

    void incrementCanonicalMerged(EntityType type);

    void incrementReviewQueued(String reason);

    void incrementAdjudicationOutcome(String outcome);

    void incrementScoringDegraded(SignalType signal);

    void incrementDeadLettered();

    void recordSimilarityAggregate(double aggregate);

    void recordCacheHit();

    void recordCacheMiss();
}
