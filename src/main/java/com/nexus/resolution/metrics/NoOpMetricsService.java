package com.nexus.resolution.metrics;

import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.SignalType;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementCanonicalCreated(EntityType type) {
    }

    @Override
    public void incrementCanonicalMerged(EntityType type) {
    }

    @Override
    public void incrementReviewQueued(String reason) {
    }

    @Override
    public void incrementAdjudicationOutcome(String outcome) {
    }

    @Override
    public void incrementScoringDegraded(SignalType signal) {
    }

    @Override
    public void incrementDeadLettered() {
    }

    @Override
    public void recordSimilarityAggregate(double aggregate) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
