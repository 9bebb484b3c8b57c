package com.nexus.resolution.metrics;

import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.SignalType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code resolution.duration} timer (tag: outcome)</li>
 *   <li>{@code canonical.created}, {@code canonical.merged} counters (tag: entityType)</li>
 *   <li>{@code review.queued} counter (tag: reason)</li>
 *   <li>{@code adjudication.outcome} counter (tag: outcome)</li>
 *   <li>{@code scoring.degraded} counter (tag: signal)</li>
 *   <li>{@code resolution.dead_lettered}, {@code resolution.cache.hit}, {@code resolution.cache.miss} counters</li>
 *   <li>{@code similarity.aggregate} distribution summary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary aggregateSummary;
    private final Counter deadLetterCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.aggregateSummary = DistributionSummary.builder("similarity.aggregate")
                .description("Aggregate similarity of scored candidate/canonical pairs")
                .register(registry);
        this.deadLetterCounter = Counter.builder("resolution.dead_lettered")
                .description("Candidates dead-lettered after exhausting graph write retries")
                .register(registry);
        this.cacheHitCounter = Counter.builder("resolution.cache.hit")
                .description("Resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("resolution.cache.miss")
                .description("Resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("resolution.duration")
                        .description("Duration of candidate resolution")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementCanonicalCreated(EntityType type) {
        counter("canonical.created", "entityType", type.name()).increment();
    }

    @Override
    public void incrementCanonicalMerged(EntityType type) {
        counter("canonical.merged", "entityType", type.name()).increment();
    }

    @Override
    public void incrementReviewQueued(String reason) {
        counter("review.queued", "reason", reason).increment();
    }

    @Override
    public void incrementAdjudicationOutcome(String outcome) {
        counter("adjudication.outcome", "outcome", outcome).increment();
    }

    @Override
    public void incrementScoringDegraded(SignalType signal) {
        counter("scoring.degraded", "signal", signal.name()).increment();
    }

    @Override
    public void incrementDeadLettered() {
        deadLetterCounter.increment();
    }

    @Override
    public void recordSimilarityAggregate(double aggregate) {
        aggregateSummary.record(aggregate);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
