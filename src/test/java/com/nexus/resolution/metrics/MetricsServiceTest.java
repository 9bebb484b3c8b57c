package com.nexus.resolution.metrics;

import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.core.model.SignalType;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolutionDuration("merged", Duration.ofMillis(100));
                noOp.incrementCanonicalCreated(EntityType.ORGANIZATION);
                noOp.incrementCanonicalMerged(EntityType.PERSON);
                noOp.incrementReviewQueued("ambiguous_score");
                noOp.incrementAdjudicationOutcome("merge");
                noOp.incrementScoringDegraded(SignalType.EMBEDDING);
                noOp.incrementDeadLettered();
                noOp.recordSimilarityAggregate(0.85);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService service;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            service = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Should record resolution durations per outcome")
        void recordDuration() {
            service.recordResolutionDuration("merged", Duration.ofMillis(40));
            service.recordResolutionDuration("merged", Duration.ofMillis(60));
            service.recordResolutionDuration("created", Duration.ofMillis(10));

            Timer merged = registry.get("resolution.duration").tag("outcome", "merged").timer();
            assertEquals(2, merged.count());
            assertEquals(100.0, merged.totalTime(TimeUnit.MILLISECONDS), 0.01);
            assertEquals(1, registry.get("resolution.duration").tag("outcome", "created").timer().count());
        }

        @Test
        @DisplayName("Should count canonical mutations per entity type")
        void canonicalCounters() {
            service.incrementCanonicalCreated(EntityType.PERSON);
            service.incrementCanonicalCreated(EntityType.PERSON);
            service.incrementCanonicalMerged(EntityType.ORGANIZATION);

            assertEquals(2.0, registry.get("canonical.created").tag("entityType", "PERSON").counter().count());
            assertEquals(1.0, registry.get("canonical.merged").tag("entityType", "ORGANIZATION").counter().count());
        }

        @Test
        @DisplayName("Should tag review, adjudication and degradation counters")
        void taggedCounters() {
            service.incrementReviewQueued("tied_leaders");
            service.incrementAdjudicationOutcome("conflict");
            service.incrementScoringDegraded(SignalType.EMBEDDING);
            service.incrementScoringDegraded(SignalType.EMBEDDING);

            assertEquals(1.0, registry.get("review.queued").tag("reason", "tied_leaders").counter().count());
            assertEquals(1.0, registry.get("adjudication.outcome").tag("outcome", "conflict").counter().count());
            assertEquals(2.0, registry.get("scoring.degraded").tag("signal", "EMBEDDING").counter().count());
        }

        @Test
        @DisplayName("Should record aggregates, dead letters and cache lookups")
        void untaggedMeters() {
            service.recordSimilarityAggregate(0.6);
            service.recordSimilarityAggregate(0.8);
            service.incrementDeadLettered();
            service.recordCacheHit();
            service.recordCacheMiss();
            service.recordCacheMiss();

            DistributionSummary summary = registry.get("similarity.aggregate").summary();
            assertEquals(2, summary.count());
            assertEquals(0.7, summary.mean(), 0.001);
            assertEquals(1.0, registry.get("resolution.dead_lettered").counter().count());
            assertEquals(1.0, registry.get("resolution.cache.hit").counter().count());
            assertEquals(2.0, registry.get("resolution.cache.miss").counter().count());
        }
    }
}
