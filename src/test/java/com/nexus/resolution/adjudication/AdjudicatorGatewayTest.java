package com.nexus.resolution.adjudication;

import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.EntityType;
import com.nexus.resolution.metrics.MicrometerMetricsService;
import com.nexus.resolution.review.ReviewReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdjudicatorGatewayTest {

    private static final String MATCH_C1 = """
            {"verdicts":[
              {"canonicalId":"c1","match":true,"confidence":0.92,"reason":"same person"},
              {"canonicalId":"c2","match":false,"confidence":0.88,"reason":"different city"}
            ]}
            """;

    private AdjudicatorGateway gateway;

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.close();
        }
    }

    private static CandidateEntity candidate() {
        return CandidateEntity.builder()
                .name("Marie Eve G.")
                .type(EntityType.PERSON)
                .ingestionId("ing-1")
                .sourceExcerpt("Marie Eve G. spoke at the Montreal summit.")
                .build();
    }

    private static List<CanonicalEntity> contenders() {
        return List.of(
                CanonicalEntity.builder().id("c1").type(EntityType.PERSON).primaryName("Marie-Eve Girard").build(),
                CanonicalEntity.builder().id("c2").type(EntityType.PERSON).primaryName("Marie Gagnon").build());
    }

    private AdjudicatorGateway gatewayFor(Adjudicator adjudicator) {
        gateway = AdjudicatorGateway.builder()
                .adjudicator(adjudicator)
                .maxAttempts(2)
                .retryBackoff(Duration.ZERO)
                .callTimeout(Duration.ofMillis(200))
                .build();
        return gateway;
    }

    @Nested
    @DisplayName("Policy")
    class Policy {

        @Test
        @DisplayName("Single confident match merges")
        void singleMatchMerges() {
            StubAdjudicator adjudicator = new StubAdjudicator(MATCH_C1);
            AdjudicationOutcome outcome = gatewayFor(adjudicator).adjudicate(candidate(), contenders());

            assertTrue(outcome.isMerge());
            assertEquals("c1", outcome.canonicalId());
            assertEquals(1, outcome.attempts());
            assertEquals(1, adjudicator.calls.get());
        }

        @Test
        @DisplayName("Two confident matches conflict")
        void twoMatchesConflict() {
            AdjudicationOutcome outcome = gatewayFor(new StubAdjudicator("")).applyPolicy(List.of(
                    Verdict.matched("c1", 0.9, "a"), Verdict.matched("c2", 0.95, "b")), 1);

            assertTrue(outcome.isReview());
            assertEquals(ReviewReason.ADJUDICATION_CONFLICT, outcome.reviewReason());
        }

        @Test
        @DisplayName("All confident non-matches are distinct")
        void allUnmatchedDistinct() {
            AdjudicationOutcome outcome = gatewayFor(new StubAdjudicator("")).applyPolicy(List.of(
                    Verdict.unmatched("c1", 0.9, "a"), Verdict.unmatched("c2", 0.86, "b")), 1);

            assertTrue(outcome.isDistinct());
            assertNull(outcome.canonicalId());
        }

        @Test
        @DisplayName("Low-confidence verdicts are inconclusive")
        void lowConfidenceInconclusive() {
            AdjudicatorGateway g = gatewayFor(new StubAdjudicator(""));

            AdjudicationOutcome weakMatch = g.applyPolicy(List.of(
                    Verdict.matched("c1", 0.70, "a"), Verdict.unmatched("c2", 0.95, "b")), 1);
            AdjudicationOutcome weakDistinct = g.applyPolicy(List.of(
                    Verdict.unmatched("c1", 0.60, "a"), Verdict.unmatched("c2", 0.95, "b")), 1);

            assertEquals(ReviewReason.ADJUDICATION_INCONCLUSIVE, weakMatch.reviewReason());
            assertEquals(ReviewReason.ADJUDICATION_INCONCLUSIVE, weakDistinct.reviewReason());
        }

        @Test
        @DisplayName("Outcome is counted under its label")
        void outcomeMetric() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            gateway = AdjudicatorGateway.builder()
                    .adjudicator(new StubAdjudicator(MATCH_C1))
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();

            gateway.adjudicate(candidate(), contenders());

            assertEquals(1.0, registry.find("adjudication.outcome").tag("outcome", "merge").counter().count());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Malformed responses are retried and then sent to review")
        void malformedRetriedThenFailed() {
            StubAdjudicator adjudicator = new StubAdjudicator("{\"verdicts\": \"nope\"}");
            AdjudicationOutcome outcome = gatewayFor(adjudicator).adjudicate(candidate(), contenders());

            assertEquals(ReviewReason.ADJUDICATION_FAILED, outcome.reviewReason());
            assertEquals(2, outcome.attempts());
            assertEquals(2, adjudicator.calls.get());
        }

        @Test
        @DisplayName("A malformed first answer can be recovered by the retry")
        void malformedThenValid() {
            StubAdjudicator adjudicator = new StubAdjudicator("garbage", MATCH_C1);
            AdjudicationOutcome outcome = gatewayFor(adjudicator).adjudicate(candidate(), contenders());

            assertTrue(outcome.isMerge());
            assertEquals(2, outcome.attempts());
        }

        @Test
        @DisplayName("Errors exhaust the attempts and never merge")
        void errorsNeverMerge() {
            StubAdjudicator adjudicator = new StubAdjudicator() {
                @Override
                public String adjudicate(AdjudicationRequest request) {
                    calls.incrementAndGet();
                    throw new AdjudicationException("HTTP 503");
                }
            };
            AdjudicationOutcome outcome = gatewayFor(adjudicator).adjudicate(candidate(), contenders());

            assertTrue(outcome.isReview());
            assertEquals(ReviewReason.ADJUDICATION_FAILED, outcome.reviewReason());
            assertEquals(2, adjudicator.calls.get());
        }

        @Test
        @DisplayName("Timeouts on every attempt go to review as adjudication_failed")
        void timeoutsGoToReview() {
            CountDownLatch never = new CountDownLatch(1);
            StubAdjudicator adjudicator = new StubAdjudicator() {
                @Override
                public String adjudicate(AdjudicationRequest request) {
                    calls.incrementAndGet();
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return MATCH_C1;
                }
            };
            gateway = AdjudicatorGateway.builder()
                    .adjudicator(adjudicator)
                    .maxAttempts(2)
                    .retryBackoff(Duration.ofMillis(10))
                    .callTimeout(Duration.ofMillis(100))
                    .build();

            AdjudicationOutcome outcome = gateway.adjudicate(candidate(), contenders());

            assertFalse(outcome.isMerge());
            assertEquals(ReviewReason.ADJUDICATION_FAILED, outcome.reviewReason());
            assertEquals(2, outcome.attempts());
        }

        @Test
        @DisplayName("Unavailable adjudicator goes straight to review")
        void unavailable() {
            AdjudicationOutcome outcome = gatewayFor(new NoOpAdjudicator()).adjudicate(candidate(), contenders());

            assertEquals(ReviewReason.ADJUDICATOR_UNAVAILABLE, outcome.reviewReason());
            assertEquals(0, outcome.attempts());
        }

        @Test
        @DisplayName("Contenders are required")
        void noContenders() {
            AdjudicatorGateway g = gatewayFor(new StubAdjudicator(MATCH_C1));
            assertThrows(IllegalArgumentException.class, () -> g.adjudicate(candidate(), List.of()));
        }

        @Test
        @DisplayName("Builder validates its settings")
        void builderValidation() {
            assertThrows(IllegalArgumentException.class, () -> AdjudicatorGateway.builder().maxAttempts(0).build());
            assertThrows(IllegalArgumentException.class, () -> AdjudicatorGateway.builder().maxConcurrency(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> AdjudicatorGateway.builder().callTimeout(Duration.ZERO).build());
        }
    }

    @Test
    @DisplayName("Outstanding calls never exceed the concurrency ceiling")
    void concurrencyCeiling() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        StubAdjudicator adjudicator = new StubAdjudicator() {
            @Override
            public String adjudicate(AdjudicationRequest request) {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    inFlight.decrementAndGet();
                }
                return MATCH_C1;
            }
        };
        gateway = AdjudicatorGateway.builder()
                .adjudicator(adjudicator)
                .maxConcurrency(2)
                .callTimeout(Duration.ofSeconds(5))
                .build();

        int callers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AdjudicationOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return gateway.adjudicate(candidate(), contenders());
                }));
            }
            start.countDown();
            for (Future<AdjudicationOutcome> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS).isMerge());
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(maxInFlight.get() <= 2, "max in flight was " + maxInFlight.get());
        assertEquals(2, gateway.availableCallSlots());
    }

    static class StubAdjudicator implements Adjudicator {
        final AtomicInteger calls = new AtomicInteger();
        private final String[] responses;

        StubAdjudicator(String... responses) {
            this.responses = responses;
        }

        @Override
        public String adjudicate(AdjudicationRequest request) {
            int call = calls.getAndIncrement();
            return responses[Math.min(call, responses.length - 1)];
        }

        @Override
        public String getName() {
            return "stub";
        }
    }
}
