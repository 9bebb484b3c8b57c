package com.nexus.resolution.adjudication;

import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.metrics.MetricsService;
import com.nexus.resolution.metrics.NoOpMetricsService;
import com.nexus.resolution.review.ReviewReason;
import com.nexus.resolution.tracing.NoOpTracingService;
import com.nexus.resolution.tracing.Span;
import com.nexus.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns an ambiguous decision into a merge, distinct or review outcome by asking the
 * external {@link Adjudicator}.
 *
 * <p>Policy:</p>
 * <ul>
 *   <li>exactly one contender matched with confidence &ge; the merge floor: merge into it</li>
 *   <li>more than one such contender: review ({@code adjudication_conflict})</li>
 *   <li>every contender unmatched with confidence &ge; the distinct floor: distinct</li>
 *   <li>anything else: review ({@code adjudication_inconclusive})</li>
 *   <li>errors, timeouts and malformed responses are retried with backoff; when attempts run
 *       out the candidate goes to review ({@code adjudication_failed})</li>
 * </ul>
 * A failed or malformed call never produces a merge.
 *
 * <p>At most {@code maxConcurrency} external calls are outstanding at once; further callers
 * block until a call finishes. A timed-out call keeps its slot until the adjudicator returns.</p>
 */
public class AdjudicatorGateway implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdjudicatorGateway.class);

    private final Adjudicator adjudicator;
    private final AdjudicationResponseParser parser;
    private final AdjudicationFloors floors;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Duration callTimeout;
    private final Semaphore callPermits;
    private final ExecutorService callExecutor;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private AdjudicatorGateway(Builder builder) {
        this.adjudicator = builder.adjudicator != null ? builder.adjudicator : new NoOpAdjudicator();
        this.parser = new AdjudicationResponseParser();
        this.floors = builder.floors != null ? builder.floors : AdjudicationFloors.defaults();
        this.maxAttempts = builder.maxAttempts;
        this.retryBackoff = builder.retryBackoff;
        this.callTimeout = builder.callTimeout;
        this.callPermits = new Semaphore(builder.maxConcurrency, true);
        this.callExecutor = Executors.newFixedThreadPool(builder.maxConcurrency, new AdjudicatorThreadFactory());
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
    }

    /**
     * @param contenders the top-k canonicals carried by the ambiguous decision
     */
    public AdjudicationOutcome adjudicate(CandidateEntity candidate, List<CanonicalEntity> contenders) {
        Objects.requireNonNull(candidate, "candidate is required");
        if (contenders == null || contenders.isEmpty()) {
            throw new IllegalArgumentException("At least one contender is required");
        }

        try (Span span = tracingService.startSpan(TracingService.ADJUDICATE, Map.of(
                "ingestionId", candidate.ingestionId(),
                "adjudicator", adjudicator.getName()))) {
            AdjudicationOutcome outcome = doAdjudicate(candidate, contenders);
            span.setAttribute("outcome", outcome.label());
            span.setAttribute("attempts", outcome.attempts());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.incrementAdjudicationOutcome(outcome.label());
            log.info("adjudication.completed ingestionId={} outcome={} canonicalId={} attempts={}",
                    candidate.ingestionId(), outcome.label(), outcome.canonicalId(), outcome.attempts());
            return outcome;
        }
    }

    private AdjudicationOutcome doAdjudicate(CandidateEntity candidate, List<CanonicalEntity> contenders) {
        if (!adjudicator.isAvailable()) {
            return AdjudicationOutcome.review(ReviewReason.ADJUDICATOR_UNAVAILABLE, List.of(), 0);
        }

        List<CandidateProfile> profiles = new ArrayList<>(contenders.size());
        List<String> contenderIds = new ArrayList<>(contenders.size());
        for (CanonicalEntity contender : contenders) {
            profiles.add(CandidateProfile.of(contender));
            contenderIds.add(contender.getId());
        }
        AdjudicationRequest request = new AdjudicationRequest(
                CandidateProfile.of(candidate), profiles, candidate.sourceExcerpt());

        long backoffMs = retryBackoff.toMillis();
        List<Verdict> lastVerdicts = List.of();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String raw = callWithTimeout(request);
                List<Verdict> verdicts = parser.parse(raw, contenderIds);
                if (verdicts.size() == 1 && verdicts.get(0).isMalformed()) {
                    lastVerdicts = verdicts;
                    log.warn("adjudication.malformed ingestionId={} attempt={} reason={}",
                            candidate.ingestionId(), attempt, verdicts.get(0).reason());
                } else {
                    return applyPolicy(verdicts, attempt);
                }
            } catch (AdjudicationException e) {
                log.warn("adjudication.failed ingestionId={} attempt={} cause={}",
                        candidate.ingestionId(), attempt, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("adjudication.interrupted ingestionId={} attempt={}", candidate.ingestionId(), attempt);
                return AdjudicationOutcome.review(ReviewReason.ADJUDICATION_FAILED, lastVerdicts, attempt);
            }

            if (attempt < maxAttempts && !pause(backoffMs)) {
                return AdjudicationOutcome.review(ReviewReason.ADJUDICATION_FAILED, lastVerdicts, attempt);
            }
            backoffMs *= 2;
        }
        return AdjudicationOutcome.review(ReviewReason.ADJUDICATION_FAILED, lastVerdicts, maxAttempts);
    }

    AdjudicationOutcome applyPolicy(List<Verdict> verdicts, int attempts) {
        List<Verdict> confidentMatches = verdicts.stream()
                .filter(v -> v.kind() == Verdict.Kind.MATCHED && v.confidence() >= floors.merge())
                .toList();
        if (confidentMatches.size() == 1) {
            return AdjudicationOutcome.merge(confidentMatches.get(0).canonicalId(), verdicts, attempts);
        }
        if (confidentMatches.size() > 1) {
            return AdjudicationOutcome.review(ReviewReason.ADJUDICATION_CONFLICT, verdicts, attempts);
        }
        boolean allConfidentlyDistinct = verdicts.stream()
                .allMatch(v -> v.kind() == Verdict.Kind.UNMATCHED && v.confidence() >= floors.distinct());
        if (allConfidentlyDistinct) {
            return AdjudicationOutcome.distinct(verdicts, attempts);
        }
        return AdjudicationOutcome.review(ReviewReason.ADJUDICATION_INCONCLUSIVE, verdicts, attempts);
    }

    private String callWithTimeout(AdjudicationRequest request) throws InterruptedException {
        callPermits.acquire();
        AtomicBoolean claimed = new AtomicBoolean();
        Future<String> future;
        try {
            future = callExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return adjudicator.adjudicate(request);
                } finally {
                    callPermits.release();
                }
            });
        } catch (RuntimeException e) {
            callPermits.release();
            throw new AdjudicationException("Adjudicator call rejected: " + e.getMessage(), e);
        }

        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (claimed.compareAndSet(false, true)) {
                // never started, so the task will not release its permit
                callPermits.release();
            }
            throw new AdjudicationException("Adjudicator timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AdjudicationException adjudicationException) {
                throw adjudicationException;
            }
            throw new AdjudicationException("Adjudicator call failed: " + cause, cause);
        }
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int availableCallSlots() {
        return callPermits.availablePermits();
    }

    public String getAdjudicatorName() {
        return adjudicator.getName();
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Adjudicator adjudicator;
        private AdjudicationFloors floors;
        private int maxAttempts = 2;
        private Duration retryBackoff = Duration.ofMillis(200);
        private Duration callTimeout = Duration.ofSeconds(30);
        private int maxConcurrency = 4;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder adjudicator(Adjudicator adjudicator) {
            this.adjudicator = adjudicator;
            return this;
        }

        public Builder floors(AdjudicationFloors floors) {
            this.floors = floors;
            return this;
        }

        /**
         * Total attempts per candidate, including the first.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public AdjudicatorGateway build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be at least 1");
            }
            if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
                throw new IllegalArgumentException("callTimeout must be positive");
            }
            if (retryBackoff == null || retryBackoff.isNegative()) {
                throw new IllegalArgumentException("retryBackoff must be non-negative");
            }
            return new AdjudicatorGateway(this);
        }
    }

    private static final class AdjudicatorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "adjudicator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
