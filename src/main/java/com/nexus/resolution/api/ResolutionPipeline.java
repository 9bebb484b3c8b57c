package com.nexus.resolution.api;

import com.nexus.resolution.adjudication.AdjudicationOutcome;
import com.nexus.resolution.adjudication.Adjudicator;
import com.nexus.resolution.adjudication.AdjudicatorGateway;
import com.nexus.resolution.cache.NoOpResolutionCache;
import com.nexus.resolution.cache.ResolutionCache;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.ResolutionDecision;
import com.nexus.resolution.core.model.SimilarityScore;
import com.nexus.resolution.decision.DecisionEngine;
import com.nexus.resolution.graph.CanonicalStore;
import com.nexus.resolution.graph.GraphWriteException;
import com.nexus.resolution.lock.LeaseManager;
import com.nexus.resolution.lock.LeaseTimeoutException;
import com.nexus.resolution.lock.LocalLeaseManager;
import com.nexus.resolution.logging.LogContext;
import com.nexus.resolution.merge.AttributePolicy;
import com.nexus.resolution.merge.MergeChainException;
import com.nexus.resolution.merge.MergeExecutor;
import com.nexus.resolution.merge.MergeListener;
import com.nexus.resolution.merge.MergeResult;
import com.nexus.resolution.merge.RetryPolicy;
import com.nexus.resolution.metrics.MetricsService;
import com.nexus.resolution.metrics.NoOpMetricsService;
import com.nexus.resolution.relationship.InferenceResult;
import com.nexus.resolution.relationship.RelationshipExtractor;
import com.nexus.resolution.relationship.RelationshipInferencer;
import com.nexus.resolution.review.InMemoryReviewQueue;
import com.nexus.resolution.review.ReviewItem;
import com.nexus.resolution.review.ReviewQueue;
import com.nexus.resolution.review.ReviewReason;
import com.nexus.resolution.review.ReviewService;
import com.nexus.resolution.rules.DefaultNormalizationRules;
import com.nexus.resolution.rules.NormalizationEngine;
import com.nexus.resolution.similarity.BlockingKeyStrategy;
import com.nexus.resolution.similarity.DefaultBlockingKeyStrategy;
import com.nexus.resolution.similarity.EmbeddingProvider;
import com.nexus.resolution.similarity.SimilarityScorer;
import com.nexus.resolution.tracing.NoOpTracingService;
import com.nexus.resolution.tracing.Span;
import com.nexus.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Resolves candidates against the canonical store.
 *
 * <p>Control flow for one candidate: validation, ingestion-id short circuit, blocking (plus the
 * cached survivor for the name, if any), scoring, decision, then one of merge, create, or
 * adjudication. Ambiguous candidates that the
 * adjudicator cannot settle go to the review queue. Lease timeouts also go to review; graph
 * write failures that exhaust their retries dead-letter the candidate.</p>
 *
 * <pre>
 * ResolutionPipeline pipeline = ResolutionPipeline.builder()
 *     .store(new GraphCanonicalStore(connection))
 *     .leaseManager(new GraphLeaseManager(connection))
 *     .adjudicator(new OllamaAdjudicator(OllamaClient.builder().build()))
 *     .options(ResolutionOptions.defaults())
 *     .build();
 *
 * ResolutionResult result = pipeline.resolve(candidate);
 * </pre>
 */
public class ResolutionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

    private final ResolutionOptions options;
    private final CanonicalStore store;
    private final NormalizationEngine normalizationEngine;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final CandidateValidator validator;
    private final SimilarityScorer scorer;
    private final DecisionEngine decisionEngine;
    private final MergeExecutor mergeExecutor;
    private final AdjudicatorGateway adjudicatorGateway;
    private final ReviewService reviewService;
    private final ReviewQueue reviewQueue;
    private final RelationshipInferencer relationshipInferencer;
    private final ResolutionCache cache;
    private final DeadLetterQueue deadLetterQueue;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private ResolutionPipeline(Builder builder) {
        this.options = builder.options != null ? builder.options : ResolutionOptions.defaults();
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.cache = builder.cache != null ? builder.cache : new NoOpResolutionCache();
        this.deadLetterQueue = builder.deadLetterQueue != null ? builder.deadLetterQueue : new DeadLetterQueue();
        this.validator = new CandidateValidator();

        this.scorer = new SimilarityScorer(normalizationEngine, options.getScorerWeights(),
                builder.embeddingProvider, metricsService);
        this.decisionEngine = new DecisionEngine(options.getUpperThreshold(), options.getLowerThreshold(),
                options.getTieEpsilon(), options.getTopK());
        this.mergeExecutor = MergeExecutor.builder()
                .store(store)
                .leaseManager(builder.leaseManager != null ? builder.leaseManager : new LocalLeaseManager())
                .normalizationEngine(normalizationEngine)
                .attributePolicy(builder.attributePolicy)
                .retryPolicy(new RetryPolicy(options.getGraphWriteRetryCount(), options.getGraphWriteBackoff()))
                .leaseTimeout(options.getMergeLeaseTimeout())
                .metricsService(metricsService)
                .tracingService(tracingService)
                .build();
        if (cache instanceof MergeListener listener) {
            mergeExecutor.addMergeListener(listener);
        }

        this.adjudicatorGateway = builder.adjudicator == null ? null : AdjudicatorGateway.builder()
                .adjudicator(builder.adjudicator)
                .floors(options.getAdjudicationFloors())
                .maxAttempts(options.getAdjudicatorRetryCount())
                .retryBackoff(options.getAdjudicatorRetryBackoff())
                .callTimeout(options.getAdjudicatorTimeout())
                .maxConcurrency(options.getAdjudicatorMaxConcurrency())
                .metricsService(metricsService)
                .tracingService(tracingService)
                .build();

        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = ReviewService.builder()
                .reviewQueue(reviewQueue)
                .mergeExecutor(mergeExecutor)
                .similarityScorer(scorer)
                .normalizationEngine(normalizationEngine)
                .blockingKeyStrategy(blockingKeyStrategy)
                .reattachThreshold(options.getReviewReattachThreshold())
                .reattachTimeout(options.getReviewReattachTimeout())
                .metricsService(metricsService)
                .build();
        this.relationshipInferencer = builder.relationshipExtractor == null ? null
                : new RelationshipInferencer(builder.relationshipExtractor, mergeExecutor, decisionEngine, reviewService);

        log.info("ResolutionPipeline initialized: {}", options);
    }

    public ResolutionResult resolve(CandidateEntity candidate) {
        return resolve(candidate, CancellationToken.create());
    }

    /**
     * Resolves one candidate.
     *
     * @throws CandidateValidationException if the candidate is malformed
     * @throws ResolutionCancelledException if cancelled before the graph was mutated
     */
    public ResolutionResult resolve(CandidateEntity candidate, CancellationToken token) {
        validator.validate(candidate);
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(),
                candidate.ingestionId(), candidate.type().name());
             Span span = tracingService.startSpan(TracingService.RESOLVE, Map.of(
                     "ingestionId", candidate.ingestionId(),
                     "entityType", candidate.type().name()))) {
            try {
                Stage stage = score(candidate, token);
                ResolutionResult result = stage.isDone() ? stage.result() : adjudicate(stage.scored(), token);
                span.setAttribute("outcome", result.outcome().name());
                span.setAttribute("topScore", result.topScore());
                span.setStatus(Span.SpanStatus.OK);
                recordCompletion(result, start);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    /**
     * First stage: idempotence checks, blocking, scoring and decision. Unambiguous
     * decisions are applied here; ambiguous ones are handed back for {@link #adjudicate}.
     */
    Stage score(CandidateEntity candidate, CancellationToken token) {
        return guarded(candidate, null, () -> {
            Optional<String> absorbedBy = store.findByIngestionId(candidate.ingestionId());
            if (absorbedBy.isPresent()) {
                String survivor = mergeExecutor.resolveSurvivor(absorbedBy.get());
                log.info("resolution.already_resolved ingestionId={} canonicalId={}", candidate.ingestionId(), survivor);
                return Stage.done(ResolutionResult.alreadyResolved(candidate.ingestionId(), survivor));
            }
            ReviewItem queued = reviewQueue.findPendingByIngestionId(candidate.ingestionId());
            if (queued != null) {
                log.info("resolution.already_queued ingestionId={} reviewItemId={}", candidate.ingestionId(), queued.getId());
                return Stage.done(ResolutionResult.queued(candidate.ingestionId(), queued.getId(), queued.getReason(),
                        null, queued.getAdjudicationOutcome(), queued.getTopAggregate()));
            }

            String normalized = normalizationEngine.normalize(candidate.name(), candidate.type());
            token.throwIfCancelled();
            Set<String> keys = blockingKeyStrategy.generateKeys(normalized);
            List<CanonicalEntity> blockingSet = withCachedSurvivor(candidate, normalized,
                    store.findBlockingSet(candidate.type(), keys, options.getMaxBlockSize()));
            List<SimilarityScore> scores = scorer.score(candidate, blockingSet);
            ResolutionDecision decision = decisionEngine.decide(scores);
            double top = scores.isEmpty() ? 0.0 : scores.get(0).aggregate();
            log.info("resolution.decided ingestionId={} decision={} top={} blockSize={}",
                    candidate.ingestionId(), decision.type(), top, blockingSet.size());

            ScoredCandidate scored = new ScoredCandidate(candidate, normalized, decision,
                    scores.subList(0, Math.min(options.getTopK(), scores.size())), blockingSet, top);
            if (decision.isAutoMerge()) {
                return Stage.done(apply(scored, null,
                        () -> mergeExecutor.applyMerge(candidate, decision.canonicalId(), token)));
            }
            if (decision.isAutoDistinct()) {
                List<String> scoredIds = blockingSet.stream().map(CanonicalEntity::getId).toList();
                return Stage.done(apply(scored, null,
                        () -> mergeExecutor.applyDistinct(candidate, scoredIds, token)));
            }
            return Stage.ambiguous(scored);
        });
    }

    /**
     * Second stage for ambiguous candidates: ask the adjudicator, then merge, create or queue.
     */
    ResolutionResult adjudicate(ScoredCandidate scored, CancellationToken token) {
        CandidateEntity candidate = scored.candidate();
        ResolutionDecision decision = scored.decision();
        Stage stage = guarded(candidate, decision, () -> {
            if (adjudicatorGateway == null) {
                ReviewReason reason = decision.tiedLeaders() ? ReviewReason.TIED_LEADERS : ReviewReason.AMBIGUOUS_SCORE;
                return Stage.done(queueForReview(scored, null, reason));
            }

            Map<String, CanonicalEntity> byId = scored.blockingSet().stream()
                    .collect(Collectors.toMap(CanonicalEntity::getId, Function.identity(), (a, b) -> a));
            List<CanonicalEntity> contenders = new ArrayList<>();
            for (SimilarityScore score : decision.contenders()) {
                CanonicalEntity contender = byId.get(score.canonicalId());
                if (contender != null) {
                    contenders.add(contender);
                }
            }
            token.throwIfCancelled();
            AdjudicationOutcome outcome = adjudicatorGateway.adjudicate(candidate, contenders);
            if (outcome.isMerge()) {
                return Stage.done(apply(scored, outcome,
                        () -> mergeExecutor.applyMerge(candidate, outcome.canonicalId(), token)));
            }
            if (outcome.isDistinct()) {
                return Stage.done(apply(scored, outcome,
                        () -> mergeExecutor.applyConfirmedDistinct(candidate, token)));
            }
            return Stage.done(queueForReview(scored, outcome, outcome.reviewReason()));
        });
        return stage.result();
    }

    void recordCompletion(ResolutionResult result, long startNanos) {
        metricsService.recordResolutionDuration(result.outcome().name().toLowerCase(Locale.ROOT),
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    void validate(CandidateEntity candidate) {
        validator.validate(candidate);
    }

    private Stage guarded(CandidateEntity candidate, ResolutionDecision decision, Supplier<Stage> work) {
        try {
            return work.get();
        } catch (GraphWriteException | MergeChainException e) {
            deadLetterQueue.add(candidate, e);
            metricsService.incrementDeadLettered();
            return Stage.done(ResolutionResult.deadLettered(candidate.ingestionId(), decision, e.getMessage()));
        }
    }

    /**
     * Adds the cached survivor for the candidate's name to the blocking set when capping left it
     * out. A hit never decides anything by itself: the candidate is still scored and the
     * decision engine still applies the thresholds.
     */
    private List<CanonicalEntity> withCachedSurvivor(CandidateEntity candidate, String normalized,
                                                     List<CanonicalEntity> blockingSet) {
        Optional<String> cachedId = cache.get(candidate.type(), normalized);
        if (cachedId.isEmpty()) {
            metricsService.recordCacheMiss();
            return blockingSet;
        }
        metricsService.recordCacheHit();
        String survivorId;
        try {
            survivorId = mergeExecutor.resolveSurvivor(cachedId.get());
        } catch (MergeChainException e) {
            log.warn("resolution.cache_stale ingestionId={} canonicalId={} cause={}",
                    candidate.ingestionId(), cachedId.get(), e.getMessage());
            cache.invalidate(cachedId.get());
            return blockingSet;
        }
        if (blockingSet.stream().anyMatch(e -> e.getId().equals(survivorId))) {
            return blockingSet;
        }
        Optional<CanonicalEntity> survivor = store.findById(survivorId);
        if (survivor.isEmpty() || survivor.get().getType() != candidate.type()) {
            return blockingSet;
        }
        log.debug("Cache hit {} added to the blocking set of {}", survivorId, candidate.ingestionId());
        List<CanonicalEntity> extended = new ArrayList<>(blockingSet);
        extended.add(survivor.get());
        return extended;
    }

    private ResolutionResult apply(ScoredCandidate scored, AdjudicationOutcome adjudication,
                                   Supplier<MergeResult> mutation) {
        try {
            ResolutionResult result = toResult(scored, mutation.get(), adjudication);
            cache.put(scored.candidate().type(), scored.normalizedName(), result.canonicalId());
            return result;
        } catch (LeaseTimeoutException e) {
            log.warn("resolution.lease_timeout ingestionId={} key={} timeoutMs={}",
                    scored.candidate().ingestionId(), e.getKey(), e.getTimeout().toMillis());
            return queueForReview(scored, adjudication, ReviewReason.MERGE_LOCK_TIMEOUT);
        }
    }

    private ResolutionResult toResult(ScoredCandidate scored, MergeResult merge, AdjudicationOutcome adjudication) {
        String ingestionId = scored.candidate().ingestionId();
        return switch (merge.outcome()) {
            case CREATED -> ResolutionResult.created(ingestionId, merge.canonicalId(), scored.decision(),
                    adjudication, scored.topScore());
            case ALREADY_APPLIED -> ResolutionResult.alreadyResolved(ingestionId, merge.canonicalId());
            case MERGED, CANONICALS_MERGED -> ResolutionResult.merged(ingestionId, merge.canonicalId(),
                    scored.decision(), adjudication, scored.topScore());
        };
    }

    private ResolutionResult queueForReview(ScoredCandidate scored, AdjudicationOutcome adjudication,
                                            ReviewReason reason) {
        ReviewItem item = reviewService.enqueue(scored.candidate(), scored.topScores(), adjudication, reason);
        return ResolutionResult.queued(scored.candidate().ingestionId(), item.getId(), item.getReason(),
                scored.decision(), adjudication, scored.topScore());
    }

    /**
     * Resolves every mention of one source document, then infers relationships between the
     * canonicals they resolved to. Candidates that fail validation are skipped and logged.
     */
    public List<ResolutionResult> resolveDocument(List<CandidateEntity> candidates, String sourceContext) {
        List<ResolutionResult> results = new ArrayList<>(candidates.size());
        Set<String> resolvedIds = new LinkedHashSet<>();
        for (CandidateEntity candidate : candidates) {
            try {
                ResolutionResult result = resolve(candidate);
                results.add(result);
                if (result.isResolved()) {
                    resolvedIds.add(result.canonicalId());
                }
            } catch (CandidateValidationException e) {
                log.warn("resolution.rejected candidate={} violations={}", candidate, e.getViolations());
            }
        }
        if (relationshipInferencer != null && resolvedIds.size() > 1) {
            InferenceResult inference = relationshipInferencer.infer(resolvedIds, sourceContext);
            log.info("relationship.inferred created={} queued={} discarded={} failed={}",
                    inference.created().size(), inference.queued().size(), inference.discarded(),
                    inference.failed().size());
        }
        return results;
    }

    /**
     * @throws IllegalStateException if no relationship extractor was configured
     */
    public InferenceResult inferRelationships(List<String> canonicalIds, String sourceContext) {
        if (relationshipInferencer == null) {
            throw new IllegalStateException("No relationship extractor configured");
        }
        return relationshipInferencer.infer(canonicalIds, sourceContext);
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public MergeExecutor getMergeExecutor() {
        return mergeExecutor;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public DeadLetterQueue getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public ResolutionCache getCache() {
        return cache;
    }

    public CanonicalStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (adjudicatorGateway != null) {
            adjudicatorGateway.close();
        }
    }

    /**
     * A scored candidate carried from the scoring stage to adjudication.
     */
    record ScoredCandidate(CandidateEntity candidate, String normalizedName, ResolutionDecision decision,
                           List<SimilarityScore> topScores, List<CanonicalEntity> blockingSet, double topScore) {
    }

    /**
     * Output of the scoring stage: a final result, or a candidate still to adjudicate.
     */
    record Stage(ResolutionResult result, ScoredCandidate scored) {

        static Stage done(ResolutionResult result) {
            return new Stage(result, null);
        }

        static Stage ambiguous(ScoredCandidate scored) {
            return new Stage(null, scored);
        }

        boolean isDone() {
            return result != null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolutionOptions options;
        private CanonicalStore store;
        private LeaseManager leaseManager;
        private NormalizationEngine normalizationEngine;
        private BlockingKeyStrategy blockingKeyStrategy;
        private EmbeddingProvider embeddingProvider;
        private Adjudicator adjudicator;
        private ReviewQueue reviewQueue;
        private RelationshipExtractor relationshipExtractor;
        private AttributePolicy attributePolicy;
        private ResolutionCache cache;
        private DeadLetterQueue deadLetterQueue;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder store(CanonicalStore store) {
            this.store = store;
            return this;
        }

        public Builder leaseManager(LeaseManager leaseManager) {
            this.leaseManager = leaseManager;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        /**
         * Without an adjudicator, ambiguous candidates go straight to review.
         */
        public Builder adjudicator(Adjudicator adjudicator) {
            this.adjudicator = adjudicator;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder relationshipExtractor(RelationshipExtractor relationshipExtractor) {
            this.relationshipExtractor = relationshipExtractor;
            return this;
        }

        public Builder attributePolicy(AttributePolicy attributePolicy) {
            this.attributePolicy = attributePolicy;
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder deadLetterQueue(DeadLetterQueue deadLetterQueue) {
            this.deadLetterQueue = deadLetterQueue;
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

        public ResolutionPipeline build() {
            return new ResolutionPipeline(this);
        }
    }
}
