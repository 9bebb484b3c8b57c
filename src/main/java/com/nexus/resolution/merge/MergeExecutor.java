package com.nexus.resolution.merge;

import com.nexus.resolution.api.CancellationToken;
import com.nexus.resolution.core.model.Alias;
import com.nexus.resolution.core.model.AttributeConflict;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.Relationship;
import com.nexus.resolution.graph.CanonicalStore;
import com.nexus.resolution.lock.Lease;
import com.nexus.resolution.lock.LeaseManager;
import com.nexus.resolution.lock.LocalLeaseManager;
import com.nexus.resolution.logging.LogContext;
import com.nexus.resolution.metrics.MetricsService;
import com.nexus.resolution.metrics.NoOpMetricsService;
import com.nexus.resolution.rules.DefaultNormalizationRules;
import com.nexus.resolution.rules.NormalizationEngine;
import com.nexus.resolution.tracing.NoOpTracingService;
import com.nexus.resolution.tracing.Span;
import com.nexus.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Applies resolution decisions to the canonical store.
 *
 * <p>Every mutation of an existing canonical happens under a lease on its id, after following
 * the redirect chain to the current survivor and re-reading it under the lease. New canonicals
 * are created under a lease on {@code create:<type>:<normalized name>} so two identical
 * candidates scored at the same time cannot both create one. Canonicals that scoring or a
 * reviewer already judged distinct are never merged into by the create path. All operations
 * are idempotent per ingestion id.</p>
 *
 * <p>Cancellation is honoured until the first mutation; after that the operation completes.</p>
 */
public class MergeExecutor {
    private static final Logger log = LoggerFactory.getLogger(MergeExecutor.class);

    private static final int MAX_REVALIDATIONS = 5;

    private final CanonicalStore store;
    private final LeaseManager leaseManager;
    private final NormalizationEngine normalizationEngine;
    private final AttributeReconciler attributeReconciler;
    private final RetryPolicy retryPolicy;
    private final Duration leaseTimeout;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    private MergeExecutor(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.leaseManager = builder.leaseManager != null ? builder.leaseManager : new LocalLeaseManager();
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.attributeReconciler = new AttributeReconciler(
                builder.attributePolicy != null ? builder.attributePolicy : AttributePolicy.defaults());
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
        this.leaseTimeout = builder.leaseTimeout != null ? builder.leaseTimeout : Duration.ofSeconds(5);
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
    }

    public void addMergeListener(MergeListener listener) {
        mergeListeners.add(listener);
    }

    /**
     * Follows {@code mergedInto} redirects from {@code canonicalId} to the active survivor.
     *
     * @throws MergeChainException on a loop or a redirect to a missing canonical
     */
    public String resolveSurvivor(String canonicalId) {
        Set<String> visited = new LinkedHashSet<>();
        String current = canonicalId;
        while (true) {
            if (!visited.add(current)) {
                throw new MergeChainException(canonicalId, "Redirect cycle detected: " + visited);
            }
            Optional<CanonicalEntity> entity = store.findById(current);
            if (entity.isEmpty()) {
                throw new MergeChainException(canonicalId,
                        "Redirect chain from " + canonicalId + " ends at missing canonical " + current);
            }
            if (entity.get().isActive()) {
                return current;
            }
            String next = entity.get().getMergedInto();
            if (next == null) {
                throw new MergeChainException(canonicalId, "Merged canonical " + current + " has no redirect");
            }
            current = next;
        }
    }

    /**
     * Creates a canonical for a candidate that was scored against nothing.
     *
     * @see #applyDistinct(CandidateEntity, Collection, CancellationToken)
     */
    public MergeResult applyDistinct(CandidateEntity candidate, CancellationToken token) {
        return applyDistinct(candidate, Set.of(), token);
    }

    /**
     * Creates a canonical for a candidate judged distinct from every canonical in
     * {@code scoredIds}. An active canonical with the same normalized name that is not among
     * them (nor a survivor of one of them) was created after scoring, usually by a concurrent
     * identical candidate, and the candidate is merged into it instead.
     *
     * @throws com.nexus.resolution.lock.LeaseTimeoutException if the create lease times out
     * @throws com.nexus.resolution.api.ResolutionCancelledException if cancelled first
     */
    public MergeResult applyDistinct(CandidateEntity candidate, Collection<String> scoredIds,
                                     CancellationToken token) {
        return create(candidate, scoredIds, true, token);
    }

    /**
     * Creates a canonical for a candidate the adjudicator or a reviewer ruled distinct. Never
     * merges into an existing canonical, even one with the same normalized name.
     */
    public MergeResult applyConfirmedDistinct(CandidateEntity candidate, CancellationToken token) {
        return create(candidate, Set.of(), false, token);
    }

    private MergeResult create(CandidateEntity candidate, Collection<String> scoredIds,
                               boolean redirectToNewcomer, CancellationToken token) {
        String normalized = normalizationEngine.normalize(candidate.name(), candidate.type());
        token.throwIfCancelled();

        try (Lease lease = leaseManager.acquire(LeaseManager.createKey(candidate.type().name(), normalized), leaseTimeout)) {
            Optional<String> absorbedBy = store.findByIngestionId(candidate.ingestionId());
            if (absorbedBy.isPresent()) {
                return MergeResult.alreadyApplied(resolveSurvivor(absorbedBy.get()));
            }
            if (redirectToNewcomer) {
                Optional<CanonicalEntity> newcomer = findUnscoredSameName(candidate, normalized, scoredIds);
                if (newcomer.isPresent()) {
                    log.info("merge.create_redirected ingestionId={} canonicalId={} normalizedName='{}'",
                            candidate.ingestionId(), newcomer.get().getId(), normalized);
                    return applyMerge(candidate, newcomer.get().getId(), token);
                }
            }

            token.enterCriticalSection();
            CanonicalEntity entity = CanonicalEntity.builder()
                    .type(candidate.type())
                    .primaryName(candidate.name())
                    .normalizedName(normalized)
                    .alias(Alias.of(candidate.name(), normalized, candidate.ingestionId(), candidate.embedding()))
                    .attributes(candidate.attributes())
                    .ingestionId(candidate.ingestionId())
                    .embedding(candidate.embedding())
                    .build();
            String id = retryPolicy.execute("createCanonical", () ->
                    store.findById(entity.getId()).isPresent() ? entity.getId() : store.createCanonical(entity));

            metricsService.incrementCanonicalCreated(candidate.type());
            log.info("canonical.created canonicalId={} ingestionId={} type={} name='{}'",
                    id, candidate.ingestionId(), candidate.type(), candidate.name());
            return MergeResult.created(id);
        }
    }

    private Optional<CanonicalEntity> findUnscoredSameName(CandidateEntity candidate, String normalized,
                                                           Collection<String> scoredIds) {
        List<CanonicalEntity> sameName = store.findByNormalizedName(candidate.type(), normalized);
        if (sameName.isEmpty()) {
            return Optional.empty();
        }
        Set<String> judged = new HashSet<>(scoredIds);
        for (String scoredId : scoredIds) {
            judged.add(resolveSurvivor(scoredId));
        }
        return sameName.stream().filter(e -> !judged.contains(e.getId())).findFirst();
    }

    /**
     * Merges the candidate into {@code targetId}, or into whatever it has since been merged into.
     *
     * @throws com.nexus.resolution.lock.LeaseTimeoutException if the target lease times out
     * @throws MergeChainException if the redirect chain is broken
     */
    public MergeResult applyMerge(CandidateEntity candidate, String targetId, CancellationToken token) {
        try (Span span = tracingService.startSpan(TracingService.MERGE, Map.of("targetId", targetId))) {
            for (int attempt = 1; attempt <= MAX_REVALIDATIONS; attempt++) {
                String survivorId = resolveSurvivor(targetId);
                token.throwIfCancelled();

                try (Lease lease = leaseManager.acquire(survivorId, leaseTimeout)) {
                    Optional<CanonicalEntity> current = store.findById(survivorId);
                    if (current.isEmpty() || !current.get().isActive()) {
                        log.debug("Target {} was merged away before lease, revalidating (attempt {})",
                                survivorId, attempt);
                        continue;
                    }
                    MergeResult result = absorb(candidate, current.get(), token);
                    span.setAttribute("survivorId", survivorId);
                    span.setStatus(Span.SpanStatus.OK);
                    return result;
                }
            }
            throw new MergeChainException(targetId,
                    "Target " + targetId + " kept moving after " + MAX_REVALIDATIONS + " revalidations");
        }
    }

    /**
     * Merges canonical {@code sourceId} into {@code targetId}: aliases unioned, attributes
     * reconciled, edges repointed, and the source turned into a redirect. Both leases are
     * taken in id order. Store failures are compensated step by step.
     *
     * <p>Both ids are first resolved to their survivors, so a source already redirected
     * (directly or transitively) into the target is reported as already applied and a
     * redirect loop cannot be created.</p>
     *
     * @throws MergeChainException if either redirect chain is broken
     */
    public MergeResult mergeCanonicals(String sourceId, String targetId, String actorId, String rationale) {
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Cannot merge a canonical into itself: " + sourceId);
        }
        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(), sourceId, targetId);
             Span span = tracingService.startSpan(TracingService.MERGE,
                     Map.of("sourceId", sourceId, "targetId", targetId))) {

            for (int attempt = 1; attempt <= MAX_REVALIDATIONS; attempt++) {
                String source = resolveSurvivor(sourceId);
                String target = resolveSurvivor(targetId);
                if (source.equals(target)) {
                    log.info("merge.already_applied sourceId={} targetId={} survivorId={}", sourceId, targetId, target);
                    return MergeResult.alreadyApplied(target);
                }
                String first = source.compareTo(target) < 0 ? source : target;
                String second = first.equals(source) ? target : source;

                try (Lease firstLease = leaseManager.acquire(first, leaseTimeout);
                     Lease secondLease = leaseManager.acquire(second, leaseTimeout)) {
                    Optional<CanonicalEntity> sourceEntity = store.findById(source);
                    Optional<CanonicalEntity> targetEntity = store.findById(target);
                    if (sourceEntity.isEmpty() || targetEntity.isEmpty()
                            || !sourceEntity.get().isActive() || !targetEntity.get().isActive()) {
                        continue;
                    }
                    MergeResult result = absorbCanonical(sourceEntity.get(), targetEntity.get(), actorId);
                    mergeListeners.forEach(l -> l.onMerge(source, target));
                    log.info("merge.completed sourceId={} targetId={} actorId={} rationale='{}' conflicts={}",
                            source, target, actorId, rationale, result.conflictsFlagged());
                    span.setStatus(Span.SpanStatus.OK);
                    return result;
                }
            }
            throw new MergeChainException(sourceId, "Canonicals kept moving after " + MAX_REVALIDATIONS + " revalidations");
        }
    }

    private MergeResult absorb(CandidateEntity candidate, CanonicalEntity target, CancellationToken token) {
        if (target.hasIngestion(candidate.ingestionId())) {
            log.info("merge.already_applied ingestionId={} canonicalId={}", candidate.ingestionId(), target.getId());
            return MergeResult.alreadyApplied(target.getId());
        }
        token.enterCriticalSection();

        String normalized = normalizationEngine.normalize(candidate.name(), candidate.type());
        boolean aliasAdded = target.addAlias(
                Alias.of(candidate.name(), normalized, candidate.ingestionId(), candidate.embedding()));
        if (aliasAdded) {
            target.recomputeEmbedding();
        }
        List<AttributeConflict> conflicts =
                attributeReconciler.reconcile(target, candidate.attributes(), candidate.ingestionId());
        target.recordIngestion(candidate.ingestionId());
        target.touchMerged();

        retryPolicy.run("save", () -> store.save(target));
        metricsService.incrementCanonicalMerged(target.getType());
        log.info("merge.completed ingestionId={} canonicalId={} aliasAdded={} conflicts={}",
                candidate.ingestionId(), target.getId(), aliasAdded, conflicts.size());
        return MergeResult.merged(target.getId(), aliasAdded, conflicts.size());
    }

    private MergeResult absorbCanonical(CanonicalEntity source, CanonicalEntity target, String actorId) {
        CanonicalEntity sourceBefore = source.copy();
        CanonicalEntity targetBefore = target.copy();
        String provenanceSource = "merge:" + source.getId() + (actorId != null ? ":" + actorId : "");

        for (Alias alias : source.getAliases()) {
            target.addAlias(alias);
        }
        target.recomputeEmbedding();
        if (!target.hasEmbedding() && source.hasEmbedding()) {
            target.setEmbedding(source.getEmbedding());
        }
        List<AttributeConflict> conflicts =
                attributeReconciler.reconcile(target, source.getAttributes(), provenanceSource);
        source.getProvenance().forEach(target::addProvenance);
        source.getConflicts().forEach(target::addConflict);
        source.getIngestionIds().forEach(target::recordIngestion);
        target.touchMerged();

        List<Relationship> edgesBefore = new ArrayList<>(store.findRelationships(source.getId()));
        edgesBefore.addAll(store.findRelationships(target.getId()));
        Set<String> edgeIdsBefore = new HashSet<>();
        edgesBefore.forEach(r -> edgeIdsBefore.add(r.getId()));

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("save target",
                    () -> retryPolicy.run("save", () -> store.save(target)),
                    () -> store.save(targetBefore));
            tx.execute("repoint relationships",
                    () -> retryPolicy.execute("repointRelationships",
                            () -> store.repointRelationships(source.getId(), target.getId())),
                    () -> restoreRelationships(target.getId(), edgesBefore, edgeIdsBefore));
            tx.execute("redirect source",
                    () -> retryPolicy.run("markMerged", () -> store.markMerged(source.getId(), target.getId())),
                    () -> store.save(sourceBefore));
            tx.markSuccess();
        }

        metricsService.incrementCanonicalMerged(target.getType());
        return MergeResult.canonicalsMerged(target.getId(), source.getId(), conflicts.size());
    }

    private void restoreRelationships(String targetId, List<Relationship> edgesBefore, Set<String> edgeIdsBefore) {
        for (Relationship edge : store.findRelationships(targetId)) {
            if (!edgeIdsBefore.contains(edge.getId())) {
                store.deleteRelationship(edge.getId());
            }
        }
        edgesBefore.forEach(store::saveRelationship);
    }

    /**
     * Writes a relationship edge with the same retry policy as canonical writes.
     *
     * @throws com.nexus.resolution.graph.GraphWriteException once retries are exhausted
     */
    public Relationship createRelationship(String subjectId, String predicate, String objectId,
                                           double confidence, String provenance) {
        return retryPolicy.execute("createRelationship",
                () -> store.createRelationship(subjectId, predicate, objectId, confidence, provenance));
    }

    public CanonicalStore getStore() {
        return store;
    }

    public LeaseManager getLeaseManager() {
        return leaseManager;
    }

    public Duration getLeaseTimeout() {
        return leaseTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CanonicalStore store;
        private LeaseManager leaseManager;
        private NormalizationEngine normalizationEngine;
        private AttributePolicy attributePolicy;
        private RetryPolicy retryPolicy;
        private Duration leaseTimeout;
        private MetricsService metricsService;
        private TracingService tracingService;

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

        public Builder attributePolicy(AttributePolicy attributePolicy) {
            this.attributePolicy = attributePolicy;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
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

        public MergeExecutor build() {
            return new MergeExecutor(this);
        }
    }
}
