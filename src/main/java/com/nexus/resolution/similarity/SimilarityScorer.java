package com.nexus.resolution.similarity;

import com.nexus.resolution.core.model.Alias;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;
import com.nexus.resolution.core.model.SignalType;
import com.nexus.resolution.core.model.SimilarityScore;
import com.nexus.resolution.metrics.MetricsService;
import com.nexus.resolution.metrics.NoOpMetricsService;
import com.nexus.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a candidate against its blocking set using four independent signals:
 * <ul>
 *   <li>string: edit-distance similarity of normalized names</li>
 *   <li>phonetic: shared per-token Soundex codes</li>
 *   <li>alias: best edit-distance similarity against any alias of the canonical</li>
 *   <li>embedding: clamped cosine against the canonical's representative embedding</li>
 * </ul>
 *
 * <p>The aggregate is the weighted mean over the signals actually available for the pair.
 * An unavailable signal is reported in {@link SimilarityScore#missingSignals()} and never
 * counted as zero. Scoring reads canonical snapshots only.</p>
 */
public class SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(SimilarityScorer.class);

    private static final Comparator<SimilarityScore> HIGHEST_FIRST =
            Comparator.comparingDouble(SimilarityScore::aggregate).reversed()
                    .thenComparing(SimilarityScore::canonicalId);

    private final NormalizationEngine normalizationEngine;
    private final ScorerWeights weights;
    private final EmbeddingProvider embeddingProvider;
    private final MetricsService metricsService;
    private final SimilarityAlgorithm stringSimilarity;
    private final PhoneticEncoder phoneticEncoder;

    public SimilarityScorer(NormalizationEngine normalizationEngine, ScorerWeights weights) {
        this(normalizationEngine, weights, new NoOpEmbeddingProvider(), new NoOpMetricsService());
    }

    public SimilarityScorer(NormalizationEngine normalizationEngine, ScorerWeights weights,
                            EmbeddingProvider embeddingProvider, MetricsService metricsService) {
        this.normalizationEngine = normalizationEngine;
        this.weights = weights;
        this.embeddingProvider = embeddingProvider != null ? embeddingProvider : new NoOpEmbeddingProvider();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.stringSimilarity = new LevenshteinSimilarity();
        this.phoneticEncoder = new PhoneticEncoder();
    }

    /**
     * Scores the candidate against every canonical of the blocking set.
     *
     * @return scores ordered by aggregate, highest first; ties ordered by canonical id
     */
    public List<SimilarityScore> score(CandidateEntity candidate, Collection<CanonicalEntity> blockingSet) {
        if (blockingSet == null || blockingSet.isEmpty()) {
            return List.of();
        }
        String normalized = normalizationEngine.normalize(candidate.name(), candidate.type());
        float[] candidateEmbedding = candidateEmbedding(candidate);

        List<SimilarityScore> scores = new ArrayList<>(blockingSet.size());
        Set<SignalType> degradedSignals = EnumSet.noneOf(SignalType.class);
        for (CanonicalEntity canonical : blockingSet) {
            SimilarityScore score = scorePair(candidate.ingestionId(), normalized, candidateEmbedding, canonical);
            degradedSignals.addAll(score.missingSignals());
            metricsService.recordSimilarityAggregate(score.aggregate());
            scores.add(score);
        }
        degradedSignals.forEach(metricsService::incrementScoringDegraded);
        scores.sort(HIGHEST_FIRST);

        if (log.isDebugEnabled()) {
            SimilarityScore top = scores.get(0);
            log.debug("Scored '{}' against {} canonicals, top={} aggregate={} missing={}",
                    candidate.name(), scores.size(), top.canonicalId(), top.aggregate(), top.missingSignals());
        }
        return scores;
    }

    /**
     * Aggregate similarity between two candidates, used to attach near-identical
     * candidates to the same pending review item. Only embeddings the candidates carry
     * themselves are compared.
     */
    public double scoreCandidates(CandidateEntity a, CandidateEntity b) {
        if (a.type() != b.type()) {
            return 0.0;
        }
        String normalizedA = normalizationEngine.normalize(a.name(), a.type());
        String normalizedB = normalizationEngine.normalize(b.name(), b.type());

        Map<SignalType, Double> components = new EnumMap<>(SignalType.class);
        components.put(SignalType.STRING, stringSimilarity.compute(normalizedA, normalizedB));
        components.put(SignalType.PHONETIC, phoneticEncoder.similarity(normalizedA, normalizedB));
        if (a.hasEmbedding() && b.hasEmbedding() && a.embedding().length == b.embedding().length) {
            components.put(SignalType.EMBEDDING, CosineSimilarity.similarity(a.embedding(), b.embedding()));
        }
        return aggregate(components);
    }

    public ScorerWeights getWeights() {
        return weights;
    }

    private SimilarityScore scorePair(String candidateId, String normalized, float[] candidateEmbedding,
                                      CanonicalEntity canonical) {
        Map<SignalType, Double> components = new EnumMap<>(SignalType.class);
        Set<SignalType> missing = EnumSet.noneOf(SignalType.class);

        components.put(SignalType.STRING, stringSimilarity.compute(normalized, canonical.getNormalizedName()));
        components.put(SignalType.PHONETIC, phoneticEncoder.similarity(normalized, canonical.getNormalizedName()));

        List<Alias> aliases = canonical.getAliases();
        if (aliases.isEmpty()) {
            missing.add(SignalType.ALIAS);
        } else {
            double best = 0.0;
            for (Alias alias : aliases) {
                best = Math.max(best, stringSimilarity.compute(normalized, alias.normalizedText()));
            }
            components.put(SignalType.ALIAS, best);
        }

        float[] canonicalEmbedding = canonical.getEmbedding();
        if (candidateEmbedding == null || canonicalEmbedding == null
                || candidateEmbedding.length != canonicalEmbedding.length) {
            missing.add(SignalType.EMBEDDING);
        } else {
            components.put(SignalType.EMBEDDING, CosineSimilarity.similarity(candidateEmbedding, canonicalEmbedding));
        }

        return new SimilarityScore(candidateId, canonical.getId(), components, aggregate(components), missing);
    }

    /**
     * Weighted mean over the present components, clamped to [0, 1].
     * Zero when no weighted signal is present.
     */
    double aggregate(Map<SignalType, Double> components) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<SignalType, Double> entry : components.entrySet()) {
            double weight = weights.weightOf(entry.getKey());
            weighted += weight * entry.getValue();
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, weighted / totalWeight));
    }

    private float[] candidateEmbedding(CandidateEntity candidate) {
        if (candidate.hasEmbedding()) {
            return candidate.embedding();
        }
        if (!embeddingProvider.isAvailable()) {
            return null;
        }
        try {
            float[] vector = embeddingProvider.embed(candidate.name());
            return vector != null && vector.length > 0 ? vector : null;
        } catch (EmbeddingUnavailableException e) {
            log.warn("scoring.degraded signal=EMBEDDING ingestionId={} reason={}",
                    candidate.ingestionId(), e.getMessage());
            return null;
        }
    }
}
