package com.nexus.resolution.api;

import com.nexus.resolution.adjudication.AdjudicationFloors;
import com.nexus.resolution.similarity.ScorerWeights;

import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Options for the resolution pipeline: decision thresholds, scorer weights, adjudication,
 * lease, review and retry settings.
 *
 * <p>The default values are illustrative starting points, not part of the pipeline's
 * behavior; deployments are expected to tune them, typically through
 * {@link #fromProperties(Properties)}.</p>
 */
public class ResolutionOptions {

    public static final String PROPERTY_PREFIX = "nexus.resolution.";

    private static final double DEFAULT_UPPER_THRESHOLD = 0.90;
    private static final double DEFAULT_LOWER_THRESHOLD = 0.50;
    private static final double DEFAULT_TIE_EPSILON = 0.02;
    private static final int DEFAULT_TOP_K = 3;
    private static final int DEFAULT_ADJUDICATOR_RETRY_COUNT = 2;
    private static final double DEFAULT_REATTACH_THRESHOLD = 0.85;
    private static final int DEFAULT_MAX_BLOCK_SIZE = 200;

    private final double upperThreshold;
    private final double lowerThreshold;
    private final double tieEpsilon;
    private final int topK;
    private final ScorerWeights scorerWeights;
    private final AdjudicationFloors adjudicationFloors;
    private final int adjudicatorRetryCount;
    private final Duration adjudicatorRetryBackoff;
    private final Duration adjudicatorTimeout;
    private final int adjudicatorMaxConcurrency;
    private final Duration mergeLeaseTimeout;
    private final double reviewReattachThreshold;
    private final Duration reviewReattachTimeout;
    private final int graphWriteRetryCount;
    private final Duration graphWriteBackoff;
    private final int maxBlockSize;
    private final String sourceSystem;
    private final int intakeQueueCapacity;
    private final int ambiguousBufferCapacity;
    private final int scoringWorkers;

    private ResolutionOptions(Builder builder) {
        this.upperThreshold = builder.upperThreshold;
        this.lowerThreshold = builder.lowerThreshold;
        this.tieEpsilon = builder.tieEpsilon;
        this.topK = builder.topK;
        this.scorerWeights = builder.scorerWeights;
        this.adjudicationFloors = builder.adjudicationFloors;
        this.adjudicatorRetryCount = builder.adjudicatorRetryCount;
        this.adjudicatorRetryBackoff = builder.adjudicatorRetryBackoff;
        this.adjudicatorTimeout = builder.adjudicatorTimeout;
        this.adjudicatorMaxConcurrency = builder.adjudicatorMaxConcurrency;
        this.mergeLeaseTimeout = builder.mergeLeaseTimeout;
        this.reviewReattachThreshold = builder.reviewReattachThreshold;
        this.reviewReattachTimeout = builder.reviewReattachTimeout;
        this.graphWriteRetryCount = builder.graphWriteRetryCount;
        this.graphWriteBackoff = builder.graphWriteBackoff;
        this.maxBlockSize = builder.maxBlockSize;
        this.sourceSystem = builder.sourceSystem;
        this.intakeQueueCapacity = builder.intakeQueueCapacity;
        this.ambiguousBufferCapacity = builder.ambiguousBufferCapacity;
        this.scoringWorkers = builder.scoringWorkers;
    }

    public double getUpperThreshold() {
        return upperThreshold;
    }

    public double getLowerThreshold() {
        return lowerThreshold;
    }

    public double getTieEpsilon() {
        return tieEpsilon;
    }

    public int getTopK() {
        return topK;
    }

    public ScorerWeights getScorerWeights() {
        return scorerWeights;
    }

    public AdjudicationFloors getAdjudicationFloors() {
        return adjudicationFloors;
    }

    /**
     * Total adjudicator attempts per candidate, including the first.
     */
    public int getAdjudicatorRetryCount() {
        return adjudicatorRetryCount;
    }

    public Duration getAdjudicatorRetryBackoff() {
        return adjudicatorRetryBackoff;
    }

    public Duration getAdjudicatorTimeout() {
        return adjudicatorTimeout;
    }

    public int getAdjudicatorMaxConcurrency() {
        return adjudicatorMaxConcurrency;
    }

    public Duration getMergeLeaseTimeout() {
        return mergeLeaseTimeout;
    }

    public double getReviewReattachThreshold() {
        return reviewReattachThreshold;
    }

    public Duration getReviewReattachTimeout() {
        return reviewReattachTimeout;
    }

    public int getGraphWriteRetryCount() {
        return graphWriteRetryCount;
    }

    public Duration getGraphWriteBackoff() {
        return graphWriteBackoff;
    }

    public int getMaxBlockSize() {
        return maxBlockSize;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public int getIntakeQueueCapacity() {
        return intakeQueueCapacity;
    }

    public int getAmbiguousBufferCapacity() {
        return ambiguousBufferCapacity;
    }

    public int getScoringWorkers() {
        return scoringWorkers;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Wider undecided band and stricter adjudication floors: more candidates reach review,
     * fewer are merged automatically.
     */
    public static ResolutionOptions conservative() {
        return builder()
                .upperThreshold(0.95)
                .lowerThreshold(0.40)
                .tieEpsilon(0.05)
                .adjudicationFloors(new AdjudicationFloors(0.95, 0.95))
                .build();
    }

    /**
     * Reads options from properties under {@value #PROPERTY_PREFIX}. Durations are in
     * milliseconds. Missing keys keep the builder defaults.
     *
     * <pre>
     * nexus.resolution.upperThreshold=0.9
     * nexus.resolution.scorerWeights.embedding=0.3
     * nexus.resolution.mergeLeaseTimeout=5000
     * </pre>
     *
     * @throws IllegalArgumentException if a value does not parse or the result is invalid
     */
    public static ResolutionOptions fromProperties(Properties properties) {
        Builder builder = builder();
        PropertyReader reader = new PropertyReader(properties);

        reader.doubleValue("upperThreshold").ifPresent(builder::upperThreshold);
        reader.doubleValue("lowerThreshold").ifPresent(builder::lowerThreshold);
        reader.doubleValue("tieEpsilon").ifPresent(builder::tieEpsilon);
        reader.intValue("topK").ifPresent(builder::topK);

        ScorerWeights weights = builder.scorerWeights;
        builder.scorerWeights(new ScorerWeights(
                reader.doubleValue("scorerWeights.string").orElse(weights.string()),
                reader.doubleValue("scorerWeights.phonetic").orElse(weights.phonetic()),
                reader.doubleValue("scorerWeights.alias").orElse(weights.alias()),
                reader.doubleValue("scorerWeights.embedding").orElse(weights.embedding())));

        AdjudicationFloors floors = builder.adjudicationFloors;
        builder.adjudicationFloors(new AdjudicationFloors(
                reader.doubleValue("adjudicatorConfidenceFloors.merge").orElse(floors.merge()),
                reader.doubleValue("adjudicatorConfidenceFloors.distinct").orElse(floors.distinct())));

        reader.intValue("adjudicatorRetryCount").ifPresent(builder::adjudicatorRetryCount);
        reader.duration("adjudicatorRetryBackoff").ifPresent(builder::adjudicatorRetryBackoff);
        reader.duration("adjudicatorTimeout").ifPresent(builder::adjudicatorTimeout);
        reader.intValue("adjudicatorMaxConcurrency").ifPresent(builder::adjudicatorMaxConcurrency);
        reader.duration("mergeLeaseTimeout").ifPresent(builder::mergeLeaseTimeout);
        reader.doubleValue("reviewReattachThreshold").ifPresent(builder::reviewReattachThreshold);
        reader.duration("reviewReattachTimeout").ifPresent(builder::reviewReattachTimeout);
        reader.intValue("graphWriteRetryCount").ifPresent(builder::graphWriteRetryCount);
        reader.duration("graphWriteBackoff").ifPresent(builder::graphWriteBackoff);
        reader.intValue("maxBlockSize").ifPresent(builder::maxBlockSize);
        reader.string("sourceSystem").ifPresent(builder::sourceSystem);
        reader.intValue("intakeQueueCapacity").ifPresent(builder::intakeQueueCapacity);
        reader.intValue("ambiguousBufferCapacity").ifPresent(builder::ambiguousBufferCapacity);
        reader.intValue("scoringWorkers").ifPresent(builder::scoringWorkers);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double upperThreshold = DEFAULT_UPPER_THRESHOLD;
        private double lowerThreshold = DEFAULT_LOWER_THRESHOLD;
        private double tieEpsilon = DEFAULT_TIE_EPSILON;
        private int topK = DEFAULT_TOP_K;
        private ScorerWeights scorerWeights = ScorerWeights.defaults();
        private AdjudicationFloors adjudicationFloors = AdjudicationFloors.defaults();
        private int adjudicatorRetryCount = DEFAULT_ADJUDICATOR_RETRY_COUNT;
        private Duration adjudicatorRetryBackoff = Duration.ofMillis(200);
        private Duration adjudicatorTimeout = Duration.ofSeconds(30);
        private int adjudicatorMaxConcurrency = 4;
        private Duration mergeLeaseTimeout = Duration.ofSeconds(5);
        private double reviewReattachThreshold = DEFAULT_REATTACH_THRESHOLD;
        private Duration reviewReattachTimeout = Duration.ofSeconds(2);
        private int graphWriteRetryCount = 3;
        private Duration graphWriteBackoff = Duration.ofMillis(100);
        private int maxBlockSize = DEFAULT_MAX_BLOCK_SIZE;
        private String sourceSystem = "SYSTEM";
        private int intakeQueueCapacity = 1_000;
        private int ambiguousBufferCapacity = 100;
        private int scoringWorkers = 4;

        public Builder upperThreshold(double upperThreshold) {
            validateThreshold(upperThreshold, "upperThreshold");
            this.upperThreshold = upperThreshold;
            return this;
        }

        public Builder lowerThreshold(double lowerThreshold) {
            validateThreshold(lowerThreshold, "lowerThreshold");
            this.lowerThreshold = lowerThreshold;
            return this;
        }

        public Builder tieEpsilon(double tieEpsilon) {
            if (tieEpsilon < 0.0) {
                throw new IllegalArgumentException("tieEpsilon must be >= 0");
            }
            this.tieEpsilon = tieEpsilon;
            return this;
        }

        public Builder topK(int topK) {
            if (topK < 1) {
                throw new IllegalArgumentException("topK must be at least 1");
            }
            this.topK = topK;
            return this;
        }

        public Builder scorerWeights(ScorerWeights scorerWeights) {
            this.scorerWeights = scorerWeights;
            return this;
        }

        public Builder adjudicationFloors(AdjudicationFloors adjudicationFloors) {
            this.adjudicationFloors = adjudicationFloors;
            return this;
        }

        public Builder adjudicatorRetryCount(int adjudicatorRetryCount) {
            if (adjudicatorRetryCount < 1) {
                throw new IllegalArgumentException("adjudicatorRetryCount must be at least 1");
            }
            this.adjudicatorRetryCount = adjudicatorRetryCount;
            return this;
        }

        public Builder adjudicatorRetryBackoff(Duration adjudicatorRetryBackoff) {
            if (adjudicatorRetryBackoff == null || adjudicatorRetryBackoff.isNegative()) {
                throw new IllegalArgumentException("adjudicatorRetryBackoff must be non-negative");
            }
            this.adjudicatorRetryBackoff = adjudicatorRetryBackoff;
            return this;
        }

        public Builder adjudicatorTimeout(Duration adjudicatorTimeout) {
            this.adjudicatorTimeout = requirePositive(adjudicatorTimeout, "adjudicatorTimeout");
            return this;
        }

        public Builder adjudicatorMaxConcurrency(int adjudicatorMaxConcurrency) {
            this.adjudicatorMaxConcurrency = requirePositive(adjudicatorMaxConcurrency, "adjudicatorMaxConcurrency");
            return this;
        }

        public Builder mergeLeaseTimeout(Duration mergeLeaseTimeout) {
            this.mergeLeaseTimeout = requirePositive(mergeLeaseTimeout, "mergeLeaseTimeout");
            return this;
        }

        public Builder reviewReattachThreshold(double reviewReattachThreshold) {
            validateThreshold(reviewReattachThreshold, "reviewReattachThreshold");
            this.reviewReattachThreshold = reviewReattachThreshold;
            return this;
        }

        public Builder reviewReattachTimeout(Duration reviewReattachTimeout) {
            this.reviewReattachTimeout = requirePositive(reviewReattachTimeout, "reviewReattachTimeout");
            return this;
        }

        public Builder graphWriteRetryCount(int graphWriteRetryCount) {
            this.graphWriteRetryCount = requirePositive(graphWriteRetryCount, "graphWriteRetryCount");
            return this;
        }

        public Builder graphWriteBackoff(Duration graphWriteBackoff) {
            if (graphWriteBackoff == null || graphWriteBackoff.isNegative()) {
                throw new IllegalArgumentException("graphWriteBackoff must be non-negative");
            }
            this.graphWriteBackoff = graphWriteBackoff;
            return this;
        }

        public Builder maxBlockSize(int maxBlockSize) {
            this.maxBlockSize = requirePositive(maxBlockSize, "maxBlockSize");
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder intakeQueueCapacity(int intakeQueueCapacity) {
            this.intakeQueueCapacity = requirePositive(intakeQueueCapacity, "intakeQueueCapacity");
            return this;
        }

        public Builder ambiguousBufferCapacity(int ambiguousBufferCapacity) {
            this.ambiguousBufferCapacity = requirePositive(ambiguousBufferCapacity, "ambiguousBufferCapacity");
            return this;
        }

        public Builder scoringWorkers(int scoringWorkers) {
            this.scoringWorkers = requirePositive(scoringWorkers, "scoringWorkers");
            return this;
        }

        public ResolutionOptions build() {
            if (lowerThreshold <= 0.0 || upperThreshold >= 1.0) {
                throw new IllegalArgumentException("Thresholds must lie strictly between 0.0 and 1.0");
            }
            if (lowerThreshold >= upperThreshold) {
                throw new IllegalArgumentException("upperThreshold must be > lowerThreshold");
            }
            if (scorerWeights == null || adjudicationFloors == null) {
                throw new IllegalArgumentException("scorerWeights and adjudicationFloors are required");
            }
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static int requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1");
            }
            return value;
        }
    }

    private record PropertyReader(Properties properties) {

        Optional<String> string(String key) {
            String value = properties.getProperty(PROPERTY_PREFIX + key);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        Optional<Double> doubleValue(String key) {
            return string(key).map(v -> parse(key, v, Double::valueOf));
        }

        Optional<Integer> intValue(String key) {
            return string(key).map(v -> parse(key, v, Integer::valueOf));
        }

        Optional<Duration> duration(String key) {
            return string(key).map(v -> Duration.ofMillis(parse(key, v, Long::valueOf)));
        }

        private static <T> T parse(String key, String value, Function<String, T> parser) {
            try {
                return parser.apply(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + key + ": " + value, e);
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "upperThreshold=" + upperThreshold +
                ", lowerThreshold=" + lowerThreshold +
                ", tieEpsilon=" + tieEpsilon +
                ", topK=" + topK +
                ", scorerWeights=" + scorerWeights +
                ", adjudicationFloors=" + adjudicationFloors +
                ", adjudicatorRetryCount=" + adjudicatorRetryCount +
                ", mergeLeaseTimeout=" + mergeLeaseTimeout +
                ", reviewReattachThreshold=" + reviewReattachThreshold +
                ", sourceSystem='" + sourceSystem + '\'' +
                '}';
    }
}
