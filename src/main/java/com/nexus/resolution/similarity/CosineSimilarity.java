package com.nexus.resolution.similarity;

/**
 * Cosine similarity between embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
        // Utility class
    }

    /**
     * Raw cosine in [-1, 1]. Zero-norm vectors yield 0.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double compute(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Cosine clamped to [0, 1]; opposed vectors count as unrelated.
     */
    public static double similarity(float[] a, float[] b) {
        return Math.max(0.0, Math.min(1.0, compute(a, b)));
    }
}
