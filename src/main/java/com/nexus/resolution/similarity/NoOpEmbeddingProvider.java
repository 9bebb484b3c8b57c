package com.nexus.resolution.similarity;

/**
 * Used when no embedding service is configured; the embedding signal is then always missing
 * unless candidates carry their own vectors.
 */
public class NoOpEmbeddingProvider implements EmbeddingProvider {

    @Override
    public float[] embed(String text) {
        throw new EmbeddingUnavailableException("No embedding provider configured");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
