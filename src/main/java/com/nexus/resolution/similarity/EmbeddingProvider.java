package com.nexus.resolution.similarity;

/**
 * Client of the external embedding service.
 */
public interface EmbeddingProvider {

    /**
     * @throws EmbeddingUnavailableException when the service cannot produce a vector
     */
    float[] embed(String text);

    default boolean isAvailable() {
        return true;
    }
}
