package com.nexus.resolution.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Alternative surface form of a canonical entity.
 * Owned by exactly one canonical at a time; alias sets are unioned on merge,
 * keyed by {@link #normalizedText()}.
 *
 * @param text           the surface form as observed
 * @param normalizedText the normalized form used for comparison and deduplication
 * @param source         where the alias came from (ingestion id, reviewer, merge)
 * @param embedding      vector for the alias, or null when the embedding service had none
 * @param addedAt        when the alias was attached to its current owner
 */
public record Alias(
        String text,
        String normalizedText,
        String source,
        float[] embedding,
        Instant addedAt
) {
    public Alias {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(normalizedText, "normalizedText is required");
        embedding = embedding != null ? embedding.clone() : null;
        addedAt = addedAt != null ? addedAt : Instant.now();
    }

    public static Alias of(String text, String normalizedText, String source, float[] embedding) {
        return new Alias(text, normalizedText, source, embedding, Instant.now());
    }

    @Override
    public float[] embedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alias)) return false;
        Alias alias = (Alias) o;
        return text.equals(alias.text)
                && normalizedText.equals(alias.normalizedText)
                && Objects.equals(source, alias.source)
                && Arrays.equals(embedding, alias.embedding)
                && addedAt.equals(alias.addedAt);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(text, normalizedText, source, addedAt) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Alias{text='" + text + "', source='" + source + "'}";
    }
}
