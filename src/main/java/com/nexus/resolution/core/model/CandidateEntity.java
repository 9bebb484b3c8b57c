package com.nexus.resolution.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An unresolved entity mention produced by the extraction stage.
 * Lives only for the duration of one resolution attempt and is never stored as a graph node.
 *
 * <p>Attribute values are either a {@link String} or a {@link java.util.Collection} of strings.
 * The optional embedding is the vector supplied by the embedding service for the mention.</p>
 */
public record CandidateEntity(
        String name,
        EntityType type,
        Map<String, Object> attributes,
        String sourceExcerpt,
        String ingestionId,
        float[] embedding
) {
    public CandidateEntity {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        embedding = embedding != null ? embedding.clone() : null;
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
        if (!(o instanceof CandidateEntity)) return false;
        CandidateEntity that = (CandidateEntity) o;
        return Objects.equals(name, that.name)
                && type == that.type
                && Objects.equals(attributes, that.attributes)
                && Objects.equals(sourceExcerpt, that.sourceExcerpt)
                && Objects.equals(ingestionId, that.ingestionId)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, type, attributes, sourceExcerpt, ingestionId);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "CandidateEntity{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", ingestionId='" + ingestionId + '\'' +
                ", attributes=" + attributes.keySet() +
                ", embedding=" + (embedding != null ? embedding.length + "d" : "none") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private EntityType type;
        private Map<String, Object> attributes;
        private String sourceExcerpt;
        private String ingestionId;
        private float[] embedding;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder type(String typeLabel) {
            this.type = EntityType.fromLabel(typeLabel);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder attribute(String key, Object value) {
            if (this.attributes == null) {
                this.attributes = new LinkedHashMap<>();
            }
            this.attributes.put(key, value);
            return this;
        }

        public Builder sourceExcerpt(String sourceExcerpt) {
            this.sourceExcerpt = sourceExcerpt;
            return this;
        }

        public Builder ingestionId(String ingestionId) {
            this.ingestionId = ingestionId;
            return this;
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding;
            return this;
        }

        public CandidateEntity build() {
            return new CandidateEntity(name, type, attributes, sourceExcerpt, ingestionId, embedding);
        }
    }
}
