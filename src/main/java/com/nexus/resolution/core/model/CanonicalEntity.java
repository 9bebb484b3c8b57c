package com.nexus.resolution.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The single authoritative graph node for one real-world referent.
 *
 * <p>The id is stable and never reused. When a canonical is merged into another it keeps its
 * id, switches to {@link EntityStatus#MERGED} and records the surviving id in
 * {@link #getMergedInto()}, forming a redirect chain.</p>
 *
 * <p>Instances handed out by a store are snapshots; mutations only take effect once the
 * instance is written back with {@code CanonicalStore.save}.</p>
 */
public class CanonicalEntity {
    private final String id;
    private final EntityType type;
    private String primaryName;
    private String normalizedName;
    private final Map<String, Alias> aliases = new LinkedHashMap<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<AttributeProvenance> provenance = new ArrayList<>();
    private final List<AttributeConflict> conflicts = new ArrayList<>();
    private final Set<String> ingestionIds = new LinkedHashSet<>();
    private float[] embedding;
    private EntityStatus status;
    private String mergedInto;
    private final Instant createdAt;
    private Instant lastMergedAt;

    private CanonicalEntity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.primaryName = builder.primaryName;
        this.normalizedName = builder.normalizedName;
        for (Alias alias : builder.aliases) {
            this.aliases.putIfAbsent(alias.normalizedText(), alias);
        }
        this.attributes.putAll(builder.attributes);
        this.provenance.addAll(builder.provenance);
        this.conflicts.addAll(builder.conflicts);
        this.ingestionIds.addAll(builder.ingestionIds);
        this.embedding = builder.embedding != null ? builder.embedding.clone() : null;
        this.status = builder.status != null ? builder.status : EntityStatus.ACTIVE;
        this.mergedInto = builder.mergedInto;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.lastMergedAt = builder.lastMergedAt;
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getPrimaryName() {
        return primaryName;
    }

    public void setPrimaryName(String primaryName, String normalizedName) {
        this.primaryName = primaryName;
        this.normalizedName = normalizedName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public List<Alias> getAliases() {
        return List.copyOf(aliases.values());
    }

    public boolean hasAlias(String normalizedText) {
        return aliases.containsKey(normalizedText);
    }

    /**
     * Adds an alias unless one with the same normalized text is already owned.
     *
     * @return true if the alias was added
     */
    public boolean addAlias(Alias alias) {
        if (aliases.containsKey(alias.normalizedText())) {
            return false;
        }
        aliases.put(alias.normalizedText(), alias);
        return true;
    }

    public void removeAlias(String normalizedText) {
        aliases.remove(normalizedText);
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void putAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public void removeAttribute(String key) {
        attributes.remove(key);
    }

    public List<AttributeProvenance> getProvenance() {
        return List.copyOf(provenance);
    }

    public void addProvenance(AttributeProvenance entry) {
        provenance.add(entry);
    }

    public List<AttributeConflict> getConflicts() {
        return List.copyOf(conflicts);
    }

    public void addConflict(AttributeConflict conflict) {
        conflicts.add(conflict);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public Set<String> getIngestionIds() {
        return Collections.unmodifiableSet(ingestionIds);
    }

    public boolean hasIngestion(String ingestionId) {
        return ingestionIds.contains(ingestionId);
    }

    /**
     * @return true if the ingestion id was not already recorded
     */
    public boolean recordIngestion(String ingestionId) {
        return ingestionIds.add(ingestionId);
    }

    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public void setEmbedding(float[] embedding) {
        this.embedding = embedding != null ? embedding.clone() : null;
    }

    /**
     * Recomputes the representative embedding as the mean of the alias embeddings
     * sharing the most common dimension. Leaves the current embedding untouched
     * when no alias carries one.
     */
    public void recomputeEmbedding() {
        Map<Integer, List<float[]>> byDimension = new HashMap<>();
        for (Alias alias : aliases.values()) {
            if (alias.hasEmbedding()) {
                float[] vector = alias.embedding();
                byDimension.computeIfAbsent(vector.length, k -> new ArrayList<>()).add(vector);
            }
        }
        if (byDimension.isEmpty()) {
            return;
        }
        List<float[]> dominant = byDimension.values().stream()
                .max((a, b) -> Integer.compare(a.size(), b.size()))
                .orElseThrow();
        int dimension = dominant.get(0).length;
        float[] mean = new float[dimension];
        for (float[] vector : dominant) {
            for (int i = 0; i < dimension; i++) {
                mean[i] += vector[i];
            }
        }
        for (int i = 0; i < dimension; i++) {
            mean[i] /= dominant.size();
        }
        this.embedding = mean;
    }

    public EntityStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == EntityStatus.ACTIVE;
    }

    public boolean isMerged() {
        return status == EntityStatus.MERGED;
    }

    public String getMergedInto() {
        return mergedInto;
    }

    /**
     * Turns this entity into a redirect to the surviving canonical.
     */
    public void markMergedInto(String survivorId) {
        if (id.equals(survivorId)) {
            throw new IllegalArgumentException("An entity cannot be merged into itself: " + id);
        }
        this.status = EntityStatus.MERGED;
        this.mergedInto = survivorId;
        this.lastMergedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastMergedAt() {
        return lastMergedAt;
    }

    public void touchMerged() {
        this.lastMergedAt = Instant.now();
    }

    /**
     * Deep copy, used by stores to hand out snapshots.
     */
    public CanonicalEntity copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", primaryName='" + primaryName + '\'' +
                ", aliases=" + aliases.size() +
                ", status=" + status +
                (mergedInto != null ? ", mergedInto='" + mergedInto + '\'' : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CanonicalEntity entity) {
        return new Builder()
                .id(entity.id)
                .type(entity.type)
                .primaryName(entity.primaryName)
                .normalizedName(entity.normalizedName)
                .aliases(entity.aliases.values())
                .attributes(entity.attributes)
                .provenance(entity.provenance)
                .conflicts(entity.conflicts)
                .ingestionIds(entity.ingestionIds)
                .embedding(entity.embedding)
                .status(entity.status)
                .mergedInto(entity.mergedInto)
                .createdAt(entity.createdAt)
                .lastMergedAt(entity.lastMergedAt);
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String primaryName;
        private String normalizedName;
        private final List<Alias> aliases = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<AttributeProvenance> provenance = new ArrayList<>();
        private final List<AttributeConflict> conflicts = new ArrayList<>();
        private final Set<String> ingestionIds = new LinkedHashSet<>();
        private float[] embedding;
        private EntityStatus status;
        private String mergedInto;
        private Instant createdAt;
        private Instant lastMergedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder primaryName(String primaryName) {
            this.primaryName = primaryName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder alias(Alias alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder aliases(Collection<Alias> aliases) {
            this.aliases.addAll(aliases);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes.putAll(attributes);
            return this;
        }

        public Builder provenance(List<AttributeProvenance> provenance) {
            this.provenance.addAll(provenance);
            return this;
        }

        public Builder conflicts(List<AttributeConflict> conflicts) {
            this.conflicts.addAll(conflicts);
            return this;
        }

        public Builder ingestionId(String ingestionId) {
            this.ingestionIds.add(ingestionId);
            return this;
        }

        public Builder ingestionIds(Collection<String> ingestionIds) {
            this.ingestionIds.addAll(ingestionIds);
            return this;
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding;
            return this;
        }

        public Builder status(EntityStatus status) {
            this.status = status;
            return this;
        }

        public Builder mergedInto(String mergedInto) {
            this.mergedInto = mergedInto;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastMergedAt(Instant lastMergedAt) {
            this.lastMergedAt = lastMergedAt;
            return this;
        }

        public CanonicalEntity build() {
            Objects.requireNonNull(primaryName, "primaryName is required");
            Objects.requireNonNull(type, "type is required");
            if (normalizedName == null) {
                normalizedName = primaryName;
            }
            return new CanonicalEntity(this);
        }
    }
}
