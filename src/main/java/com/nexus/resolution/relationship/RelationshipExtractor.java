package com.nexus.resolution.relationship;

import com.nexus.resolution.core.model.CanonicalEntity;

import java.util.List;

/**
 * Proposes typed edges between resolved entities mentioned in the same source context.
 */
public interface RelationshipExtractor {

    /**
     * @param entities     the resolved canonicals, at least two
     * @param sourceContext the text the entities were extracted from
     * @return proposed edges whose endpoints are ids of {@code entities}
     */
    List<RelationshipCandidate> extract(List<CanonicalEntity> entities, String sourceContext);

    String getName();
}
