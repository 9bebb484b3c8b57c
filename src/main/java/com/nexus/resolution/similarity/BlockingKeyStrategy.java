package com.nexus.resolution.similarity;

import java.util.Set;

/**
 * Generates cheap blocking keys for a normalized name. Canonicals sharing at least one key
 * with a candidate (within the same entity type) form its blocking set.
 */
public interface BlockingKeyStrategy {

    /**
     * @return keys for the name, never null, possibly empty
     */
    Set<String> generateKeys(String normalizedName);
}
