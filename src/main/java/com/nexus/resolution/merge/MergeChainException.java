package com.nexus.resolution.merge;

/**
 * The redirect chain of merged-away canonicals is broken: it loops, points at a missing
 * canonical, or a merge would close a loop.
 */
public class MergeChainException extends RuntimeException {

    private final String canonicalId;

    public MergeChainException(String canonicalId, String message) {
        super(message);
        this.canonicalId = canonicalId;
    }

    public String getCanonicalId() {
        return canonicalId;
    }
}
