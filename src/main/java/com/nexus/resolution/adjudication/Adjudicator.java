package com.nexus.resolution.adjudication;

/**
 * External judge for ambiguous candidates. Implementations return the raw response body;
 * parsing and policy belong to {@link AdjudicatorGateway}.
 */
public interface Adjudicator {

    /**
     * @return raw response text, expected to be {@code {"verdicts":[...]}} JSON
     * @throws AdjudicationException on transport or server errors
     */
    String adjudicate(AdjudicationRequest request);

    String getName();

    default boolean isAvailable() {
        return true;
    }
}
