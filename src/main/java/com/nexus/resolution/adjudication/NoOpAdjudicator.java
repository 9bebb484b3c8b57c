package com.nexus.resolution.adjudication;

/**
 * Stand-in when no adjudicator is configured. Every ambiguous candidate goes to review.
 */
public class NoOpAdjudicator implements Adjudicator {

    @Override
    public String adjudicate(AdjudicationRequest request) {
        throw new AdjudicationException("No adjudicator configured");
    }

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
