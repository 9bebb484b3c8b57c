package com.nexus.resolution.adjudication;

import java.util.Objects;

/**
 * Parsed adjudicator answer for one contender, or the marker for an unusable response.
 */
public record Verdict(Kind kind, String canonicalId, double confidence, String reason) {

    public enum Kind {
        MATCHED,
        UNMATCHED,
        MALFORMED
    }

    public Verdict {
        Objects.requireNonNull(kind, "kind is required");
        if (kind != Kind.MALFORMED) {
            Objects.requireNonNull(canonicalId, "canonicalId is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
            }
        }
    }

    public static Verdict matched(String canonicalId, double confidence, String reason) {
        return new Verdict(Kind.MATCHED, canonicalId, confidence, reason);
    }

    public static Verdict unmatched(String canonicalId, double confidence, String reason) {
        return new Verdict(Kind.UNMATCHED, canonicalId, confidence, reason);
    }

    public static Verdict malformed(String reason) {
        return new Verdict(Kind.MALFORMED, null, 0.0, reason);
    }

    public boolean isMalformed() {
        return kind == Kind.MALFORMED;
    }
}
