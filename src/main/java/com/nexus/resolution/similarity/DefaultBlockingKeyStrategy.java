package com.nexus.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Prefix and phonetic buckets:
 * <ul>
 *   <li>{@code pfx:} first three characters of the name</li>
 *   <li>{@code ph:} Soundex of the first token</li>
 *   <li>{@code tok:} the longest token, which catches reordered names</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private final PhoneticEncoder phoneticEncoder;

    public DefaultBlockingKeyStrategy() {
        this(new PhoneticEncoder());
    }

    public DefaultBlockingKeyStrategy(PhoneticEncoder phoneticEncoder) {
        this.phoneticEncoder = phoneticEncoder;
    }

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        String cleaned = normalizedName.trim();
        keys.add("pfx:" + cleaned.substring(0, Math.min(3, cleaned.length())));

        String[] tokens = cleaned.split("\\s+");
        String phonetic = phoneticEncoder.encode(tokens[0]);
        if (!phonetic.isEmpty()) {
            keys.add("ph:" + phonetic);
        }

        String longest = tokens[0];
        for (String token : tokens) {
            if (token.length() > longest.length()) {
                longest = token;
            }
        }
        if (longest.length() >= 3) {
            keys.add("tok:" + longest);
        }
        return keys;
    }
}
