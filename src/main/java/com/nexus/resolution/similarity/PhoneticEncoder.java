package com.nexus.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * American Soundex applied per token of a normalized name.
 *
 * <p>The phonetic signal is coarse: the share of token codes two names have in common,
 * so "marie eve girard" and "mary eve girard" score 1.0.</p>
 */
public class PhoneticEncoder {

    //                                       ABCDEFGHIJKLMNOPQRSTUVWXYZ
    private static final char[] CODES = "01230120022455012623010202".toCharArray();

    /**
     * Soundex code of a single word, or an empty string when it has no ASCII letter.
     */
    public String encode(String word) {
        if (word == null) {
            return "";
        }
        String letters = word.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        if (letters.isEmpty()) {
            return "";
        }

        StringBuilder code = new StringBuilder(4);
        code.append(letters.charAt(0));
        char last = CODES[letters.charAt(0) - 'A'];
        for (int i = 1; i < letters.length() && code.length() < 4; i++) {
            char ch = letters.charAt(i);
            char digit = CODES[ch - 'A'];
            if (digit != '0' && digit != last) {
                code.append(digit);
            }
            // H and W do not separate letters with the same code
            if (ch != 'H' && ch != 'W') {
                last = digit;
            }
        }
        while (code.length() < 4) {
            code.append('0');
        }
        return code.toString();
    }

    public Set<String> encodeTokens(String normalizedName) {
        Set<String> codes = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return codes;
        }
        for (String token : normalizedName.trim().split("\\s+")) {
            String code = encode(token);
            if (!code.isEmpty()) {
                codes.add(code);
            }
        }
        return codes;
    }

    /**
     * Shared token codes over the larger code set; 0.0 when either side has none.
     */
    public double similarity(String normalizedA, String normalizedB) {
        Set<String> a = encodeTokens(normalizedA);
        Set<String> b = encodeTokens(normalizedB);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / Math.max(a.size(), b.size());
    }
}
