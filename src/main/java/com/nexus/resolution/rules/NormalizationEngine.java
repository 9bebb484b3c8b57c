package com.nexus.resolution.rules;

import com.nexus.resolution.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Applies normalization rules to entity names.
 *
 * <p>Diacritics are folded first, then rules run in priority order (lower number first),
 * filtered by entity type. The result is lowercased, trimmed and whitespace-collapsed.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules = new CopyOnWriteArrayList<>();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public void addRule(NormalizationRule rule) {
        addRules(List.of(rule));
    }

    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> merged = new ArrayList<>(rules);
        merged.addAll(newRules);
        merged.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        rules.clear();
        rules.addAll(merged);
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String name) {
        return normalize(name, null);
    }

    /**
     * Normalizes a name for the given type; a null type applies only unscoped rules.
     */
    public String normalize(String name, EntityType entityType) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = foldDiacritics(name);
        for (NormalizationRule rule : rules) {
            boolean applies = entityType == null ? rule.isUnscoped() : rule.appliesTo(entityType);
            if (applies) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    public boolean areEquivalent(String name1, String name2, EntityType entityType) {
        return normalize(name1, entityType).equals(normalize(name2, entityType));
    }

    static String foldDiacritics(String input) {
        String decomposed = Normalizer.normalize(input, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
