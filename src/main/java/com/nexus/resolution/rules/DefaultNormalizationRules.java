package com.nexus.resolution.rules;

import com.nexus.resolution.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for common person and organization name patterns.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> all = new ArrayList<>();
        all.addAll(getOrganizationRules());
        all.addAll(getPersonRules());
        all.addAll(getCommonRules());
        return new NormalizationEngine(all);
    }

    public static List<NormalizationRule> getOrganizationRules() {
        return List.of(
                suffix("org-inc", "(Inc\\.?|Incorporated)"),
                suffix("org-ltd", "(Ltd\\.?|Limited)"),
                suffix("org-corp", "(Corp\\.?|Corporation)"),
                suffix("org-co", "(Co\\.?|Company)"),
                suffix("org-llc", "(LLC|L\\.L\\.C\\.)"),
                suffix("org-plc", "(PLC|P\\.L\\.C\\.)"),
                suffix("org-gmbh", "GmbH"),
                suffix("org-ag", "AG"),
                suffix("org-sa", "S\\.?A\\.?"),
                suffix("org-nv", "N\\.?V\\.?"),
                suffix("org-bv", "B\\.?V\\.?"),
                NormalizationRule.builder()
                        .name("org-the")
                        .pattern("^The\\s+")
                        .applicableTypes(EntityType.ORGANIZATION)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^(Mr|Mrs|Ms|Mme|Mlle|Dr|Prof|Sir)\\.?\\s+")
                        .applicableTypes(EntityType.PERSON)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("person-generational")
                        .pattern(",?\\s+(Jr\\.?|Junior|Sr\\.?|Senior|II|III)$")
                        .applicableTypes(EntityType.PERSON)
                        .priority(10)
                        .build()
        );
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-and")
                        .pattern("\\s*(&|\\band\\b)\\s*")
                        .replacement(" ")
                        .priority(50)
                        .build(),
                // hyphens, apostrophes, periods and other punctuation become word breaks
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build()
        );
    }

    private static NormalizationRule suffix(String name, String suffixPattern) {
        return NormalizationRule.builder()
                .name(name)
                .pattern("(,\\s*|\\s+)" + suffixPattern + "$")
                .applicableTypes(EntityType.ORGANIZATION)
                .priority(10)
                .build();
    }
}
