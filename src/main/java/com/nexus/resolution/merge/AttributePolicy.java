package com.nexus.resolution.merge;

import java.util.Set;

/**
 * How attributes are reconciled on merge.
 *
 * @param multiValued attributes whose values are unioned
 * @param required    single-valued attributes whose disagreements are flagged instead of overwritten
 */
public record AttributePolicy(Set<String> multiValued, Set<String> required) {

    public AttributePolicy {
        multiValued = multiValued != null ? Set.copyOf(multiValued) : Set.of();
        required = required != null ? Set.copyOf(required) : Set.of();
        for (String key : required) {
            if (multiValued.contains(key)) {
                throw new IllegalArgumentException("Attribute cannot be both multi-valued and required: " + key);
            }
        }
    }

    /**
     * Common list-like attributes are unioned; everything else is single-valued, most recent wins.
     */
    public static AttributePolicy defaults() {
        return new AttributePolicy(Set.of("roles", "emails", "urls", "tags"), Set.of());
    }

    public boolean isMultiValued(String attribute) {
        return multiValued.contains(attribute);
    }

    public boolean isRequired(String attribute) {
        return required.contains(attribute);
    }
}
