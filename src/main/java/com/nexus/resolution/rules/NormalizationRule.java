package com.nexus.resolution.rules;

import com.nexus.resolution.core.model.EntityType;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied to entity names before blocking and comparison.
 * Lower priorities run first. A rule with no entity types applies to every type.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<EntityType> scope;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.scope = builder.scope.isEmpty() ? Set.of() : Set.copyOf(builder.scope);
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isUnscoped() {
        return scope.isEmpty();
    }

    public boolean appliesTo(EntityType type) {
        return scope.isEmpty() || scope.contains(type);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private final Set<EntityType> scope = EnumSet.noneOf(EntityType.class);
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableTypes(EntityType... types) {
            scope.addAll(Set.of(types));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
