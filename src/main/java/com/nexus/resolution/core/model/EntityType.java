package com.nexus.resolution.core.model;

import java.util.Locale;

/**
 * Entity types produced by the extraction stage.
 * Extraction emits free-form type labels; {@link #fromLabel(String)} maps them
 * onto this taxonomy, falling back to {@link #OTHER}.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    LOCATION("Location"),
    PRODUCT("Product"),
    EVENT("Event"),
    CONCEPT("Concept"),
    WORK("Work"),
    OTHER("Other");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps an extraction label such as {@code "person"}, {@code "Organisation"} or
     * {@code "COMPANY"} to a type. Unknown labels map to {@link #OTHER}.
     *
     * @throws IllegalArgumentException if the label is null or blank
     */
    public static EntityType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Entity type label must not be blank");
        }
        String key = label.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        switch (key) {
            case "ORGANISATION":
            case "COMPANY":
            case "ORG":
            case "INSTITUTION":
                return ORGANIZATION;
            case "PLACE":
            case "GPE":
            case "CITY":
            case "COUNTRY":
                return LOCATION;
            case "PEOPLE":
            case "HUMAN":
            case "PER":
                return PERSON;
            default:
                for (EntityType type : values()) {
                    if (type.name().equals(key)) {
                        return type;
                    }
                }
                return OTHER;
        }
    }
}
