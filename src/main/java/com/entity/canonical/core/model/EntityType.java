package com.entity.canonical.core.model;

/**
 * Kinds of named entities extracted from documents.
 * Matching is always scoped by type: a PERSON and a LOCATION never share a canonical entity.
 */
public enum EntityType {
    PERSON("Person", true),
    LOCATION("Location", false),
    ORGANIZATION("Organization", true);

    private final String label;
    private final boolean keyFingerprinted;

    EntityType(String label, boolean keyFingerprinted) {
        this.label = label;
        this.keyFingerprinted = keyFingerprinted;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether mentions of this type carry a secondary key fingerprint (surname, org root).
     */
    public boolean isKeyFingerprinted() {
        return keyFingerprinted;
    }

    /**
     * Parses an extractor type label, returning null for anything unknown.
     */
    public static EntityType fromLabel(String value) {
        if (value == null) {
            return null;
        }
        for (EntityType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
