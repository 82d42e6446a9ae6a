package com.entity.canonical.rules;

import java.util.List;

/**
 * Built-in rules used to canonicalize mention text.
 * Input is already lowercased when these run.
 */
public final class DefaultNormalizationRules {

    public static final List<String> HONORIFICS = List.of(
            "mr", "mrs", "ms", "dr", "prof", "sir", "madam", "miss",
            "mister", "professor", "judge", "hon", "honorable");

    private DefaultNormalizationRules() {
    }

    /**
     * Returns the default rule set: honorific stripping, then punctuation removal.
     */
    public static List<NormalizationRule> getDefaultRules() {
        return List.of(honorificRule(), nonAlphanumericRule());
    }

    /**
     * Removes a whole-word honorific, with optional trailing period, when followed by whitespace.
     */
    public static NormalizationRule honorificRule() {
        return NormalizationRule.builder()
                .name("strip-honorifics")
                .pattern("\\b(" + String.join("|", HONORIFICS) + ")\\.?\\s+")
                .replacement(" ")
                .priority(10)
                .build();
    }

    public static NormalizationRule nonAlphanumericRule() {
        return NormalizationRule.builder()
                .name("non-alphanumeric")
                .pattern("[^a-z0-9\\s]")
                .replacement(" ")
                .priority(20)
                .build();
    }
}
