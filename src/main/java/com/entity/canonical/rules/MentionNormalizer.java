package com.entity.canonical.rules;

import com.entity.canonical.cache.NoOpNormalizationCache;
import com.entity.canonical.cache.NormalizationCache;
import com.entity.canonical.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes mention text and derives its fingerprints.
 * Text is lowercased, the rules are applied in priority order, then whitespace is
 * collapsed and trimmed. Normalization is pure, so results may be memoized.
 */
public class MentionNormalizer {
    private static final Logger log = LoggerFactory.getLogger(MentionNormalizer.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<NormalizationRule> rules;
    private final FingerprintStrategy fingerprintStrategy;
    private final NormalizationCache cache;

    public MentionNormalizer() {
        this(DefaultNormalizationRules.getDefaultRules(), new LastTokenFingerprintStrategy(),
                new NoOpNormalizationCache());
    }

    public MentionNormalizer(List<NormalizationRule> rules, FingerprintStrategy fingerprintStrategy,
                             NormalizationCache cache) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = Collections.unmodifiableList(sorted);
        this.fingerprintStrategy = fingerprintStrategy;
        this.cache = cache;
    }

    /**
     * Normalizes mention text. Null or blank input yields the empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return cache.get(text, this::computeNormalized);
    }

    /**
     * Returns the normalized text followed by the strategy's keys, or an empty set when the
     * text normalizes to nothing.
     */
    public Set<String> fingerprints(EntityType type, String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        result.add(normalized);
        result.addAll(fingerprintStrategy.keys(type, normalized));
        return Collections.unmodifiableSet(result);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    public FingerprintStrategy getFingerprintStrategy() {
        return fingerprintStrategy;
    }

    private String computeNormalized(String text) {
        String result = text.toLowerCase(Locale.ROOT);
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("normalize.rule rule={} before='{}' after='{}'", rule.getName(), before, result);
            }
        }
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }
}
