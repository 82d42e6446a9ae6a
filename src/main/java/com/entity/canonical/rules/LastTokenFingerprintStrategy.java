package com.entity.canonical.rules;

import com.entity.canonical.core.model.EntityType;

import java.util.Set;

/**
 * Uses the last token (surname, organization root) as key for fingerprinted types.
 * Short tokens such as "inc" or "jr" are ignored to limit false matches.
 */
public class LastTokenFingerprintStrategy implements FingerprintStrategy {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 4;

    private final int minTokenLength;

    public LastTokenFingerprintStrategy() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    public LastTokenFingerprintStrategy(int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be >= 1");
        }
        this.minTokenLength = minTokenLength;
    }

    @Override
    public Set<String> keys(EntityType type, String normalized) {
        if (type == null || !type.isKeyFingerprinted() || normalized == null || normalized.isEmpty()) {
            return Set.of();
        }
        String[] tokens = normalized.split(" ");
        String last = tokens[tokens.length - 1];
        if (last.length() >= minTokenLength) {
            return Set.of(last);
        }
        return Set.of();
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }
}
