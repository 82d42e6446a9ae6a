package com.entity.canonical.rules;

import com.entity.canonical.core.model.EntityType;

import java.util.Set;

/**
 * Produces secondary match keys for a normalized mention.
 * Two surface forms that share a key are candidate referents of the same entity.
 */
public interface FingerprintStrategy {

    /**
     * Returns the keys for a normalized, non-empty mention. The normalized text itself
     * is added by the caller and need not be returned here.
     *
     * @param type       entity type of the mention
     * @param normalized normalized mention text
     * @return keys in preference order, possibly empty
     */
    Set<String> keys(EntityType type, String normalized);
}
