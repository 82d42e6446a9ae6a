package com.entity.canonical.store;

/**
 * Thrown when a canonical entity already owns an alias with the same normalized text,
 * typically because a concurrent writer registered it first.
 */
public class DuplicateAliasException extends CanonicalStoreException {

    private final String canonicalEntityId;
    private final String aliasNormalized;

    public DuplicateAliasException(String canonicalEntityId, String aliasNormalized) {
        super("Alias '" + aliasNormalized + "' already registered for canonical entity " + canonicalEntityId);
        this.canonicalEntityId = canonicalEntityId;
        this.aliasNormalized = aliasNormalized;
    }

    public String getCanonicalEntityId() {
        return canonicalEntityId;
    }

    public String getAliasNormalized() {
        return aliasNormalized;
    }
}
