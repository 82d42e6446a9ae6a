package com.entity.canonical.store;

/**
 * Persistent home of canonical entities, aliases, mentions and candidate links.
 * Instances are injected into the components that need them; there is no global store.
 */
public interface CanonicalStore extends AutoCloseable {

    /**
     * Opens a transaction with a serializable view of the store.
     *
     * @param label identifies the unit of work in logs and lock keys (usually a document id)
     */
    StoreTransaction begin(String label);

    /**
     * Returns a reader over committed data.
     */
    CanonicalStoreReader reader();

    /**
     * Clears the resolved flag of a document, outside of any transaction.
     */
    void markDocumentUnresolved(String documentId);

    @Override
    default void close() {
    }
}
