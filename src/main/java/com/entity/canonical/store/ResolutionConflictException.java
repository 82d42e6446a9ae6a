package com.entity.canonical.store;

/**
 * Thrown when a mention keeps colliding with concurrent alias registrations after the
 * allowed number of retries.
 */
public class ResolutionConflictException extends CanonicalStoreException {

    public ResolutionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
