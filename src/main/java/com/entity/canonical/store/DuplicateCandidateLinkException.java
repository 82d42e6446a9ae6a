package com.entity.canonical.store;

/**
 * Thrown when a mention already has a candidate link to the same canonical entity.
 */
public class DuplicateCandidateLinkException extends CanonicalStoreException {

    public DuplicateCandidateLinkException(String mentionId, String candidateCanonicalEntityId) {
        super("Candidate link already exists for mention " + mentionId
                + " and canonical entity " + candidateCanonicalEntityId);
    }
}
