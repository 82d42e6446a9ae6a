package com.entity.canonical.query;

import com.entity.canonical.core.model.CanonicalEntity;

/**
 * One canonical entity mentioned in a document, with the number of its mentions there.
 */
public record DocumentEntitySummary(CanonicalEntity entity, int mentionCount) {
}
