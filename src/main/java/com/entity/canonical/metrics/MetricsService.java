package com.entity.canonical.metrics;

import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.decision.DecisionOutcome;

import java.time.Duration;

/**
 * Records canonicalization metrics. {@link NoOpMetricsService} is the default so the
 * engine runs without a metrics backend.
 */
public interface MetricsService {

    void recordDocumentDuration(Duration duration, boolean success);

    void incrementCanonicalCreated(EntityType type);

    void incrementMentionMerged(EntityType type, DecisionOutcome outcome);

    void incrementAmbiguous(EntityType type);

    void incrementDocumentFailed();

    void incrementDocumentSkipped();

    void recordCandidateCount(int count);

    void incrementConflictRetry(EntityType type);

    void incrementExtractionRetry();
}
