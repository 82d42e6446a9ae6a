package com.entity.canonical.metrics;

import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.decision.DecisionOutcome;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDocumentDuration(Duration duration, boolean success) {
    }

    @Override
    public void incrementCanonicalCreated(EntityType type) {
    }

    @Override
    public void incrementMentionMerged(EntityType type, DecisionOutcome outcome) {
    }

    @Override
    public void incrementAmbiguous(EntityType type) {
    }

    @Override
    public void incrementDocumentFailed() {
    }

    @Override
    public void incrementDocumentSkipped() {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void incrementConflictRetry(EntityType type) {
    }

    @Override
    public void incrementExtractionRetry() {
    }
}
