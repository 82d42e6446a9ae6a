package com.entity.canonical.metrics;

import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.decision.DecisionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code canonical.document.duration}: Timer (tag: outcome)</li>
 *   <li>{@code canonical.entity.created}: Counter (tag: entityType)</li>
 *   <li>{@code canonical.mention.merged}: Counter (tags: entityType, decision)</li>
 *   <li>{@code canonical.mention.ambiguous}: Counter (tag: entityType)</li>
 *   <li>{@code canonical.document.failed}, {@code canonical.document.skipped}: Counters</li>
 *   <li>{@code canonical.candidates}: DistributionSummary of candidates per mention</li>
 *   <li>{@code canonical.conflict.retry}: Counter (tag: entityType)</li>
 *   <li>{@code canonical.extraction.retry}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer successTimer;
    private final Timer failureTimer;
    private final DistributionSummary candidateSummary;
    private final Counter documentFailedCounter;
    private final Counter documentSkippedCounter;
    private final Counter extractionRetryCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.successTimer = documentTimer("success");
        this.failureTimer = documentTimer("failure");
        this.candidateSummary = DistributionSummary.builder("canonical.candidates")
                .description("Candidate canonical entities found per mention")
                .register(registry);
        this.documentFailedCounter = Counter.builder("canonical.document.failed")
                .description("Documents whose resolution was rolled back")
                .register(registry);
        this.documentSkippedCounter = Counter.builder("canonical.document.skipped")
                .description("Documents skipped by the ingestion runner")
                .register(registry);
        this.extractionRetryCounter = Counter.builder("canonical.extraction.retry")
                .description("Retried extractor calls")
                .register(registry);
    }

    @Override
    public void recordDocumentDuration(Duration duration, boolean success) {
        (success ? successTimer : failureTimer).record(duration);
    }

    @Override
    public void incrementCanonicalCreated(EntityType type) {
        typedCounter("canonical.entity.created", "Canonical entities created", type, null).increment();
    }

    @Override
    public void incrementMentionMerged(EntityType type, DecisionOutcome outcome) {
        typedCounter("canonical.mention.merged", "Mentions merged into an existing entity", type, outcome)
                .increment();
    }

    @Override
    public void incrementAmbiguous(EntityType type) {
        typedCounter("canonical.mention.ambiguous", "Mentions routed to an ambiguity placeholder", type, null)
                .increment();
    }

    @Override
    public void incrementDocumentFailed() {
        documentFailedCounter.increment();
    }

    @Override
    public void incrementDocumentSkipped() {
        documentSkippedCounter.increment();
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void incrementConflictRetry(EntityType type) {
        typedCounter("canonical.conflict.retry", "Alias conflicts retried", type, null).increment();
    }

    @Override
    public void incrementExtractionRetry() {
        extractionRetryCounter.increment();
    }

    private Timer documentTimer(String outcome) {
        return Timer.builder("canonical.document.duration")
                .description("Duration of document resolution transactions")
                .tag("outcome", outcome)
                .register(registry);
    }

    private Counter typedCounter(String name, String description, EntityType type, DecisionOutcome outcome) {
        String key = name + ":" + type.name() + (outcome != null ? ":" + outcome.name() : "");
        return counterCache.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name)
                    .description(description)
                    .tag("entityType", type.name());
            if (outcome != null) {
                builder.tag("decision", outcome.name());
            }
            return builder.register(registry);
        });
    }
}
