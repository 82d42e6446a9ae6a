package com.entity.canonical.api;

import com.entity.canonical.audit.AuditService;
import com.entity.canonical.cache.CacheConfig;
import com.entity.canonical.config.GraphSettings;
import com.entity.canonical.config.IngestionSettings;
import com.entity.canonical.core.model.RawMention;
import com.entity.canonical.decision.MentionResolver;
import com.entity.canonical.decision.ResolutionDecisionEngine;
import com.entity.canonical.document.DocumentSource;
import com.entity.canonical.extraction.MentionExtractor;
import com.entity.canonical.graph.FalkorDBConnection;
import com.entity.canonical.graph.GraphCanonicalStore;
import com.entity.canonical.lock.GraphDistributedLock;
import com.entity.canonical.lock.LocalDistributedLock;
import com.entity.canonical.matching.CandidateMatcher;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.metrics.NoOpMetricsService;
import com.entity.canonical.pipeline.DocumentIngestionRunner;
import com.entity.canonical.pipeline.IngestionResult;
import com.entity.canonical.pipeline.MentionIngestionPipeline;
import com.entity.canonical.pipeline.MentionValidator;
import com.entity.canonical.pipeline.RunRequest;
import com.entity.canonical.pipeline.RunSummary;
import com.entity.canonical.query.EntityQueryService;
import com.entity.canonical.review.CandidateLinkReviewService;
import com.entity.canonical.rules.DefaultNormalizationRules;
import com.entity.canonical.rules.FingerprintStrategy;
import com.entity.canonical.rules.LastTokenFingerprintStrategy;
import com.entity.canonical.rules.MentionNormalizer;
import com.entity.canonical.store.CanonicalStore;
import com.entity.canonical.store.InMemoryCanonicalStore;
import com.entity.canonical.tracing.NoOpTracingService;
import com.entity.canonical.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point wiring the canonicalization components around one store.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * try (CanonicalizationEngine engine = CanonicalizationEngine.builder()
 *         .falkorDB(GraphSettings.defaults())
 *         .build()) {
 *     engine.ingest("doc-1", mentions);
 *     engine.query().resolveQuery("Epstein", EntityType.PERSON);
 * }
 * }</pre>
 */
public class CanonicalizationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CanonicalizationEngine.class);

    private final CanonicalStore store;
    private final boolean ownsStore;
    private final IngestionSettings settings;
    private final MentionNormalizer normalizer;
    private final MentionIngestionPipeline pipeline;
    private final EntityQueryService queryService;
    private final CandidateLinkReviewService reviewService;
    private final AuditService auditService;
    private final DocumentIngestionRunner runner;

    private CanonicalizationEngine(Builder builder) {
        this.store = builder.store;
        this.ownsStore = builder.ownsStore;
        this.settings = builder.settings;
        this.auditService = builder.auditService != null ? builder.auditService
                : new AuditService(settings.getAuditMaxEntries());
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();

        FingerprintStrategy strategy = builder.fingerprintStrategy != null
                ? builder.fingerprintStrategy
                : new LastTokenFingerprintStrategy(settings.getFingerprintMinTokenLength());
        CacheConfig cacheConfig = new CacheConfig(settings.getNormalizationCacheSize(),
                settings.isNormalizationCacheEnabled());
        this.normalizer = new MentionNormalizer(DefaultNormalizationRules.getDefaultRules(), strategy,
                cacheConfig.createCache());

        CandidateMatcher matcher = new CandidateMatcher(normalizer, settings.getMaxCandidatesPerMechanism());
        MentionResolver resolver = new MentionResolver(normalizer, matcher, new ResolutionDecisionEngine(),
                metrics, settings.getConflictRetries());
        this.pipeline = new MentionIngestionPipeline(store, normalizer, resolver,
                new MentionValidator(settings.getMaxMentionLength()), auditService, metrics, tracing);
        this.queryService = new EntityQueryService(store.reader(), normalizer);
        this.reviewService = new CandidateLinkReviewService(store, auditService);
        this.runner = builder.documentSource != null && builder.extractor != null
                ? new DocumentIngestionRunner(builder.documentSource, builder.extractor, pipeline,
                        store.reader(), metrics, settings)
                : null;

        log.info("engine.initialized store={} runner={} cache={}", store.getClass().getSimpleName(),
                runner != null, cacheConfig.enabled());
    }

    /**
     * Ingests the extracted mentions of one document. Re-ingesting a document replaces its
     * previous mentions.
     */
    public IngestionResult ingest(String documentId, List<RawMention> mentions) {
        return pipeline.ingest(documentId, mentions);
    }

    /**
     * Runs the document loop over the configured document source and extractor.
     *
     * @throws IllegalStateException if the engine was built without them
     */
    public RunSummary run(RunRequest request) {
        if (runner == null) {
            throw new IllegalStateException("No document source and extractor configured");
        }
        return runner.run(request);
    }

    public EntityQueryService query() {
        return queryService;
    }

    public CandidateLinkReviewService review() {
        return reviewService;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MentionNormalizer getNormalizer() {
        return normalizer;
    }

    public IngestionSettings getSettings() {
        return settings;
    }

    public CanonicalStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownsStore) {
            store.close();
        }
    }

    /**
     * Engine over a fresh in-memory store with default settings.
     */
    public static CanonicalizationEngine inMemory() {
        return builder().inMemory().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CanonicalStore store;
        private boolean ownsStore;
        private IngestionSettings settings = IngestionSettings.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;
        private FingerprintStrategy fingerprintStrategy;
        private MentionExtractor extractor;
        private DocumentSource documentSource;
        private GraphSettings graphSettings;
        private boolean graphLock;

        /**
         * Uses a caller-managed store; it is not closed with the engine.
         */
        public Builder store(CanonicalStore store) {
            this.store = store;
            this.ownsStore = false;
            this.graphSettings = null;
            return this;
        }

        public Builder inMemory() {
            this.store = null;
            this.ownsStore = true;
            this.graphSettings = null;
            return this;
        }

        /**
         * Connects to FalkorDB; the connection is owned and closed by the engine.
         */
        public Builder falkorDB(GraphSettings graphSettings) {
            this.graphSettings = Objects.requireNonNull(graphSettings, "graphSettings is required");
            this.store = null;
            this.ownsStore = true;
            return this;
        }

        /**
         * Serializes graph transactions through a lock node in the graph, so several
         * processes can write to the same graph.
         */
        public Builder graphLock(boolean enabled) {
            this.graphLock = enabled;
            return this;
        }

        public Builder settings(IngestionSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder fingerprintStrategy(FingerprintStrategy fingerprintStrategy) {
            this.fingerprintStrategy = fingerprintStrategy;
            return this;
        }

        public Builder extractor(MentionExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder documentSource(DocumentSource documentSource) {
            this.documentSource = documentSource;
            return this;
        }

        public CanonicalizationEngine build() {
            Objects.requireNonNull(settings, "settings is required");
            if (graphSettings != null) {
                FalkorDBConnection connection = new FalkorDBConnection(graphSettings.host(), graphSettings.port(),
                        graphSettings.graphName());
                store = graphLock
                        ? new GraphCanonicalStore(connection, new GraphDistributedLock(connection, settings.getLockConfig()))
                        : new GraphCanonicalStore(connection, new LocalDistributedLock(settings.getLockConfig()));
            } else if (store == null) {
                store = new InMemoryCanonicalStore(settings.getLockConfig().timeoutMs());
                ownsStore = true;
            }
            return new CanonicalizationEngine(this);
        }
    }
}
