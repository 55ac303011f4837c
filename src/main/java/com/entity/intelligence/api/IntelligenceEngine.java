package com.entity.intelligence.api;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.analyzer.CollaborativeAnalyzer;
import com.entity.intelligence.analyzer.ConnectionAnalyzer;
import com.entity.intelligence.analyzer.ContentAnalyzer;
import com.entity.intelligence.analyzer.ContextualAnalyzer;
import com.entity.intelligence.analyzer.CulturalAnalyzer;
import com.entity.intelligence.analyzer.SemanticAnalyzer;
import com.entity.intelligence.analyzer.TemporalAnalyzer;
import com.entity.intelligence.cache.CacheStats;
import com.entity.intelligence.cache.ProfileCache;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.enrich.EnrichmentPipeline;
import com.entity.intelligence.enrich.CollectionEnricher;
import com.entity.intelligence.enrich.CompanyEnricher;
import com.entity.intelligence.enrich.EntityEnricher;
import com.entity.intelligence.enrich.GenreEnricher;
import com.entity.intelligence.enrich.KeywordEnricher;
import com.entity.intelligence.enrich.PersonEnricher;
import com.entity.intelligence.graph.GraphBuilder;
import com.entity.intelligence.graph.GraphStatistics;
import com.entity.intelligence.graph.RelationshipGraph;
import com.entity.intelligence.logging.LogContext;
import com.entity.intelligence.metrics.MetricsService;
import com.entity.intelligence.metrics.NoOpMetricsService;
import com.entity.intelligence.recommend.RecommendationCompiler;
import com.entity.intelligence.recommend.RecommendationSet;
import com.entity.intelligence.rules.RuleTables;
import com.entity.intelligence.search.SearchIndex;
import com.entity.intelligence.search.SearchIndexCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.function.Supplier;

/**
 * Main entry point: compiles a frozen entity corpus into a relationship graph, a search
 * index and recommendation sets.
 *
 * <pre>
 * IntelligenceEngine engine = IntelligenceEngine.builder()
 *         .options(EngineOptions.builder().referenceYear(2024).build())
 *         .build();
 * CompilationResult result = engine.compile(corpus);
 * </pre>
 *
 * <p>A build runs synchronously: enrichment, graph building, statistics, indexing and
 * recommendations, in that order. Graph building and indexing share one profile cache,
 * which is invalidated when the build ends, so nothing computed by one build is kept for the next.
 * Errors other than per-entity analyzer or enricher failures propagate to the caller.</p>
 */
public class IntelligenceEngine {
    private static final Logger log = LoggerFactory.getLogger(IntelligenceEngine.class);

    private final EngineOptions options;
    private final MetricsService metricsService;
    private final EnrichmentPipeline enrichmentPipeline;
    private final GraphBuilder graphBuilder;
    private final SearchIndexCompiler searchIndexCompiler;
    private final RecommendationCompiler recommendationCompiler;

    private IntelligenceEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();

        List<EntityEnricher> enrichers = new ArrayList<>();
        if (options.isPersonEnrichment()) {
            enrichers.add(new PersonEnricher(options.getMinPersonPopularity()));
        }
        if (options.isCatalogEnrichment()) {
            int year = options.getReferenceYear();
            enrichers.add(new CompanyEnricher(year));
            enrichers.add(new CollectionEnricher(year));
            enrichers.add(new GenreEnricher());
            enrichers.add(new KeywordEnricher(year));
        }
        enrichers.addAll(builder.enrichers);
        this.enrichmentPipeline = new EnrichmentPipeline(enrichers);

        this.graphBuilder = GraphBuilder.builder()
                .analyzers(analyzersFor(options))
                .analyzers(builder.analyzers)
                .cacheConfig(options.getCacheConfig())
                .maxConnectionsPerCategory(options.getMaxConnectionsPerCategory())
                .maxClusterConnectionsPerEntity(options.getMaxClusterConnectionsPerEntity())
                .metricsService(metricsService)
                .build();
        this.searchIndexCompiler = new SearchIndexCompiler();
        this.recommendationCompiler = new RecommendationCompiler(
                options.getQuickRecommendations(), options.getDeepRecommendations(),
                options.getDiversityThreshold());

        log.info("engine.initialized rules={} analyzers={} enrichers={}",
                RuleTables.VERSION, graphBuilder.getAnalyzers().size(), enrichers.size());
    }

    static List<ConnectionAnalyzer> analyzersFor(EngineOptions options) {
        List<ConnectionAnalyzer> analyzers = new ArrayList<>();
        if (options.isContentAnalysis()) {
            analyzers.add(new ContentAnalyzer());
        }
        if (options.isSemanticAnalysis()) {
            analyzers.add(new SemanticAnalyzer());
        }
        if (options.isCulturalAnalysis()) {
            analyzers.add(new CulturalAnalyzer(options.getCulturalWeights()));
        }
        if (options.isTemporalAnalysis()) {
            analyzers.add(new TemporalAnalyzer());
        }
        if (options.isContextualAnalysis()) {
            analyzers.add(new ContextualAnalyzer());
        }
        if (options.isCollaborativeAnalysis()) {
            analyzers.add(new CollaborativeAnalyzer());
        }
        return analyzers;
    }

    public CompilationResult compile(EntityCorpus corpus) {
        return compile(corpus, BuildProgressCallback.NOOP);
    }

    /**
     * Runs a full build over the corpus.
     *
     * @param corpus   frozen input corpus
     * @param callback progress listener; may be null
     */
    public CompilationResult compile(EntityCorpus corpus, BuildProgressCallback callback) {
        Objects.requireNonNull(corpus, "corpus is required");
        BuildProgressCallback cb = callback != null ? callback : BuildProgressCallback.NOOP;
        String buildId = LogContext.generateBuildId();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forBuild(buildId)) {
            log.info("engine.build.started entities={} referenceYear={}", corpus.size(), options.getReferenceYear());

            EnrichmentPipeline.Outcome enriched = timed("enrich", () -> enrichmentPipeline.run(corpus));
            metricsService.recordCorpusSize(enriched.corpus().size());
            metricsService.incrementEntitiesExcluded(enriched.excludedIds().size());
            cb.onProgress("enrich", enriched.corpus().size(), corpus.size());

            ProfileCache cache = options.getCacheConfig().createCache();
            CacheStats before = cache.getStats();
            RelationshipGraph graph;
            GraphStatistics statistics;
            SearchIndex index;
            try {
                AnalysisContext context = AnalysisContext.of(cache, options.getReferenceYear());
                graph = graphBuilder.build(enriched.corpus(), context, cb);

                statistics = GraphStatistics.of(graph);
                log.info("graph.statistics connections={} strong={} medium={} weak={} isolated={} clusters={}",
                        statistics.connections(), statistics.strong(), statistics.medium(), statistics.weak(),
                        statistics.isolated(), statistics.clusters());
                if (!statistics.isValid()) {
                    log.warn("graph.validation.failed invalidConnections={}", statistics.invalidConnections());
                }

                index = timed("index", () -> searchIndexCompiler.compile(enriched.corpus(), graph, context));
                cb.onProgress("index", enriched.corpus().size(), enriched.corpus().size());
            } finally {
                CacheStats used = cache.getStats().minus(before);
                metricsService.recordCacheHits(used.hitCount());
                metricsService.recordCacheMisses(used.missCount());
                cache.invalidateAll();
                log.debug("engine.cache hits={} misses={}", used.hitCount(), used.missCount());
            }

            SortedMap<String, RecommendationSet> recommendations =
                    timed("recommend", () -> recommendationCompiler.compile(graph));
            cb.onProgress("recommend", recommendations.size(), enriched.corpus().size());

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordBuildDuration(duration);
            CompilationResult result = new CompilationResult(buildId, enriched.corpus(), enriched.excludedIds(),
                    graph, statistics, index, recommendations, duration);
            log.info("engine.build.completed result={}", result);
            return result;
        }
    }

    private <T> T timed(String phase, Supplier<T> step) {
        long start = System.nanoTime();
        T result = step.get();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordPhaseDuration(phase, elapsed);
        log.debug("engine.phase.completed phase={} durationMs={}", phase, elapsed.toMillis());
        return result;
    }

    public EngineOptions getOptions() {
        return options;
    }

    public GraphBuilder getGraphBuilder() {
        return graphBuilder;
    }

    public EnrichmentPipeline getEnrichmentPipeline() {
        return enrichmentPipeline;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EngineOptions options = EngineOptions.defaults();
        private MetricsService metricsService;
        private final List<ConnectionAnalyzer> analyzers = new ArrayList<>();
        private final List<EntityEnricher> enrichers = new ArrayList<>();

        public Builder options(EngineOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Registers an analyzer in addition to the built-in ones enabled by the options.
         */
        public Builder analyzer(ConnectionAnalyzer analyzer) {
            this.analyzers.add(Objects.requireNonNull(analyzer, "analyzer is required"));
            return this;
        }

        /**
         * Registers an enricher that runs after the built-in enrichers.
         */
        public Builder enricher(EntityEnricher enricher) {
            this.enrichers.add(Objects.requireNonNull(enricher, "enricher is required"));
            return this;
        }

        public IntelligenceEngine build() {
            return new IntelligenceEngine(this);
        }
    }
}
