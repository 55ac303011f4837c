package com.entity.intelligence.graph;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.analyzer.ConnectionAnalyzer;
import com.entity.intelligence.api.BuildProgressCallback;
import com.entity.intelligence.cache.CacheConfig;
import com.entity.intelligence.cache.CacheStats;
import com.entity.intelligence.cache.ProfileCache;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.logging.LogContext;
import com.entity.intelligence.metrics.MetricsService;
import com.entity.intelligence.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static com.entity.intelligence.rules.ScoringConstants.MAX_CONNECTIONS_PER_CATEGORY;

/**
 * Runs every analyzer over a frozen corpus and post-processes the result into the final
 * relationship graph.
 *
 * <p>Phases, in order:</p>
 * <ol>
 *   <li>analyze: each analyzer against each entity; a failing analyzer contributes nothing
 *       for that entity and the build continues</li>
 *   <li>bidirectional: discounted reverse edges, then per-category caps</li>
 *   <li>peer: two-hop inference over direct edges, capped again</li>
 *   <li>cluster: semantic clusters and member links</li>
 *   <li>score: confidence calibration and final ordering</li>
 * </ol>
 *
 * <p>Profiles live in one cache per build, created from the configured {@link CacheConfig}
 * unless the caller supplies its own context.</p>
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final List<ConnectionAnalyzer> analyzers;
    private final CacheConfig cacheConfig;
    private final int maxConnectionsPerCategory;
    private final int maxClusterConnectionsPerEntity;
    private final MetricsService metricsService;
    private final BidirectionalEnhancer bidirectionalEnhancer = new BidirectionalEnhancer();
    private final PeerInference peerInference = new PeerInference();
    private final SemanticClusterer semanticClusterer = new SemanticClusterer();
    private final ConfidenceScorer confidenceScorer = new ConfidenceScorer();

    private GraphBuilder(Builder builder) {
        this.analyzers = List.copyOf(builder.analyzers);
        this.cacheConfig = builder.cacheConfig;
        this.maxConnectionsPerCategory = builder.maxConnectionsPerCategory;
        this.maxClusterConnectionsPerEntity = builder.maxClusterConnectionsPerEntity;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    public RelationshipGraph build(EntityCorpus corpus, int referenceYear) {
        return build(corpus, referenceYear, BuildProgressCallback.NOOP);
    }

    /**
     * Builds with a profile cache of its own, invalidated before returning.
     */
    public RelationshipGraph build(EntityCorpus corpus, int referenceYear, BuildProgressCallback callback) {
        ProfileCache cache = cacheConfig.createCache();
        CacheStats before = cache.getStats();
        try {
            return build(corpus, AnalysisContext.of(cache, referenceYear), callback);
        } finally {
            CacheStats used = cache.getStats().minus(before);
            metricsService.recordCacheHits(used.hitCount());
            metricsService.recordCacheMisses(used.missCount());
            cache.invalidateAll();
            log.debug("graph.cache hits={} misses={}", used.hitCount(), used.missCount());
        }
    }

    /**
     * Builds with a caller-owned context. Profiles stay in its cache after the build,
     * so later phases of the same build can read them; the caller invalidates it.
     */
    public RelationshipGraph build(EntityCorpus corpus, AnalysisContext context, BuildProgressCallback callback) {
        Objects.requireNonNull(corpus, "corpus is required");
        Objects.requireNonNull(context, "context is required");
        BuildProgressCallback cb = callback != null ? callback : BuildProgressCallback.NOOP;

        RelationshipGraph graph = timed("analyze", () -> analyze(corpus, context, cb));
        graph = phase("bidirectional", graph, g -> bidirectionalEnhancer.enhance(g)
                .capped(maxConnectionsPerCategory, maxClusterConnectionsPerEntity));
        graph = phase("peer", graph, g -> peerInference.infer(g)
                .capped(maxConnectionsPerCategory, maxClusterConnectionsPerEntity));
        graph = phase("cluster", graph, semanticClusterer::cluster);
        graph = phase("score", graph, confidenceScorer::score);

        for (ConnectionCategory category : ConnectionCategory.values()) {
            metricsService.recordConnections(category, graph.connectionCount(category));
        }
        metricsService.recordClusters(graph.clusters().size());
        return graph;
    }

    RelationshipGraph analyze(EntityCorpus corpus, AnalysisContext context, BuildProgressCallback cb) {
        RelationshipGraph.Builder builder = RelationshipGraph.builder(corpus.ids());
        long processed = 0;
        for (Entity entity : corpus.entities()) {
            for (ConnectionAnalyzer analyzer : analyzers) {
                builder.addAll(entity.getId(), runAnalyzer(analyzer, entity, corpus, context));
            }
            cb.onProgress("analyze", ++processed, corpus.size());
        }
        return builder.build();
    }

    /**
     * Runs one analyzer for one entity, dropping self-loops and targets outside the corpus.
     * Any runtime failure yields no connections.
     */
    List<Connection> runAnalyzer(ConnectionAnalyzer analyzer, Entity entity, EntityCorpus corpus,
                                 AnalysisContext context) {
        List<Connection> found;
        try {
            found = analyzer.analyze(entity, corpus, context);
        } catch (RuntimeException e) {
            try (LogContext ctx = LogContext.forAnalyzer(analyzer.getName()).with("entityId", entity.getId())) {
                log.warn("graph.analyzer.failed analyzer={} entityId={} error={}",
                        analyzer.getName(), entity.getId(), e.toString());
            }
            metricsService.incrementAnalyzerFailure(analyzer.getName());
            return List.of();
        }
        if (found == null) {
            return List.of();
        }
        List<Connection> accepted = new ArrayList<>(found.size());
        for (Connection connection : found) {
            String targetId = connection.getTargetId();
            if (targetId.equals(entity.getId()) || !corpus.contains(targetId)) {
                log.trace("graph.connection.dropped source={} target={} analyzer={}",
                        entity.getId(), targetId, analyzer.getName());
                continue;
            }
            accepted.add(connection);
        }
        return accepted;
    }

    private RelationshipGraph phase(String name, RelationshipGraph graph, UnaryOperator<RelationshipGraph> step) {
        return timed(name, () -> step.apply(graph));
    }

    private RelationshipGraph timed(String name, Supplier<RelationshipGraph> step) {
        long start = System.nanoTime();
        RelationshipGraph result = step.get();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordPhaseDuration(name, elapsed);
        log.info("graph.phase.completed phase={} connections={} durationMs={}",
                name, result.connectionCount(), elapsed.toMillis());
        return result;
    }

    public List<ConnectionAnalyzer> getAnalyzers() {
        return analyzers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<ConnectionAnalyzer> analyzers = new ArrayList<>();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private int maxConnectionsPerCategory = MAX_CONNECTIONS_PER_CATEGORY;
        private int maxClusterConnectionsPerEntity = 0;
        private MetricsService metricsService;

        public Builder analyzer(ConnectionAnalyzer analyzer) {
            this.analyzers.add(Objects.requireNonNull(analyzer, "analyzer is required"));
            return this;
        }

        public Builder analyzers(List<? extends ConnectionAnalyzer> analyzers) {
            analyzers.forEach(this::analyzer);
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder maxConnectionsPerCategory(int maxConnectionsPerCategory) {
            if (maxConnectionsPerCategory <= 0) {
                throw new IllegalArgumentException("maxConnectionsPerCategory must be positive");
            }
            this.maxConnectionsPerCategory = maxConnectionsPerCategory;
            return this;
        }

        /**
         * Cap on cluster connections per entity; zero disables the cap.
         */
        public Builder maxClusterConnectionsPerEntity(int maxClusterConnectionsPerEntity) {
            if (maxClusterConnectionsPerEntity < 0) {
                throw new IllegalArgumentException("maxClusterConnectionsPerEntity must not be negative");
            }
            this.maxClusterConnectionsPerEntity = maxClusterConnectionsPerEntity;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public GraphBuilder build() {
            return new GraphBuilder(this);
        }
    }
}
