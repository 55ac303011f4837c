package com.entity.intelligence.metrics;

import com.entity.intelligence.core.model.ConnectionCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code intelligence.build.duration}: Timer</li>
 *   <li>{@code intelligence.phase.duration}: Timer (tag: phase)</li>
 *   <li>{@code intelligence.corpus.size}: DistributionSummary</li>
 *   <li>{@code intelligence.connections}: Counter (tag: category)</li>
 *   <li>{@code intelligence.clusters}: DistributionSummary</li>
 *   <li>{@code intelligence.analyzer.failures}: Counter (tag: analyzer)</li>
 *   <li>{@code intelligence.entities.excluded}: Counter</li>
 *   <li>{@code intelligence.cache.hit} and {@code intelligence.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Timer buildTimer;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary corpusSizeSummary;
    private final DistributionSummary clusterSummary;
    private final Counter excludedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.buildTimer = Timer.builder("intelligence.build.duration")
                .description("Duration of full artifact builds")
                .register(registry);
        this.corpusSizeSummary = DistributionSummary.builder("intelligence.corpus.size")
                .description("Number of entities per build after enrichment")
                .register(registry);
        this.clusterSummary = DistributionSummary.builder("intelligence.clusters")
                .description("Number of semantic clusters per build")
                .register(registry);
        this.excludedCounter = Counter.builder("intelligence.entities.excluded")
                .description("Number of entities excluded by enrichment")
                .register(registry);
        this.cacheHitCounter = Counter.builder("intelligence.cache.hit")
                .description("Number of profile cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("intelligence.cache.miss")
                .description("Number of profile cache misses")
                .register(registry);
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildTimer.record(duration);
    }

    @Override
    public void recordPhaseDuration(String phase, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(phase, k ->
                Timer.builder("intelligence.phase.duration")
                        .description("Duration of individual build phases")
                        .tag("phase", phase)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCorpusSize(int size) {
        corpusSizeSummary.record(size);
    }

    @Override
    public void recordConnections(ConnectionCategory category, long count) {
        String key = "connections:" + category.getWireName();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("intelligence.connections")
                        .description("Number of connections emitted")
                        .tag("category", category.getWireName())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordClusters(int count) {
        clusterSummary.record(count);
    }

    @Override
    public void incrementAnalyzerFailure(String analyzer) {
        String key = "failure:" + analyzer;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("intelligence.analyzer.failures")
                        .description("Number of per-entity analyzer failures")
                        .tag("analyzer", analyzer)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementEntitiesExcluded(int count) {
        excludedCounter.increment(count);
    }

    @Override
    public void recordCacheHits(long count) {
        cacheHitCounter.increment(count);
    }

    @Override
    public void recordCacheMisses(long count) {
        cacheMissCounter.increment(count);
    }
}
