package com.entity.intelligence.metrics;

import com.entity.intelligence.core.model.ConnectionCategory;

import java.time.Duration;

/**
 * Interface for recording build metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordBuildDuration(Duration duration);

    /**
     * Records the duration of one build phase, e.g. {@code enrich}, {@code analyze}, {@code index}.
     */
    void recordPhaseDuration(String phase, Duration duration);

    void recordCorpusSize(int size);

    void recordConnections(ConnectionCategory category, long count);

    void recordClusters(int count);

    void incrementAnalyzerFailure(String analyzer);

    void incrementEntitiesExcluded(int count);

    void recordCacheHits(long count);

    void recordCacheMisses(long count);
}
