package com.entity.intelligence.metrics;

import com.entity.intelligence.core.model.ConnectionCategory;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBuildDuration(Duration duration) {
    }

    @Override
    public void recordPhaseDuration(String phase, Duration duration) {
    }

    @Override
    public void recordCorpusSize(int size) {
    }

    @Override
    public void recordConnections(ConnectionCategory category, long count) {
    }

    @Override
    public void recordClusters(int count) {
    }

    @Override
    public void incrementAnalyzerFailure(String analyzer) {
    }

    @Override
    public void incrementEntitiesExcluded(int count) {
    }

    @Override
    public void recordCacheHits(long count) {
    }

    @Override
    public void recordCacheMisses(long count) {
    }
}
