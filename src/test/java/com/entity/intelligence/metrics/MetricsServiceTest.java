package com.entity.intelligence.metrics;

import com.entity.intelligence.core.model.ConnectionCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordBuildDuration(Duration.ofMillis(100));
                noOp.recordPhaseDuration("analyze", Duration.ofMillis(10));
                noOp.recordCorpusSize(10);
                noOp.recordConnections(ConnectionCategory.DIRECT, 5);
                noOp.recordClusters(2);
                noOp.incrementAnalyzerFailure("content");
                noOp.incrementEntitiesExcluded(1);
                noOp.recordCacheHits(3);
                noOp.recordCacheMisses(4);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record build duration as timer")
        void recordBuildDuration() {
            metrics.recordBuildDuration(Duration.ofMillis(150));

            Timer timer = registry.find("intelligence.build.duration").timer();

            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should create one phase timer per phase")
        void recordPhaseDuration() {
            metrics.recordPhaseDuration("analyze", Duration.ofMillis(100));
            metrics.recordPhaseDuration("analyze", Duration.ofMillis(120));
            metrics.recordPhaseDuration("score", Duration.ofMillis(5));

            Timer analyze = registry.find("intelligence.phase.duration").tag("phase", "analyze").timer();
            Timer score = registry.find("intelligence.phase.duration").tag("phase", "score").timer();

            assertNotNull(analyze);
            assertEquals(2, analyze.count());
            assertNotNull(score);
            assertEquals(1, score.count());
        }

        @Test
        @DisplayName("Should count connections per category")
        void recordConnections() {
            metrics.recordConnections(ConnectionCategory.DIRECT, 12);
            metrics.recordConnections(ConnectionCategory.SEMANTIC, 3);

            Counter direct = registry.find("intelligence.connections").tag("category", "direct").counter();
            Counter semantic = registry.find("intelligence.connections").tag("category", "semantic").counter();

            assertNotNull(direct);
            assertEquals(12.0, direct.count());
            assertNotNull(semantic);
            assertEquals(3.0, semantic.count());
        }

        @Test
        @DisplayName("Should count analyzer failures by analyzer name")
        void incrementAnalyzerFailure() {
            metrics.incrementAnalyzerFailure("semantic");
            metrics.incrementAnalyzerFailure("semantic");

            Counter counter = registry.find("intelligence.analyzer.failures").tag("analyzer", "semantic").counter();

            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }

        @Test
        @DisplayName("Should record corpus size and clusters as summaries")
        void recordSummaries() {
            metrics.recordCorpusSize(120);
            metrics.recordClusters(4);
            metrics.recordClusters(6);

            DistributionSummary corpus = registry.find("intelligence.corpus.size").summary();
            DistributionSummary clusters = registry.find("intelligence.clusters").summary();

            assertNotNull(corpus);
            assertEquals(1, corpus.count());
            assertNotNull(clusters);
            assertEquals(10.0, clusters.totalAmount());
        }

        @Test
        @DisplayName("Should record exclusions and cache hits and misses")
        void recordCounters() {
            metrics.incrementEntitiesExcluded(3);
            metrics.recordCacheHits(7);
            metrics.recordCacheMisses(2);

            assertEquals(3.0, registry.find("intelligence.entities.excluded").counter().count());
            assertEquals(7.0, registry.find("intelligence.cache.hit").counter().count());
            assertEquals(2.0, registry.find("intelligence.cache.miss").counter().count());
        }
    }
}
