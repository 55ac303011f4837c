package com.entity.intelligence.graph;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.analyzer.ConnectionAnalyzer;
import com.entity.intelligence.analyzer.ContentAnalyzer;
import com.entity.intelligence.cache.CacheConfig;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GraphBuilder Tests")
class GraphBuilderTest {

    private static final int REFERENCE_YEAR = 2024;

    @Mock
    private ConnectionAnalyzer brokenAnalyzer;

    @Mock
    private MetricsService metricsService;

    private EntityCorpus corpus;

    @BeforeEach
    void setUp() {
        Entity a = movie(1).title("Kappa").genres("Horror", "Thriller").company(420, "Marvel Studios").build();
        Entity b = movie(2).title("Sigma").genres("Horror", "Thriller").company(420, "Marvel Studios").build();
        Entity c = movie(3).title("Zed").genres("Horror", "Thriller", "Drama").build();
        corpus = corpus(a, b, c);
    }

    private static Connection edge(String targetId) {
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.GENRE_MATCH)
                .strength(0.5)
                .confidence(0.5)
                .reason("test")
                .build();
    }

    @Nested
    @DisplayName("Analyzer isolation")
    class AnalyzerIsolationTests {

        @Test
        @DisplayName("A failing analyzer should be counted and not stop the build")
        void testFailingAnalyzer() {
            when(brokenAnalyzer.getName()).thenReturn("broken");
            when(brokenAnalyzer.analyze(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

            RelationshipGraph graph = GraphBuilder.builder()
                    .analyzer(brokenAnalyzer)
                    .analyzer(new ContentAnalyzer())
                    .metricsService(metricsService)
                    .build()
                    .build(corpus, REFERENCE_YEAR);

            verify(metricsService, times(3)).incrementAnalyzerFailure("broken");
            assertFalse(graph.connections("movie:1", ConnectionCategory.DIRECT).isEmpty());
            assertTrue(GraphStatistics.of(graph).isValid());
        }

        @Test
        @DisplayName("Self-loops and targets outside the corpus should be dropped")
        void testDroppedTargets() {
            when(brokenAnalyzer.analyze(any(), any(), any()))
                    .thenReturn(List.of(edge("movie:1"), edge("movie:42"), edge("movie:2")));
            GraphBuilder builder = GraphBuilder.builder().analyzer(brokenAnalyzer).build();
            Entity source = corpus.get("movie:1").orElseThrow();

            List<Connection> accepted = builder.runAnalyzer(brokenAnalyzer, source, corpus, AnalysisContext.defaults());

            assertEquals(List.of("movie:2"), accepted.stream().map(Connection::getTargetId).toList());
        }

        @Test
        @DisplayName("A null result should count as no connections")
        void testNullResult() {
            when(brokenAnalyzer.analyze(any(), any(), any())).thenReturn(null);
            GraphBuilder builder = GraphBuilder.builder().analyzer(brokenAnalyzer).build();

            assertTrue(builder.runAnalyzer(brokenAnalyzer, corpus.get("movie:1").orElseThrow(), corpus,
                    AnalysisContext.defaults()).isEmpty());
        }
    }

    @Test
    @DisplayName("Built graph should be symmetric, scored and free of self-loops")
    void testBuild() {
        RelationshipGraph graph = GraphBuilder.builder()
                .analyzer(new ContentAnalyzer())
                .build()
                .build(corpus, REFERENCE_YEAR);

        assertEquals(corpus.ids(), graph.entityIds());
        GraphStatistics stats = GraphStatistics.of(graph);
        assertTrue(stats.isValid());
        assertTrue(stats.bidirectional() > 0);
        for (String id : graph.entityIds()) {
            for (Connection connection : graph.allConnections(id)) {
                assertNotEquals(id, connection.getTargetId());
                assertTrue(connection.getMetadata().containsKey(ConfidenceScorer.EVIDENCE_CONFIDENCE));
            }
        }
    }

    @Test
    @DisplayName("Building twice should give identical graphs")
    void testIdempotent() {
        GraphBuilder builder = GraphBuilder.builder().analyzer(new ContentAnalyzer()).build();

        assertEquals(builder.build(corpus, REFERENCE_YEAR).toRecord(),
                builder.build(corpus, REFERENCE_YEAR).toRecord());
    }

    @Test
    @DisplayName("Caps should bound every non-cluster category")
    void testCapped() {
        RelationshipGraph graph = GraphBuilder.builder()
                .analyzer(new ContentAnalyzer())
                .maxConnectionsPerCategory(1)
                .cacheConfig(CacheConfig.disabled())
                .build()
                .build(corpus, REFERENCE_YEAR);

        for (String id : graph.entityIds()) {
            graph.connectionsOf(id).forEach((category, list) -> {
                if (category != ConnectionCategory.CLUSTER) {
                    assertTrue(list.size() <= 1, id + " " + category);
                }
            });
        }
    }

    @Test
    @DisplayName("Should report progress and phase timings")
    void testProgressAndMetrics() {
        List<Long> progress = new ArrayList<>();

        GraphBuilder.builder()
                .analyzer(new ContentAnalyzer())
                .metricsService(metricsService)
                .build()
                .build(corpus, REFERENCE_YEAR, (phase, processed, total) -> progress.add(processed));

        assertEquals(List.of(1L, 2L, 3L), progress);
        for (String phase : List.of("analyze", "bidirectional", "peer", "cluster", "score")) {
            verify(metricsService).recordPhaseDuration(eq(phase), any(Duration.class));
        }
        verify(metricsService).recordConnections(eq(ConnectionCategory.DIRECT), longThat(count -> count > 0));
        verify(metricsService).recordClusters(0);
    }

    @Test
    @DisplayName("Builder should reject invalid caps")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> GraphBuilder.builder().maxConnectionsPerCategory(0));
        assertThrows(IllegalArgumentException.class, () -> GraphBuilder.builder().maxClusterConnectionsPerEntity(-1));
        assertThrows(NullPointerException.class, () -> GraphBuilder.builder().analyzer(null));
    }
}
