package com.entity.intelligence.api;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.analyzer.ConnectionAnalyzer;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.enrich.EnrichmentResult;
import com.entity.intelligence.enrich.EntityEnricher;
import com.entity.intelligence.graph.RelationshipGraph;
import com.entity.intelligence.metrics.MicrometerMetricsService;
import com.entity.intelligence.recommend.RecommendationSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.entity.intelligence.EntityFixtures.company;
import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.genre;
import static com.entity.intelligence.EntityFixtures.movie;
import static com.entity.intelligence.EntityFixtures.person;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IntelligenceEngine Tests")
class IntelligenceEngineTest {

    private static final EngineOptions OPTIONS = EngineOptions.builder().referenceYear(2024).build();

    private EntityCorpus corpus;

    @BeforeEach
    void setUp() {
        Entity kappa = movie(1).title("Kappa")
                .genres("Horror", "Thriller")
                .company(420, "Marvel Studios")
                .released(2010)
                .rating(7.5, 500)
                .overview("A detective must solve a murder in the city.")
                .build();
        Entity sigma = movie(2).title("Sigma")
                .genres("Horror", "Thriller", "Drama")
                .company(420, "Marvel Studios")
                .released(2011)
                .rating(7.8, 800)
                .overview("A detective hunts a killer through the city.")
                .build();
        Entity zed = movie(3).title("Zed").genres("Horror").released(2010).overview("A haunted ghost story.").build();
        Entity pym = movie(4).title("Pym").genres("Comedy").released(1995).build();
        Entity jane = person(10).name("Jane Doe")
                .popularity(25)
                .attribute("known_for_department", "Acting")
                .attribute("combined_credits", Map.of("cast", List.of(
                        Map.of("release_date", "2010-06-01", "genre_ids", List.of(27)),
                        Map.of("release_date", "2011-06-01", "genre_ids", List.of(27, 53)))))
                .build();
        Entity nobody = person(11).name("Nobody").popularity(1).build();
        corpus = corpus(kappa, sigma, zed, pym, jane, nobody);
    }

    private IntelligenceEngine engine() {
        return IntelligenceEngine.builder().options(OPTIONS).build();
    }

    @Test
    @DisplayName("Build should exclude unpopular people and keep the rest")
    void testExclusion() {
        CompilationResult result = engine().compile(corpus);

        assertEquals(Set.of("person:11"), result.excludedIds());
        assertFalse(result.corpus().contains("person:11"));
        assertEquals(result.corpus().ids(), result.graph().entityIds());
        assertTrue(result.corpus().get("person:10").orElseThrow().get("career_stage").isPresent());
    }

    @Test
    @DisplayName("Built graph should be valid and bounded")
    void testGraphInvariants() {
        CompilationResult result = engine().compile(corpus);
        RelationshipGraph graph = result.graph();

        assertTrue(result.statistics().isValid());
        assertTrue(graph.connectionCount() > 0);
        for (String id : graph.entityIds()) {
            graph.connectionsOf(id).forEach((category, list) -> {
                if (category != ConnectionCategory.CLUSTER) {
                    assertTrue(list.size() <= OPTIONS.getMaxConnectionsPerCategory());
                }
                for (Connection connection : list) {
                    assertNotEquals(id, connection.getTargetId());
                    assertTrue(graph.contains(connection.getTargetId()));
                }
            });
        }
        assertFalse(graph.connections("movie:1", ConnectionCategory.DIRECT).isEmpty());
    }

    @Test
    @DisplayName("Search index and recommendations should cover the corpus")
    void testOutputs() {
        CompilationResult result = engine().compile(corpus);

        assertEquals(Set.of("movie:1"), result.searchIndex().entitiesForTerm("kappa"));
        assertTrue(result.searchIndex().entitiesForTerm("jane doe").contains("person:10"));
        assertTrue(result.searchIndex().entitiesForCategory("genre_horror").containsAll(
                List.of("movie:1", "movie:2", "movie:3")));
        assertEquals(result.corpus().ids(), result.recommendations().keySet());
        assertFalse(result.recommendationsFor("movie:1").deep().isEmpty());
        assertSame(RecommendationSet.EMPTY, result.recommendationsFor("movie:99"));
    }

    @Test
    @DisplayName("Compiling the same corpus twice should give identical artifacts")
    void testIdempotent() {
        IntelligenceEngine engine = engine();

        CompilationResult first = engine.compile(corpus);
        CompilationResult second = engine.compile(corpus);

        assertNotEquals(first.buildId(), second.buildId());
        assertEquals(first.graph().toRecord(), second.graph().toRecord());
        assertEquals(first.searchIndex().toRecord(), second.searchIndex().toRecord());
        assertEquals(first.recommendations(), second.recommendations());
        assertEquals(first.excludedIds(), second.excludedIds());
    }

    @Test
    @DisplayName("Build should report progress and clear its logging context")
    void testProgressAndLogContext() {
        Set<String> phases = new LinkedHashSet<>();

        engine().compile(corpus, (phase, processed, total) -> phases.add(phase));

        assertEquals(List.of("enrich", "analyze", "index", "recommend"), List.copyOf(phases));
        assertNull(MDC.get("buildId"));
    }

    @Nested
    @DisplayName("Extensions and metrics")
    class ExtensionTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

        @Test
        @DisplayName("Custom enrichers and failing analyzers should be honored and measured")
        void testExtensions() {
            EntityEnricher dropComedies = new EntityEnricher() {
                @Override
                public String getName() {
                    return "drop-comedies";
                }

                @Override
                public boolean supports(Entity entity) {
                    return entity.getId().startsWith("movie:");
                }

                @Override
                public EnrichmentResult enrich(Entity entity, EntityCorpus corpus) {
                    return entity.getId().equals("movie:4")
                            ? EnrichmentResult.excluded(entity, "comedy")
                            : EnrichmentResult.kept(entity);
                }
            };
            ConnectionAnalyzer broken = new ConnectionAnalyzer() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public ConnectionCategory getCategory() {
                    return ConnectionCategory.DIRECT;
                }

                @Override
                public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
                    throw new IllegalStateException("broken analyzer");
                }
            };

            CompilationResult result = IntelligenceEngine.builder()
                    .options(OPTIONS)
                    .metricsService(new MicrometerMetricsService(registry))
                    .enricher(dropComedies)
                    .analyzer(broken)
                    .build()
                    .compile(corpus);

            assertEquals(Set.of("movie:4", "person:11"), result.excludedIds());
            assertEquals(4.0, registry.find("intelligence.analyzer.failures").tag("analyzer", "broken")
                    .counter().count());
            assertEquals(2.0, registry.find("intelligence.entities.excluded").counter().count());
            assertEquals(1, registry.find("intelligence.build.duration").timer().count());
            assertEquals(1, registry.find("intelligence.phase.duration").tag("phase", "score").timer().count());
            assertEquals(4.0, registry.find("intelligence.corpus.size").summary().totalAmount());
        }
    }

    @Nested
    @DisplayName("Catalog enrichment")
    class CatalogTests {

        private EntityCorpus catalog() {
            List<Entity> entities = new ArrayList<>(corpus.entities());
            entities.add(company(420).name("Marvel Studios").build());
            entities.add(company(999).name("Ghost Pictures").build());
            entities.add(genre(27).name("Horror").build());
            return EntityCorpus.of(entities);
        }

        @Test
        @DisplayName("Companies and genres should be enriched from the titles that reference them")
        void testCatalogEnrichment() {
            CompilationResult result = engine().compile(catalog());

            assertEquals(Set.of("company:999", "person:11"), result.excludedIds());
            Entity studio = result.corpus().get("company:420").orElseThrow();
            assertEquals(2, studio.get("movie_count").orElseThrow());
            assertEquals("production", studio.get("company_category").orElseThrow());
            assertEquals(3, result.corpus().get("genre:27").orElseThrow().get("movie_count").orElseThrow());

            assertTrue(result.searchIndex().entitiesForCategory("company_production").contains("company:420"));
            assertTrue(result.searchIndex().entitiesForTerm("horror").containsAll(List.of("company:420", "genre:27")));
        }

        @Test
        @DisplayName("Disabling catalog enrichment should keep catalog entities as ingested")
        void testCatalogEnrichmentDisabled() {
            CompilationResult result = IntelligenceEngine.builder()
                    .options(EngineOptions.builder().referenceYear(2024).catalogEnrichment(false).build())
                    .build()
                    .compile(catalog());

            assertEquals(Set.of("person:11"), result.excludedIds());
            assertTrue(result.corpus().get("company:420").orElseThrow().get("company_category").isEmpty());
        }
    }
}
