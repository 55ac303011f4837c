package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.keyword;
import static com.entity.intelligence.EntityFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeywordEnricher Tests")
class KeywordEnricherTest {

    private final KeywordEnricher enricher = new KeywordEnricher(2024);

    private static Entity superhero() {
        return keyword(9715).name("superhero").build();
    }

    private static EntityCorpus library() {
        return corpus(superhero(),
                movie(1).title("Kappa").released(2021).rating(8.0, 100)
                        .genres("Action", "Adventure").keywords("superhero").build(),
                movie(2).title("Sigma").released(2022).rating(7.0, 100)
                        .genres("Action", "Science Fiction").keywords("Superhero", "based on comic").build(),
                movie(3).title("Tau").released(2005).rating(6.0, 100)
                        .genres("Action").keywords("superhero").build(),
                movie(4).title("Omega").released(2010).keywords("romance").build());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> field(Entity entity, String key) {
        return (Map<String, Object>) entity.get(key).orElseThrow();
    }

    @Test
    @DisplayName("Should only support keyword entities")
    void testSupports() {
        assertTrue(enricher.supports(superhero()));
        assertFalse(enricher.supports(movie(1).title("Kappa").build()));
    }

    @Nested
    @DisplayName("Exclusion")
    class ExclusionTests {

        @Test
        @DisplayName("Stop-word keywords should be excluded")
        void testStopWord() {
            EnrichmentResult result = enricher.enrich(keyword(1).name("Film").build(), corpus());

            assertTrue(result.excluded());
            assertEquals("stop word", result.exclusionReason());
        }

        @Test
        @DisplayName("Single-character keywords should be excluded")
        void testTooShort() {
            EnrichmentResult result = enricher.enrich(keyword(2).name("x").build(), corpus());

            assertTrue(result.excluded());
            assertEquals("name length 1", result.exclusionReason());
        }
    }

    @Nested
    @DisplayName("Usage over the corpus")
    class UsageTests {

        private final Entity enriched = enricher.enrich(superhero(), library()).entity();

        @Test
        @DisplayName("Should count titles tagged by name regardless of case")
        void testMovieCount() {
            assertEquals(3, enriched.get("movie_count").orElseThrow());
        }

        @Test
        @DisplayName("Should combine usage, predefined significance, recency and rating into popularity")
        void testPopularity() {
            // 10 + 3/2 + 0.95 * 30 + 2 recent * 3 + 10 (rating)
            assertEquals(56, enriched.get("popularity").orElseThrow());
            assertEquals(0.95, enriched.get("significance").orElseThrow());
            assertEquals("character_type", enriched.get("keyword_category").orElseThrow());
        }

        @Test
        @DisplayName("Related keywords should add synonyms and category vocabulary")
        void testRelatedKeywords() {
            assertEquals(List.of("superhero", "comic book", "powers", "cape", "hero", "vampire", "zombie"),
                    enriched.get("related_keywords").orElseThrow());
        }

        @Test
        @DisplayName("More recent than older titles should be trending")
        void testUsageAnalysis() {
            Map<String, Object> usage = field(enriched, "usage_analysis");

            assertEquals("rare", usage.get("frequency"));
            assertEquals(true, usage.get("trending"));
            assertEquals(Map.of("decade", "2020s", "movie_count", 2, "percentage", 67L), usage.get("peak_period"));
        }

        @Test
        @DisplayName("Should place the keyword in a semantic field and rate its relevance")
        void testSemantics() {
            assertEquals(Map.of("primary_field", "character", "confidence", 0.8, "related_concepts", List.of("hero")),
                    enriched.get("semantic_field").orElseThrow());
            assertEquals(Map.of("strength", "high", "specificity", "medium", "narrative_importance", "high"),
                    enriched.get("thematic_relevance").orElseThrow());
        }

        @Test
        @DisplayName("Widely spaced uses should be sporadic")
        void testTemporalPatterns() {
            Map<String, Object> temporal = field(enriched, "temporal_patterns");

            assertEquals("sporadic", temporal.get("pattern"));
            assertEquals(18, temporal.get("time_span"));
            assertEquals(2005, temporal.get("first_use"));
            assertEquals(2022, temporal.get("most_recent"));
            assertEquals(0.17, temporal.get("frequency_per_year"));
        }

        @Test
        @DisplayName("A genre holding sixty percent of tags should concentrate the affinity")
        void testGenreAffinity() {
            Map<String, Object> affinity = field(enriched, "genre_affinity");

            assertEquals("concentrated", affinity.get("distribution"));
            assertEquals("Action", affinity.get("primary_genre"));
            assertEquals(3, ((List<?>) affinity.get("top_genres")).size());
        }
    }

    @Test
    @DisplayName("A movie_count attribute should override the corpus count")
    void testMovieCountAttribute() {
        Entity popular = keyword(4379).name("time travel").attribute("movie_count", 150).build();

        Entity enriched = enricher.enrich(popular, corpus()).entity();

        assertEquals(150, enriched.get("movie_count").orElseThrow());
        assertEquals("very_common", field(enriched, "usage_analysis").get("frequency"));
        assertEquals(false, field(enriched, "usage_analysis").get("trending"));
        assertEquals(Map.of("pattern", "insufficient_data"), enriched.get("temporal_patterns").orElseThrow());
        assertEquals("unknown", field(enriched, "genre_affinity").get("distribution"));
    }

    @ParameterizedTest
    @CsvSource({
            "superhero, character_type",
            "christmas eve, seasonal",
            "college, setting_type",
            "love, theme",
            "xylophone, general"
    })
    @DisplayName("Should categorize keywords")
    void testCategory(String name, String category) {
        assertEquals(category, KeywordEnricher.category(name));
    }

    @ParameterizedTest
    @CsvSource({
            "superhero, 0.95",
            "life, 0.3",
            "based on novel or book, 0.9",
            "heist, 0.5"
    })
    @DisplayName("Should rate keyword significance")
    void testSignificance(String name, double significance) {
        assertEquals(significance, KeywordEnricher.significance(name));
    }
}
