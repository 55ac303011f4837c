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
import static com.entity.intelligence.EntityFixtures.genre;
import static com.entity.intelligence.EntityFixtures.movie;
import static com.entity.intelligence.EntityFixtures.show;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GenreEnricher Tests")
class GenreEnricherTest {

    private final GenreEnricher enricher = new GenreEnricher();

    private static Entity horror() {
        return genre(27).name("Horror").build();
    }

    private static EntityCorpus library() {
        return corpus(horror(),
                movie(1).title("Kappa").genres("Horror", "Thriller").build(),
                show(2).name("Sigma").genres("horror").build(),
                movie(3).title("Tau").genres("Comedy").build());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> field(Entity entity, String key) {
        return (Map<String, Object>) entity.get(key).orElseThrow();
    }

    @Test
    @DisplayName("Should only support genre entities")
    void testSupports() {
        assertTrue(enricher.supports(horror()));
        assertFalse(enricher.supports(movie(1).title("Kappa").build()));
    }

    @Nested
    @DisplayName("Known genre")
    class KnownGenreTests {

        private final EnrichmentResult result = enricher.enrich(horror(), library());
        private final Entity enriched = result.entity();

        @Test
        @DisplayName("Should never exclude a genre and copy its traits")
        void testTraits() {
            assertFalse(result.excluded());
            assertEquals(List.of("fear", "suspense", "supernatural"), enriched.get("themes").orElseThrow());
            assertEquals("mature_teens_adults", enriched.get("target_audience").orElseThrow());
            assertEquals(80, enriched.get("popularity").orElseThrow());
            assertEquals(List.of("Thriller", "Mystery", "Supernatural"), enriched.get("related_genres").orElseThrow());
        }

        @Test
        @DisplayName("Keywords should merge themes, elements and subgenres without duplicates")
        void testKeywords() {
            assertEquals(List.of("horror", "fear", "suspense", "supernatural", "fear_elements",
                            "supernatural_themes", "slasher", "psychological", "zombie"),
                    enriched.get("genre_keywords").orElseThrow());
        }

        @Test
        @DisplayName("Should count tagged titles of every kind, matching names case-insensitively")
        void testTitles() {
            assertEquals(2, enriched.get("movie_count").orElseThrow());
            assertEquals(List.of("movie", "show"), enriched.get("applies_to").orElseThrow());
        }

        @Test
        @DisplayName("Should describe market, audience and content")
        void testProfiles() {
            assertEquals(Map.of("market_position", "strong", "trend", "growing", "commercial_viability", "high",
                    "franchise_potential", "high", "international_appeal", "universal"),
                    enriched.get("market_analysis").orElseThrow());
            assertEquals(Map.of("historical_importance", "medium", "cultural_impact", "high",
                    "social_relevance", "high", "artistic_value", "medium"),
                    enriched.get("cultural_significance").orElseThrow());

            Map<String, Object> audience = field(enriched, "audience_demographics");
            assertEquals(Map.of("primary", "young_adults", "secondary", "teenagers"), audience.get("age_demographics"));
            assertEquals(Map.of("peak", "fall", "secondary", "winter"), audience.get("seasonal_preferences"));

            Map<String, Object> content = field(enriched, "content_patterns");
            assertEquals(Map.of("min", 80, "max", 110, "average", 95), content.get("typical_runtime"));
            assertEquals("variable", content.get("pacing"));
        }
    }

    @Test
    @DisplayName("A lower-cased name should resolve to the built-in vocabulary")
    void testCanonicalName() {
        Entity enriched = enricher.enrich(genre(878).name("science fiction").build(), corpus()).entity();

        @SuppressWarnings("unchecked")
        List<String> keywords = (List<String>) enriched.get("genre_keywords").orElseThrow();
        assertTrue(keywords.contains("sci-fi"), keywords.toString());
        assertEquals(80, enriched.get("popularity").orElseThrow());
        assertEquals(0, enriched.get("movie_count").orElseThrow());
        assertEquals(List.of(), enriched.get("applies_to").orElseThrow());
    }

    @Test
    @DisplayName("An unknown genre should fall back to defaults")
    void testUnknownGenre() {
        Entity enriched = enricher.enrich(genre(900).name("Foreign").build(), corpus()).entity();

        assertEquals(40, enriched.get("popularity").orElseThrow());
        assertEquals(List.of(), enriched.get("themes").orElseThrow());
        assertEquals(List.of("foreign"), enriched.get("genre_keywords").orElseThrow());
        Map<String, Object> market = field(enriched, "market_analysis");
        assertEquals("niche", market.get("market_position"));
        assertEquals("low", market.get("commercial_viability"));
        assertEquals("medium", market.get("franchise_potential"));
        assertEquals(Map.of("peak", "all_year"),
                field(enriched, "audience_demographics").get("seasonal_preferences"));
        assertEquals(List.of("three_act"), field(enriched, "content_patterns").get("narrative_structures"));
    }

    @ParameterizedTest
    @CsvSource({
            "95, dominant",
            "70, strong",
            "55, moderate",
            "40, niche",
            "30, specialized"
    })
    @DisplayName("Market position thresholds")
    void testMarketPosition(int score, String position) {
        assertEquals(position, GenreEnricher.marketAnalysis("Anything", score).get("market_position"));
    }
}
