package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.entity.intelligence.EntityFixtures.movie;
import static com.entity.intelligence.EntityFixtures.person;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersonEnricher Tests")
class PersonEnricherTest {

    private static final EntityCorpus EMPTY = EntityCorpus.empty();

    private final PersonEnricher enricher = new PersonEnricher();

    private static Map<String, Object> credit(String date, Integer... genreIds) {
        return Map.of("release_date", date, "genre_ids", List.of(genreIds), "popularity", 10.0, "vote_average", 6.5);
    }

    private static Entity director() {
        return person(525).name("Jane Doe")
                .popularity(25)
                .attribute("known_for_department", "Directing")
                .attribute("combined_credits", Map.of(
                        "cast", List.of(credit("2001-03-01", 18), credit("2005-03-01", 18, 80)),
                        "crew", List.of(credit("2010-03-01", 18), credit("2020-03-01", 53))))
                .build();
    }

    @Test
    @DisplayName("Should only support person entities")
    void testSupports() {
        assertTrue(enricher.supports(director()));
        assertFalse(enricher.supports(movie(1).title("Kappa").build()));
    }

    @Nested
    @DisplayName("Exclusion")
    class ExclusionTests {

        @Test
        @DisplayName("People below the popularity floor should be excluded")
        void testLowPopularity() {
            Entity entity = person(1).name("Nobody").popularity(3).cast(0, "x", 0).build();

            EnrichmentResult result = enricher.enrich(entity, EMPTY);

            assertTrue(result.excluded());
            assertEquals("popularity 3.0 below minimum 10.0", result.exclusionReason());
            assertSame(entity, result.entity());
        }

        @Test
        @DisplayName("People without any credit should be excluded")
        void testNoCredits() {
            EnrichmentResult result = enricher.enrich(person(2).name("Idle").popularity(40).build(), EMPTY);

            assertTrue(result.excluded());
            assertEquals("no credits", result.exclusionReason());
        }

        @Test
        @DisplayName("A lower floor should keep less popular people")
        void testCustomFloor() {
            Entity entity = person(3).name("Extra").popularity(3).cast(0, "x", 0).build();

            assertFalse(new PersonEnricher(1.0).enrich(entity, EMPTY).excluded());
            assertThrows(IllegalArgumentException.class, () -> new PersonEnricher(-1.0));
        }
    }

    @Test
    @DisplayName("Should derive career fields from combined credits")
    @SuppressWarnings("unchecked")
    void testDerivedFields() {
        EnrichmentResult result = enricher.enrich(director(), EMPTY);

        assertFalse(result.excluded());
        Entity enriched = result.entity();
        Map<String, Object> derived = enriched.getDerived();

        assertEquals("emerging", derived.get("career_stage"));
        assertEquals(4, derived.get("total_credits"));
        assertEquals(2, derived.get("acting_credits"));
        assertEquals(2, derived.get("crew_credits"));

        Map<String, Object> analysis = (Map<String, Object>) derived.get("career_analysis");
        assertEquals("multi_role", analysis.get("primary_role"));
        assertEquals(20, analysis.get("span_years"));
        assertEquals("low", analysis.get("versatility"));

        Map<String, Object> specialization = (Map<String, Object>) derived.get("genre_specialization");
        assertEquals("Drama", specialization.get("specialization"));
        assertEquals(0.6, (double) specialization.get("confidence"), 1e-9);

        assertEquals(Map.of("collaboration_score", 65), derived.get("collaboration_network"));
        assertEquals(List.of("jane doe", "jane", "doe", "directing", "director", "drama", "crime", "thriller",
                "emerging"), derived.get("person_keywords"));
    }

    @Test
    @DisplayName("Fields already on the entity should not be overwritten")
    void testExistingFieldKept() {
        Entity entity = person(7).name("Sam Roe").popularity(20).attribute("total_credits", 99)
                .cast(1, "x", 0).build();

        Entity enriched = enricher.enrich(entity, EMPTY).entity();

        assertEquals(99, enriched.get("total_credits").orElseThrow());
        assertFalse(enriched.getDerived().containsKey("total_credits"));
        assertTrue(enriched.getDerived().containsKey("career_stage"));
    }

    @ParameterizedTest
    @CsvSource({
            "3, 3, emerging",
            "12, 11, established",
            "40, 20, veteran",
            "70, 35, legend",
            "35, 5, veteran",
            "15, 40, established",
    })
    @DisplayName("Career stage should follow years active and credit count")
    void testCareerStage(int count, int span, String expected) {
        List<Map<String, Object>> cast = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int year = 2000 + (i * (span - 1)) / (count - 1);
            cast.add(Map.of("release_date", year + "-01-01"));
        }
        Entity entity = person(9).name("Pat").popularity(20).attribute("cast", cast).build();

        assertEquals(expected, PersonEnricher.careerStage(PersonEnricher.creditsOf(entity)));
    }

    @Test
    @DisplayName("Significance should need both popularity and credits")
    void testCareerSignificance() {
        assertEquals("major", PersonEnricher.careerSignificance(55, 30));
        assertEquals("significant", PersonEnricher.careerSignificance(55, 25));
        assertEquals("notable", PersonEnricher.careerSignificance(15, 10));
        assertEquals("emerging", PersonEnricher.careerSignificance(5, 5));
        assertEquals("minor", PersonEnricher.careerSignificance(90, 4));
    }

    @Test
    @DisplayName("Profession should map departments onto categories")
    void testProfession() {
        assertEquals("director", PersonEnricher.professionOf("Directing").orElseThrow());
        assertEquals("actor", PersonEnricher.professionOf("Acting").orElseThrow());
        assertEquals("lighting", PersonEnricher.professionOf("Lighting").orElseThrow());
        assertTrue(PersonEnricher.professionOf(" ").isEmpty());
    }
}
