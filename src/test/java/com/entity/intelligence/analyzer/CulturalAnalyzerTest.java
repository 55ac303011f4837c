package com.entity.intelligence.analyzer;

import com.entity.intelligence.cache.NoOpProfileCache;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.OptionalInt;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CulturalAnalyzer Tests")
class CulturalAnalyzerTest {

    private static final int REFERENCE_YEAR = 2024;

    private final CulturalAnalyzer analyzer = new CulturalAnalyzer();
    private final AnalysisContext context = AnalysisContext.of(new NoOpProfileCache(), REFERENCE_YEAR);

    private static Entity acclaimed(long id, String title) {
        return movie(id).title(title)
                .released(REFERENCE_YEAR)
                .rating(8.6, 2000)
                .popularity(60)
                .country("US")
                .build();
    }

    @Nested
    @DisplayName("Profiles")
    class ProfileTests {

        @Test
        @DisplayName("Should derive markers from rating, popularity and content")
        void testMarkers() {
            Entity entity = movie(1).title("Kappa")
                    .overview("A cult masterpiece.")
                    .released(REFERENCE_YEAR)
                    .rating(8.6, 2000)
                    .popularity(60)
                    .build();

            CulturalProfile profile = CulturalProfile.of(entity, REFERENCE_YEAR);

            assertTrue(profile.markerTypes().containsAll(
                    List.of("oscar_worthy", "cult_classic", "critically_acclaimed", "mainstream_popular")));
            assertEquals("contemporary", profile.timeContext().era());
            assertEquals(1.0, profile.significance(), 1e-9);
        }

        @Test
        @DisplayName("Unknown release year should zero significance")
        void testUnknownYear() {
            CulturalProfile profile = CulturalProfile.of(movie(1).title("Zed").build(), REFERENCE_YEAR);

            assertEquals(0.0, profile.significance());
            assertTrue(profile.isInsignificant());
        }

        @ParameterizedTest
        @CsvSource({
                "2024, contemporary, 1.0",
                "2012, recent, 0.9",
                "2000, modern, 0.7",
                "1980, classic, 0.6",
                "1950, vintage, 0.4",
        })
        @DisplayName("Era relevance should follow release age")
        void testTimeContext(int year, String era, double relevance) {
            CulturalProfile.TimeContext time = CulturalProfile.timeContext(OptionalInt.of(year), REFERENCE_YEAR);
            assertEquals(era, time.era());
            assertEquals(relevance, time.relevance(), 1e-9);
        }
    }

    @Test
    @DisplayName("Significant entities with shared markers should connect")
    void testConnect() {
        Entity a = acclaimed(1, "Kappa");
        Entity b = acclaimed(2, "Sigma");

        List<Connection> connections = analyzer.analyze(a, corpus(a, b), context);

        assertEquals(1, connections.size());
        Connection c = connections.get(0);
        assertEquals(ConnectionType.CULTURAL_SIGNIFICANCE, c.getType());
        assertEquals("movie:2", c.getTargetId());
        assertTrue(c.getStrength() > 0.3);
        assertTrue(c.getReason().startsWith("Cultural significance: "));
        assertTrue(c.getReason().contains("critically_acclaimed"));
        assertTrue(c.getConfidence() >= 0.8);
    }

    @Test
    @DisplayName("Insignificant entities should take no part as source or target")
    void testInsignificantExcluded() {
        Entity a = acclaimed(1, "Kappa");
        Entity plain = movie(2).title("Zed").build();
        EntityCorpus corpus = corpus(a, plain);

        assertTrue(analyzer.analyze(plain, corpus, context).isEmpty());
        assertTrue(analyzer.analyze(a, corpus, context).stream()
                .noneMatch(c -> c.getTargetId().equals("movie:2")));
    }

    @Test
    @DisplayName("Same regional culture should score its influence")
    void testCompareRegional() {
        CulturalProfile us = CulturalProfile.of(acclaimed(1, "Kappa"), REFERENCE_YEAR);
        CulturalProfile gb = CulturalProfile.of(movie(2).title("Sigma").country("GB").build(), REFERENCE_YEAR);

        assertEquals(1.0, CulturalAnalyzer.compareRegional(us.regionalCulture(), us.regionalCulture()), 1e-9);
        assertEquals(0.0, CulturalAnalyzer.compareRegional(us.regionalCulture(), gb.regionalCulture()), 1e-9);
    }
}
