package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentAnalyzer Tests")
class ContentAnalyzerTest {

    private final ContentAnalyzer analyzer = new ContentAnalyzer();
    private final AnalysisContext context = AnalysisContext.defaults();

    private Optional<Connection> find(Entity source, EntityCorpus corpus, ConnectionType type, String targetId) {
        return analyzer.analyze(source, corpus, context).stream()
                .filter(c -> c.getType() == type && c.getTargetId().equals(targetId))
                .findFirst();
    }

    @Nested
    @DisplayName("Genre match")
    class GenreTests {

        @Test
        @DisplayName("Should weight shared genres and boost multiple matches")
        void testGenreMatch() {
            Entity a = movie(1).title("A").genres("Horror", "Thriller").build();
            Entity b = movie(2).title("B").genres("Horror", "Thriller", "Drama").build();

            Connection c = find(a, corpus(a, b), ConnectionType.GENRE_MATCH, "movie:2").orElseThrow();

            // 2/3 * 0.9 * 0.85 * 1.1
            assertEquals(0.561, c.getStrength(), 1e-9);
            assertEquals(0.95, c.getConfidence(), 1e-9);
            assertEquals("Shared genres: Horror, Thriller", c.getReason());
            assertEquals(List.of("Horror", "Thriller"), c.getMetadata().get("commonGenres"));
        }

        @Test
        @DisplayName("Weak overlaps should not be emitted")
        void testWeakGenreOverlap() {
            Entity a = movie(1).title("A").genres("Drama", "Comedy", "Family").build();
            Entity b = movie(2).title("B").genres("Drama", "War", "History", "Music").build();

            assertTrue(find(a, corpus(a, b), ConnectionType.GENRE_MATCH, "movie:2").isEmpty());
        }
    }

    @Test
    @DisplayName("Shared major studio should give a strong studio connection")
    void testStudioUniverse() {
        Entity a = movie(1).title("A").company(420, "Marvel Studios").build();
        Entity b = movie(2).title("B").company(420, "Marvel Studios").build();

        Connection c = find(a, corpus(a, b), ConnectionType.STUDIO_UNIVERSE, "movie:2").orElseThrow();

        assertEquals(0.9025, c.getStrength(), 1e-9);
        assertEquals(0.95, c.getConfidence(), 1e-9);
        assertEquals("Same production company: Marvel Studios", c.getReason());
    }

    @Test
    @DisplayName("Shared director should give a talent overlap")
    void testTalentOverlap() {
        Entity a = movie(1).title("A").crew(525, "Christopher Nolan", "Director").build();
        Entity b = movie(2).title("B").crew(525, "Christopher Nolan", "Director").build();

        Connection c = find(a, corpus(a, b), ConnectionType.TALENT_OVERLAP, "movie:2").orElseThrow();

        // (0.4 + 0.1 * 0.95) * 1.3 * 0.95
        assertEquals(0.611325, c.getStrength(), 1e-9);
        assertEquals(0.9, c.getConfidence(), 1e-9);
        assertEquals("1 shared cast/crew members", c.getReason());
    }

    @Test
    @DisplayName("Same collection should give a franchise member connection")
    void testFranchiseMember() {
        Entity a = movie(1).title("A").collection(10, "Matrix Collection").build();
        Entity b = movie(2).title("B").collection(10, "Matrix Collection").build();

        Connection c = find(a, corpus(a, b), ConnectionType.FRANCHISE_MEMBER, "movie:2").orElseThrow();

        assertEquals(0.92, c.getStrength(), 1e-9);
        assertEquals(0.98, c.getConfidence(), 1e-9);
        assertEquals("Part of Matrix Collection collection", c.getReason());
    }

    @Nested
    @DisplayName("Rating similarity")
    class RatingTests {

        @Test
        @DisplayName("Close high ratings should connect")
        void testHighRatings() {
            Entity a = movie(1).title("A").rating(8.4, 100).build();
            Entity b = movie(2).title("B").rating(7.5, 100).build();

            Connection c = find(a, corpus(a, b), ConnectionType.RATING_SIMILARITY, "movie:2").orElseThrow();

            assertEquals(0.546, c.getStrength(), 1e-9);
            assertEquals(0.7, c.getConfidence(), 1e-9);
            assertEquals("Similar high ratings: 8.4 vs 7.5", c.getReason());
        }

        @Test
        @DisplayName("A rating below the floor should not connect")
        void testBelowFloor() {
            Entity a = movie(1).title("A").rating(7.5, 100).build();
            Entity b = movie(2).title("B").rating(6.9, 100).build();

            assertTrue(find(a, corpus(a, b), ConnectionType.RATING_SIMILARITY, "movie:2").isEmpty());
        }
    }

    @Test
    @DisplayName("Should never connect an entity to itself")
    void testNoSelfLoop() {
        Entity a = movie(1).title("A").genres("Horror").company(420, "Marvel Studios").rating(8.0, 10).build();
        Entity b = movie(2).title("B").genres("Horror").company(420, "Marvel Studios").rating(8.0, 10).build();

        List<Connection> connections = analyzer.analyze(a, corpus(a, b), context);

        assertFalse(connections.isEmpty());
        assertTrue(connections.stream().noneMatch(c -> c.getTargetId().equals("movie:1")));
    }

    @Test
    @DisplayName("Entities without structured data should produce nothing")
    void testEmptyEntity() {
        Entity a = movie(1).build();
        Entity b = movie(2).title("B").genres("Drama").build();

        assertTrue(analyzer.analyze(a, corpus(a, b), context).isEmpty());
    }
}
