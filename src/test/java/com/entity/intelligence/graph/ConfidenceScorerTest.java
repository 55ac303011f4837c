package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    private static Connection edge(String targetId, ConnectionType type, double strength, double confidence) {
        return Connection.builder()
                .targetId(targetId)
                .type(type)
                .strength(strength)
                .confidence(confidence)
                .reason("test")
                .build();
    }

    @ParameterizedTest
    @CsvSource({
            "studio_universe, 0.9025, 0.7716375",
            "peer_recommendation, 0.336, 0.16128",
            "cluster_member, 0.6, 0.36",
            "same_decade, 0.4, 0.24",
            "franchise_timing, 0.7, 0.2975",
    })
    @DisplayName("Confidence should be strength times category and type weights")
    void testConfidence(String type, double strength, double expected) {
        Connection connection = edge("movie:2", ConnectionType.fromWireName(type), strength, 0.5);

        assertEquals(expected, scorer.confidence(connection), 1e-9);
    }

    @Test
    @DisplayName("Rescoring should keep the analyzer confidence as evidence")
    void testRescore() {
        Connection rescored = scorer.rescore(edge("movie:2", ConnectionType.STUDIO_UNIVERSE, 0.9025, 0.95));

        assertEquals(0.7716375, rescored.getConfidence(), 1e-9);
        assertEquals(0.95, rescored.getMetadata().get(ConfidenceScorer.EVIDENCE_CONFIDENCE));
        assertEquals(0.9025, rescored.getStrength(), 1e-9);
    }

    @Test
    @DisplayName("Scoring twice should not change the evidence confidence")
    void testScoreStable() {
        RelationshipGraph graph = RelationshipGraph.builder(List.of("movie:1", "movie:2", "movie:3"))
                .add("movie:1", edge("movie:2", ConnectionType.GENRE_MATCH, 0.5, 0.95))
                .add("movie:1", edge("movie:3", ConnectionType.STUDIO_UNIVERSE, 0.5, 0.95))
                .build();

        RelationshipGraph scored = scorer.score(graph);
        RelationshipGraph twice = scorer.score(scored);

        List<Connection> direct = twice.connections("movie:1", ConnectionCategory.DIRECT);
        assertEquals("movie:3", direct.get(0).getTargetId());
        assertEquals(0.95, direct.get(1).getMetadata().get(ConfidenceScorer.EVIDENCE_CONFIDENCE));
        assertEquals(scored.toRecord(), twice.toRecord());
    }
}
