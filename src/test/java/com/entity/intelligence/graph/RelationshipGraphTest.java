package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Cluster;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipGraphTest {

    private static final List<String> IDS = List.of("movie:1", "movie:2", "movie:3", "movie:4");

    private static Connection edge(String targetId, ConnectionType type, double strength, double confidence) {
        return Connection.builder()
                .targetId(targetId)
                .type(type)
                .strength(strength)
                .confidence(confidence)
                .reason("test " + type.getWireName())
                .build();
    }

    @Test
    @DisplayName("Every entity should have an empty list for every category")
    void testEmptyCategories() {
        RelationshipGraph graph = RelationshipGraph.builder(IDS).build();

        assertEquals(4, graph.size());
        for (ConnectionCategory category : ConnectionCategory.values()) {
            assertEquals(List.of(), graph.connections("movie:1", category));
        }
        assertEquals(0, graph.connectionCount());
        assertTrue(graph.allConnections("movie:99").isEmpty());
    }

    @Test
    @DisplayName("Unknown sources and self-loops should be rejected")
    void testRejectedEdges() {
        RelationshipGraph.Builder builder = RelationshipGraph.builder(IDS);

        assertThrows(IllegalArgumentException.class,
                () -> builder.add("movie:9", edge("movie:1", ConnectionType.GENRE_MATCH, 0.5, 0.5)));
        assertThrows(IllegalArgumentException.class,
                () -> builder.add("movie:1", edge("movie:1", ConnectionType.GENRE_MATCH, 0.5, 0.5)));
    }

    @Test
    @DisplayName("Connections should be filed by category and ordered by final score")
    void testOrdering() {
        RelationshipGraph graph = RelationshipGraph.builder(IDS)
                .add("movie:1", edge("movie:2", ConnectionType.GENRE_MATCH, 0.5, 0.5))
                .add("movie:1", edge("movie:3", ConnectionType.STUDIO_UNIVERSE, 0.9, 0.9))
                .add("movie:1", edge("movie:4", ConnectionType.SAME_DECADE, 0.4, 0.6))
                .build();

        List<Connection> direct = graph.connections("movie:1", ConnectionCategory.DIRECT);
        assertEquals(List.of("movie:3", "movie:2"), direct.stream().map(Connection::getTargetId).toList());
        assertEquals(1, graph.connectionCount(ConnectionCategory.CONTEXTUAL));
        assertEquals(3, graph.connectionCount());
        assertThrows(UnsupportedOperationException.class, () -> direct.add(direct.get(0)));
    }

    @Test
    @DisplayName("Capping should keep the best connections of each category")
    void testCapped() {
        RelationshipGraph.Builder builder = RelationshipGraph.builder(IDS);
        builder.add("movie:1", edge("movie:2", ConnectionType.GENRE_MATCH, 0.3, 0.5));
        builder.add("movie:1", edge("movie:3", ConnectionType.GENRE_MATCH, 0.9, 0.5));
        builder.add("movie:1", edge("movie:4", ConnectionType.GENRE_MATCH, 0.6, 0.5));
        builder.add("movie:1", edge("movie:2", ConnectionType.CLUSTER_MEMBER, 0.6, 0.7));
        builder.add("movie:1", edge("movie:3", ConnectionType.CLUSTER_MEMBER, 0.6, 0.7));
        RelationshipGraph graph = builder.build();

        RelationshipGraph capped = graph.capped(2, 0);
        assertEquals(List.of("movie:3", "movie:4"), capped.connections("movie:1", ConnectionCategory.DIRECT)
                .stream().map(Connection::getTargetId).toList());
        assertEquals(2, capped.connections("movie:1", ConnectionCategory.CLUSTER).size());

        assertEquals(1, graph.capped(2, 1).connections("movie:1", ConnectionCategory.CLUSTER).size());
    }

    @Test
    @DisplayName("Record form should nest category wire names under entity ids")
    @SuppressWarnings("unchecked")
    void testToRecord() {
        RelationshipGraph graph = RelationshipGraph.builder(List.of("movie:1", "movie:2"))
                .add("movie:1", edge("movie:2", ConnectionType.GENRE_MATCH, 0.5, 0.5))
                .clusters(List.of(new Cluster("semantic_similarity_cluster",
                        new TreeSet<>(List.of("movie:1", "movie:2", "movie:3")))))
                .build();

        Map<String, Object> record = graph.toRecord();

        assertEquals(List.of("movie:1", "movie:2"), List.copyOf(record.keySet()));
        Map<String, Object> categories = (Map<String, Object>) record.get("movie:1");
        assertEquals(ConnectionCategory.values().length, categories.size());
        assertEquals(1, ((List<?>) categories.get("direct")).size());
        assertEquals(1, graph.clusters().size());
    }
}
