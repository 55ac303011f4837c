package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Cluster;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticClustererTest {

    private static final List<String> IDS = List.of("movie:1", "movie:2", "movie:3", "movie:4", "movie:5");

    private final SemanticClusterer clusterer = new SemanticClusterer();

    private static Connection semantic(String targetId) {
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.SEMANTIC_SIMILARITY)
                .strength(0.7)
                .confidence(0.9)
                .reason("Similar themes: horror")
                .build();
    }

    @Test
    @DisplayName("Entities joined by semantic edges should form one cluster")
    void testCluster() {
        RelationshipGraph graph = RelationshipGraph.builder(IDS)
                .add("movie:1", semantic("movie:2"))
                .add("movie:1", semantic("movie:3"))
                .add("movie:2", semantic("movie:4"))
                .build();

        RelationshipGraph clustered = clusterer.cluster(graph);

        assertEquals(1, clustered.clusters().size());
        Cluster cluster = clustered.clusters().get(0);
        assertEquals("semantic_similarity_cluster", cluster.key());
        assertEquals(List.of("movie:1", "movie:2", "movie:3", "movie:4"), List.copyOf(cluster.members()));

        List<Connection> links = clustered.connections("movie:3", ConnectionCategory.CLUSTER);
        assertEquals(List.of("movie:1", "movie:2", "movie:4"), links.stream().map(Connection::getTargetId).toList());
        Connection link = links.get(0);
        assertEquals(ConnectionType.CLUSTER_MEMBER, link.getType());
        assertEquals(0.6, link.getStrength(), 1e-9);
        assertEquals(0.7, link.getConfidence(), 1e-9);
        assertEquals("Part of semantic_similarity_cluster cluster", link.getReason());
        assertTrue(clustered.connections("movie:5", ConnectionCategory.CLUSTER).isEmpty());
        assertEquals(12, clustered.connectionCount(ConnectionCategory.CLUSTER));
    }

    @Test
    @DisplayName("Groups below the minimum size should not cluster")
    void testTooSmall() {
        RelationshipGraph graph = RelationshipGraph.builder(IDS)
                .add("movie:1", semantic("movie:2"))
                .add("movie:2", semantic("movie:1"))
                .build();

        assertTrue(clusterer.findClusters(graph).isEmpty());
        assertEquals(0, clusterer.cluster(graph).connectionCount(ConnectionCategory.CLUSTER));
    }

    @Test
    @DisplayName("Reclustering should recompute instead of accumulating")
    void testRecluster() {
        RelationshipGraph graph = RelationshipGraph.builder(IDS)
                .add("movie:1", semantic("movie:2"))
                .add("movie:1", semantic("movie:3"))
                .build();

        RelationshipGraph once = clusterer.cluster(graph);

        assertEquals(once.clusters(), clusterer.findClusters(once));
    }
}
