package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Cluster;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.entity.intelligence.rules.ScoringConstants.CLUSTER_STRENGTH;

/**
 * Groups entities appearing on either side of a semantic connection into one cluster per
 * connection type, and links every member of a cluster with at least
 * {@value Cluster#MIN_MEMBERS} entities to every other member.
 *
 * <p>Clusters are recomputed from the current connections on every build.</p>
 */
public class SemanticClusterer {

    private static final double CLUSTER_CONFIDENCE = 0.7;

    public RelationshipGraph cluster(RelationshipGraph graph) {
        List<Cluster> clusters = findClusters(graph);
        RelationshipGraph.Builder builder = graph.toBuilder().clusters(clusters);
        for (Cluster cluster : clusters) {
            for (String member : cluster.members()) {
                if (!builder.contains(member)) {
                    continue;
                }
                for (String other : cluster.members()) {
                    if (!other.equals(member)) {
                        builder.add(member, membership(other, cluster.key()));
                    }
                }
            }
        }
        return builder.build();
    }

    List<Cluster> findClusters(RelationshipGraph graph) {
        SortedMap<String, SortedSet<String>> groups = new TreeMap<>();
        for (String entityId : graph.entityIds()) {
            for (Connection connection : graph.connections(entityId, ConnectionCategory.SEMANTIC)) {
                SortedSet<String> members = groups.computeIfAbsent(clusterKey(connection), k -> new TreeSet<>());
                members.add(entityId);
                members.add(connection.getTargetId());
            }
        }
        List<Cluster> clusters = new ArrayList<>();
        for (Map.Entry<String, SortedSet<String>> group : groups.entrySet()) {
            if (group.getValue().size() >= Cluster.MIN_MEMBERS) {
                clusters.add(new Cluster(group.getKey(), group.getValue()));
            }
        }
        return clusters;
    }

    static String clusterKey(Connection connection) {
        return connection.getType().getWireName() + "_cluster";
    }

    private static Connection membership(String targetId, String clusterKey) {
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.CLUSTER_MEMBER)
                .strength(CLUSTER_STRENGTH)
                .confidence(CLUSTER_CONFIDENCE)
                .reason("Part of " + clusterKey + " cluster")
                .metadata(Map.of("cluster", clusterKey))
                .build();
    }
}
