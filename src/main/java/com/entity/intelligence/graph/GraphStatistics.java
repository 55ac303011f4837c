package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a relationship graph, plus a consistency check.
 *
 * @param entities              number of entities in the graph
 * @param connections           total number of connections
 * @param byCategory            connection count per category
 * @param strong                connections with final score at least 0.8
 * @param medium                connections with final score at least 0.5
 * @param weak                  remaining connections
 * @param bidirectional         reverse edges added by symmetrization
 * @param isolated              entities without any connection
 * @param clusters              number of clusters
 * @param averageConnections    connections per entity
 * @param invalidConnections    self-loops and edges pointing outside the graph
 * @param missingReverse        forward edges whose target has no edge back in the same category
 */
public record GraphStatistics(
        int entities,
        long connections,
        Map<ConnectionCategory, Long> byCategory,
        long strong,
        long medium,
        long weak,
        long bidirectional,
        int isolated,
        int clusters,
        double averageConnections,
        long invalidConnections,
        long missingReverse
) {

    public static final double STRONG_THRESHOLD = 0.8;
    public static final double MEDIUM_THRESHOLD = 0.5;

    public GraphStatistics {
        byCategory = Collections.unmodifiableMap(new EnumMap<>(byCategory));
    }

    public static GraphStatistics of(RelationshipGraph graph) {
        Map<ConnectionCategory, Long> byCategory = new EnumMap<>(ConnectionCategory.class);
        for (ConnectionCategory category : ConnectionCategory.values()) {
            byCategory.put(category, 0L);
        }
        long total = 0;
        long strong = 0;
        long medium = 0;
        long weak = 0;
        long bidirectional = 0;
        int isolated = 0;
        long invalid = 0;
        long missingReverse = 0;

        for (String entityId : graph.entityIds()) {
            int entityConnections = 0;
            for (Map.Entry<ConnectionCategory, List<Connection>> entry : graph.connectionsOf(entityId).entrySet()) {
                for (Connection connection : entry.getValue()) {
                    total++;
                    entityConnections++;
                    byCategory.merge(entry.getKey(), 1L, Long::sum);

                    double score = connection.getFinalScore();
                    if (score >= STRONG_THRESHOLD) {
                        strong++;
                    } else if (score >= MEDIUM_THRESHOLD) {
                        medium++;
                    } else {
                        weak++;
                    }

                    if (connection.getTargetId().equals(entityId) || !graph.contains(connection.getTargetId())) {
                        invalid++;
                        continue;
                    }
                    if (connection.isBidirectional()) {
                        bidirectional++;
                    } else if (!hasReverse(graph, entityId, connection)) {
                        missingReverse++;
                    }
                }
            }
            if (entityConnections == 0) {
                isolated++;
            }
        }

        double average = graph.size() > 0 ? (double) total / graph.size() : 0.0;
        return new GraphStatistics(graph.size(), total, byCategory, strong, medium, weak, bidirectional,
                isolated, graph.clusters().size(), average, invalid, missingReverse);
    }

    private static boolean hasReverse(RelationshipGraph graph, String sourceId, Connection connection) {
        return graph.connections(connection.getTargetId(), connection.getCategory()).stream()
                .anyMatch(reverse -> reverse.getTargetId().equals(sourceId));
    }

    public boolean isValid() {
        return invalidConnections == 0;
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> categories = new LinkedHashMap<>();
        byCategory.forEach((category, count) -> categories.put(category.getWireName(), count));

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("totalEntities", entities);
        record.put("totalConnections", connections);
        record.put("connectionTypeDistribution", categories);
        record.put("strengthDistribution", Map.of("strong", strong, "medium", medium, "weak", weak));
        record.put("bidirectionalPairs", bidirectional);
        record.put("isolatedNodes", isolated);
        record.put("totalClusters", clusters);
        record.put("averageConnections", averageConnections);
        record.put("invalidConnections", invalidConnections);
        record.put("missingReverseConnections", missingReverse);
        return record;
    }
}
