package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.entity.intelligence.rules.ScoringConstants.REVERSE_DISCOUNT;
import static com.entity.intelligence.rules.ScoringConstants.REVERSE_PREFIX;

/**
 * Symmetrizes a graph: every edge a→b whose target is in the graph gains a discounted
 * reverse edge b→a in the same category.
 */
public class BidirectionalEnhancer {

    public RelationshipGraph enhance(RelationshipGraph graph) {
        RelationshipGraph.Builder builder = graph.toBuilder();
        for (String sourceId : graph.entityIds()) {
            for (Map.Entry<ConnectionCategory, List<Connection>> entry : graph.connectionsOf(sourceId).entrySet()) {
                for (Connection connection : entry.getValue()) {
                    if (builder.contains(connection.getTargetId())) {
                        builder.add(connection.getTargetId(), reverse(connection, sourceId));
                    }
                }
            }
        }
        return builder.build();
    }

    /**
     * Reverse of an edge pointing back at {@code sourceId}, with strength and confidence
     * discounted by {@value com.entity.intelligence.rules.ScoringConstants#REVERSE_DISCOUNT}.
     */
    static Connection reverse(Connection connection, String sourceId) {
        Map<String, Object> metadata = new LinkedHashMap<>(connection.getMetadata());
        metadata.put("originalStrength", connection.getStrength());
        return connection.toBuilder()
                .targetId(sourceId)
                .strength(connection.getStrength() * REVERSE_DISCOUNT)
                .confidence(connection.getConfidence() * REVERSE_DISCOUNT)
                .reason(REVERSE_PREFIX + connection.getReason())
                .metadata(metadata)
                .bidirectional(true)
                .build();
    }
}
