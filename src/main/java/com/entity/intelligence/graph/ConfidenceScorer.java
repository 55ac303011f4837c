package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.entity.intelligence.rules.ScoringConstants.clamp;

/**
 * Final calibration: confidence becomes {@code strength × category weight × type weight}.
 * The analyzer's own confidence is kept as {@code evidenceConfidence} metadata.
 */
public class ConfidenceScorer {

    public static final String EVIDENCE_CONFIDENCE = "evidenceConfidence";

    public double confidence(Connection connection) {
        return clamp(connection.getStrength()
                * connection.getCategory().getConfidenceWeight()
                * connection.getType().getTypeConfidence());
    }

    public Connection rescore(Connection connection) {
        Map<String, Object> metadata = new LinkedHashMap<>(connection.getMetadata());
        metadata.putIfAbsent(EVIDENCE_CONFIDENCE, connection.getConfidence());
        return connection.toBuilder()
                .confidence(confidence(connection))
                .metadata(metadata)
                .build();
    }

    /**
     * Rescores every connection; the built graph orders each list by final score.
     */
    public RelationshipGraph score(RelationshipGraph graph) {
        RelationshipGraph.Builder builder = RelationshipGraph.builder(graph.entityIds()).clusters(graph.clusters());
        for (String entityId : graph.entityIds()) {
            for (Map.Entry<ConnectionCategory, List<Connection>> entry : graph.connectionsOf(entityId).entrySet()) {
                for (Connection connection : entry.getValue()) {
                    builder.add(entityId, rescore(connection));
                }
            }
        }
        return builder.build();
    }
}
