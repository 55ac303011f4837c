package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.entity.intelligence.rules.ScoringConstants.PEER_DISCOUNT;
import static com.entity.intelligence.rules.ScoringConstants.PEER_THRESHOLD;

/**
 * Two-hop inference over direct connections: a→b and b→c yield a weaker a→c
 * {@code peer_recommendation} in the collaborative category.
 *
 * <p>Only the strongest path to each target is kept.</p>
 */
public class PeerInference {

    private static final double PEER_CONFIDENCE_SCALE = 0.8;

    public RelationshipGraph infer(RelationshipGraph graph) {
        RelationshipGraph.Builder builder = graph.toBuilder();
        for (String sourceId : graph.entityIds()) {
            peersOf(graph, sourceId).values().forEach(peer -> builder.add(sourceId, peer));
        }
        return builder.build();
    }

    /**
     * Peer edges of one entity keyed by target id.
     */
    SortedMap<String, Connection> peersOf(RelationshipGraph graph, String sourceId) {
        SortedMap<String, Connection> best = new TreeMap<>();
        for (Connection first : graph.connections(sourceId, ConnectionCategory.DIRECT)) {
            String peerId = first.getTargetId();
            if (!graph.contains(peerId)) {
                continue;
            }
            for (Connection second : graph.connections(peerId, ConnectionCategory.DIRECT)) {
                String targetId = second.getTargetId();
                if (targetId.equals(sourceId) || !graph.contains(targetId)) {
                    continue;
                }
                double strength = peerStrength(first, second);
                if (strength <= PEER_THRESHOLD) {
                    continue;
                }
                Connection current = best.get(targetId);
                if (current == null || strength > current.getStrength()) {
                    best.put(targetId, peer(targetId, peerId, strength, first, second));
                }
            }
        }
        return best;
    }

    static double peerStrength(Connection first, Connection second) {
        return first.getStrength() * second.getStrength() * PEER_DISCOUNT;
    }

    private static Connection peer(String targetId, String peerId, double strength,
                                   Connection first, Connection second) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intermediateEntity", peerId);
        metadata.put("pathStrength", List.of(first.getStrength(), second.getStrength()));
        metadata.put("pathTypes", List.of(first.getType().getWireName(), second.getType().getWireName()));
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.PEER_RECOMMENDATION)
                .strength(strength)
                .confidence(strength * PEER_CONFIDENCE_SCALE)
                .reason("Connected through " + peerId)
                .metadata(metadata)
                .build();
    }
}
