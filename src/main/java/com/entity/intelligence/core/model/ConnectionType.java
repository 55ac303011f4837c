package com.entity.intelligence.core.model;

/**
 * Closed taxonomy of connection types.
 *
 * <p>Each type belongs to the category its analyzer fills and carries a
 * relationship-type confidence weight used during graph scoring. Types without a
 * dedicated weight use 1.0.</p>
 */
public enum ConnectionType {
    GENRE_MATCH("genre_match", ConnectionCategory.DIRECT, 0.8),
    STUDIO_UNIVERSE("studio_universe", ConnectionCategory.DIRECT, 0.95),
    TALENT_OVERLAP("talent_overlap", ConnectionCategory.DIRECT, 0.9),
    FRANCHISE_MEMBER("franchise_member", ConnectionCategory.DIRECT, 1.0),
    RATING_SIMILARITY("rating_similarity", ConnectionCategory.DIRECT, 1.0),
    SEMANTIC_SIMILARITY("semantic_similarity", ConnectionCategory.SEMANTIC, 0.7),
    CULTURAL_SIGNIFICANCE("cultural_significance", ConnectionCategory.CULTURAL, 1.0),
    SAME_DECADE("same_decade", ConnectionCategory.CONTEXTUAL, 1.0),
    CULTURAL_MOVEMENT("cultural_movement", ConnectionCategory.CONTEXTUAL, 0.75),
    CONCURRENT_RELEASE("concurrent_release", ConnectionCategory.TEMPORAL, 1.0),
    FRANCHISE_TIMING("franchise_timing", ConnectionCategory.TEMPORAL, 0.85),
    COLLABORATIVE_FILTERING("collaborative_filtering", ConnectionCategory.COLLABORATIVE, 0.8),
    PEER_RECOMMENDATION("peer_recommendation", ConnectionCategory.COLLABORATIVE, 0.6),
    CLUSTER_MEMBER("cluster_member", ConnectionCategory.CLUSTER, 1.0);

    private final String wireName;
    private final ConnectionCategory category;
    private final double typeConfidence;

    ConnectionType(String wireName, ConnectionCategory category, double typeConfidence) {
        this.wireName = wireName;
        this.category = category;
        this.typeConfidence = typeConfidence;
    }

    public String getWireName() {
        return wireName;
    }

    public ConnectionCategory getCategory() {
        return category;
    }

    public double getTypeConfidence() {
        return typeConfidence;
    }

    public static ConnectionType fromWireName(String wireName) {
        for (ConnectionType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown connection type: " + wireName);
    }
}
