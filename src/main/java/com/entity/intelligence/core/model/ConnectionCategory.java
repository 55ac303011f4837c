package com.entity.intelligence.core.model;

/**
 * Partitions of an entity's outbound connections in the relationship graph.
 * Each category carries the confidence weight applied during graph scoring.
 */
public enum ConnectionCategory {
    DIRECT("direct", 0.9),
    SEMANTIC("semantic", 0.7),
    CONTEXTUAL("contextual", 0.6),
    COLLABORATIVE("collaborative", 0.8),
    TEMPORAL("temporal", 0.5),
    CULTURAL("cultural", 0.7),
    CLUSTER("cluster", 0.6);

    private final String wireName;
    private final double confidenceWeight;

    ConnectionCategory(String wireName, double confidenceWeight) {
        this.wireName = wireName;
        this.confidenceWeight = confidenceWeight;
    }

    public String getWireName() {
        return wireName;
    }

    public double getConfidenceWeight() {
        return confidenceWeight;
    }

    public static ConnectionCategory fromWireName(String wireName) {
        for (ConnectionCategory category : values()) {
            if (category.wireName.equals(wireName)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown connection category: " + wireName);
    }
}
