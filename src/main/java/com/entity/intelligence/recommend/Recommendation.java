package com.entity.intelligence.recommend;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A recommended target entity, taken from one connection of the source entity.
 *
 * @param targetId   recommended entity
 * @param score      final score of the connection it came from
 * @param reason     human-readable reason of that connection
 * @param category   category the connection is stored under
 * @param type       relationship type of the connection
 */
public record Recommendation(
        String targetId,
        double score,
        String reason,
        ConnectionCategory category,
        ConnectionType type
) {

    public Recommendation {
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(reason, "reason is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(type, "type is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0,1], got " + score);
        }
    }

    public static Recommendation of(Connection connection) {
        return new Recommendation(connection.getTargetId(), connection.getFinalScore(), connection.getReason(),
                connection.getCategory(), connection.getType());
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", targetId);
        record.put("score", score);
        record.put("reason", reason);
        record.put("category", category.getWireName());
        record.put("relationship", type.getWireName());
        return record;
    }
}
