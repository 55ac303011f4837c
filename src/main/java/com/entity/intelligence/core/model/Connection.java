package com.entity.intelligence.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A scored, typed, directed edge from a source entity to {@link #getTargetId()}.
 *
 * <p>The source is implied by where the connection is stored. Strength and
 * confidence are both in [0, 1]; the ranking score is their product and is never
 * stored on its own. Instances are immutable; use {@link #toBuilder()} to derive
 * a modified copy.</p>
 */
public final class Connection {

    /**
     * Ranking order: final score descending, then target id, type and reason ascending.
     */
    public static final Comparator<Connection> BY_FINAL_SCORE =
            Comparator.comparingDouble(Connection::getFinalScore).reversed()
                    .thenComparing(Connection::getTargetId)
                    .thenComparing(c -> c.getType().getWireName())
                    .thenComparing(Connection::getReason);

    /**
     * Evidence order: strength descending with the same tiebreak as {@link #BY_FINAL_SCORE}.
     */
    public static final Comparator<Connection> BY_STRENGTH =
            Comparator.comparingDouble(Connection::getStrength).reversed()
                    .thenComparing(Connection::getTargetId)
                    .thenComparing(c -> c.getType().getWireName())
                    .thenComparing(Connection::getReason);

    private final String targetId;
    private final ConnectionType type;
    private final double strength;
    private final double confidence;
    private final String reason;
    private final Map<String, Object> metadata;
    private final boolean bidirectional;

    private Connection(Builder builder) {
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.strength = requireUnit(builder.strength, "strength");
        this.confidence = requireUnit(builder.confidence, "confidence");
        Objects.requireNonNull(builder.reason, "reason is required");
        if (builder.reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be blank");
        }
        this.reason = builder.reason;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new TreeMap<>(builder.metadata))
                : Map.of();
        this.bidirectional = builder.bidirectional;
    }

    private static double requireUnit(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be in [0,1], got " + value);
        }
        return value;
    }

    public String getTargetId() {
        return targetId;
    }

    public ConnectionType getType() {
        return type;
    }

    public ConnectionCategory getCategory() {
        return type.getCategory();
    }

    public double getStrength() {
        return strength;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Ranking score, {@code strength × confidence}.
     */
    public double getFinalScore() {
        return strength * confidence;
    }

    public String getReason() {
        return reason;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * True for reverse edges added by bidirectional enhancement.
     */
    public boolean isBidirectional() {
        return bidirectional;
    }

    /**
     * Plain map form of this connection, as written to the graph artifact.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", targetId);
        record.put("type", type.getWireName());
        record.put("strength", strength);
        record.put("confidence", confidence);
        record.put("finalScore", getFinalScore());
        record.put("reason", reason);
        if (bidirectional) {
            record.put("bidirectional", true);
        }
        if (!metadata.isEmpty()) {
            record.put("metadata", metadata);
        }
        return record;
    }

    public Builder toBuilder() {
        return new Builder()
                .targetId(targetId)
                .type(type)
                .strength(strength)
                .confidence(confidence)
                .reason(reason)
                .metadata(metadata)
                .bidirectional(bidirectional);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection that = (Connection) o;
        return Double.compare(that.strength, strength) == 0
                && Double.compare(that.confidence, confidence) == 0
                && bidirectional == that.bidirectional
                && targetId.equals(that.targetId)
                && type == that.type
                && reason.equals(that.reason)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetId, type, strength, confidence, reason, metadata, bidirectional);
    }

    @Override
    public String toString() {
        return "Connection{" +
                "targetId='" + targetId + '\'' +
                ", type=" + type.getWireName() +
                ", strength=" + strength +
                ", confidence=" + confidence +
                ", reason='" + reason + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String targetId;
        private ConnectionType type;
        private double strength;
        private double confidence;
        private String reason;
        private Map<String, Object> metadata;
        private boolean bidirectional;

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder type(ConnectionType type) {
            this.type = type;
            return this;
        }

        public Builder strength(double strength) {
            this.strength = strength;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder bidirectional(boolean bidirectional) {
            this.bidirectional = bidirectional;
            return this;
        }

        public Connection build() {
            return new Connection(this);
        }
    }
}
