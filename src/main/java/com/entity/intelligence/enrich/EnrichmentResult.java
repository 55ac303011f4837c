package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;

import java.util.Objects;

/**
 * Outcome of enriching one entity.
 *
 * @param entity          the entity to keep; the input entity when excluded
 * @param excluded        whether the entity is dropped from the corpus
 * @param exclusionReason why the entity was dropped, {@code null} when kept
 */
public record EnrichmentResult(Entity entity, boolean excluded, String exclusionReason) {

    public EnrichmentResult {
        Objects.requireNonNull(entity, "entity is required");
        if (excluded && (exclusionReason == null || exclusionReason.isBlank())) {
            throw new IllegalArgumentException("exclusionReason is required when excluded");
        }
    }

    public static EnrichmentResult kept(Entity entity) {
        return new EnrichmentResult(entity, false, null);
    }

    public static EnrichmentResult excluded(Entity entity, String reason) {
        return new EnrichmentResult(entity, true, reason);
    }
}
