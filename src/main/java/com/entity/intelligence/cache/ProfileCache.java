package com.entity.intelligence.cache;

import com.entity.intelligence.core.model.Entity;

import java.util.function.Function;

/**
 * Cache of per-entity analysis profiles (content, semantic, cultural), keyed by
 * profile type and entity id. One instance serves a single build over a frozen
 * corpus and is invalidated when the build finishes.
 */
public interface ProfileCache {

    /**
     * Returns the cached profile, computing and storing it on a miss.
     *
     * @param profileType name of the profile family, e.g. {@code "semantic"}
     * @param entity      the entity the profile describes
     * @param type        expected profile class
     * @param loader      computes the profile on a miss
     */
    <T> T getOrCompute(String profileType, Entity entity, Class<T> type, Function<Entity, T> loader);

    /**
     * Invalidates every profile computed for the given entity id.
     */
    void invalidate(String entityId);

    void invalidateAll();

    CacheStats getStats();
}
