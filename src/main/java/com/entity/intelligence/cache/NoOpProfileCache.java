package com.entity.intelligence.cache;

import com.entity.intelligence.core.model.Entity;

import java.util.function.Function;

/**
 * Cache that stores nothing. Every lookup runs the loader.
 */
public class NoOpProfileCache implements ProfileCache {

    @Override
    public <T> T getOrCompute(String profileType, Entity entity, Class<T> type, Function<Entity, T> loader) {
        return loader.apply(entity);
    }

    @Override
    public void invalidate(String entityId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
