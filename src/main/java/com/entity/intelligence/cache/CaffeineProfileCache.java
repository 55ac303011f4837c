package com.entity.intelligence.cache;

import com.entity.intelligence.core.model.Entity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Caffeine-backed profile cache with an entity id index for targeted invalidation.
 */
public class CaffeineProfileCache implements ProfileCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineProfileCache.class);

    private final Cache<CacheKey, Object> cache;
    // Secondary index: entityId -> keys of profiles computed for that entity
    private final ConcurrentMap<String, Set<CacheKey>> entityIndex = new ConcurrentHashMap<>();

    public CaffeineProfileCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((key, value, cause) -> {
                    if (key instanceof CacheKey ck) {
                        removeFromIndex(ck);
                    }
                })
                .build();
        log.info("CaffeineProfileCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public <T> T getOrCompute(String profileType, Entity entity, Class<T> type, Function<Entity, T> loader) {
        CacheKey key = new CacheKey(profileType, entity.getId());
        Object value = cache.get(key, k -> {
            entityIndex.computeIfAbsent(entity.getId(), id -> ConcurrentHashMap.newKeySet()).add(k);
            return loader.apply(entity);
        });
        return type.cast(value);
    }

    @Override
    public void invalidate(String entityId) {
        Set<CacheKey> keys = entityIndex.remove(entityId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cached profiles for entity {}", keys.size(), entityId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        entityIndex.clear();
        log.debug("Invalidated all cached profiles");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    private void removeFromIndex(CacheKey key) {
        Set<CacheKey> keys = entityIndex.get(key.entityId());
        if (keys != null) {
            keys.remove(key);
        }
    }

    /**
     * Cache key combining the profile family and the entity id.
     */
    record CacheKey(String profileType, String entityId) {}
}
