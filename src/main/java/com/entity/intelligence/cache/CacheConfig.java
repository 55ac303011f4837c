package com.entity.intelligence.cache;

/**
 * Configuration for the profile cache.
 *
 * @param maxSize    maximum number of cached profiles
 * @param ttlSeconds time-to-live in seconds for each profile
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 50,000 profiles, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }

    /**
     * Builds the cache this configuration describes.
     */
    public ProfileCache createCache() {
        return enabled ? new CaffeineProfileCache(this) : new NoOpProfileCache();
    }
}
