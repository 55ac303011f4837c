package com.entity.intelligence.cache;

/**
 * Cache counters.
 *
 * @param hitCount      number of cache hits
 * @param missCount     number of cache misses
 * @param evictionCount number of evictions
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    /**
     * Counter growth since an earlier snapshot. Size is taken from this snapshot.
     */
    public CacheStats minus(CacheStats earlier) {
        return new CacheStats(
                hitCount - earlier.hitCount,
                missCount - earlier.missCount,
                evictionCount - earlier.evictionCount,
                size);
    }
}
