package com.entity.intelligence.analyzer;

import com.entity.intelligence.cache.NoOpProfileCache;
import com.entity.intelligence.cache.ProfileCache;

import java.time.Year;
import java.util.Objects;

/**
 * Build-scoped collaborators handed to every analyzer.
 *
 * @param cache         per-build profile cache
 * @param referenceYear the year release ages are measured against
 */
public record AnalysisContext(ProfileCache cache, int referenceYear) {

    public AnalysisContext {
        Objects.requireNonNull(cache, "cache is required");
        if (referenceYear <= 0) {
            throw new IllegalArgumentException("referenceYear must be > 0");
        }
    }

    /**
     * Uncached context measured against the current year.
     */
    public static AnalysisContext defaults() {
        return new AnalysisContext(new NoOpProfileCache(), Year.now().getValue());
    }

    public static AnalysisContext of(ProfileCache cache, int referenceYear) {
        return new AnalysisContext(cache, referenceYear);
    }
}
