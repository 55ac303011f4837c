package com.entity.intelligence.api;

import com.entity.intelligence.cache.CacheConfig;
import com.entity.intelligence.similarity.CulturalWeights;

import java.time.Year;
import java.util.Objects;

import static com.entity.intelligence.rules.ScoringConstants.DEEP_MAX;
import static com.entity.intelligence.rules.ScoringConstants.DIVERSITY_THRESHOLD;
import static com.entity.intelligence.rules.ScoringConstants.MAX_CONNECTIONS_PER_CATEGORY;
import static com.entity.intelligence.rules.ScoringConstants.QUICK_MAX;

/**
 * Options for one engine build.
 * Configures output caps, the reference year for era relevance, person filtering,
 * which analyzers run, and the build-scoped profile cache.
 */
public class EngineOptions {

    private static final double DEFAULT_MIN_PERSON_POPULARITY = 10.0;

    private final int maxConnectionsPerCategory;
    private final int maxClusterConnectionsPerEntity;
    private final int quickRecommendations;
    private final int deepRecommendations;
    private final double diversityThreshold;
    private final int referenceYear;
    private final double minPersonPopularity;
    private final boolean personEnrichment;
    private final boolean catalogEnrichment;
    private final boolean contentAnalysis;
    private final boolean semanticAnalysis;
    private final boolean culturalAnalysis;
    private final boolean temporalAnalysis;
    private final boolean contextualAnalysis;
    private final boolean collaborativeAnalysis;
    private final CulturalWeights culturalWeights;
    private final CacheConfig cacheConfig;

    private EngineOptions(Builder builder) {
        this.maxConnectionsPerCategory = builder.maxConnectionsPerCategory;
        this.maxClusterConnectionsPerEntity = builder.maxClusterConnectionsPerEntity;
        this.quickRecommendations = builder.quickRecommendations;
        this.deepRecommendations = builder.deepRecommendations;
        this.diversityThreshold = builder.diversityThreshold;
        this.referenceYear = builder.referenceYear;
        this.minPersonPopularity = builder.minPersonPopularity;
        this.personEnrichment = builder.personEnrichment;
        this.catalogEnrichment = builder.catalogEnrichment;
        this.contentAnalysis = builder.contentAnalysis;
        this.semanticAnalysis = builder.semanticAnalysis;
        this.culturalAnalysis = builder.culturalAnalysis;
        this.temporalAnalysis = builder.temporalAnalysis;
        this.contextualAnalysis = builder.contextualAnalysis;
        this.collaborativeAnalysis = builder.collaborativeAnalysis;
        this.culturalWeights = builder.culturalWeights;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getMaxConnectionsPerCategory() {
        return maxConnectionsPerCategory;
    }

    /**
     * Cap on cluster connections per entity; zero means no cap.
     */
    public int getMaxClusterConnectionsPerEntity() {
        return maxClusterConnectionsPerEntity;
    }

    public int getQuickRecommendations() {
        return quickRecommendations;
    }

    public int getDeepRecommendations() {
        return deepRecommendations;
    }

    /**
     * Similarity above which a deep recommendation is demoted behind more diverse ones.
     * {@code 1.0} keeps the plain score order.
     */
    public double getDiversityThreshold() {
        return diversityThreshold;
    }

    public int getReferenceYear() {
        return referenceYear;
    }

    public double getMinPersonPopularity() {
        return minPersonPopularity;
    }

    public boolean isPersonEnrichment() {
        return personEnrichment;
    }

    /**
     * Whether companies, collections, genres and keywords are enriched from the titles
     * that reference them.
     */
    public boolean isCatalogEnrichment() {
        return catalogEnrichment;
    }

    public boolean isContentAnalysis() {
        return contentAnalysis;
    }

    public boolean isSemanticAnalysis() {
        return semanticAnalysis;
    }

    public boolean isCulturalAnalysis() {
        return culturalAnalysis;
    }

    public boolean isTemporalAnalysis() {
        return temporalAnalysis;
    }

    public boolean isContextualAnalysis() {
        return contextualAnalysis;
    }

    public boolean isCollaborativeAnalysis() {
        return collaborativeAnalysis;
    }

    public CulturalWeights getCulturalWeights() {
        return culturalWeights;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Creates default options: every analyzer enabled, reference year taken from the clock.
     */
    public static EngineOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options running only the content, semantic and cultural analyzers.
     */
    public static EngineOptions coreAnalyzersOnly() {
        return builder()
                .temporalAnalysis(false)
                .contextualAnalysis(false)
                .collaborativeAnalysis(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConnectionsPerCategory = MAX_CONNECTIONS_PER_CATEGORY;
        private int maxClusterConnectionsPerEntity = 0;
        private int quickRecommendations = QUICK_MAX;
        private int deepRecommendations = DEEP_MAX;
        private double diversityThreshold = DIVERSITY_THRESHOLD;
        private int referenceYear = Year.now().getValue();
        private double minPersonPopularity = DEFAULT_MIN_PERSON_POPULARITY;
        private boolean personEnrichment = true;
        private boolean catalogEnrichment = true;
        private boolean contentAnalysis = true;
        private boolean semanticAnalysis = true;
        private boolean culturalAnalysis = true;
        private boolean temporalAnalysis = true;
        private boolean contextualAnalysis = true;
        private boolean collaborativeAnalysis = true;
        private CulturalWeights culturalWeights = CulturalWeights.defaultWeights();
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder maxConnectionsPerCategory(int maxConnectionsPerCategory) {
            if (maxConnectionsPerCategory <= 0) {
                throw new IllegalArgumentException("maxConnectionsPerCategory must be positive");
            }
            this.maxConnectionsPerCategory = maxConnectionsPerCategory;
            return this;
        }

        public Builder maxClusterConnectionsPerEntity(int maxClusterConnectionsPerEntity) {
            if (maxClusterConnectionsPerEntity < 0) {
                throw new IllegalArgumentException("maxClusterConnectionsPerEntity must not be negative");
            }
            this.maxClusterConnectionsPerEntity = maxClusterConnectionsPerEntity;
            return this;
        }

        public Builder quickRecommendations(int quickRecommendations) {
            if (quickRecommendations < 0) {
                throw new IllegalArgumentException("quickRecommendations must not be negative");
            }
            this.quickRecommendations = quickRecommendations;
            return this;
        }

        public Builder deepRecommendations(int deepRecommendations) {
            if (deepRecommendations < 0) {
                throw new IllegalArgumentException("deepRecommendations must not be negative");
            }
            this.deepRecommendations = deepRecommendations;
            return this;
        }

        public Builder diversityThreshold(double diversityThreshold) {
            if (!(diversityThreshold >= 0.0 && diversityThreshold <= 1.0)) {
                throw new IllegalArgumentException("diversityThreshold must be in [0,1]");
            }
            this.diversityThreshold = diversityThreshold;
            return this;
        }

        public Builder referenceYear(int referenceYear) {
            if (referenceYear <= 0) {
                throw new IllegalArgumentException("referenceYear must be positive");
            }
            this.referenceYear = referenceYear;
            return this;
        }

        public Builder minPersonPopularity(double minPersonPopularity) {
            if (minPersonPopularity < 0.0 || Double.isNaN(minPersonPopularity)) {
                throw new IllegalArgumentException("minPersonPopularity must not be negative");
            }
            this.minPersonPopularity = minPersonPopularity;
            return this;
        }

        public Builder personEnrichment(boolean personEnrichment) {
            this.personEnrichment = personEnrichment;
            return this;
        }

        public Builder catalogEnrichment(boolean catalogEnrichment) {
            this.catalogEnrichment = catalogEnrichment;
            return this;
        }

        public Builder contentAnalysis(boolean contentAnalysis) {
            this.contentAnalysis = contentAnalysis;
            return this;
        }

        public Builder semanticAnalysis(boolean semanticAnalysis) {
            this.semanticAnalysis = semanticAnalysis;
            return this;
        }

        public Builder culturalAnalysis(boolean culturalAnalysis) {
            this.culturalAnalysis = culturalAnalysis;
            return this;
        }

        public Builder temporalAnalysis(boolean temporalAnalysis) {
            this.temporalAnalysis = temporalAnalysis;
            return this;
        }

        public Builder contextualAnalysis(boolean contextualAnalysis) {
            this.contextualAnalysis = contextualAnalysis;
            return this;
        }

        public Builder collaborativeAnalysis(boolean collaborativeAnalysis) {
            this.collaborativeAnalysis = collaborativeAnalysis;
            return this;
        }

        public Builder culturalWeights(CulturalWeights culturalWeights) {
            this.culturalWeights = Objects.requireNonNull(culturalWeights, "culturalWeights is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public EngineOptions build() {
            if (!contentAnalysis && !semanticAnalysis && !culturalAnalysis
                    && !temporalAnalysis && !contextualAnalysis && !collaborativeAnalysis) {
                throw new IllegalArgumentException("at least one analyzer must be enabled");
            }
            return new EngineOptions(this);
        }
    }

    @Override
    public String toString() {
        return "EngineOptions{" +
                "maxConnectionsPerCategory=" + maxConnectionsPerCategory +
                ", maxClusterConnectionsPerEntity=" + maxClusterConnectionsPerEntity +
                ", quickRecommendations=" + quickRecommendations +
                ", deepRecommendations=" + deepRecommendations +
                ", diversityThreshold=" + diversityThreshold +
                ", referenceYear=" + referenceYear +
                ", minPersonPopularity=" + minPersonPopularity +
                ", personEnrichment=" + personEnrichment +
                ", catalogEnrichment=" + catalogEnrichment +
                ", cacheConfig=" + cacheConfig +
                '}';
    }
}
