package com.entity.intelligence.rules;

/**
 * Named scoring constants shared by the analyzers, the graph builder and the
 * recommendation compiler. Heuristic vocabularies live in {@link RuleTables},
 * {@link SemanticRules} and {@link CulturalRules}.
 */
public final class ScoringConstants {

    private ScoringConstants() {
        // Constants holder
    }

    // Genre match
    public static final double GENRE_MATCH_THRESHOLD = 0.3;
    public static final double GENRE_STRENGTH_CAP = 0.9;
    public static final double GENRE_MULTI_MATCH_STEP = 0.1;
    public static final double GENRE_BASE_CONFIDENCE = 0.8;
    public static final double GENRE_DISTINCT_CONFIDENCE = 0.9;
    public static final double GENRE_CONFIDENCE_STEP = 0.05;
    public static final double GENRE_CONFIDENCE_CAP = 0.95;

    // Studio universe
    public static final double STUDIO_BASE_STRENGTH = 0.95;
    public static final double STUDIO_STRENGTH_CAP = 0.98;
    public static final double STUDIO_MAJOR_IMPORTANCE = 0.95;
    public static final double STUDIO_PRESTIGE_IMPORTANCE = 0.85;
    public static final double STUDIO_DEFAULT_IMPORTANCE = 0.7;
    public static final double STUDIO_CONFIDENCE = 0.95;

    // Talent overlap
    public static final double TALENT_BASE_STRENGTH = 0.4;
    public static final double TALENT_PER_PERSON_STEP = 0.1;
    public static final double TALENT_DIRECTOR_BONUS = 1.3;
    public static final double TALENT_KEY_ROLES_BONUS = 1.2;
    public static final double TALENT_STRENGTH_CAP = 0.95;
    public static final double TALENT_MIN_STRENGTH = 0.2;
    public static final double TALENT_BASE_IMPORTANCE = 0.7;
    public static final double TALENT_HEADLINER_IMPORTANCE = 0.9;
    public static final double TALENT_HEADLINER_THRESHOLD = 0.8;
    public static final double TALENT_BASE_CONFIDENCE = 0.75;
    public static final double TALENT_KEY_ROLE_CONFIDENCE = 0.9;
    public static final double TALENT_CONFIDENCE_STEP = 0.03;
    public static final double TALENT_CONFIDENCE_CAP = 0.95;
    public static final double CAST_DEFAULT_IMPORTANCE = 0.5;
    public static final double CAST_POPULARITY_THRESHOLD = 20.0;
    public static final double CAST_POPULARITY_BOOST = 0.1;
    public static final double CAST_IMPORTANCE_CAP = 0.95;
    public static final double CREW_DEFAULT_IMPORTANCE = 0.6;

    // Franchise member
    public static final double FRANCHISE_STRENGTH = 0.92;
    public static final double FRANCHISE_CONFIDENCE = 0.98;

    // Rating similarity
    public static final double RATING_FLOOR = 7.0;
    public static final double RATING_MAX_DIFFERENCE = 1.0;
    public static final double RATING_STRENGTH_SCALE = 0.6;
    public static final double RATING_CONFIDENCE = 0.7;

    // Semantic similarity
    public static final double SEMANTIC_THRESHOLD = 0.3;
    public static final int SEMANTIC_MAX_CONNECTIONS = 20;
    public static final double SEMANTIC_STRONG_THEME_BOOST = 1.3;
    public static final double SEMANTIC_THREE_AXES_BOOST = 1.2;
    public static final double SEMANTIC_TWO_AXES_BOOST = 1.1;
    public static final double SEMANTIC_HORROR_DARK_BOOST = 1.2;
    public static final double SEMANTIC_ROMANCE_EMOTIONAL_BOOST = 1.2;
    public static final double SEMANTIC_FAMILY_BOOST = 1.15;
    public static final double SEMANTIC_BASE_CONFIDENCE = 0.7;
    public static final double SEMANTIC_STRONG_THEME_CONFIDENCE = 0.85;
    public static final double SEMANTIC_HIGH_SCORE = 0.7;

    // Cultural significance
    public static final double CULTURAL_THRESHOLD = 0.3;
    public static final int CULTURAL_MAX_CONNECTIONS = 15;
    public static final double CULTURAL_INSIGNIFICANCE = 0.2;
    public static final double CULTURAL_BASE_SIGNIFICANCE = 0.3;
    public static final double CULTURAL_MOVEMENT_MIN_RELEVANCE = 0.5;
    public static final double CULTURAL_BASE_CONFIDENCE = 0.6;
    public static final double CULTURAL_CONFIDENCE_CAP = 0.95;

    // Contextual signals
    public static final double SAME_DECADE_STRENGTH = 0.4;
    public static final double SAME_DECADE_CONFIDENCE = 0.6;
    public static final double CULTURAL_MOVEMENT_STRENGTH = 0.7;
    public static final double CULTURAL_MOVEMENT_CONFIDENCE = 0.8;

    // Temporal signals
    public static final int CONCURRENT_RELEASE_MAX_GAP = 2;
    public static final double SAME_YEAR_STRENGTH = 0.6;
    public static final double SAME_YEAR_BONUS = 1.2;
    public static final double ONE_YEAR_STRENGTH = 0.5;
    public static final double TWO_YEAR_STRENGTH = 0.4;
    public static final double CONCURRENT_RELEASE_CONFIDENCE = 0.6;
    public static final double SAME_YEAR_CONFIDENCE = 0.8;
    public static final double FRANCHISE_TIMING_BASE = 0.8;
    public static final double FRANCHISE_TIMING_CAP = 0.95;
    public static final double FRANCHISE_TIMING_CONFIDENCE = 0.85;
    public static final double FRANCHISE_TIMING_THRESHOLD = 0.3;

    // Collaborative signals
    public static final int COLLABORATIVE_MIN_SHARED_GENRES = 2;
    public static final double COLLABORATIVE_MAX_RATING_DISTANCE = 2.0;
    public static final double COLLABORATIVE_THRESHOLD = 0.3;
    public static final double COLLABORATIVE_CONFIDENCE_SCALE = 0.8;

    // Graph post-processing
    public static final double REVERSE_DISCOUNT = 0.9;
    public static final String REVERSE_PREFIX = "Reverse: ";
    public static final double PEER_DISCOUNT = 0.7;
    public static final double PEER_THRESHOLD = 0.3;
    public static final double CLUSTER_STRENGTH = 0.6;
    public static final int MAX_CONNECTIONS_PER_CATEGORY = 15;

    // Recommendations
    public static final double QUICK_MIN_CONFIDENCE = 0.8;
    public static final int QUICK_MAX = 5;
    public static final int DEEP_MAX = 25;
    /** Deep candidates more similar than this to an earlier pick are moved behind the diverse ones. */
    public static final double DIVERSITY_THRESHOLD = 0.7;

    // Search index
    public static final int MIN_TERM_LENGTH = 2;
    public static final int MIN_CONTENT_WORD_LENGTH = 3;
    public static final int MAX_CONTENT_WORDS = 20;
    public static final int MAX_INDEXED_CAST = 10;
    public static final int MIN_COMPANY_WORD_LENGTH = 4;
    public static final double AWARD_WORTHY_RATING = 8.0;
    public static final double MAINSTREAM_HIT_POPULARITY = 80.0;
    public static final int HIGHLY_CONNECTED = 50;
    public static final int WELL_CONNECTED = 20;
    public static final int CONNECTED = 5;

    /**
     * Clamps a score to [0, 1].
     */
    public static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
