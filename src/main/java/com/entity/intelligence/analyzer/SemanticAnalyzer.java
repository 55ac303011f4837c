package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.rules.SemanticRules;
import com.entity.intelligence.rules.SemanticRules.Axis;
import com.entity.intelligence.similarity.JaccardSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.entity.intelligence.rules.ScoringConstants.*;

/**
 * Thematic similarity from text patterns, genre semantics and title heuristics,
 * compared axis by axis.
 */
public class SemanticAnalyzer implements ConnectionAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    static final String PROFILE = "semantic";

    private static final double TOTAL_AXIS_WEIGHT;

    static {
        double total = 0;
        for (Axis axis : Axis.values()) {
            total += axis.getWeight();
        }
        TOTAL_AXIS_WEIGHT = total;
    }

    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    /**
     * Per-axis comparison of two profiles.
     *
     * @param common     shared keywords per axis
     * @param axisScores Jaccard score per axis
     * @param score      weighted, boosted score in [0, 1]
     */
    record Similarity(Map<Axis, Set<String>> common, Map<Axis, Double> axisScores, double score) {

        Set<String> common(Axis axis) {
            return common.get(axis);
        }

        int totalMatches() {
            return common.values().stream().mapToInt(Set::size).sum();
        }
    }

    @Override
    public String getName() {
        return "semantic";
    }

    @Override
    public ConnectionCategory getCategory() {
        return ConnectionCategory.SEMANTIC;
    }

    @Override
    public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
        SemanticProfile profile = profileOf(source, context);
        if (profile.isEmpty()) {
            return List.of();
        }
        List<Connection> connections = new ArrayList<>();
        for (Entity other : corpus.entities()) {
            if (other.getId().equals(source.getId())) {
                continue;
            }
            SemanticProfile otherProfile = profileOf(other, context);
            if (otherProfile.isEmpty()) {
                continue;
            }
            Similarity similarity = compare(profile, otherProfile);
            if (similarity.score() > SEMANTIC_THRESHOLD) {
                connections.add(toConnection(other.getId(), similarity));
            }
        }
        connections.sort(Connection.BY_STRENGTH);
        if (connections.size() > SEMANTIC_MAX_CONNECTIONS) {
            log.trace("semantic.truncated entityId={} found={} kept={}",
                    source.getId(), connections.size(), SEMANTIC_MAX_CONNECTIONS);
            return new ArrayList<>(connections.subList(0, SEMANTIC_MAX_CONNECTIONS));
        }
        return connections;
    }

    private SemanticProfile profileOf(Entity entity, AnalysisContext context) {
        return SemanticProfile.cached(entity, context);
    }

    Similarity compare(SemanticProfile first, SemanticProfile second) {
        Map<Axis, Set<String>> common = new EnumMap<>(Axis.class);
        Map<Axis, Double> axisScores = new EnumMap<>(Axis.class);
        double weighted = 0;
        for (Axis axis : Axis.values()) {
            common.put(axis, jaccard.intersection(first.get(axis), second.get(axis)));
            double axisScore = jaccard.compute(first.get(axis), second.get(axis));
            axisScores.put(axis, axisScore);
            weighted += axisScore * axis.getWeight();
        }
        double score = applyBoosts(weighted / TOTAL_AXIS_WEIGHT, common);
        return new Similarity(common, axisScores, score);
    }

    private double applyBoosts(double score, Map<Axis, Set<String>> common) {
        Set<String> themes = common.get(Axis.THEME);
        Set<String> moods = common.get(Axis.MOOD);
        Set<String> audience = common.get(Axis.AUDIENCE);

        if (themes.stream().anyMatch(SemanticRules.STRONG_THEMES::contains)) {
            score *= SEMANTIC_STRONG_THEME_BOOST;
        }
        long matchedAxes = common.values().stream().filter(set -> !set.isEmpty()).count();
        if (matchedAxes >= 3) {
            score *= SEMANTIC_THREE_AXES_BOOST;
        } else if (matchedAxes >= 2) {
            score *= SEMANTIC_TWO_AXES_BOOST;
        }
        if (themes.contains("horror") && moods.contains("dark")) {
            score *= SEMANTIC_HORROR_DARK_BOOST;
        }
        if (themes.contains("romance") && moods.contains("emotional")) {
            score *= SEMANTIC_ROMANCE_EMOTIONAL_BOOST;
        }
        if (themes.contains("family") && audience.contains("family_friendly")) {
            score *= SEMANTIC_FAMILY_BOOST;
        }
        return Math.min(1.0, score);
    }

    static double confidence(Similarity similarity) {
        double confidence = similarity.common(Axis.THEME).stream().anyMatch(SemanticRules.CONFIDENT_THEMES::contains)
                ? SEMANTIC_STRONG_THEME_CONFIDENCE : SEMANTIC_BASE_CONFIDENCE;
        int totalMatches = similarity.totalMatches();
        if (totalMatches >= 4) {
            confidence = Math.min(0.95, confidence + 0.15);
        } else if (totalMatches >= 2) {
            confidence = Math.min(0.9, confidence + 0.1);
        }
        if (similarity.score() > SEMANTIC_HIGH_SCORE) {
            confidence = Math.min(0.95, confidence + 0.1);
        }
        return confidence;
    }

    /**
     * Names the shared themes, or the first other axis with shared keywords.
     */
    static String reason(Similarity similarity) {
        if (!similarity.common(Axis.THEME).isEmpty()) {
            return "Similar themes: " + String.join(", ", similarity.common(Axis.THEME));
        }
        if (!similarity.common(Axis.MOOD).isEmpty()) {
            return "Similar mood: " + String.join(", ", similarity.common(Axis.MOOD));
        }
        if (!similarity.common(Axis.SETTING).isEmpty()) {
            return "Similar setting: " + String.join(", ", similarity.common(Axis.SETTING));
        }
        return "Similar audience: " + String.join(", ", similarity.common(Axis.AUDIENCE));
    }

    private Connection toConnection(String targetId, Similarity similarity) {
        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("themeScore", similarity.axisScores().get(Axis.THEME));
        breakdown.put("settingScore", similarity.axisScores().get(Axis.SETTING));
        breakdown.put("moodScore", similarity.axisScores().get(Axis.MOOD));
        breakdown.put("audienceScore", similarity.axisScores().get(Axis.AUDIENCE));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("commonThemes", List.copyOf(similarity.common(Axis.THEME)));
        metadata.put("commonSettings", List.copyOf(similarity.common(Axis.SETTING)));
        metadata.put("commonMoods", List.copyOf(similarity.common(Axis.MOOD)));
        metadata.put("commonAudience", List.copyOf(similarity.common(Axis.AUDIENCE)));
        metadata.put("semanticScore", similarity.score());
        metadata.put("detailedAnalysis", breakdown);
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.SEMANTIC_SIMILARITY)
                .strength(similarity.score())
                .confidence(confidence(similarity))
                .reason(reason(similarity))
                .metadata(metadata)
                .build();
    }
}
