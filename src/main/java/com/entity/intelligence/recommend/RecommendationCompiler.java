package com.entity.intelligence.recommend;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.graph.RelationshipGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.entity.intelligence.rules.ScoringConstants.DEEP_MAX;
import static com.entity.intelligence.rules.ScoringConstants.DIVERSITY_THRESHOLD;
import static com.entity.intelligence.rules.ScoringConstants.QUICK_MAX;
import static com.entity.intelligence.rules.ScoringConstants.QUICK_MIN_CONFIDENCE;

/**
 * Derives per-entity recommendation sets from a scored relationship graph.
 *
 * <p>Quick: direct connections whose confidence reaches {@code 0.8}, in graph order, at most five.
 * Deep: connections of every category ranked by final score, one per target entity, at most 25.
 * Lists longer than three are then diversified: walking in score order, a candidate too similar
 * to one already picked is deferred, and deferred candidates fill the remaining slots in score
 * order. The list therefore keeps its length, but near-duplicates sink below different ones.</p>
 */
public class RecommendationCompiler {
    private static final Logger log = LoggerFactory.getLogger(RecommendationCompiler.class);

    private static final int MIN_DIVERSIFIED = 3;

    private final int quickMax;
    private final int deepMax;
    private final double diversityThreshold;

    public RecommendationCompiler() {
        this(QUICK_MAX, DEEP_MAX);
    }

    public RecommendationCompiler(int quickMax, int deepMax) {
        this(quickMax, deepMax, DIVERSITY_THRESHOLD);
    }

    public RecommendationCompiler(int quickMax, int deepMax, double diversityThreshold) {
        if (quickMax < 0 || deepMax < 0) {
            throw new IllegalArgumentException("recommendation limits must not be negative");
        }
        if (!(diversityThreshold >= 0.0 && diversityThreshold <= 1.0)) {
            throw new IllegalArgumentException("diversityThreshold must be in [0,1]");
        }
        this.quickMax = quickMax;
        this.deepMax = deepMax;
        this.diversityThreshold = diversityThreshold;
    }

    public SortedMap<String, RecommendationSet> compile(RelationshipGraph graph) {
        Objects.requireNonNull(graph, "graph is required");
        SortedMap<String, RecommendationSet> result = new TreeMap<>();
        long quickTotal = 0;
        long deepTotal = 0;
        for (String entityId : graph.entityIds()) {
            RecommendationSet set = new RecommendationSet(quick(graph, entityId), deep(graph, entityId));
            quickTotal += set.quick().size();
            deepTotal += set.deep().size();
            result.put(entityId, set);
        }
        log.info("recommend.compiled entities={} quick={} deep={}", result.size(), quickTotal, deepTotal);
        return Collections.unmodifiableSortedMap(result);
    }

    List<Recommendation> quick(RelationshipGraph graph, String entityId) {
        return graph.connections(entityId, ConnectionCategory.DIRECT).stream()
                .filter(connection -> connection.getConfidence() >= QUICK_MIN_CONFIDENCE)
                .limit(quickMax)
                .map(Recommendation::of)
                .toList();
    }

    List<Recommendation> deep(RelationshipGraph graph, String entityId) {
        List<Connection> all = new ArrayList<>(graph.allConnections(entityId));
        all.sort(Connection.BY_FINAL_SCORE);
        Set<String> seen = new HashSet<>();
        List<Recommendation> ranked = new ArrayList<>();
        for (Connection connection : all) {
            if (seen.add(connection.getTargetId())) {
                ranked.add(Recommendation.of(connection));
            }
        }
        return diversify(ranked);
    }

    /**
     * Reorders score-ranked recommendations so that near-duplicates follow the diverse
     * picks, then truncates to the deep limit. The top recommendation always stays first.
     */
    List<Recommendation> diversify(List<Recommendation> ranked) {
        if (ranked.size() <= MIN_DIVERSIFIED) {
            return ranked.subList(0, Math.min(deepMax, ranked.size()));
        }
        List<Recommendation> picked = new ArrayList<>();
        List<Recommendation> deferred = new ArrayList<>();
        picked.add(ranked.get(0));
        for (Recommendation candidate : ranked.subList(1, ranked.size())) {
            if (picked.size() == deepMax) {
                break;
            }
            boolean tooSimilar = picked.stream().anyMatch(kept -> similarity(candidate, kept) > diversityThreshold);
            if (tooSimilar) {
                deferred.add(candidate);
            } else {
                picked.add(candidate);
            }
        }
        for (Recommendation candidate : deferred) {
            if (picked.size() == deepMax) {
                break;
            }
            picked.add(candidate);
        }
        return picked.subList(0, Math.min(deepMax, picked.size()));
    }

    /**
     * Similarity in [0, 1]: same category 0.3, same relationship 0.2, score closeness up to 0.2
     * and shared reason words up to 0.3.
     */
    static double similarity(Recommendation a, Recommendation b) {
        double similarity = 0.0;
        if (a.category() == b.category()) {
            similarity += 0.3;
        }
        if (a.type() == b.type()) {
            similarity += 0.2;
        }
        similarity += (1.0 - Math.abs(a.score() - b.score())) * 0.2;

        List<String> wordsA = words(a.reason());
        List<String> wordsB = words(b.reason());
        if (!wordsA.isEmpty() && !wordsB.isEmpty()) {
            Set<String> other = new HashSet<>(wordsB);
            long common = wordsA.stream().filter(other::contains).count();
            similarity += (double) common / Math.max(wordsA.size(), wordsB.size()) * 0.3;
        }
        return Math.min(1.0, similarity);
    }

    private static List<String> words(String reason) {
        return Arrays.stream(reason.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> !word.isEmpty())
                .toList();
    }
}
