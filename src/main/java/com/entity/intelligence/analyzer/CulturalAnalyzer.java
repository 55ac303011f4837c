package com.entity.intelligence.analyzer;

import com.entity.intelligence.analyzer.CulturalProfile.AudienceSegment;
import com.entity.intelligence.analyzer.CulturalProfile.Marker;
import com.entity.intelligence.analyzer.CulturalProfile.Movement;
import com.entity.intelligence.analyzer.CulturalProfile.RegionalCulture;
import com.entity.intelligence.analyzer.CulturalProfile.SocialTheme;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.rules.CulturalRules;
import com.entity.intelligence.similarity.CulturalWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.entity.intelligence.rules.ScoringConstants.*;

/**
 * Connects entities whose cultural footprints overlap.
 */
public class CulturalAnalyzer implements ConnectionAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(CulturalAnalyzer.class);

    static final String PROFILE = "cultural";

    private final CulturalWeights weights;

    public CulturalAnalyzer() {
        this(CulturalWeights.defaultWeights());
    }

    public CulturalAnalyzer(CulturalWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    /**
     * Result of comparing two cultural profiles.
     */
    record Similarity(List<String> sharedMarkers, List<String> sharedThemes, List<String> sharedMovements,
                      double markerScore, double themeScore, double movementScore,
                      double regionalScore, double audienceScore, double score) {

        int totalShared() {
            return sharedMarkers.size() + sharedThemes.size() + sharedMovements.size();
        }
    }

    @Override
    public String getName() {
        return "cultural";
    }

    @Override
    public ConnectionCategory getCategory() {
        return ConnectionCategory.CULTURAL;
    }

    @Override
    public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
        CulturalProfile profile = profileOf(source, context);
        if (profile.isInsignificant()) {
            log.trace("cultural.skipped entityId={} significance={}", source.getId(), profile.significance());
            return List.of();
        }
        List<Connection> connections = new ArrayList<>();
        for (Entity other : corpus.entities()) {
            if (other.getId().equals(source.getId())) {
                continue;
            }
            CulturalProfile otherProfile = profileOf(other, context);
            if (otherProfile.isInsignificant()) {
                continue;
            }
            Similarity similarity = compare(profile, otherProfile);
            if (similarity.score() > CULTURAL_THRESHOLD) {
                connections.add(toConnection(other.getId(), profile, otherProfile, similarity));
            }
        }
        connections.sort(Connection.BY_STRENGTH);
        if (connections.size() > CULTURAL_MAX_CONNECTIONS) {
            return new ArrayList<>(connections.subList(0, CULTURAL_MAX_CONNECTIONS));
        }
        return connections;
    }

    private CulturalProfile profileOf(Entity entity, AnalysisContext context) {
        return CulturalProfile.cached(entity, context);
    }

    Similarity compare(CulturalProfile first, CulturalProfile second) {
        List<String> sharedMarkers = shared(first.markers(), second.markers(), Marker::type);
        double markerScore = 0;
        if (!sharedMarkers.isEmpty()) {
            double totalWeight = first.markers().stream()
                    .filter(m -> sharedMarkers.contains(m.type()))
                    .mapToDouble(Marker::weight)
                    .sum();
            markerScore = Math.min(1.0, totalWeight / sharedMarkers.size());
        }

        List<String> sharedThemes = shared(first.socialThemes(), second.socialThemes(), SocialTheme::type);
        double themeScore = 0;
        if (!sharedThemes.isEmpty()) {
            double avgRelevance = first.socialThemes().stream()
                    .filter(t -> sharedThemes.contains(t.type()))
                    .mapToDouble(SocialTheme::relevance)
                    .average()
                    .orElse(0);
            themeScore = avgRelevance * sharedThemes.size()
                    / Math.max(first.socialThemes().size(), second.socialThemes().size());
        }

        List<String> sharedMovements = shared(first.movements(), second.movements(), Movement::type);
        double movementScore = 0;
        if (!sharedMovements.isEmpty()) {
            movementScore = first.movements().stream()
                    .filter(m -> sharedMovements.contains(m.type()))
                    .mapToDouble(Movement::strength)
                    .average()
                    .orElse(0);
        }

        double regionalScore = compareRegional(first.regionalCulture(), second.regionalCulture());
        double audienceScore = compareAudience(first.audienceSegment(), second.audienceSegment());

        double score = weights.combine(markerScore, themeScore, movementScore, regionalScore, audienceScore);
        double significance = Math.min(first.significance(), second.significance());
        score *= 0.5 + significance * 0.5;

        return new Similarity(sharedMarkers, sharedThemes, sharedMovements,
                markerScore, themeScore, movementScore, regionalScore, audienceScore, Math.min(1.0, score));
    }

    private static <T> List<String> shared(List<T> first, List<T> second, Function<T, String> type) {
        Set<String> otherTypes = second.stream().map(type).collect(Collectors.toSet());
        return first.stream().map(type).filter(otherTypes::contains).distinct().toList();
    }

    static double compareRegional(Optional<RegionalCulture> first, Optional<RegionalCulture> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0;
        }
        RegionalCulture a = first.get();
        RegionalCulture b = second.get();
        double minInfluence = Math.min(a.influence(), b.influence());
        if (a.type().equals(b.type())) {
            return minInfluence;
        }
        if (a.regions().stream().anyMatch(b.regions()::contains)) {
            return 0.5 * minInfluence;
        }
        return 0;
    }

    static double compareAudience(AudienceSegment a, AudienceSegment b) {
        if (a.type().equals(b.type())) {
            return Math.min(a.appeal(), b.appeal()) * Math.min(a.confidence(), b.confidence());
        }
        if (CulturalRules.RELATED_SEGMENTS.getOrDefault(a.type(), Set.of()).contains(b.type())) {
            return 0.5 * Math.min(a.appeal(), b.appeal());
        }
        return 0;
    }

    static String reason(Similarity similarity) {
        List<String> reasons = new ArrayList<>();
        if (!similarity.sharedMarkers().isEmpty()) {
            reasons.add("Cultural significance: " + String.join(", ", similarity.sharedMarkers()));
        }
        if (!similarity.sharedThemes().isEmpty()) {
            reasons.add("Social themes: " + String.join(", ", similarity.sharedThemes()));
        }
        if (!similarity.sharedMovements().isEmpty()) {
            reasons.add("Cultural movements: " + String.join(", ", similarity.sharedMovements()));
        }
        return reasons.isEmpty() ? "Shared cultural context" : String.join(" | ", reasons);
    }

    static double confidence(Similarity similarity) {
        double confidence = CULTURAL_BASE_CONFIDENCE;
        int totalShared = similarity.totalShared();
        if (totalShared >= 3) {
            confidence = 0.9;
        } else if (totalShared >= 2) {
            confidence = 0.8;
        } else if (totalShared >= 1) {
            confidence = 0.7;
        }
        if (similarity.markerScore() > 0.8) {
            confidence = Math.max(confidence, 0.85);
        }
        if (similarity.movementScore() > 0.8) {
            confidence = Math.max(confidence, 0.8);
        }
        return Math.min(CULTURAL_CONFIDENCE_CAP, confidence);
    }

    private Connection toConnection(String targetId, CulturalProfile profile, CulturalProfile otherProfile,
                                    Similarity similarity) {
        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("markers", similarity.markerScore());
        breakdown.put("themes", similarity.themeScore());
        breakdown.put("movements", similarity.movementScore());
        breakdown.put("regional", similarity.regionalScore());
        breakdown.put("audience", similarity.audienceScore());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entityCulture", profile.summary());
        metadata.put("otherCulture", otherProfile.summary());
        metadata.put("sharedMarkers", similarity.sharedMarkers());
        metadata.put("sharedThemes", similarity.sharedThemes());
        metadata.put("sharedMovements", similarity.sharedMovements());
        metadata.put("breakdown", breakdown);
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.CULTURAL_SIGNIFICANCE)
                .strength(similarity.score())
                .confidence(confidence(similarity))
                .reason(reason(similarity))
                .metadata(metadata)
                .build();
    }
}
