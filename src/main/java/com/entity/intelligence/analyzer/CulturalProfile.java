package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityAttributes.Ref;
import com.entity.intelligence.rules.CulturalRules;
import com.entity.intelligence.rules.CulturalRules.MarkerRule;
import com.entity.intelligence.rules.CulturalRules.MovementRule;
import com.entity.intelligence.rules.CulturalRules.RegionalRule;
import com.entity.intelligence.rules.CulturalRules.SegmentRule;
import com.entity.intelligence.rules.CulturalRules.SocialThemeRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static com.entity.intelligence.rules.ScoringConstants.CULTURAL_BASE_SIGNIFICANCE;
import static com.entity.intelligence.rules.ScoringConstants.CULTURAL_INSIGNIFICANCE;
import static com.entity.intelligence.rules.ScoringConstants.CULTURAL_MOVEMENT_MIN_RELEVANCE;

/**
 * Cultural footprint of an entity: markers, social themes, movements, regional
 * culture, audience segment, era and overall significance.
 *
 * <p>Release ages are measured against a reference year so the profile of an
 * unchanged entity is the same on every build run with the same options.</p>
 */
public record CulturalProfile(
        List<Marker> markers,
        List<SocialTheme> socialThemes,
        List<Movement> movements,
        Optional<RegionalCulture> regionalCulture,
        AudienceSegment audienceSegment,
        TimeContext timeContext,
        double significance
) {

    public record Marker(String type, double weight, double confidence, String source) {
    }

    public record SocialTheme(String type, List<String> categories, double relevance) {
    }

    public record Movement(String type, double strength, double timeRelevance) {
    }

    public record RegionalCulture(String type, List<String> regions, double influence) {
    }

    public record AudienceSegment(String type, double appeal, double confidence, String source) {
    }

    /**
     * Era of a release relative to the reference year. Unknown years have relevance 0.
     */
    public record TimeContext(String era, double relevance) {
        static final TimeContext UNKNOWN = new TimeContext("unknown", 0.0);
    }

    public CulturalProfile {
        markers = List.copyOf(markers);
        socialThemes = List.copyOf(socialThemes);
        movements = List.copyOf(movements);
    }

    /**
     * An entity with low significance and no markers, themes or movements takes no part
     * in cultural matching, neither as source nor as target.
     */
    public boolean isInsignificant() {
        return significance < CULTURAL_INSIGNIFICANCE
                && markers.isEmpty()
                && socialThemes.isEmpty()
                && movements.isEmpty();
    }

    public List<String> markerTypes() {
        return markers.stream().map(Marker::type).toList();
    }

    /**
     * The entity's profile from the build's cache, measured against the context's reference year.
     */
    public static CulturalProfile cached(Entity entity, AnalysisContext context) {
        return context.cache().getOrCompute(CulturalAnalyzer.PROFILE, entity, CulturalProfile.class,
                e -> of(e, context.referenceYear()));
    }

    public static CulturalProfile of(Entity entity, int referenceYear) {
        String content = contentOf(entity);
        OptionalInt year = EntityAttributes.releaseYear(entity);
        TimeContext timeContext = timeContext(year, referenceYear);
        return new CulturalProfile(
                markers(entity, content),
                socialThemes(content),
                movements(content, year),
                regionalCulture(entity),
                audienceSegment(entity, content),
                timeContext,
                significance(entity, content, timeContext));
    }

    static String contentOf(Entity entity) {
        List<String> parts = new ArrayList<>();
        String text = EntityAttributes.joinedText(entity, CulturalRules.CONTENT_FIELDS);
        if (!text.isEmpty()) {
            parts.add(text);
        }
        List<String> genres = EntityAttributes.genres(entity);
        if (!genres.isEmpty()) {
            parts.add(String.join(" ", genres));
        }
        List<String> keywords = EntityAttributes.keywords(entity);
        if (!keywords.isEmpty()) {
            parts.add(String.join(" ", keywords));
        }
        List<Ref> companies = EntityAttributes.companies(entity);
        if (!companies.isEmpty()) {
            parts.add(String.join(" ", companies.stream().map(Ref::name).toList()));
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static List<Marker> markers(Entity entity, String content) {
        List<Marker> markers = new ArrayList<>();
        for (Map.Entry<String, MarkerRule> entry : CulturalRules.CONTENT_MARKERS.entrySet()) {
            MarkerRule rule = entry.getValue();
            if (rule.pattern().matcher(content).find()) {
                markers.add(new Marker(entry.getKey(), rule.weight(), rule.confidence(), "content_analysis"));
            }
        }

        double rating = EntityAttributes.ratingOrZero(entity);
        double votes = EntityAttributes.voteCount(entity);
        if (rating >= 8.5 && votes > 1000) {
            markers.add(new Marker("critically_acclaimed", 0.9, 0.9, "rating_analysis"));
        } else if (rating >= 8.0 && votes > 500) {
            markers.add(new Marker("highly_rated", 0.8, 0.8, "rating_analysis"));
        }
        if (rating <= 4.0 && votes > 100) {
            markers.add(new Marker("notorious", 0.6, 0.7, "rating_analysis"));
        }

        double popularity = EntityAttributes.popularity(entity);
        if (popularity >= 80) {
            markers.add(new Marker("culturally_impactful", 0.85, 0.8, "popularity_analysis"));
        } else if (popularity >= 50) {
            markers.add(new Marker("mainstream_popular", 0.7, 0.75, "popularity_analysis"));
        } else if (popularity < 10 && rating > 7.5) {
            markers.add(new Marker("hidden_gem", 0.6, 0.7, "popularity_analysis"));
        }

        if (rating >= 8.0 && CulturalRules.AWARD_PATTERN.matcher(content).find()) {
            markers.add(new Marker("award_contender", 0.85, 0.75, "award_inference"));
        }
        return markers;
    }

    private static List<SocialTheme> socialThemes(String content) {
        List<SocialTheme> themes = new ArrayList<>();
        for (Map.Entry<String, SocialThemeRule> entry : CulturalRules.SOCIAL_THEMES.entrySet()) {
            SocialThemeRule rule = entry.getValue();
            if (rule.pattern().matcher(content).find()) {
                themes.add(new SocialTheme(entry.getKey(), rule.categories(), rule.relevance()));
            }
        }
        return themes;
    }

    private static List<Movement> movements(String content, OptionalInt year) {
        if (year.isEmpty()) {
            return List.of();
        }
        List<Movement> movements = new ArrayList<>();
        for (Map.Entry<String, MovementRule> entry : CulturalRules.MOVEMENTS.entrySet()) {
            MovementRule rule = entry.getValue();
            double relevance = rule.relevance(year.getAsInt());
            if (relevance > CULTURAL_MOVEMENT_MIN_RELEVANCE
                    && rule.indicators().stream().anyMatch(content::contains)) {
                movements.add(new Movement(entry.getKey(), rule.strength() * relevance, relevance));
            }
        }
        return movements;
    }

    private static Optional<RegionalCulture> regionalCulture(Entity entity) {
        List<String> countries = EntityAttributes.countries(entity);
        if (countries.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, RegionalRule> entry : CulturalRules.REGIONAL_CULTURES.entrySet()) {
            RegionalRule rule = entry.getValue();
            if (countries.stream().anyMatch(rule.regions()::contains)) {
                return Optional.of(new RegionalCulture(entry.getKey(), countries, rule.influence()));
            }
        }
        return Optional.of(new RegionalCulture(CulturalRules.OTHER_REGIONAL, countries,
                CulturalRules.OTHER_REGIONAL_INFLUENCE));
    }

    private static AudienceSegment audienceSegment(Entity entity, String content) {
        AudienceSegment best = null;
        double bestScore = 0;
        for (Map.Entry<String, SegmentRule> entry : CulturalRules.AUDIENCE_SEGMENTS.entrySet()) {
            SegmentRule rule = entry.getValue();
            long hits = rule.indicators().stream().filter(content::contains).count();
            double score = (double) hits / rule.indicators().size();
            if (score > bestScore) {
                bestScore = score;
                best = new AudienceSegment(entry.getKey(), rule.appeal(), score, "audience_analysis");
            }
        }
        if (EntityAttributes.ratingOrZero(entity) >= 8.0 && (best == null || best.confidence() < 0.5)) {
            best = new AudienceSegment("art_house", 0.7, 0.6, "rating_inference");
        }
        return best != null ? best
                : new AudienceSegment(CulturalRules.GENERAL_AUDIENCE, 0.6, 0.3, "default");
    }

    static TimeContext timeContext(OptionalInt year, int referenceYear) {
        if (year.isEmpty()) {
            return TimeContext.UNKNOWN;
        }
        int age = referenceYear - year.getAsInt();
        if (age <= 5) {
            return new TimeContext("contemporary", 1.0);
        } else if (age <= 15) {
            return new TimeContext("recent", 0.9);
        } else if (age <= 30) {
            return new TimeContext("modern", 0.7);
        } else if (age <= 50) {
            return new TimeContext("classic", 0.6);
        }
        return new TimeContext("vintage", 0.4);
    }

    private static double significance(Entity entity, String content, TimeContext timeContext) {
        double significance = CULTURAL_BASE_SIGNIFICANCE;
        double rating = EntityAttributes.ratingOrZero(entity);
        double votes = EntityAttributes.voteCount(entity);
        if (rating >= 8.0 && votes > 1000) {
            significance += 0.3;
        } else if (rating >= 7.0 && votes > 500) {
            significance += 0.2;
        }
        double popularity = EntityAttributes.popularity(entity);
        if (popularity >= 50) {
            significance += 0.2;
        } else if (popularity >= 20) {
            significance += 0.1;
        }
        if (CulturalRules.SIGNIFICANT_TERMS.stream().anyMatch(content::contains)) {
            significance += 0.2;
        }
        return Math.min(1.0, significance * timeContext.relevance());
    }

    /**
     * Plain-map form written into connection metadata.
     */
    Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("markers", markerTypes());
        summary.put("socialThemes", socialThemes.stream().map(SocialTheme::type).toList());
        summary.put("movements", movements.stream().map(Movement::type).toList());
        summary.put("regionalCulture", regionalCulture.map(RegionalCulture::type).orElse("none"));
        summary.put("audienceSegment", audienceSegment.type());
        summary.put("era", timeContext.era());
        summary.put("significance", significance);
        return Collections.unmodifiableMap(summary);
    }
}
