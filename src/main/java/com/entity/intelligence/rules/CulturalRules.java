package com.entity.intelligence.rules;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import static com.entity.intelligence.rules.RuleTables.ordered;

/**
 * Cultural footprint vocabulary: markers, social themes, movements, regional
 * cultures and audience segments. Also used by the search index for
 * {@code cultural_*} context tags.
 */
public final class CulturalRules {

    private CulturalRules() {
        // Constants holder
    }

    public record MarkerRule(Pattern pattern, double weight, double confidence) {
    }

    public record SocialThemeRule(Pattern pattern, List<String> categories, double relevance) {
    }

    /**
     * A cultural movement whose relevance is interpolated between year anchors.
     */
    public record MovementRule(List<String> indicators, NavigableMap<Integer, Double> anchors, double strength) {

        /**
         * Relevance of the movement for a release year. Years before the first anchor
         * take the first anchor's value, years after the last take the last value,
         * and years in between are interpolated linearly. Unknown years score 0.
         */
        public double relevance(int year) {
            if (year <= 0 || anchors.isEmpty()) {
                return 0.0;
            }
            Map.Entry<Integer, Double> lower = anchors.floorEntry(year);
            Map.Entry<Integer, Double> upper = anchors.ceilingEntry(year);
            if (lower == null) {
                return upper.getValue();
            }
            if (upper == null || lower.getKey().equals(upper.getKey())) {
                return lower.getValue();
            }
            double ratio = (double) (year - lower.getKey()) / (upper.getKey() - lower.getKey());
            return lower.getValue() + (upper.getValue() - lower.getValue()) * ratio;
        }
    }

    public record RegionalRule(Set<String> regions, double influence) {
    }

    public record SegmentRule(List<String> indicators, double appeal) {
    }

    public static final Map<String, MarkerRule> CONTENT_MARKERS = ordered(
            "oscar_worthy", marker("oscar|academy.award|prestigious|acclaimed|masterpiece|critically.acclaimed", 0.9, 0.85),
            "cult_classic", marker("cult|underground|alternative|indie|quirky|unique|offbeat", 0.8, 0.75),
            "blockbuster", marker("blockbuster|massive|biggest|record.breaking|phenomenon|box.office", 0.85, 0.8),
            "controversial", marker("controversial|banned|censored|provocative|shocking|scandal", 0.8, 0.9),
            "innovative", marker("innovative|groundbreaking|revolutionary|first|pioneering|breakthrough", 0.9, 0.8),
            "nostalgic", marker("classic|nostalgic|timeless|beloved|iconic|legendary", 0.7, 0.7),
            "international", marker("international|foreign|subtitled|world.cinema|global", 0.7, 0.8),
            "based_on", marker("based.on|adapted|true.story|novel|book|real|memoir", 0.6, 0.9));

    public static final Pattern AWARD_PATTERN = Pattern.compile(
            "(award|winner|nominated|festival|cannes|oscar|emmy|golden.globe)", Pattern.CASE_INSENSITIVE);

    public static final Map<String, SocialThemeRule> SOCIAL_THEMES = ordered(
            "social_justice", theme("equality|discrimination|prejudice|civil.rights|justice|activism|protest",
                    List.of("politics", "society"), 0.9),
            "environmentalism", theme("environment|climate|pollution|nature|green|ecology|conservation",
                    List.of("environment", "society"), 0.85),
            "technology_impact", theme("artificial.intelligence|digital|cyber|virtual|robot|automation|future",
                    List.of("technology", "society"), 0.8),
            "globalization", theme("global|international|multicultural|diversity|immigration|border",
                    List.of("politics", "society"), 0.75),
            "generational_conflict", theme("generation|millennial|boomer|gen.z|youth|aging|old.vs.new",
                    List.of("society", "family"), 0.7),
            "economic_inequality", theme("economic|capitalism|poverty|wealth|class|money|rich|poor",
                    List.of("economics", "society"), 0.8),
            "political_power", theme("political|government|democracy|power|corruption|election|authority",
                    List.of("politics"), 0.85),
            "religious_spiritual", theme("religious|faith|spiritual|god|church|belief|divine|sacred",
                    List.of("religion", "spirituality"), 0.7),
            "gender_roles", theme("gender|feminism|masculinity|equality|sexism|patriarchy|empowerment",
                    List.of("society", "politics"), 0.85),
            "mental_health", theme("mental.health|depression|anxiety|therapy|trauma|healing|wellness",
                    List.of("health", "society"), 0.8));

    public static final Map<String, MovementRule> MOVEMENTS = ordered(
            "feminist_cinema", movement(List.of("female director", "female protagonist", "gender equality", "women's rights"),
                    anchors(1970, 0.8, 1990, 0.9, 2010, 1.0), 0.85),
            "black_cinema", movement(List.of("african american", "black experience", "racial", "civil rights"),
                    anchors(1970, 0.9, 1990, 0.95, 2010, 0.9), 0.9),
            "queer_cinema", movement(List.of("lgbtq", "gay", "lesbian", "transgender", "queer", "pride"),
                    anchors(1980, 0.7, 2000, 0.85, 2010, 0.95), 0.8),
            "environmental_awareness", movement(List.of("climate change", "environmental", "nature", "conservation"),
                    anchors(1990, 0.7, 2000, 0.8, 2010, 0.95), 0.75),
            "digital_age", movement(List.of("internet", "social media", "digital", "virtual", "online"),
                    anchors(1990, 0.5, 2000, 0.8, 2010, 1.0), 0.8),
            "post_9_11", movement(List.of("terrorism", "security", "surveillance", "paranoia", "fear"),
                    anchors(2001, 1.0, 2010, 0.8, 2020, 0.6), 0.85));

    /**
     * Regional cultures by production country, checked in order.
     */
    public static final Map<String, RegionalRule> REGIONAL_CULTURES = ordered(
            "hollywood_mainstream", new RegionalRule(Set.of("US"), 1.0),
            "european_arthouse", new RegionalRule(Set.of("FR", "DE", "IT", "GB"), 0.8),
            "asian_cinema", new RegionalRule(Set.of("JP", "KR", "CN", "IN"), 0.75),
            "latin_american", new RegionalRule(Set.of("MX", "BR", "AR"), 0.6));

    public static final String OTHER_REGIONAL = "other_regional";
    public static final double OTHER_REGIONAL_INFLUENCE = 0.5;

    public static final Map<String, SegmentRule> AUDIENCE_SEGMENTS = ordered(
            "mass_market", new SegmentRule(List.of("mainstream", "popular", "commercial"), 0.9),
            "art_house", new SegmentRule(List.of("artistic", "experimental", "intellectual"), 0.7),
            "genre_fans", new SegmentRule(List.of("horror", "sci-fi", "fantasy", "action"), 0.8),
            "family_audience", new SegmentRule(List.of("family", "children", "wholesome"), 0.85),
            "mature_audience", new SegmentRule(List.of("adult", "sophisticated", "complex"), 0.75),
            "niche_market", new SegmentRule(List.of("cult", "specialized", "alternative"), 0.6));

    /**
     * Segments considered adjacent for partial audience credit.
     */
    public static final Map<String, Set<String>> RELATED_SEGMENTS = Map.of(
            "art_house", Set.of("mature_audience", "niche_market"),
            "mass_market", Set.of("family_audience", "genre_fans"),
            "family_audience", Set.of("mass_market"),
            "mature_audience", Set.of("art_house"));

    public static final String GENERAL_AUDIENCE = "general_audience";

    public static final List<String> SIGNIFICANT_TERMS = List.of(
            "academy award", "oscar", "cannes", "festival", "groundbreaking",
            "revolutionary", "controversial", "banned", "cult", "masterpiece",
            "influential", "landmark", "historic", "breakthrough", "phenomenon");

    /**
     * Text attributes that make up the cultural content string, in order.
     */
    public static final List<String> CONTENT_FIELDS = List.of("overview", "tagline", "title", "name", "biography");

    private static MarkerRule marker(String alternatives, double weight, double confidence) {
        return new MarkerRule(Pattern.compile("(" + alternatives + ")", Pattern.CASE_INSENSITIVE), weight, confidence);
    }

    private static SocialThemeRule theme(String alternatives, List<String> categories, double relevance) {
        return new SocialThemeRule(Pattern.compile("(" + alternatives + ")", Pattern.CASE_INSENSITIVE),
                categories, relevance);
    }

    private static MovementRule movement(List<String> indicators, NavigableMap<Integer, Double> anchors,
                                         double strength) {
        return new MovementRule(indicators, anchors, strength);
    }

    private static NavigableMap<Integer, Double> anchors(int y1, double r1, int y2, double r2, int y3, double r3) {
        TreeMap<Integer, Double> map = new TreeMap<>();
        map.put(y1, r1);
        map.put(y2, r2);
        map.put(y3, r3);
        return Collections.unmodifiableNavigableMap(map);
    }
}
