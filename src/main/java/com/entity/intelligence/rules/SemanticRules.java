package com.entity.intelligence.rules;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.entity.intelligence.rules.RuleTables.ordered;

/**
 * Keyword pattern families for the four semantic axes, plus the genre-to-axis table.
 * Patterns are matched against lower-cased content and need not align with word boundaries.
 */
public final class SemanticRules {

    private SemanticRules() {
        // Constants holder
    }

    /**
     * The four semantic axes with their weight in the combined score.
     */
    public enum Axis {
        THEME(1.0),
        SETTING(0.8),
        MOOD(0.9),
        AUDIENCE(0.7);

        private final double weight;

        Axis(double weight) {
            this.weight = weight;
        }

        public double getWeight() {
            return weight;
        }
    }

    public static final Map<String, Pattern> THEME_PATTERNS = ordered(
            "family", p("family|children|kids|parent|father|mother|son|daughter|sibling|relatives"),
            "romance", p("love|romance|relationship|marriage|wedding|date|romantic|passion|affair"),
            "action", p("action|fight|battle|war|explosion|chase|violence|combat|martial arts"),
            "mystery", p("mystery|detective|investigation|crime|murder|police|clues|solve|puzzle"),
            "supernatural", p("magic|supernatural|fantasy|ghost|vampire|wizard|witch|spell|mystical"),
            "comedy", p("comedy|funny|humor|laugh|joke|comic|hilarious|amusing|witty"),
            "drama", p("drama|emotional|tragedy|life|death|struggle|serious|heartbreak"),
            "scifi", p("future|space|technology|robot|alien|science|fiction|cyberpunk|dystopian"),
            "horror", p("horror|scary|fear|terror|nightmare|monster|demon|evil|haunted"),
            "historical", p("history|historical|period|past|ancient|medieval|victorian|vintage"),
            "biography", p("biography|biopic|real|true|based|story|life|memoir|documentary"),
            "musical", p("music|musical|song|dance|band|concert|performance|singing"),
            "sports", p("sport|game|competition|team|athlete|championship|olympics|tournament"),
            "adventure", p("adventure|journey|quest|explore|travel|discover|expedition|treasure"),
            "western", p("western|cowboy|frontier|ranch|sheriff|outlaw|saloon|horse"),
            "coming_of_age", p("growing up|teenager|adolescent|youth|teen|high school|college"),
            "revenge", p("revenge|vengeance|payback|retribution|justice|betrayal"),
            "survival", p("survival|survive|stranded|wilderness|disaster|apocalypse|rescue"),
            "friendship", p("friendship|friends|buddy|companion|loyalty|bond|brotherhood"),
            "redemption", p("redemption|second chance|forgiveness|reform|salvation|recovery"));

    public static final Map<String, Pattern> SETTING_PATTERNS = ordered(
            "urban", p("city|urban|street|downtown|metropolitan|skyscraper|neighborhood"),
            "rural", p("rural|country|farm|village|small.town|countryside|provincial"),
            "school", p("school|college|university|student|education|classroom|campus"),
            "workplace", p("office|work|job|business|corporate|company|career|profession"),
            "hospital", p("hospital|medical|doctor|nurse|patient|clinic|surgery"),
            "military", p("military|army|soldier|war|combat|veteran|base|battlefield"),
            "prison", p("prison|jail|convict|criminal|inmate|correctional|penitentiary"),
            "high_society", p("wealthy|rich|elite|luxury|mansion|society|aristocrat|privilege"),
            "underground", p("underground|secret|hidden|criminal|mafia|gang|illegal"),
            "small_town", p("small.town|village|rural|community|local|provincial|intimate"),
            "futuristic", p("futuristic|future|advanced|technological|space|cyberpunk"),
            "historical", p("historical|period|past|vintage|classic|traditional|ancient"));

    public static final Map<String, Pattern> MOOD_PATTERNS = ordered(
            "dark", p("dark|gritty|noir|bleak|grim|sinister|ominous|foreboding"),
            "light", p("light|bright|cheerful|optimistic|uplifting|positive|joyful"),
            "intense", p("intense|gripping|thrilling|suspenseful|edge.of.seat|nail.biting"),
            "emotional", p("emotional|touching|heartfelt|moving|tear.jerker|poignant"),
            "humorous", p("humorous|funny|witty|satirical|comedic|amusing|entertaining"),
            "thought_provoking", p("thought.provoking|philosophical|deep|meaningful|profound"),
            "escapist", p("escapist|fantasy|magical|whimsical|imaginative|fantastical"),
            "realistic", p("realistic|authentic|genuine|true.to.life|documentary.style"));

    public static final Map<String, Pattern> AUDIENCE_PATTERNS = ordered(
            "family_friendly", p("family.friendly|all.ages|wholesome|clean|appropriate"),
            "mature", p("mature|adult|sophisticated|complex|nuanced|intellectual"),
            "teen", p("teen|teenage|adolescent|young.adult|youth|high.school"),
            "male_oriented", p("action.packed|testosterone|masculine|guy.movie|bros"),
            "female_oriented", p("romance|emotional|relationship|chick.flick|feminine"),
            "art_house", p("art.house|independent|indie|experimental|avant.garde|festival"),
            "mainstream", p("mainstream|popular|blockbuster|commercial|mass.appeal"),
            "niche", p("niche|specialized|cult|underground|alternative|unique"));

    public static Map<String, Pattern> patternsFor(Axis axis) {
        return switch (axis) {
            case THEME -> THEME_PATTERNS;
            case SETTING -> SETTING_PATTERNS;
            case MOOD -> MOOD_PATTERNS;
            case AUDIENCE -> AUDIENCE_PATTERNS;
        };
    }

    /**
     * Axis keywords implied by a genre.
     */
    public record GenreSemantics(List<String> themes, List<String> settings, List<String> moods,
                                 List<String> audience) {

        public List<String> forAxis(Axis axis) {
            return switch (axis) {
                case THEME -> themes;
                case SETTING -> settings;
                case MOOD -> moods;
                case AUDIENCE -> audience;
            };
        }
    }

    public static final Map<String, GenreSemantics> GENRE_SEMANTICS = Map.ofEntries(
            Map.entry("Action", g(List.of("action"), List.of(), List.of("intense"), List.of("male_oriented"))),
            Map.entry("Adventure", g(List.of("adventure"), List.of(), List.of("escapist"), List.of("family_friendly"))),
            Map.entry("Animation", g(List.of("family"), List.of(), List.of("light"), List.of("family_friendly"))),
            Map.entry("Comedy", g(List.of("comedy"), List.of(), List.of("humorous", "light"), List.of("mainstream"))),
            Map.entry("Crime", g(List.of("mystery"), List.of("urban"), List.of("dark"), List.of())),
            Map.entry("Documentary", g(List.of("biography"), List.of(), List.of("realistic"), List.of("mature"))),
            Map.entry("Drama", g(List.of("drama"), List.of(), List.of("emotional"), List.of("mature"))),
            Map.entry("Family", g(List.of("family"), List.of(), List.of("light"), List.of("family_friendly"))),
            Map.entry("Fantasy", g(List.of("supernatural"), List.of(), List.of("escapist"), List.of("mainstream"))),
            Map.entry("History", g(List.of("historical"), List.of("historical"), List.of(), List.of("mature"))),
            Map.entry("Horror", g(List.of("horror"), List.of(), List.of("dark"), List.of("mature"))),
            Map.entry("Music", g(List.of("musical"), List.of(), List.of("light"), List.of("mainstream"))),
            Map.entry("Mystery", g(List.of("mystery"), List.of(), List.of("intense"), List.of("mature"))),
            Map.entry("Romance", g(List.of("romance"), List.of(), List.of("emotional"), List.of("female_oriented"))),
            Map.entry("Science Fiction", g(List.of("scifi"), List.of("futuristic"), List.of("thought_provoking"), List.of())),
            Map.entry("Thriller", g(List.of("mystery"), List.of(), List.of("intense"), List.of("mature"))),
            Map.entry("War", g(List.of("action"), List.of("military"), List.of("dark"), List.of())),
            Map.entry("Western", g(List.of("western"), List.of("rural"), List.of("dark"), List.of())));

    /**
     * Shared themes that boost the similarity score.
     */
    public static final Set<String> STRONG_THEMES = Set.of("horror", "romance", "comedy", "musical", "western");

    /**
     * Shared themes that raise confidence in a semantic match.
     */
    public static final Set<String> CONFIDENT_THEMES = Set.of("horror", "romance", "comedy", "musical", "documentary");

    /**
     * Text attributes that make up the semantic content string, in order.
     */
    public static final List<String> CONTENT_FIELDS = List.of(
            "overview", "tagline", "title", "name", "original_title", "original_name");

    private static Pattern p(String alternatives) {
        return Pattern.compile("(" + alternatives + ")", Pattern.CASE_INSENSITIVE);
    }

    private static GenreSemantics g(List<String> themes, List<String> settings, List<String> moods,
                                    List<String> audience) {
        return new GenreSemantics(themes, settings, moods, audience);
    }
}
