package com.entity.intelligence.rules;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.entity.intelligence.rules.RuleTables.ordered;

/**
 * Vocabulary for enriching catalog entities: production companies, collections and
 * keywords. Lookups match lower-cased names by substring, in declaration order.
 */
public final class CatalogRules {

    private CatalogRules() {
        // Constants holder
    }

    // Companies

    public static final Map<String, List<String>> STUDIO_CATEGORIES = ordered(
            "major_studio", List.of("disney", "warner", "universal", "paramount", "sony", "fox", "columbia"),
            "streaming", List.of("netflix", "amazon", "hbo", "hulu", "apple", "peacock"),
            "independent", List.of("a24", "neon", "focus features", "searchlight", "annapurna"),
            "animation", List.of("pixar", "dreamworks", "illumination", "ghibli", "laika"),
            "horror", List.of("blumhouse", "new line", "dimension"),
            "family", List.of("hallmark", "disney", "nickelodeon", "cartoon network"),
            "documentary", List.of("national geographic", "discovery", "hbo documentary"),
            "international", List.of("studio ghibli", "gaumont", "pathé", "toho"));

    /**
     * Description words that categorize a company no name rule matched.
     */
    public static final List<String> DESCRIPTION_CATEGORIES = List.of(
            "animation", "documentary", "television", "streaming", "independent");

    public static final List<String> MAJOR_COMPANIES = List.of(
            "disney", "warner", "universal", "paramount", "sony", "fox", "marvel", "netflix");

    public static final List<String> POPULAR_COMPANIES = List.of("pixar", "a24", "blumhouse", "hallmark", "hbo");

    /**
     * Sequel markers removed from a title to group a studio's titles into franchises.
     */
    public static final Pattern SEQUEL_MARKERS = Pattern.compile(
            "\\b(part|chapter|episode|volume)\\s*\\d+|\\b(ii|iii|iv|v|vi|vii|viii|ix|x)\\b|\\b\\d+\\b",
            Pattern.CASE_INSENSITIVE);

    // Collections

    public static final Map<String, List<String>> FRANCHISE_TYPES = ordered(
            "superhero", List.of("batman", "superman", "spider-man", "x-men", "avengers", "marvel", "dc"),
            "sci_fi", List.of("star wars", "star trek", "alien", "predator", "terminator", "transformers"),
            "action", List.of("james bond", "fast and furious", "mission impossible", "rambo", "rocky"),
            "fantasy", List.of("lord of the rings", "hobbit", "harry potter", "chronicles of narnia"),
            "horror", List.of("halloween", "friday the 13th", "nightmare on elm street", "saw", "scream"),
            "comedy", List.of("american pie", "meet the parents", "rush hour", "hangover", "anchorman"),
            "animation", List.of("toy story", "shrek", "madagascar", "ice age", "despicable me"),
            "adventure", List.of("indiana jones", "pirates of the caribbean", "jurassic park"));

    public static final List<String> MAJOR_FRANCHISES = List.of(
            "batman", "superman", "spider-man", "star wars", "marvel",
            "harry potter", "fast and furious", "james bond");

    /**
     * Popularity bonus for a word in the collection name.
     */
    public static final Map<String, Integer> COLLECTION_NAME_BONUS = ordered(
            "collection", 10,
            "saga", 15,
            "universe", 20,
            "trilogy", 12);

    public static final List<String> FRANCHISE_INDICATORS = List.of(
            "collection", "saga", "trilogy", "series", "universe", "chronicles");

    public static final Pattern FRANCHISE_SUFFIX = Pattern.compile(
            "\\b(collection|saga|trilogy|series|chronicles|universe)\\b", Pattern.CASE_INSENSITIVE);

    public static final List<String> FRANCHISE_CHARACTERS = List.of(
            "batman", "superman", "spider-man", "iron man", "captain america",
            "thor", "hulk", "wolverine", "harry potter", "james bond",
            "indiana jones", "rocky", "rambo", "john wick");

    public static final Pattern ROMAN_NUMERAL = Pattern.compile(
            "\\b(ii|iii|iv|v|vi|vii|viii|ix|x)\\b", Pattern.CASE_INSENSITIVE);
    public static final Pattern ARABIC_NUMBER = Pattern.compile("\\b(\\d+)\\b");
    public static final Pattern NUMBER_WORD = Pattern.compile(
            "\\b(part|chapter|episode|volume)\\s*\\d+", Pattern.CASE_INSENSITIVE);

    public static final Map<String, Integer> ROMAN_VALUES = Map.of(
            "ii", 2, "iii", 3, "iv", 4, "v", 5, "vi", 6, "vii", 7, "viii", 8, "ix", 9, "x", 10);

    // Keywords

    public static final Map<String, List<String>> KEYWORD_CATEGORIES = ordered(
            "seasonal", List.of("christmas", "halloween", "valentine", "summer", "winter", "holiday"),
            "character_type", List.of("superhero", "vampire", "zombie", "robot", "alien", "detective", "spy"),
            "setting_location", List.of("new york", "los angeles", "london", "paris", "tokyo", "space"),
            "setting_type", List.of("school", "hospital", "prison", "workplace", "small town", "big city"),
            "profession", List.of("police", "lawyer", "doctor", "teacher", "soldier", "pilot", "chef"),
            "theme", List.of("friendship", "family", "love", "revenge", "survival", "coming of age"),
            "genre_element", List.of("time travel", "underwater", "post apocalyptic", "historical"),
            "source", List.of("based on true story", "biography", "novel", "comic book"),
            "demographic", List.of("teenager", "child", "elderly", "female protagonist", "male protagonist"),
            "mood", List.of("dark", "comedy", "romantic", "action", "suspense", "adventure"));

    /**
     * Category for a keyword no category list matched, keyed by a word it contains.
     */
    public static final Map<String, String> KEYWORD_CATEGORY_FALLBACKS = ordered(
            "christmas", "seasonal",
            "holiday", "seasonal",
            "school", "setting_type",
            "college", "setting_type",
            "city", "setting_location",
            "town", "setting_location",
            "based on", "source",
            "adaptation", "source",
            "friendship", "theme",
            "love", "theme");

    public static final Map<String, Double> KEYWORD_SIGNIFICANCE = Map.ofEntries(
            Map.entry("christmas", 0.9), Map.entry("halloween", 0.9), Map.entry("superhero", 0.95),
            Map.entry("vampire", 0.85), Map.entry("zombie", 0.8), Map.entry("time travel", 0.9),
            Map.entry("based on true story", 0.85),
            Map.entry("friendship", 0.7), Map.entry("family", 0.75), Map.entry("school", 0.6),
            Map.entry("police", 0.65), Map.entry("new york", 0.6), Map.entry("small town", 0.7),
            Map.entry("hospital", 0.65),
            Map.entry("teenager", 0.5), Map.entry("love", 0.45), Map.entry("comedy", 0.4),
            Map.entry("action", 0.4));

    public static final List<String> HIGH_SIGNIFICANCE_PATTERNS = List.of(
            "superhero", "vampire", "zombie", "time travel", "christmas",
            "based on", "true story", "biography", "adaptation");

    public static final Set<String> GENERIC_TERMS = Set.of(
            "action", "drama", "comedy", "love", "life", "man", "woman");

    /**
     * Keywords too generic to keep as entities.
     */
    public static final Set<String> EXCLUDED_KEYWORDS = Set.of(
            "film", "movie", "cinema", "entertainment", "story");

    public static final Map<String, List<String>> KEYWORD_SYNONYMS = ordered(
            "christmas", List.of("holiday", "xmas", "festive", "winter holiday"),
            "halloween", List.of("horror", "scary", "spooky", "october"),
            "superhero", List.of("comic book", "powers", "cape", "hero"),
            "vampire", List.of("bloodsucker", "undead", "fangs", "gothic"),
            "zombie", List.of("undead", "apocalypse", "walking dead", "infection"),
            "time travel", List.of("temporal", "past", "future", "timeline"),
            "space", List.of("sci-fi", "cosmic", "astronaut", "alien"),
            "detective", List.of("investigation", "mystery", "crime", "police"),
            "school", List.of("education", "student", "teacher", "classroom"),
            "friendship", List.of("buddy", "companion", "bond", "relationship"));

    public static final Map<String, List<String>> SEMANTIC_FIELDS = ordered(
            "temporal", List.of("time", "past", "future", "historical", "modern", "ancient"),
            "spatial", List.of("space", "earth", "underwater", "city", "country", "home"),
            "character", List.of("hero", "villain", "detective", "doctor", "teacher", "child"),
            "emotional", List.of("love", "fear", "joy", "anger", "sadness", "hope"),
            "social", List.of("family", "friendship", "marriage", "community", "society"),
            "supernatural", List.of("magic", "ghost", "vampire", "alien", "supernatural"),
            "technological", List.of("robot", "computer", "internet", "artificial intelligence"),
            "cultural", List.of("christmas", "holiday", "tradition", "ceremony", "celebration"));

    public static final Set<String> HIGH_NARRATIVE_CATEGORIES = Set.of("theme", "character_type", "source");
    public static final Set<String> LOW_NARRATIVE_CATEGORIES = Set.of("setting_location", "demographic");

    /**
     * First key whose word list has an entry contained in the lower-cased name.
     */
    public static String firstMatch(Map<String, List<String>> table, String lowerName, String fallback) {
        for (Map.Entry<String, List<String>> entry : table.entrySet()) {
            if (entry.getValue().stream().anyMatch(lowerName::contains)) {
                return entry.getKey();
            }
        }
        return fallback;
    }
}
