package com.entity.intelligence.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared heuristic vocabulary used by analysis, enrichment and indexing.
 *
 * <p>Tables that must agree between the analyzers and the search index are defined
 * once here (genres, studios, crew roles, eras, title patterns) or in the sibling
 * {@link SemanticRules}, {@link CulturalRules}, {@link CatalogRules} and {@link GenreRules}
 * tables. {@link #VERSION} is bumped
 * whenever any table changes so compiled artifacts can be traced to their rules.</p>
 */
public final class RuleTables {

    public static final String VERSION = "3.2.0";

    private RuleTables() {
        // Constants holder
    }

    /**
     * Per-genre weight applied to genre matches; unknown genres use {@link #DEFAULT_GENRE_WEIGHT}.
     */
    public static final Map<String, Double> GENRE_WEIGHTS = Map.of(
            "Action", 0.85,
            "Comedy", 0.80,
            "Drama", 0.75,
            "Horror", 0.90,
            "Romance", 0.85,
            "Science Fiction", 0.80,
            "Fantasy", 0.80,
            "Thriller", 0.85,
            "Animation", 0.75,
            "Documentary", 0.70);

    public static final double DEFAULT_GENRE_WEIGHT = 0.7;

    /**
     * Genres distinctive enough that sharing one raises genre-match confidence.
     */
    public static final Set<String> DISTINCTIVE_GENRES = Set.of("Horror", "Romance", "Documentary", "Animation");

    public static final List<String> MAJOR_STUDIOS = List.of(
            "Marvel Studios", "Walt Disney Pictures", "Warner Bros.",
            "Universal Pictures", "Paramount Pictures", "Sony Pictures");

    public static final List<String> PRESTIGE_STUDIOS = List.of(
            "A24", "Focus Features", "Searchlight Pictures", "Neon");

    /**
     * Crew jobs treated as talent for overlap scoring.
     */
    public static final Set<String> KEY_CREW_JOBS = Set.of(
            "Director", "Producer", "Executive Producer", "Writer", "Screenplay");

    /**
     * Crew jobs that count as key creative roles.
     */
    public static final Set<String> KEY_ROLES = Set.of("Director", "Producer", "Writer");

    public static final Map<String, Double> CREW_JOB_IMPORTANCE = Map.of(
            "Director", 0.95,
            "Producer", 0.85,
            "Executive Producer", 0.8,
            "Writer", 0.8,
            "Screenplay", 0.8,
            "Cinematographer", 0.7,
            "Editor", 0.7,
            "Composer", 0.65);

    /**
     * Crew jobs indexed as searchable names.
     */
    public static final Set<String> INDEXED_CREW_JOBS = Set.of("Director", "Producer", "Writer", "Screenplay");

    // Title heuristics

    public static final Pattern SAGA_TITLE = Pattern.compile(
            "\\b(the|a|an)\\s+\\w+\\s+(saga|chronicles|trilogy|series|collection)\\b");
    public static final Pattern SEQUEL_TITLE = Pattern.compile(
            "\\b(part|chapter|episode|volume|book)\\s+\\d+|\\d+\\s*$");
    public static final Pattern FRANCHISE_TITLE = Pattern.compile(
            "(saga|chronicles|trilogy|series|collection|universe)");
    public static final Pattern REBOOT_TITLE = Pattern.compile(
            "(reboot|remake|reimagining|retelling|origins?)");
    public static final Pattern DARK_TITLE = Pattern.compile(
            "(dark|black|shadow|night|blood|death|dead|kill|murder)");
    public static final Pattern LIGHT_TITLE = Pattern.compile(
            "(love|happy|joy|light|bright|hope|dream|wish|magic)");
    public static final Pattern FAMILY_TITLE = Pattern.compile(
            "(family|kids|children|baby|home|mom|dad|parent)");

    // Franchise detection for release timing

    public static final Pattern SEQUEL_NUMBER = Pattern.compile(
            "\\b(ii|iii|iv|v|vi|vii|viii|ix|x|\\d+)\\b", Pattern.CASE_INSENSITIVE);
    public static final Pattern SEQUEL_WORD = Pattern.compile(
            "\\b(part|chapter|episode|volume|book)\\s*\\d+", Pattern.CASE_INSENSITIVE);
    public static final Pattern REBOOT_INDICATOR = Pattern.compile(
            "(reboot|remake|reimagining|retelling|origins?|begins?)", Pattern.CASE_INSENSITIVE);

    /**
     * Film-industry eras with an inclusive year window and the keywords that place
     * a title inside them. Checked in declaration order; the first match wins.
     */
    public record FilmEra(int fromYear, int toYear, List<String> keywords) {
        public boolean covers(int year) {
            return year >= fromYear && year <= toYear;
        }
    }

    public static final Map<String, FilmEra> FILM_ERAS = ordered(
            "new_hollywood", new FilmEra(1967, 1982, List.of("independent", "auteur", "artistic")),
            "blockbuster_era", new FilmEra(1975, 1990, List.of("blockbuster", "adventure", "spectacular")),
            "indie_boom", new FilmEra(1989, 2000, List.of("independent", "quirky", "alternative")),
            "superhero_renaissance", new FilmEra(2000, 2025, List.of("superhero", "comic", "marvel", "dc")),
            "streaming_revolution", new FilmEra(2010, 2025, List.of("netflix", "amazon", "original")),
            "franchise_era", new FilmEra(2000, 2025, List.of("franchise", "universe", "cinematic")));

    // Search vocabulary

    public static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "is", "are", "was", "were", "be", "been", "have",
            "has", "had", "do", "does", "did", "will", "would", "could", "should",
            "may", "might", "must", "can", "this", "that", "these", "those",
            "he", "she", "it", "they", "we", "you", "i", "me", "him", "her", "us", "them");

    /**
     * Substring of a company name mapped to its studio-family category tag.
     * Checked in declaration order; the first match wins.
     */
    public static final Map<String, String> STUDIO_FAMILIES = ordered(
            "marvel", "studio_marvel",
            "disney", "studio_disney",
            "pixar", "studio_pixar",
            "warner", "studio_warner",
            "universal", "studio_universal",
            "paramount", "studio_paramount",
            "sony", "studio_sony",
            "netflix", "studio_netflix",
            "amazon", "studio_amazon",
            "hbo", "studio_hbo",
            "a24", "studio_a24",
            "blumhouse", "studio_blumhouse",
            "hallmark", "studio_hallmark",
            "lionsgate", "studio_lionsgate",
            "fox", "studio_fox");

    public static final Map<String, String> COUNTRY_NAMES = Map.of(
            "US", "United States",
            "GB", "United Kingdom",
            "FR", "France",
            "DE", "Germany",
            "JP", "Japan",
            "KR", "South Korea",
            "CN", "China",
            "IN", "India",
            "CA", "Canada",
            "AU", "Australia");

    public static final Map<String, Pattern> SEASONAL_PATTERNS = ordered(
            "christmas", Pattern.compile("(christmas|holiday|santa|winter|festive)"),
            "halloween", Pattern.compile("(halloween|scary|horror|october|spooky)"),
            "summer", Pattern.compile("(summer|beach|vacation|hot|sunny)"),
            "valentines", Pattern.compile("(valentine|love|romantic|february|romance)"));

    /**
     * Lower bound of a tagging band. Bands are listed from the highest bound down.
     */
    public record Tier(String tag, double min) {
    }

    public static final List<Tier> RATING_TIERS = List.of(
            new Tier("highly_rated", 8.0),
            new Tier("well_rated", 7.0),
            new Tier("decent_rated", 6.0));

    public static final List<Tier> POPULARITY_TIERS = List.of(
            new Tier("very_popular", 50.0),
            new Tier("popular", 20.0),
            new Tier("somewhat_popular", 5.0));

    public static final List<Tier> ERA_TIERS = List.of(
            new Tier("recent", 2020),
            new Tier("modern", 2010),
            new Tier("millennium", 2000),
            new Tier("nineties", 1990),
            new Tier("eighties", 1980),
            new Tier("classic", 1));

    /**
     * Tag of the first band whose lower bound the value reaches, if any.
     */
    public static Optional<String> tierOf(List<Tier> tiers, double value) {
        for (Tier tier : tiers) {
            if (value >= tier.min()) {
                return Optional.of(tier.tag());
            }
        }
        return Optional.empty();
    }

    /**
     * Hand-curated query intents: canonical term to related search terms.
     */
    public static final Map<String, List<String>> INTENT_MAPPINGS = ordered(
            "marvel", List.of("marvel studios", "marvel entertainment", "mcu", "superhero", "comic book",
                    "avengers", "spider-man", "x-men"),
            "disney", List.of("walt disney", "pixar", "disney animation", "family friendly", "animated",
                    "princess", "fairy tale"),
            "netflix", List.of("netflix original", "streaming", "binge-worthy", "series", "limited series",
                    "netflix exclusive"),
            "warner", List.of("warner bros", "dc comics", "batman", "superman", "harry potter",
                    "lord of the rings"),
            "universal", List.of("universal pictures", "illumination", "fast and furious", "jurassic", "minions"),
            "horror", List.of("scary", "thriller", "supernatural", "slasher", "psychological", "ghost",
                    "monster", "zombie"),
            "comedy", List.of("funny", "humor", "laughs", "romantic comedy", "parody", "satire", "slapstick"),
            "action", List.of("adventure", "thriller", "chase", "fight", "explosive", "martial arts", "spy"),
            "drama", List.of("emotional", "character study", "serious", "tear-jerker", "biographical",
                    "historical"),
            "scifi", List.of("science fiction", "futuristic", "space", "alien", "technology", "dystopian",
                    "cyberpunk"),
            "christmas", List.of("holiday", "winter", "santa", "family gathering", "festive", "seasonal",
                    "heartwarming"),
            "romance", List.of("love story", "romantic", "relationship", "dating", "wedding", "couples",
                    "valentine"),
            "family", List.of("kids", "children", "parenting", "wholesome", "all ages", "educational", "disney"),
            "true story", List.of("based on", "biographical", "real events", "documentary", "historical",
                    "biopic"),
            "independent", List.of("indie", "art house", "film festival", "low budget", "alternative",
                    "experimental"),
            "foreign", List.of("international", "subtitled", "world cinema", "non-english", "cultural"),
            "classic", List.of("vintage", "old hollywood", "golden age", "timeless", "iconic", "legendary"),
            "batman", List.of("dark knight", "gotham", "bruce wayne", "dc comics", "superhero", "vigilante"),
            "star wars", List.of("jedi", "sith", "force", "galactic", "lucas", "space opera", "rebellion"),
            "james bond", List.of("007", "spy", "secret agent", "british", "action", "espionage"),
            "tarantino", List.of("pulp fiction", "kill bill", "django", "violent", "nonlinear", "dialogue-heavy"),
            "spielberg", List.of("adventure", "family friendly", "historical", "emotional", "blockbuster"),
            "nolan", List.of("complex", "mind-bending", "non-linear", "dark", "psychological", "inception"),
            "80s", List.of("eighties", "retro", "neon", "synth", "nostalgic", "classic", "vintage"),
            "90s", List.of("nineties", "grunge", "alternative", "teen", "generation x", "millennium"),
            "2000s", List.of("millennium", "early 2000s", "y2k", "digital age", "post-9/11"));

    // Person vocabulary

    /**
     * Genre ids used in filmography credits.
     */
    public static final Map<Integer, String> CREDIT_GENRES = Map.ofEntries(
            Map.entry(28, "Action"), Map.entry(12, "Adventure"), Map.entry(16, "Animation"),
            Map.entry(35, "Comedy"), Map.entry(80, "Crime"), Map.entry(99, "Documentary"),
            Map.entry(18, "Drama"), Map.entry(10751, "Family"), Map.entry(14, "Fantasy"),
            Map.entry(36, "History"), Map.entry(27, "Horror"), Map.entry(10402, "Music"),
            Map.entry(9648, "Mystery"), Map.entry(10749, "Romance"), Map.entry(878, "Science Fiction"),
            Map.entry(10770, "TV Movie"), Map.entry(53, "Thriller"), Map.entry(10752, "War"),
            Map.entry(37, "Western"));

    /**
     * Career stages with inclusive years-active and credit-count ranges, checked in order.
     */
    public record CareerStageRule(int minYears, int maxYears, int minCredits, int maxCredits) {
        public boolean matches(int yearsActive, int credits) {
            return yearsActive >= minYears && yearsActive <= maxYears
                    && credits >= minCredits && credits <= maxCredits;
        }
    }

    public static final Map<String, CareerStageRule> CAREER_STAGES = ordered(
            "emerging", new CareerStageRule(0, 5, 1, 10),
            "established", new CareerStageRule(6, 15, 11, 30),
            "veteran", new CareerStageRule(16, 30, 31, 60),
            "legend", new CareerStageRule(30, 100, 61, 200));

    public static final Map<String, List<String>> PROFESSION_CATEGORIES = ordered(
            "actor", List.of("actor", "actress", "voice actor", "performer", "acting"),
            "director", List.of("director", "filmmaker", "directing"),
            "producer", List.of("producer", "executive producer", "production"),
            "writer", List.of("writer", "screenplay", "story", "novelist", "writing"),
            "cinematographer", List.of("director of photography", "cinematographer", "camera"),
            "composer", List.of("composer", "music", "soundtrack", "sound"),
            "editor", List.of("editor", "film editor", "editing"),
            "designer", List.of("production designer", "costume designer", "set decorator", "art"));

    /**
     * Builds an insertion-ordered, read-only map from alternating keys and values.
     */
    @SuppressWarnings("unchecked")
    static <K, V> Map<K, V> ordered(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<K, V> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((K) keysAndValues[i], (V) keysAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
