package com.entity.intelligence.rules;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.entity.intelligence.rules.RuleTables.ordered;

/**
 * Descriptive vocabulary for genre entities, keyed by genre name.
 * Genres missing from a table take the table's documented default.
 */
public final class GenreRules {

    private GenreRules() {
        // Constants holder
    }

    /**
     * @param themes    what stories of the genre are about
     * @param audience  target audience label
     * @param elements  typical story elements
     * @param subgenres common subgenres
     * @param score     popularity score in [0, 100]
     */
    public record GenreTraits(List<String> themes, String audience, List<String> elements,
                              List<String> subgenres, int score) {
    }

    public static final Map<String, GenreTraits> TRAITS = ordered(
            "Action", new GenreTraits(List.of("adrenaline", "excitement", "physical conflict"), "teens_adults",
                    List.of("fast_paced", "stunts", "chase_scenes", "combat"),
                    List.of("martial arts", "spy", "superhero", "military"), 95),
            "Adventure", new GenreTraits(List.of("exploration", "journey", "discovery"), "all_ages",
                    List.of("exotic_locations", "quests", "treasure_hunting"),
                    List.of("survival", "treasure hunt", "exploration"), 85),
            "Animation", new GenreTraits(List.of("imagination", "creativity", "storytelling"), "all_ages",
                    List.of("animated_characters", "voice_acting", "creative_visuals"),
                    List.of("cgi", "traditional", "stop_motion", "anime"), 70),
            "Comedy", new GenreTraits(List.of("humor", "entertainment", "social commentary"), "all_ages",
                    List.of("jokes", "funny_situations", "comic_timing"),
                    List.of("romantic comedy", "dark comedy", "parody", "slapstick"), 90),
            "Crime", new GenreTraits(List.of("justice", "morality", "law enforcement"), "adults",
                    List.of("investigation", "criminal_activity", "police_work"),
                    List.of("detective", "heist", "gangster", "procedural"), 75),
            "Documentary", new GenreTraits(List.of("education", "reality", "information"), "adults",
                    List.of("factual_content", "real_people", "educational_value"),
                    List.of("nature", "biographical", "investigative", "historical"), 45),
            "Drama", new GenreTraits(List.of("emotion", "character_development", "human_condition"), "adults",
                    List.of("realistic_situations", "emotional_depth", "character_study"),
                    List.of("family drama", "courtroom drama", "medical drama", "period drama"), 85),
            "Family", new GenreTraits(List.of("relationships", "values", "togetherness"), "all_ages",
                    List.of("wholesome_content", "moral_lessons", "multi_generational_appeal"),
                    List.of("children", "teen", "holiday", "educational"), 80),
            "Fantasy", new GenreTraits(List.of("magic", "imagination", "escape"), "all_ages",
                    List.of("magical_elements", "mythical_creatures", "alternate_worlds"),
                    List.of("high fantasy", "urban fantasy", "dark fantasy", "fairy tale"), 75),
            "History", new GenreTraits(List.of("past", "education", "cultural_heritage"), "adults",
                    List.of("historical_accuracy", "period_setting", "real_events"),
                    List.of("war", "biographical", "period piece", "ancient"), 55),
            "Horror", new GenreTraits(List.of("fear", "suspense", "supernatural"), "mature_teens_adults",
                    List.of("fear_elements", "suspense", "supernatural_themes"),
                    List.of("slasher", "psychological", "supernatural", "zombie"), 80),
            "Music", new GenreTraits(List.of("performance", "creativity", "emotion"), "all_ages",
                    List.of("musical_numbers", "dance", "performance"),
                    List.of("musical", "concert", "biographical", "competition"), 55),
            "Mystery", new GenreTraits(List.of("puzzle", "investigation", "revelation"), "teens_adults",
                    List.of("clues", "investigation", "puzzle_solving"),
                    List.of("detective", "cozy mystery", "noir", "whodunit"), 70),
            "Romance", new GenreTraits(List.of("love", "relationships", "emotion"), "teens_adults",
                    List.of("love_story", "emotional_connection", "relationships"),
                    List.of("romantic comedy", "romantic drama", "period romance", "teen romance"), 75),
            "Science Fiction", new GenreTraits(List.of("technology", "future", "exploration"), "teens_adults",
                    List.of("advanced_technology", "future_setting", "scientific_concepts"),
                    List.of("space opera", "cyberpunk", "dystopian", "time travel"), 80),
            "Thriller", new GenreTraits(List.of("suspense", "tension", "excitement"), "adults",
                    List.of("suspense", "tension", "psychological_elements"),
                    List.of("psychological thriller", "action thriller", "spy thriller", "supernatural thriller"), 85),
            "War", new GenreTraits(List.of("conflict", "heroism", "sacrifice"), "adults",
                    List.of("military_conflict", "battlefield_scenes", "heroism"),
                    List.of("world war", "vietnam war", "modern warfare", "historical war"), 60),
            "Western", new GenreTraits(List.of("frontier", "justice", "survival"), "adults",
                    List.of("frontier_setting", "cowboys", "law_vs_lawlessness"),
                    List.of("classic western", "spaghetti western", "modern western", "comedy western"), 50));

    /**
     * Scores for genres without traits; anything else scores {@link #DEFAULT_SCORE}.
     */
    public static final Map<String, Integer> FALLBACK_SCORES = Map.of("TV Movie", 45, "Foreign", 40, "Short", 30);
    public static final int DEFAULT_SCORE = 50;

    public static final Map<String, List<String>> ALTERNATIVE_NAMES = Map.of(
            "Science Fiction", List.of("sci-fi", "scifi", "science_fiction"),
            "TV Movie", List.of("television", "tv_movie", "made_for_tv"),
            "Music", List.of("musical", "music_drama", "concert"));

    public static final Map<String, List<String>> RELATED = Map.ofEntries(
            Map.entry("Action", List.of("Adventure", "Thriller", "Crime")),
            Map.entry("Adventure", List.of("Action", "Fantasy", "Family")),
            Map.entry("Animation", List.of("Family", "Comedy", "Adventure")),
            Map.entry("Comedy", List.of("Romance", "Family", "Animation")),
            Map.entry("Crime", List.of("Thriller", "Drama", "Mystery")),
            Map.entry("Documentary", List.of("History", "Biography")),
            Map.entry("Drama", List.of("Romance", "Crime", "History")),
            Map.entry("Family", List.of("Animation", "Comedy", "Adventure")),
            Map.entry("Fantasy", List.of("Adventure", "Animation", "Romance")),
            Map.entry("History", List.of("Drama", "War", "Biography")),
            Map.entry("Horror", List.of("Thriller", "Mystery", "Supernatural")),
            Map.entry("Music", List.of("Comedy", "Drama", "Romance")),
            Map.entry("Mystery", List.of("Crime", "Thriller", "Horror")),
            Map.entry("Romance", List.of("Comedy", "Drama", "Family")),
            Map.entry("Science Fiction", List.of("Action", "Adventure", "Thriller")),
            Map.entry("Thriller", List.of("Action", "Crime", "Mystery")),
            Map.entry("War", List.of("Drama", "History", "Action")),
            Map.entry("Western", List.of("Action", "Drama", "Adventure")));

    /**
     * Significance aspects rated high per genre; every other aspect is medium.
     */
    public static final Map<String, Set<String>> HIGH_SIGNIFICANCE = Map.of(
            "Documentary", Set.of("historical_importance", "social_relevance", "artistic_value"),
            "Horror", Set.of("cultural_impact", "social_relevance"),
            "Science Fiction", Set.of("cultural_impact", "social_relevance", "artistic_value"),
            "Western", Set.of("historical_importance", "cultural_impact"),
            "Animation", Set.of("artistic_value", "cultural_impact"),
            "War", Set.of("historical_importance", "social_relevance"),
            "Crime", Set.of("social_relevance"),
            "Romance", Set.of("cultural_impact"));

    public static final List<String> SIGNIFICANCE_ASPECTS = List.of(
            "historical_importance", "cultural_impact", "social_relevance", "artistic_value");

    /**
     * Market trend per genre; {@code stable} otherwise.
     */
    public static final Map<String, String> MARKET_TRENDS = Map.of(
            "Action", "stable_high",
            "Comedy", "stable_high",
            "Horror", "growing",
            "Science Fiction", "growing",
            "Documentary", "growing",
            "Western", "declining",
            "Music", "stable_low",
            "War", "stable_low");

    public static final Map<String, Set<String>> FRANCHISE_POTENTIAL = ordered(
            "high", Set.of("Action", "Science Fiction", "Fantasy", "Horror", "Adventure"),
            "medium", Set.of("Comedy", "Thriller", "Crime", "Animation"),
            "low", Set.of("Drama", "Romance", "Documentary", "History"));

    public static final Map<String, Set<String>> INTERNATIONAL_APPEAL = ordered(
            "universal", Set.of("Action", "Animation", "Horror", "Science Fiction", "Adventure"),
            "moderate", Set.of("Comedy", "Drama", "Romance", "Thriller", "Family"),
            "limited", Set.of("Western", "History", "Documentary", "Music"));

    /**
     * Primary and secondary age group; adults and young adults otherwise.
     */
    public static final Map<String, List<String>> AGE_GROUPS = Map.of(
            "Animation", List.of("children", "families"),
            "Family", List.of("families", "all_ages"),
            "Horror", List.of("young_adults", "teenagers"),
            "Action", List.of("young_adults", "teenagers"),
            "Romance", List.of("adults", "young_adults"),
            "Documentary", List.of("adults", "older_adults"),
            "Comedy", List.of("all_ages", "young_adults"));

    public static final Map<String, List<String>> VIEWING_CONTEXTS = Map.of(
            "Horror", List.of("theater", "group_viewing", "halloween"),
            "Comedy", List.of("theater", "home", "social_viewing"),
            "Action", List.of("theater", "premium_formats"),
            "Romance", List.of("home", "date_night"),
            "Documentary", List.of("home", "educational_settings"),
            "Family", List.of("home", "family_time"),
            "Drama", List.of("home", "awards_season"));

    /**
     * Peak and secondary season.
     */
    public static final Map<String, List<String>> SEASONS = Map.of(
            "Horror", List.of("fall", "winter"),
            "Family", List.of("winter", "summer"),
            "Action", List.of("summer", "spring"),
            "Romance", List.of("winter", "spring"),
            "Comedy", List.of("summer", "all_year"),
            "Drama", List.of("fall", "winter"));

    /**
     * Minimum, maximum and average runtime in minutes.
     */
    public record Runtime(int min, int max, int average) {
    }

    public static final Runtime DEFAULT_RUNTIME = new Runtime(90, 130, 110);

    public static final Map<String, Runtime> RUNTIMES = Map.of(
            "Action", new Runtime(90, 150, 120),
            "Comedy", new Runtime(80, 120, 100),
            "Drama", new Runtime(90, 180, 135),
            "Horror", new Runtime(80, 110, 95),
            "Documentary", new Runtime(60, 180, 120),
            "Animation", new Runtime(75, 120, 95),
            "Romance", new Runtime(90, 130, 110));

    public static final Map<String, List<String>> SETTINGS = Map.of(
            "Action", List.of("urban", "international", "vehicles", "rooftops"),
            "Horror", List.of("isolated", "dark", "supernatural", "confined_spaces"),
            "Western", List.of("frontier", "desert", "small_towns", "saloons"),
            "Science Fiction", List.of("future", "space", "laboratories", "cities"),
            "Romance", List.of("cities", "romantic_locations", "homes", "restaurants"),
            "War", List.of("battlefields", "military_bases", "historical_locations"),
            "Crime", List.of("urban", "police_stations", "courtrooms", "streets"));

    public static final Map<String, List<String>> NARRATIVES = Map.of(
            "Action", List.of("three_act", "hero_journey", "chase"),
            "Horror", List.of("building_tension", "final_girl", "supernatural_reveal"),
            "Comedy", List.of("setup_punchline", "mistaken_identity", "fish_out_of_water"),
            "Drama", List.of("character_arc", "slice_of_life", "ensemble"),
            "Mystery", List.of("investigation", "red_herrings", "revelation"),
            "Romance", List.of("meet_cute", "obstacles", "happy_ending"));

    public static final Map<String, List<String>> VISUAL_STYLES = Map.of(
            "Horror", List.of("dark_lighting", "shadows", "confined_framing"),
            "Action", List.of("dynamic_camera", "quick_cuts", "wide_shots"),
            "Romance", List.of("soft_lighting", "close_ups", "warm_colors"),
            "Science Fiction", List.of("futuristic_design", "special_effects", "cool_colors"),
            "Western", List.of("wide_landscapes", "natural_lighting", "earth_tones"),
            "Documentary", List.of("realistic", "handheld", "natural_lighting"));

    public static final Map<String, String> PACING = Map.of(
            "Action", "fast",
            "Thriller", "fast",
            "Comedy", "medium_fast",
            "Horror", "variable",
            "Drama", "slow",
            "Documentary", "slow",
            "Romance", "medium",
            "Mystery", "medium");

    public static int scoreOf(String genre) {
        GenreTraits traits = TRAITS.get(genre);
        return traits != null ? traits.score() : FALLBACK_SCORES.getOrDefault(genre, DEFAULT_SCORE);
    }
}
