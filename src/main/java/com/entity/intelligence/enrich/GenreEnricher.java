package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.rules.GenreRules;
import com.entity.intelligence.rules.GenreRules.GenreTraits;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Descriptive profile for genre entities. Genres are never excluded; names outside the
 * built-in vocabulary get empty traits and the default score.
 */
public class GenreEnricher implements EntityEnricher {

    private static final GenreTraits UNKNOWN_TRAITS =
            new GenreTraits(List.of(), "general", List.of(), List.of(), GenreRules.DEFAULT_SCORE);

    @Override
    public String getName() {
        return "genre";
    }

    @Override
    public boolean supports(Entity entity) {
        return entity.getKind() == EntityKind.GENRE;
    }

    @Override
    public EnrichmentResult enrich(Entity genre, EntityCorpus corpus) {
        String name = canonicalName(genre.getDisplayName());
        GenreTraits traits = GenreRules.TRAITS.getOrDefault(name, UNKNOWN_TRAITS);
        int score = GenreRules.scoreOf(name);
        Filmography titles = titlesOf(genre, name, corpus);

        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("themes", traits.themes());
        derived.put("target_audience", traits.audience());
        derived.put("typical_elements", traits.elements());
        derived.put("subgenres", traits.subgenres());
        derived.put("popularity", score);
        derived.put("genre_keywords", keywords(name, traits));
        derived.put("related_genres", GenreRules.RELATED.getOrDefault(name, List.of()));
        derived.put("cultural_significance", culturalSignificance(name));
        derived.put("market_analysis", marketAnalysis(name, score));
        derived.put("audience_demographics", audienceDemographics(name, traits));
        derived.put("content_patterns", contentPatterns(name));
        derived.put("movie_count", titles.size());
        derived.put("applies_to", appliesTo(titles));

        derived.keySet().removeIf(key -> genre.get(key).isPresent());
        return EnrichmentResult.kept(genre.withDerived(derived));
    }

    /**
     * The vocabulary's spelling of a genre name, matched case-insensitively.
     */
    static String canonicalName(String name) {
        return GenreRules.TRAITS.keySet().stream()
                .filter(known -> known.equalsIgnoreCase(name))
                .findFirst()
                .orElse(name);
    }

    private static Filmography titlesOf(Entity genre, String name, EntityCorpus corpus) {
        String genreId = Long.toString(genre.getSourceId());
        return Filmography.referencing(corpus, title ->
                EntityAttributes.genres(title).stream().anyMatch(name::equalsIgnoreCase)
                        || EntityAttributes.records(title, "genres").stream()
                        .anyMatch(record -> EntityAttributes.idOf(record.get("id")).filter(genreId::equals).isPresent()));
    }

    static List<String> keywords(String name, GenreTraits traits) {
        Set<String> keywords = new LinkedHashSet<>();
        keywords.add(name.toLowerCase(Locale.ROOT));
        keywords.addAll(GenreRules.ALTERNATIVE_NAMES.getOrDefault(name, List.of()));
        keywords.addAll(traits.themes());
        keywords.addAll(traits.elements());
        keywords.addAll(traits.subgenres());
        return List.copyOf(keywords);
    }

    static Map<String, Object> culturalSignificance(String name) {
        Set<String> high = GenreRules.HIGH_SIGNIFICANCE.getOrDefault(name, Set.of());
        Map<String, Object> significance = new LinkedHashMap<>();
        for (String aspect : GenreRules.SIGNIFICANCE_ASPECTS) {
            significance.put(aspect, high.contains(aspect) ? "high" : "medium");
        }
        return significance;
    }

    static Map<String, Object> marketAnalysis(String name, int score) {
        String position;
        if (score >= 85) {
            position = "dominant";
        } else if (score >= 70) {
            position = "strong";
        } else if (score >= 55) {
            position = "moderate";
        } else if (score >= 40) {
            position = "niche";
        } else {
            position = "specialized";
        }
        Map<String, Object> market = new LinkedHashMap<>();
        market.put("market_position", position);
        market.put("trend", GenreRules.MARKET_TRENDS.getOrDefault(name, "stable"));
        market.put("commercial_viability", score >= 70 ? "high" : score >= 50 ? "medium" : "low");
        market.put("franchise_potential", tierOf(GenreRules.FRANCHISE_POTENTIAL, name, "medium"));
        market.put("international_appeal", tierOf(GenreRules.INTERNATIONAL_APPEAL, name, "moderate"));
        return market;
    }

    private static String tierOf(Map<String, Set<String>> tiers, String name, String fallback) {
        return tiers.entrySet().stream()
                .filter(tier -> tier.getValue().contains(name))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(fallback);
    }

    static Map<String, Object> audienceDemographics(String name, GenreTraits traits) {
        List<String> ages = GenreRules.AGE_GROUPS.getOrDefault(name, List.of("adults", "young_adults"));
        Map<String, Object> age = new LinkedHashMap<>();
        age.put("primary", ages.get(0));
        age.put("secondary", ages.get(1));

        Map<String, Object> seasonal = new LinkedHashMap<>();
        List<String> seasons = GenreRules.SEASONS.get(name);
        if (seasons == null) {
            seasonal.put("peak", "all_year");
        } else {
            seasonal.put("peak", seasons.get(0));
            seasonal.put("secondary", seasons.get(1));
        }

        Map<String, Object> demographics = new LinkedHashMap<>();
        demographics.put("primary_audience", traits.audience());
        demographics.put("age_demographics", age);
        demographics.put("viewing_context", GenreRules.VIEWING_CONTEXTS.getOrDefault(name, List.of("theater", "home")));
        demographics.put("seasonal_preferences", seasonal);
        return demographics;
    }

    static Map<String, Object> contentPatterns(String name) {
        GenreRules.Runtime runtime = GenreRules.RUNTIMES.getOrDefault(name, GenreRules.DEFAULT_RUNTIME);
        Map<String, Object> typicalRuntime = new LinkedHashMap<>();
        typicalRuntime.put("min", runtime.min());
        typicalRuntime.put("max", runtime.max());
        typicalRuntime.put("average", runtime.average());

        Map<String, Object> patterns = new LinkedHashMap<>();
        patterns.put("typical_runtime", typicalRuntime);
        patterns.put("common_settings", GenreRules.SETTINGS.getOrDefault(name, List.of("various")));
        patterns.put("narrative_structures", GenreRules.NARRATIVES.getOrDefault(name, List.of("three_act")));
        patterns.put("visual_style", GenreRules.VISUAL_STYLES.getOrDefault(name, List.of("standard_cinematography")));
        patterns.put("pacing", GenreRules.PACING.getOrDefault(name, "medium"));
        return patterns;
    }

    private static List<String> appliesTo(Filmography titles) {
        Set<String> kinds = new TreeSet<>();
        titles.works().forEach(work -> kinds.add(work.kind().getPrefix()));
        return List.copyOf(kinds);
    }
}
