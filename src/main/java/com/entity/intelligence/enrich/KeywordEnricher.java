package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.rules.CatalogRules;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Usage and meaning analysis for keyword entities.
 *
 * <p>Usage is measured over the corpus titles tagged with the keyword, by id or by name.
 * A {@code movie_count} attribute on the keyword overrides the corpus count for the
 * popularity and frequency figures. Stop-word keywords and names shorter than two or
 * longer than one hundred characters are excluded.</p>
 */
public class KeywordEnricher implements EntityEnricher {

    private static final int MIN_LENGTH = 2;
    private static final int MAX_LENGTH = 100;
    private static final int RECENT_YEARS = 5;

    private final int referenceYear;

    public KeywordEnricher(int referenceYear) {
        this.referenceYear = referenceYear;
    }

    @Override
    public String getName() {
        return "keyword";
    }

    @Override
    public boolean supports(Entity entity) {
        return entity.getKind() == EntityKind.KEYWORD;
    }

    @Override
    public EnrichmentResult enrich(Entity keyword, EntityCorpus corpus) {
        String name = keyword.getDisplayName().toLowerCase(Locale.ROOT).trim();
        if (CatalogRules.EXCLUDED_KEYWORDS.contains(name)) {
            return EnrichmentResult.excluded(keyword, "stop word");
        }
        if (name.length() < MIN_LENGTH || name.length() > MAX_LENGTH) {
            return EnrichmentResult.excluded(keyword, "name length " + name.length());
        }
        Filmography titles = titlesOf(keyword, name, corpus);
        int count = (int) EntityAttributes.number(keyword, "movie_count").orElse(titles.size());
        String category = category(name);
        double significance = significance(name);

        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("popularity", popularity(name, count, titles));
        derived.put("keyword_category", category);
        derived.put("significance", significance);
        derived.put("related_keywords", relatedKeywords(name, category));
        derived.put("usage_analysis", usageAnalysis(count, titles));
        derived.put("semantic_field", semanticField(name));
        derived.put("thematic_relevance", thematicRelevance(name, category, significance));
        derived.put("temporal_patterns", temporalPatterns(titles));
        derived.put("genre_affinity", genreAffinity(titles));
        derived.put("movie_count", count);

        derived.keySet().removeIf(key -> keyword.get(key).isPresent());
        return EnrichmentResult.kept(keyword.withDerived(derived));
    }

    private static Filmography titlesOf(Entity keyword, String name, EntityCorpus corpus) {
        String keywordId = Long.toString(keyword.getSourceId());
        return Filmography.referencing(corpus, title -> EntityAttributes.records(title, "keywords").stream()
                .anyMatch(record -> EntityAttributes.idOf(record.get("id")).filter(keywordId::equals).isPresent()
                        || EntityAttributes.asText(record.get("name")).filter(name::equalsIgnoreCase).isPresent()));
    }

    int popularity(String name, int count, Filmography titles) {
        double score = 10;
        score += Math.min(40, count / 2.0);
        score += CatalogRules.KEYWORD_SIGNIFICANCE.getOrDefault(name, 0.0) * 30;
        long recent = titles.releasedSince(referenceYear - RECENT_YEARS);
        score += Math.min(15, recent * 3);
        if (!titles.isEmpty()) {
            double averageRating = titles.averageRating();
            if (averageRating >= 7.0) {
                score += 10;
            } else if (averageRating >= 6.0) {
                score += 5;
            }
        }
        return (int) Math.min(100, Math.round(score));
    }

    /**
     * Category whose vocabulary overlaps the name in either direction, then a word fallback.
     */
    static String category(String name) {
        for (Map.Entry<String, List<String>> entry : CatalogRules.KEYWORD_CATEGORIES.entrySet()) {
            if (entry.getValue().stream().anyMatch(word -> name.contains(word) || word.contains(name))) {
                return entry.getKey();
            }
        }
        for (Map.Entry<String, String> fallback : CatalogRules.KEYWORD_CATEGORY_FALLBACKS.entrySet()) {
            if (name.contains(fallback.getKey())) {
                return fallback.getValue();
            }
        }
        return "general";
    }

    /**
     * Predefined significance, else 0.5 adjusted for specificity and genericness, in [0.1, 1].
     */
    static double significance(String name) {
        Double predefined = CatalogRules.KEYWORD_SIGNIFICANCE.get(name);
        if (predefined != null) {
            return predefined;
        }
        double significance = 0.5;
        if (name.length() > 15) {
            significance += 0.1;
        }
        if (name.split("\\s+").length > 2) {
            significance += 0.1;
        }
        if (CatalogRules.HIGH_SIGNIFICANCE_PATTERNS.stream().anyMatch(name::contains)) {
            significance += 0.2;
        }
        if (CatalogRules.GENERIC_TERMS.contains(name)) {
            significance -= 0.2;
        }
        return Filmography.round2(Math.max(0.1, Math.min(1.0, significance)));
    }

    static List<String> relatedKeywords(String name, String category) {
        Set<String> related = new LinkedHashSet<>();
        related.add(name);
        related.addAll(CatalogRules.KEYWORD_SYNONYMS.getOrDefault(name, List.of()));
        CatalogRules.KEYWORD_CATEGORIES.getOrDefault(category, List.of()).stream().limit(3).forEach(related::add);
        String[] words = name.split("\\s+");
        if (words.length > 1) {
            for (String word : words) {
                if (word.length() > 3) {
                    related.add(word);
                }
            }
        }
        return related.stream().filter(keyword -> keyword.length() > 1).toList();
    }

    Map<String, Object> usageAnalysis(int count, Filmography titles) {
        String frequency;
        if (count >= 100) {
            frequency = "very_common";
        } else if (count >= 50) {
            frequency = "common";
        } else if (count >= 20) {
            frequency = "moderate";
        } else if (count >= 5) {
            frequency = "uncommon";
        } else {
            frequency = "rare";
        }
        int cutoff = referenceYear - RECENT_YEARS;
        long recent = titles.releasedSince(cutoff);
        long older = titles.works().stream()
                .filter(work -> work.year().isPresent() && work.year().getAsInt() < cutoff)
                .count();

        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("frequency", frequency);
        usage.put("trending", !titles.isEmpty() && recent > older * 1.5);
        titles.peakDecade().ifPresent(peak -> usage.put("peak_period", peak));
        return usage;
    }

    static Map<String, Object> semanticField(String name) {
        Map<String, Object> field = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : CatalogRules.SEMANTIC_FIELDS.entrySet()) {
            List<String> concepts = entry.getValue().stream().filter(name::contains).toList();
            if (!concepts.isEmpty()) {
                field.put("primary_field", entry.getKey());
                field.put("confidence", 0.8);
                field.put("related_concepts", concepts);
                return field;
            }
        }
        field.put("primary_field", "general");
        field.put("confidence", 0.5);
        field.put("related_concepts", List.of());
        return field;
    }

    static Map<String, Object> thematicRelevance(String name, String category, double significance) {
        String strength = "medium";
        if (significance >= 0.8) {
            strength = "high";
        } else if (significance <= 0.3) {
            strength = "low";
        }
        String specificity = "medium";
        if (name.length() > 15 || name.split("\\s+").length > 2) {
            specificity = "high";
        } else if (name.length() < 8) {
            specificity = "low";
        }
        String narrative = "medium";
        if (CatalogRules.HIGH_NARRATIVE_CATEGORIES.contains(category)) {
            narrative = "high";
        } else if (CatalogRules.LOW_NARRATIVE_CATEGORIES.contains(category)) {
            narrative = "low";
        }
        Map<String, Object> relevance = new LinkedHashMap<>();
        relevance.put("strength", strength);
        relevance.put("specificity", specificity);
        relevance.put("narrative_importance", narrative);
        return relevance;
    }

    static Map<String, Object> temporalPatterns(Filmography titles) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (titles.isEmpty()) {
            result.put("pattern", "insufficient_data");
            return result;
        }
        List<Integer> years = titles.years();
        if (years.isEmpty()) {
            result.put("pattern", "no_date_data");
            return result;
        }
        int first = years.get(0);
        int last = years.get(years.size() - 1);
        int span = last - first + 1;
        double frequency = (double) years.size() / span;
        String pattern;
        if (span <= 5) {
            pattern = "concentrated";
        } else if (frequency >= 0.5) {
            pattern = "consistent";
        } else if (frequency >= 0.2) {
            pattern = "periodic";
        } else {
            pattern = "sporadic";
        }
        result.put("pattern", pattern);
        result.put("time_span", span);
        result.put("first_use", first);
        result.put("most_recent", last);
        result.put("frequency_per_year", Filmography.round2(frequency));
        titles.peakDecade().ifPresent(peak -> result.put("peak_period", peak));
        return result;
    }

    static Map<String, Object> genreAffinity(Filmography titles) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (titles.isEmpty()) {
            result.put("top_genres", List.of());
            result.put("distribution", "unknown");
            return result;
        }
        Map<String, Integer> frequency = titles.genreFrequency();
        if (frequency.isEmpty()) {
            result.put("top_genres", List.of());
            result.put("distribution", "no_genre_data");
            return result;
        }
        int total = frequency.values().stream().mapToInt(Integer::intValue).sum();
        Map.Entry<String, Integer> top = frequency.entrySet().iterator().next();
        double share = (double) top.getValue() / total;
        String distribution;
        if (share >= 0.6) {
            distribution = "concentrated";
        } else if (share >= 0.4) {
            distribution = "focused";
        } else if (share >= 0.25) {
            distribution = "moderate";
        } else {
            distribution = "diverse";
        }
        result.put("top_genres", Filmography.genreShares(frequency, 5));
        result.put("distribution", distribution);
        result.put("primary_genre", top.getKey());
        return result;
    }
}
