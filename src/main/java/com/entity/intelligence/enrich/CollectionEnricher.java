package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.enrich.Filmography.Work;
import com.entity.intelligence.rules.CatalogRules;
import com.entity.intelligence.rules.RuleTables;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Franchise analysis for collections.
 *
 * <p>Parts are read from the collection's {@code parts} records or, when it has none, from
 * the corpus titles whose {@code belongs_to_collection} points at it. Collections with fewer
 * than two parts are excluded.</p>
 *
 * <p>Derived fields: {@code movie_count}, {@code popularity}, {@code genres},
 * {@code franchise_type}, {@code release_span}, {@code franchise_health},
 * {@code sequencing}, {@code box_office_trajectory}, {@code critical_reception} and
 * {@code collection_keywords}.</p>
 */
public class CollectionEnricher implements EntityEnricher {

    public static final int MIN_PARTS = 2;

    private final int referenceYear;

    public CollectionEnricher(int referenceYear) {
        this.referenceYear = referenceYear;
    }

    @Override
    public String getName() {
        return "collection";
    }

    @Override
    public boolean supports(Entity entity) {
        return entity.getKind() == EntityKind.COLLECTION;
    }

    @Override
    public EnrichmentResult enrich(Entity collection, EntityCorpus corpus) {
        Filmography parts = partsOf(collection, corpus);
        if (parts.size() < MIN_PARTS) {
            return EnrichmentResult.excluded(collection, "fewer than " + MIN_PARTS + " titles");
        }
        String name = collection.getDisplayName();
        String franchiseType = CatalogRules.firstMatch(CatalogRules.FRANCHISE_TYPES,
                name.toLowerCase(Locale.ROOT), "general");

        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("movie_count", parts.size());
        derived.put("popularity", popularity(name, parts));
        derived.put("genres", parts.topGenres(5));
        derived.put("franchise_type", franchiseType);
        releaseSpan(parts).ifPresent(span -> derived.put("release_span", span));
        derived.put("franchise_health", franchiseHealth(parts));
        derived.put("sequencing", sequencing(parts));
        derived.put("box_office_trajectory", boxOfficeTrajectory(parts));
        derived.put("critical_reception", criticalReception(parts));
        derived.put("collection_keywords", keywords(name, franchiseType, parts));

        derived.keySet().removeIf(key -> collection.get(key).isPresent());
        return EnrichmentResult.kept(collection.withDerived(derived));
    }

    static Filmography partsOf(Entity collection, EntityCorpus corpus) {
        List<Map<String, Object>> records = EntityAttributes.records(collection, "parts");
        if (!records.isEmpty()) {
            return Filmography.of(records.stream().map(Filmography::workOf).toList());
        }
        String collectionId = Long.toString(collection.getSourceId());
        return Filmography.referencing(corpus, title -> EntityAttributes.collection(title)
                .filter(ref -> ref.id().equals(collectionId))
                .isPresent());
    }

    static int popularity(String name, Filmography parts) {
        String lower = name.toLowerCase(Locale.ROOT);
        double score = 20;
        score += Math.min(30, parts.size() * 5);
        if (CatalogRules.MAJOR_FRANCHISES.stream().anyMatch(lower::contains)) {
            score += 35;
        }
        for (Map.Entry<String, Integer> bonus : CatalogRules.COLLECTION_NAME_BONUS.entrySet()) {
            if (lower.contains(bonus.getKey())) {
                score += bonus.getValue();
            }
        }
        double[] ratings = parts.works().stream().mapToDouble(Work::rating).filter(r -> r > 0).toArray();
        if (ratings.length > 0) {
            double averageRating = average(ratings);
            if (averageRating >= 7.5) {
                score += 15;
            } else if (averageRating >= 6.5) {
                score += 10;
            } else if (averageRating >= 5.5) {
                score += 5;
            }
        }
        if (parts.works().stream().mapToDouble(Work::popularity).max().orElse(0) > 50) {
            score += 10;
        }
        return (int) Math.min(100, Math.round(score));
    }

    static Optional<Map<String, Object>> releaseSpan(Filmography parts) {
        List<Integer> years = parts.years();
        if (years.isEmpty()) {
            return Optional.empty();
        }
        int start = years.get(0);
        int end = years.get(years.size() - 1);
        int longestGap = 0;
        for (int i = 1; i < years.size(); i++) {
            longestGap = Math.max(longestGap, years.get(i) - years.get(i - 1));
        }
        double averageGap = years.size() > 1 ? (double) (end - start) / (years.size() - 1) : 0.0;

        Map<String, Object> span = new LinkedHashMap<>();
        span.put("start_year", start);
        span.put("end_year", end);
        span.put("span_years", end - start + 1);
        span.put("total_movies", parts.size());
        span.put("average_gap", Filmography.round1(averageGap));
        span.put("longest_gap", longestGap);
        span.put("release_frequency", Filmography.round2(averageGap));
        return Optional.of(span);
    }

    Map<String, Object> franchiseHealth(Filmography parts) {
        List<Work> dated = parts.byRelease();
        Map<String, Object> result = new LinkedHashMap<>();
        if (dated.size() < 2) {
            result.put("health", "insufficient_data");
            result.put("score", 0);
            return result;
        }

        int score = 50;
        double[] ratings = dated.stream().mapToDouble(Work::rating).filter(r -> r > 0).toArray();
        String ratingTrend = "unknown";
        if (ratings.length >= 2) {
            double first = average(Arrays.copyOfRange(ratings, 0, (ratings.length + 1) / 2));
            double second = average(Arrays.copyOfRange(ratings, ratings.length / 2, ratings.length));
            if (second > first) {
                score += 20;
                ratingTrend = "improving";
            } else {
                if (second < first - 1) {
                    score -= 15;
                }
                ratingTrend = second < first ? "declining" : "stable";
            }
        }

        Optional<Double> averageGap = releaseSpan(parts).map(span -> (Double) span.get("average_gap"));
        boolean consistent = averageGap.filter(gap -> gap <= 4).isPresent();
        if (consistent) {
            score += 15;
        } else if (averageGap.filter(gap -> gap > 8).isPresent()) {
            score -= 10;
        }

        OptionalInt latest = dated.stream().map(Work::year).filter(OptionalInt::isPresent)
                .mapToInt(OptionalInt::getAsInt).max();
        boolean active = false;
        if (latest.isPresent()) {
            int yearsSinceLatest = referenceYear - latest.getAsInt();
            active = yearsSinceLatest <= 3;
            if (active) {
                score += 15;
            } else if (yearsSinceLatest > 10) {
                score -= 20;
            }
        }

        double averageRating = average(ratings);
        if (averageRating >= 7.0) {
            score += 20;
        } else if (ratings.length > 0 && averageRating < 5.0) {
            score -= 15;
        }
        score = Math.max(0, Math.min(100, score));

        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put("rating_trend", ratingTrend);
        factors.put("release_consistency", consistent ? "consistent" : "irregular");
        factors.put("recent_activity", active ? "active" : "dormant");
        factors.put("overall_quality", averageRating >= 7.0 ? "high" : averageRating >= 5.0 ? "medium" : "low");

        result.put("health", healthOf(score));
        result.put("score", score);
        result.put("factors", factors);
        return result;
    }

    static String healthOf(int score) {
        if (score >= 75) {
            return "thriving";
        }
        if (score >= 60) {
            return "healthy";
        }
        if (score >= 40) {
            return "stable";
        }
        return score >= 25 ? "declining" : "struggling";
    }

    static Map<String, Object> sequencing(Filmography parts) {
        int count = parts.size();
        String type;
        if (count == 2) {
            type = "duology";
        } else if (count == 3) {
            type = "trilogy";
        } else if (count <= 6) {
            type = "series";
        } else {
            type = "franchise";
        }
        List<Integer> numbers = new ArrayList<>();
        for (Work work : parts.byRelease()) {
            numberOf(work.title()).ifPresent(numbers::add);
        }
        boolean chronological = numbers.size() > 1;
        for (int i = 1; i < numbers.size() && chronological; i++) {
            chronological = numbers.get(i) > numbers.get(i - 1);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", type);
        result.put("has_numbering", parts.works().stream()
                .anyMatch(work -> RuleTables.SEQUEL_NUMBER.matcher(work.title()).find()));
        result.put("is_chronological", chronological);
        result.put("movie_count", count);
        result.put("numbering_pattern", numberingPattern(parts));
        return result;
    }

    /**
     * Sequel number of a title, a roman numeral taking precedence over digits.
     */
    static Optional<Integer> numberOf(String title) {
        Matcher roman = CatalogRules.ROMAN_NUMERAL.matcher(title);
        if (roman.find()) {
            return Optional.ofNullable(CatalogRules.ROMAN_VALUES.get(roman.group(1).toLowerCase(Locale.ROOT)));
        }
        Matcher digits = CatalogRules.ARABIC_NUMBER.matcher(title);
        if (digits.find()) {
            try {
                return Optional.of(Integer.parseInt(digits.group(1)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static String numberingPattern(Filmography parts) {
        if (parts.works().stream().anyMatch(work -> CatalogRules.ROMAN_NUMERAL.matcher(work.title()).find())) {
            return "roman_numerals";
        }
        if (parts.works().stream().anyMatch(work -> CatalogRules.NUMBER_WORD.matcher(work.title()).find())) {
            return "word_numbers";
        }
        if (parts.works().stream().anyMatch(work -> CatalogRules.ARABIC_NUMBER.matcher(work.title()).find())) {
            return "arabic_numbers";
        }
        return "none";
    }

    static Map<String, Object> boxOfficeTrajectory(Filmography parts) {
        List<Work> sorted = parts.byRelease().stream().filter(work -> work.popularity() > 0).toList();
        Map<String, Object> result = new LinkedHashMap<>();
        if (sorted.size() < 2) {
            result.put("trend", "insufficient_data");
            return result;
        }
        double[] popularities = sorted.stream().mapToDouble(Work::popularity).toArray();
        double first = average(Arrays.copyOfRange(popularities, 0, (popularities.length + 1) / 2));
        double second = average(Arrays.copyOfRange(popularities, popularities.length / 2,
                popularities.length));
        String trend = "stable";
        if (second > first * 1.1) {
            trend = "growing";
        } else if (second < first * 0.9) {
            trend = "declining";
        }
        Work peak = sorted.stream().max(Comparator.comparingDouble(Work::popularity)).orElseThrow();

        Map<String, Object> peakEntry = new LinkedHashMap<>();
        peakEntry.put("title", peak.title());
        peak.year().ifPresent(year -> peakEntry.put("year", year));
        peakEntry.put("popularity", peak.popularity());

        Map<String, Object> range = new LinkedHashMap<>();
        range.put("min", Arrays.stream(popularities).min().orElse(0));
        range.put("max", Arrays.stream(popularities).max().orElse(0));
        range.put("average", Filmography.round2(average(popularities)));

        result.put("trend", trend);
        result.put("peak", peakEntry);
        result.put("popularity_range", range);
        return result;
    }

    static Map<String, Object> criticalReception(Filmography parts) {
        List<Work> rated = parts.works().stream().filter(work -> work.rating() > 0).toList();
        Map<String, Object> result = new LinkedHashMap<>();
        if (rated.isEmpty()) {
            result.put("overall", "unknown");
            result.put("consistency", "unknown");
            return result;
        }
        double[] ratings = rated.stream().mapToDouble(Work::rating).toArray();
        double mean = average(ratings);
        double variance = 0.0;
        for (double rating : ratings) {
            variance += (rating - mean) * (rating - mean);
        }
        double deviation = Math.sqrt(variance / ratings.length);

        String overall;
        if (mean >= 7.5) {
            overall = "excellent";
        } else if (mean >= 6.5) {
            overall = "good";
        } else if (mean >= 5.5) {
            overall = "mixed";
        } else {
            overall = "poor";
        }
        String consistency;
        if (deviation <= 0.5) {
            consistency = "very_consistent";
        } else if (deviation <= 1.0) {
            consistency = "consistent";
        } else if (deviation <= 1.5) {
            consistency = "variable";
        } else {
            consistency = "inconsistent";
        }

        result.put("overall", overall);
        result.put("consistency", consistency);
        result.put("average_rating", Filmography.round1(mean));
        result.put("standard_deviation", Filmography.round2(deviation));
        // First of equal ratings wins both ends.
        result.put("best_rated", rated.stream().reduce((best, w) -> w.rating() > best.rating() ? w : best)
                .orElseThrow().title());
        result.put("worst_rated", rated.stream().reduce((worst, w) -> w.rating() < worst.rating() ? w : worst)
                .orElseThrow().title());
        return result;
    }

    static List<String> keywords(String name, String franchiseType, Filmography parts) {
        Set<String> keywords = new LinkedHashSet<>();
        String lower = name.toLowerCase(Locale.ROOT);
        keywords.add(lower);
        String base = CatalogRules.FRANCHISE_SUFFIX.matcher(lower).replaceAll("").replaceAll("\\s+", " ").trim();
        if (!base.isEmpty()) {
            keywords.add(base);
        }
        for (String indicator : CatalogRules.FRANCHISE_INDICATORS) {
            if (lower.contains(indicator)) {
                keywords.add("franchise");
                keywords.add(indicator);
            }
        }
        for (Work work : parts.works()) {
            String title = work.title().toLowerCase(Locale.ROOT);
            for (String character : CatalogRules.FRANCHISE_CHARACTERS) {
                if (title.contains(character)) {
                    keywords.add(character.replaceAll("[^a-z]", ""));
                }
            }
        }
        keywords.add(franchiseType);
        parts.topGenres(3).forEach(genre -> keywords.add(genre.toLowerCase(Locale.ROOT)));
        return keywords.stream().filter(keyword -> keyword.length() > 1).toList();
    }

    private static double average(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}
