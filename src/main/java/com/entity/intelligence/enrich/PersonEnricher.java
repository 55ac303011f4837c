package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.rules.RuleTables;
import com.entity.intelligence.rules.RuleTables.CareerStageRule;

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

/**
 * Career analysis for person entities.
 *
 * <p>Credits are read from {@code combined_credits.cast}/{@code combined_credits.crew},
 * falling back to the person's own {@code cast}/{@code crew} lists. Each credit may carry
 * {@code release_date}, {@code genre_ids}, {@code popularity} and {@code vote_average}.
 * People below the minimum popularity or without any credit are excluded.</p>
 *
 * <p>Derived fields: {@code career_stage}, {@code career_analysis}, {@code genre_specialization},
 * {@code collaboration_network}, {@code career_trajectory}, {@code influence_metrics},
 * {@code total_credits}, {@code acting_credits}, {@code crew_credits} and
 * {@code person_keywords}. Fields already present on the entity are left untouched.</p>
 */
public class PersonEnricher implements EntityEnricher {

    public static final double DEFAULT_MIN_POPULARITY = 10.0;

    private static final int MIN_CREDIT_YEAR = 1900;
    private static final double SPECIALIZATION_SHARE = 0.4;

    private final double minPopularity;

    public PersonEnricher() {
        this(DEFAULT_MIN_POPULARITY);
    }

    public PersonEnricher(double minPopularity) {
        if (minPopularity < 0.0) {
            throw new IllegalArgumentException("minPopularity must not be negative");
        }
        this.minPopularity = minPopularity;
    }

    record Credit(String date, OptionalInt year, List<String> genres, double popularity, double rating) {
    }

    record Credits(List<Credit> cast, List<Credit> crew) {

        List<Credit> all() {
            List<Credit> all = new ArrayList<>(cast);
            all.addAll(crew);
            return all;
        }

        int total() {
            return cast.size() + crew.size();
        }

        /**
         * Known credit years after 1900, in credit order.
         */
        List<Integer> years() {
            List<Integer> years = new ArrayList<>();
            for (Credit credit : all()) {
                credit.year().ifPresent(year -> {
                    if (year > MIN_CREDIT_YEAR) {
                        years.add(year);
                    }
                });
            }
            return years;
        }

        int yearsActive() {
            List<Integer> years = years();
            if (years.isEmpty()) {
                return 0;
            }
            int min = years.stream().mapToInt(Integer::intValue).min().orElse(0);
            int max = years.stream().mapToInt(Integer::intValue).max().orElse(0);
            return max - min + 1;
        }
    }

    @Override
    public String getName() {
        return "person";
    }

    @Override
    public boolean supports(Entity entity) {
        return entity.getKind() == EntityKind.PERSON;
    }

    @Override
    public EnrichmentResult enrich(Entity person, EntityCorpus corpus) {
        double popularity = EntityAttributes.popularity(person);
        if (popularity < minPopularity) {
            return EnrichmentResult.excluded(person,
                    "popularity " + popularity + " below minimum " + minPopularity);
        }
        Credits credits = creditsOf(person);
        if (credits.total() == 0) {
            return EnrichmentResult.excluded(person, "no credits");
        }

        String department = EntityAttributes.text(person, "known_for_department").orElse(null);
        Map<String, Integer> genreFrequency = genreFrequency(credits);
        String stage = careerStage(credits);

        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("career_stage", stage);
        derived.put("career_analysis", careerAnalysis(credits, stage, genreFrequency.size()));
        derived.put("genre_specialization", genreSpecialization(genreFrequency));
        derived.put("collaboration_network", Map.of("collaboration_score", collaborationScore(credits)));
        derived.put("career_trajectory", careerTrajectory(credits));
        derived.put("influence_metrics", influenceMetrics(popularity, department, credits));
        derived.put("total_credits", credits.total());
        derived.put("acting_credits", credits.cast().size());
        derived.put("crew_credits", credits.crew().size());
        derived.put("person_keywords", keywords(person, department, genreFrequency, stage));

        derived.keySet().removeIf(key -> person.get(key).isPresent());
        return EnrichmentResult.kept(person.withDerived(derived));
    }

    static Credits creditsOf(Entity person) {
        Optional<Object> combined = person.get("combined_credits");
        if (combined.isPresent() && combined.get() instanceof Map<?, ?> map) {
            return new Credits(parse(map.get("cast")), parse(map.get("crew")));
        }
        return new Credits(parse(person.get("cast").orElse(null)), parse(person.get("crew").orElse(null)));
    }

    private static List<Credit> parse(Object value) {
        List<Credit> credits = new ArrayList<>();
        for (Map<String, Object> record : EntityAttributes.asRecords(value)) {
            String date = EntityAttributes.asText(record.get("release_date"))
                    .or(() -> EntityAttributes.asText(record.get("first_air_date")))
                    .orElse(null);
            List<String> genres = new ArrayList<>();
            if (record.get("genre_ids") instanceof List<?> ids) {
                for (Object id : ids) {
                    if (id instanceof Number n) {
                        String genre = RuleTables.CREDIT_GENRES.get(n.intValue());
                        if (genre != null) {
                            genres.add(genre);
                        }
                    }
                }
            }
            credits.add(new Credit(date, EntityAttributes.yearOf(date), genres,
                    EntityAttributes.asNumber(record.get("popularity")).orElse(0.0),
                    EntityAttributes.asNumber(record.get("vote_average")).orElse(0.0)));
        }
        return credits;
    }

    /**
     * First career stage whose year and credit ranges both match, else a credit-count fallback.
     */
    static String careerStage(Credits credits) {
        int total = credits.total();
        int yearsActive = credits.yearsActive();
        for (Map.Entry<String, CareerStageRule> entry : RuleTables.CAREER_STAGES.entrySet()) {
            if (entry.getValue().matches(yearsActive, total)) {
                return entry.getKey();
            }
        }
        if (total >= 61) {
            return "legend";
        }
        if (total >= 31) {
            return "veteran";
        }
        if (total >= 11) {
            return "established";
        }
        return "emerging";
    }

    private static Map<String, Object> careerAnalysis(Credits credits, String stage, int uniqueGenres) {
        int span = credits.yearsActive();
        int castCount = credits.cast().size();
        int crewCount = credits.crew().size();

        String primaryRole = "unknown";
        if (castCount > crewCount * 2) {
            primaryRole = "actor";
        } else if (crewCount > castCount * 2) {
            primaryRole = "crew";
        } else if (castCount > 0 && crewCount > 0) {
            primaryRole = "multi_role";
        }

        String versatility = "medium";
        if (uniqueGenres >= 8) {
            versatility = "high";
        } else if (uniqueGenres <= 3) {
            versatility = "low";
        }

        String consistency = "medium";
        int datedCredits = credits.years().size();
        if (datedCredits > 3) {
            double averageGap = (double) span / (datedCredits - 1);
            if (averageGap <= 2) {
                consistency = "high";
            } else if (averageGap >= 5) {
                consistency = "low";
            }
        }

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("stage", stage);
        analysis.put("span_years", span);
        analysis.put("primary_role", primaryRole);
        analysis.put("versatility", versatility);
        analysis.put("consistency", consistency);
        return analysis;
    }

    /**
     * Genre counts over all credits, most frequent first. Ties keep first-seen order.
     */
    static Map<String, Integer> genreFrequency(Credits credits) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Credit credit : credits.all()) {
            for (String genre : credit.genres()) {
                counts.merge(genre, 1, Integer::sum);
            }
        }
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    static Map<String, Object> genreSpecialization(Map<String, Integer> frequency) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (frequency.isEmpty()) {
            result.put("specialization", "unknown");
            result.put("confidence", 0.0);
            result.put("top_genres", List.of());
            return result;
        }
        int total = frequency.values().stream().mapToInt(Integer::intValue).sum();
        Map.Entry<String, Integer> top = frequency.entrySet().iterator().next();
        double share = (double) top.getValue() / total;

        List<Map<String, Object>> topGenres = new ArrayList<>();
        frequency.entrySet().stream().limit(5).forEach(e -> {
            Map<String, Object> genre = new LinkedHashMap<>();
            genre.put("genre", e.getKey());
            genre.put("count", e.getValue());
            genre.put("percentage", Math.round(e.getValue() * 100.0 / total));
            topGenres.add(genre);
        });

        result.put("specialization", share > SPECIALIZATION_SHARE ? top.getKey() : "versatile");
        result.put("confidence", Math.round(share * 100) / 100.0);
        result.put("top_genres", topGenres);
        result.put("diversity_score", diversityScore(frequency, total));
        return result;
    }

    /**
     * Shannon entropy of the genre distribution normalized to [0, 1].
     */
    static double diversityScore(Map<String, Integer> frequency, int total) {
        if (frequency.size() <= 1) {
            return 0.0;
        }
        double diversity = 0.0;
        for (int count : frequency.values()) {
            double proportion = (double) count / total;
            diversity -= proportion * log2(proportion);
        }
        return diversity / log2(frequency.size());
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }

    static int collaborationScore(Credits credits) {
        int score = 50;
        int total = credits.total();
        if (total >= 50) {
            score += 20;
        } else if (total >= 20) {
            score += 10;
        }
        if (!credits.cast().isEmpty() && !credits.crew().isEmpty()) {
            score += 15;
        }
        return Math.min(100, score);
    }

    static Map<String, Object> careerTrajectory(Credits credits) {
        Map<String, Object> result = new LinkedHashMap<>();
        List<Credit> dated = credits.all().stream()
                .filter(credit -> credit.date() != null)
                .sorted(Comparator.comparing(Credit::date))
                .toList();
        if (credits.total() < 3 || dated.size() < 3) {
            result.put("trajectory", "insufficient_data");
            result.put("trend", "unknown");
            return result;
        }

        int third = (int) Math.ceil(dated.size() / 3.0);
        double early = average(dated.subList(0, third).stream().mapToDouble(Credit::popularity).toArray());
        double recent = average(dated.subList(dated.size() - third, dated.size()).stream()
                .mapToDouble(Credit::popularity).toArray());
        String trajectory = "stable";
        if (recent > early * 1.3) {
            trajectory = "ascending";
        } else if (recent < early * 0.7) {
            trajectory = "declining";
        }

        double[] ratings = dated.stream().mapToDouble(Credit::rating).filter(r -> r > 0).toArray();
        String trend = "stable";
        if (ratings.length >= 6) {
            int half = (int) Math.ceil(ratings.length / 2.0);
            double first = average(Arrays.copyOfRange(ratings, 0, half));
            double second = average(Arrays.copyOfRange(ratings, ratings.length / 2, ratings.length));
            if (second > first + 0.5) {
                trend = "improving";
            } else if (second < first - 0.5) {
                trend = "declining";
            }
        }
        result.put("trajectory", trajectory);
        result.put("trend", trend);
        return result;
    }

    private static double average(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    static Map<String, Object> influenceMetrics(double popularity, String department, Credits credits) {
        double influence = 20;
        influence += Math.min(30, popularity / 2);
        influence += Math.min(25, credits.total());
        if ("Acting".equals(department)) {
            influence += 10;
        } else if ("Directing".equals(department)) {
            influence += 15;
        } else if ("Production".equals(department)) {
            influence += 8;
        }
        double averageRating = average(credits.all().stream().mapToDouble(Credit::rating).toArray());
        if (averageRating >= 7.0) {
            influence += 15;
        } else if (averageRating >= 6.0) {
            influence += 8;
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("overall_influence", (int) Math.min(100, Math.round(influence)));
        metrics.put("industry_impact", influence >= 70 ? "high" : influence >= 50 ? "medium" : "low");
        metrics.put("career_significance", careerSignificance(popularity, credits.total()));
        metrics.put("legacy_potential", legacyPotential(credits));
        return metrics;
    }

    static String careerSignificance(double popularity, int totalCredits) {
        if (popularity >= 50 && totalCredits >= 30) {
            return "major";
        }
        if (popularity >= 30 && totalCredits >= 20) {
            return "significant";
        }
        if (popularity >= 15 && totalCredits >= 10) {
            return "notable";
        }
        return totalCredits >= 5 ? "emerging" : "minor";
    }

    static String legacyPotential(Credits credits) {
        long highRated = credits.all().stream().filter(credit -> credit.rating() >= 7.5).count();
        int span = credits.yearsActive();
        if (highRated >= 5 && span >= 20) {
            return "legendary";
        }
        if (highRated >= 3 && span >= 15) {
            return "enduring";
        }
        if (highRated >= 2 && span >= 10) {
            return "memorable";
        }
        return highRated >= 1 ? "notable" : "developing";
    }

    /**
     * Profession category for a department, or the lower-cased department when none matches.
     */
    static Optional<String> professionOf(String department) {
        if (department == null || department.isBlank()) {
            return Optional.empty();
        }
        String dept = department.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : RuleTables.PROFESSION_CATEGORIES.entrySet()) {
            if (entry.getValue().stream().anyMatch(dept::contains)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.of(dept);
    }

    static List<String> keywords(Entity person, String department, Map<String, Integer> genreFrequency,
                                 String stage) {
        Set<String> keywords = new LinkedHashSet<>();
        String name = person.getDisplayName().toLowerCase(Locale.ROOT);
        keywords.add(name);
        for (String part : name.split("\\s+")) {
            if (part.length() > 2) {
                keywords.add(part);
            }
        }
        if (department != null) {
            keywords.add(department.toLowerCase(Locale.ROOT));
        }
        professionOf(department).ifPresent(keywords::add);
        EntityAttributes.text(person, "place_of_birth").ifPresent(place -> {
            for (String part : place.toLowerCase(Locale.ROOT).split(",")) {
                if (part.trim().length() > 2) {
                    keywords.add(part.trim());
                }
            }
        });
        genreFrequency.keySet().stream().limit(3)
                .forEach(genre -> keywords.add(genre.toLowerCase(Locale.ROOT)));
        keywords.add(stage);
        EntityAttributes.strings(person, "also_known_as").stream().limit(2).forEach(alias -> {
            String clean = alias.toLowerCase(Locale.ROOT).replaceAll("[^a-z\\s]", "").trim();
            if (clean.length() > 2) {
                keywords.add(clean);
            }
        });
        return keywords.stream().filter(keyword -> keyword.length() > 1).toList();
    }
}
