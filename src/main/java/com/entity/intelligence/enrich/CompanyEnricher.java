package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.enrich.Filmography.Work;
import com.entity.intelligence.rules.CatalogRules;
import com.entity.intelligence.rules.DefaultNormalizationRules;
import com.entity.intelligence.rules.NormalizationEngine;
import com.entity.intelligence.rules.RuleTables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Studio profile for production companies, built from the corpus titles that list the
 * company in {@code production_companies}.
 *
 * <p>Derived fields: {@code company_category}, {@code popularity}, {@code movie_count},
 * {@code studio_universe}, {@code genre_specialization}, {@code production_scale},
 * {@code time_period} and {@code company_keywords}. A company with no titles and no
 * {@code description} is excluded.</p>
 */
public class CompanyEnricher implements EntityEnricher {

    private static final double SPECIALIZATION_SHARE = 0.4;
    private static final int MIN_UNIVERSE_TITLES = 5;

    private final int referenceYear;
    private final NormalizationEngine normalizationEngine;

    public CompanyEnricher(int referenceYear) {
        this(referenceYear, DefaultNormalizationRules.createDefaultEngine());
    }

    public CompanyEnricher(int referenceYear, NormalizationEngine normalizationEngine) {
        this.referenceYear = referenceYear;
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
    }

    @Override
    public String getName() {
        return "company";
    }

    @Override
    public boolean supports(Entity entity) {
        return entity.getKind() == EntityKind.COMPANY;
    }

    @Override
    public EnrichmentResult enrich(Entity company, EntityCorpus corpus) {
        String companyId = Long.toString(company.getSourceId());
        Filmography titles = Filmography.referencing(corpus, title -> EntityAttributes.companies(title).stream()
                .anyMatch(ref -> ref.id().equals(companyId)));
        String description = EntityAttributes.text(company, "description").orElse("");
        int movieCount = (int) EntityAttributes.number(company, "movie_count").orElse(titles.size());
        if (movieCount == 0 && description.isEmpty()) {
            return EnrichmentResult.excluded(company, "no titles and no description");
        }

        String name = company.getDisplayName();
        String category = category(name, description);

        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put("company_category", category);
        derived.put("popularity", popularity(name, movieCount, titles));
        derived.put("movie_count", movieCount);
        derived.put("studio_universe", studioUniverse(titles));
        derived.put("genre_specialization", genreSpecialization(titles));
        derived.put("production_scale", productionScale(titles));
        derived.put("time_period", timePeriod(titles));
        derived.put("company_keywords", keywords(company, category, titles));

        derived.keySet().removeIf(key -> company.get(key).isPresent());
        return EnrichmentResult.kept(company.withDerived(derived));
    }

    /**
     * Category from the name, then from words of the description, else {@code production}.
     */
    static String category(String name, String description) {
        String category = CatalogRules.firstMatch(CatalogRules.STUDIO_CATEGORIES, name.toLowerCase(Locale.ROOT), null);
        if (category != null) {
            return category;
        }
        String text = description.toLowerCase(Locale.ROOT);
        return CatalogRules.DESCRIPTION_CATEGORIES.stream()
                .filter(text::contains)
                .findFirst()
                .orElse("production");
    }

    int popularity(String name, int movieCount, Filmography titles) {
        String lower = name.toLowerCase(Locale.ROOT);
        double score = 10;
        score += Math.min(40, movieCount / 5.0);
        if (CatalogRules.MAJOR_COMPANIES.stream().anyMatch(lower::contains)) {
            score += 35;
        }
        if (CatalogRules.POPULAR_COMPANIES.stream().anyMatch(lower::contains)) {
            score += 25;
        }
        long recent = titles.releasedSince(referenceYear - 5);
        if (recent > 0) {
            score += Math.min(15, recent * 2);
        }
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
     * Franchises are base titles shared by at least two of the company's titles.
     */
    static Map<String, Object> studioUniverse(Filmography titles) {
        int franchiseCount = 0;
        if (titles.size() >= MIN_UNIVERSE_TITLES) {
            Map<String, Integer> groups = new LinkedHashMap<>();
            for (Work work : titles.works()) {
                String base = baseTitle(work.title());
                if (base.length() > 3) {
                    groups.merge(base, 1, Integer::sum);
                }
            }
            franchiseCount = (int) groups.values().stream().filter(count -> count >= 2).count();
        }
        String universeType = "standalone";
        if (franchiseCount >= 3) {
            universeType = "cinematic_universe";
        } else if (franchiseCount >= 1) {
            universeType = "franchise_studio";
        }
        Map<String, Object> universe = new LinkedHashMap<>();
        universe.put("has_connected_universe", franchiseCount >= 3);
        universe.put("franchise_count", franchiseCount);
        universe.put("universe_type", universeType);
        return universe;
    }

    static String baseTitle(String title) {
        return CatalogRules.SEQUEL_MARKERS.matcher(title).replaceAll("")
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
    }

    static Map<String, Object> genreSpecialization(Filmography titles) {
        Map<String, Integer> frequency = titles.genreFrequency();
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
        result.put("specialization", share > SPECIALIZATION_SHARE ? top.getKey() : "diverse");
        result.put("confidence", Filmography.round2(share));
        result.put("top_genres", Filmography.genreShares(frequency, 5));
        return result;
    }

    static Map<String, Object> productionScale(Filmography titles) {
        Map<String, Object> result = new LinkedHashMap<>();
        int count = titles.size();
        String scale;
        if (count == 0) {
            scale = "unknown";
        } else if (count >= 100) {
            scale = "major";
        } else if (count >= 50) {
            scale = "large";
        } else if (count >= 20) {
            scale = "medium";
        } else if (count >= 5) {
            scale = "small";
        } else {
            scale = "boutique";
        }
        result.put("scale", scale);
        result.put("movie_count", count);
        result.put("average_popularity", Filmography.round1(titles.averagePopularity()));
        return result;
    }

    Map<String, Object> timePeriod(Filmography titles) {
        Map<String, Object> result = new LinkedHashMap<>();
        List<Integer> years = titles.years();
        if (years.isEmpty()) {
            result.put("period", "unknown");
            result.put("span", 0);
            return result;
        }
        int start = years.get(0);
        int end = years.get(years.size() - 1);
        String period;
        if (end >= referenceYear - 2) {
            period = "active";
        } else if (end >= referenceYear - 10) {
            period = "recent";
        } else if (end >= referenceYear - 30) {
            period = "classic";
        } else {
            period = "historical";
        }
        result.put("period", period);
        result.put("start_year", start);
        result.put("end_year", end);
        result.put("span", end - start + 1);
        result.put("is_active", end >= referenceYear - 5);
        return result;
    }

    List<String> keywords(Entity company, String category, Filmography titles) {
        Set<String> keywords = new LinkedHashSet<>();
        String name = company.getDisplayName().toLowerCase(Locale.ROOT);
        keywords.add(name);
        for (String word : name.split("\\s+")) {
            if (word.length() > 2) {
                keywords.add(word);
            }
        }
        String base = normalizationEngine.normalize(company.getDisplayName(), EntityKind.COMPANY);
        if (base.length() > 2) {
            keywords.add(base);
        }
        keywords.add(category);
        titles.topGenres(3).forEach(genre -> keywords.add(genre.toLowerCase(Locale.ROOT)));
        for (String country : countries(company)) {
            keywords.add(country.toLowerCase(Locale.ROOT));
            keywords.add(RuleTables.COUNTRY_NAMES.getOrDefault(country.toUpperCase(Locale.ROOT), country)
                    .toLowerCase(Locale.ROOT));
        }
        return keywords.stream().filter(keyword -> keyword.length() > 1).toList();
    }

    /**
     * Company records carry {@code origin_country} as a single code; titles carry a list.
     */
    private static List<String> countries(Entity company) {
        List<String> countries = new ArrayList<>();
        EntityAttributes.text(company, "origin_country").ifPresentOrElse(countries::add,
                () -> countries.addAll(EntityAttributes.countries(company)));
        return countries;
    }
}
