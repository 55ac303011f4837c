package com.entity.intelligence.search;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityAttributes.Ref;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.rules.DefaultNormalizationRules;
import com.entity.intelligence.rules.NormalizationEngine;
import com.entity.intelligence.rules.RuleTables;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

import static com.entity.intelligence.rules.ScoringConstants.MAX_CONTENT_WORDS;
import static com.entity.intelligence.rules.ScoringConstants.MAX_INDEXED_CAST;
import static com.entity.intelligence.rules.ScoringConstants.MIN_COMPANY_WORD_LENGTH;
import static com.entity.intelligence.rules.ScoringConstants.MIN_CONTENT_WORD_LENGTH;
import static com.entity.intelligence.rules.ScoringConstants.MIN_TERM_LENGTH;

/**
 * Extracts the lower-cased search terms an entity is registered under.
 *
 * <p>Sources: names and titles, aliases, keywords, genres, company names with their
 * variations, leading cast, key crew, important words of the overview and tagline,
 * countries and languages, year and decade, collection name, and the keyword lists
 * enrichers derive for people, companies, collections, genres and keywords. Terms
 * shorter than two characters are dropped.</p>
 */
public class TermExtractor {

    private static final List<String> NAME_FIELDS = List.of("name", "title", "original_name", "original_title");
    private static final List<String> DERIVED_KEYWORD_FIELDS = List.of(
            "person_keywords", "company_keywords", "collection_keywords", "genre_keywords", "related_keywords");

    private final NormalizationEngine normalizationEngine;

    public TermExtractor() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public TermExtractor(NormalizationEngine normalizationEngine) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
    }

    public Set<String> extract(Entity entity) {
        Set<String> terms = new LinkedHashSet<>();

        for (String field : NAME_FIELDS) {
            EntityAttributes.text(entity, field).ifPresent(value -> add(terms, value));
        }
        EntityAttributes.strings(entity, "also_known_as").forEach(alias -> add(terms, alias));

        for (String keyword : EntityAttributes.keywords(entity)) {
            add(terms, keyword);
            add(terms, lower(keyword).replaceAll("[^a-z0-9]", ""));
        }
        EntityAttributes.genres(entity).forEach(genre -> add(terms, genre));

        for (Ref company : EntityAttributes.companies(entity)) {
            add(terms, company.name());
            companyVariations(company.name()).forEach(variation -> add(terms, variation));
        }

        List<Map<String, Object>> cast = EntityAttributes.records(entity, "cast");
        for (Map<String, Object> member : cast.subList(0, Math.min(MAX_INDEXED_CAST, cast.size()))) {
            EntityAttributes.asText(member.get("name")).ifPresent(name -> add(terms, name));
        }
        for (Map<String, Object> member : EntityAttributes.records(entity, "crew")) {
            boolean keyJob = EntityAttributes.asText(member.get("job"))
                    .filter(RuleTables.INDEXED_CREW_JOBS::contains)
                    .isPresent();
            if (keyJob) {
                EntityAttributes.asText(member.get("name")).ifPresent(name -> add(terms, name));
            }
        }

        EntityAttributes.text(entity, "overview").ifPresent(text -> importantWords(text).forEach(w -> add(terms, w)));
        EntityAttributes.text(entity, "tagline").ifPresent(text -> importantWords(text).forEach(w -> add(terms, w)));

        for (String country : EntityAttributes.countries(entity)) {
            add(terms, country);
            add(terms, RuleTables.COUNTRY_NAMES.getOrDefault(country.toUpperCase(Locale.ROOT), country));
        }
        for (Map<String, Object> language : EntityAttributes.records(entity, "spoken_languages")) {
            EntityAttributes.asText(language.get("name")).ifPresent(name -> add(terms, name));
            EntityAttributes.asText(language.get("english_name")).ifPresent(name -> add(terms, name));
        }

        OptionalInt year = EntityAttributes.releaseYear(entity);
        if (year.isPresent()) {
            add(terms, Integer.toString(year.getAsInt()));
            add(terms, (year.getAsInt() / 10) * 10 + "s");
        }
        EntityAttributes.collection(entity).ifPresent(collection -> add(terms, collection.name()));

        for (String field : DERIVED_KEYWORD_FIELDS) {
            EntityAttributes.strings(entity, field).forEach(keyword -> add(terms, keyword));
        }
        return terms;
    }

    /**
     * Forms with one suffix stripped, the fully normalized name, the acronym of a
     * multi-word name and its longer words.
     */
    public Set<String> companyVariations(String companyName) {
        Set<String> variations = new LinkedHashSet<>(normalizationEngine.variations(companyName, EntityKind.COMPANY));
        String cleaned = normalizationEngine.clean(companyName);
        if (cleaned.isEmpty()) {
            return variations;
        }
        String normalized = normalizationEngine.normalize(companyName, EntityKind.COMPANY);
        if (!normalized.isEmpty() && !normalized.equals(cleaned)) {
            variations.add(normalized);
        }
        String[] words = cleaned.split(" ");
        if (words.length > 1) {
            StringBuilder acronym = new StringBuilder();
            for (String word : words) {
                acronym.append(word.charAt(0));
            }
            variations.add(acronym.toString());
        }
        for (String word : words) {
            if (word.length() >= MIN_COMPANY_WORD_LENGTH) {
                variations.add(word);
            }
        }
        return variations;
    }

    /**
     * First words of a text that are long enough and not stop words.
     */
    static List<String> importantWords(String text) {
        List<String> words = new ArrayList<>();
        for (String word : lower(text).split("[^a-z0-9]+")) {
            if (word.length() >= MIN_CONTENT_WORD_LENGTH && !RuleTables.STOP_WORDS.contains(word)) {
                words.add(word);
                if (words.size() == MAX_CONTENT_WORDS) {
                    break;
                }
            }
        }
        return words;
    }

    private static void add(Set<String> terms, String value) {
        String term = lower(value).trim();
        if (term.length() >= MIN_TERM_LENGTH) {
            terms.add(term);
        }
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
