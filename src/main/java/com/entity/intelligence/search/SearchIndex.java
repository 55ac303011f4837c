package com.entity.intelligence.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compiled lookup tables: search term, category tag and context tag to entity ids, plus the
 * intent map of related query terms. All maps and id sets are sorted and read-only.
 */
public final class SearchIndex {

    private final SortedMap<String, SortedSet<String>> termMap;
    private final SortedMap<String, SortedSet<String>> categoryMap;
    private final SortedMap<String, SortedSet<String>> contextMap;
    private final SortedMap<String, SortedSet<String>> intentMap;

    private SearchIndex(Builder builder) {
        this.termMap = freeze(builder.termMap);
        this.categoryMap = freeze(builder.categoryMap);
        this.contextMap = freeze(builder.contextMap);
        this.intentMap = freeze(builder.intentMap);
    }

    private static SortedMap<String, SortedSet<String>> freeze(SortedMap<String, SortedSet<String>> source) {
        SortedMap<String, SortedSet<String>> frozen = new TreeMap<>();
        source.forEach((key, ids) -> frozen.put(key, Collections.unmodifiableSortedSet(new TreeSet<>(ids))));
        return Collections.unmodifiableSortedMap(frozen);
    }

    public SortedMap<String, SortedSet<String>> termMap() {
        return termMap;
    }

    public SortedMap<String, SortedSet<String>> categoryMap() {
        return categoryMap;
    }

    public SortedMap<String, SortedSet<String>> contextMap() {
        return contextMap;
    }

    public SortedMap<String, SortedSet<String>> intentMap() {
        return intentMap;
    }

    public SortedSet<String> entitiesForTerm(String term) {
        return termMap.getOrDefault(normalize(term), Collections.emptySortedSet());
    }

    public SortedSet<String> entitiesForCategory(String category) {
        return categoryMap.getOrDefault(category, Collections.emptySortedSet());
    }

    public SortedSet<String> entitiesForContext(String context) {
        return contextMap.getOrDefault(context, Collections.emptySortedSet());
    }

    /**
     * Entities registered under the query term or under any term its intent relates it to.
     */
    public SortedSet<String> search(String query) {
        String term = normalize(query);
        SortedSet<String> result = new TreeSet<>(entitiesForTerm(term));
        for (String related : intentMap.getOrDefault(term, Collections.emptySortedSet())) {
            result.addAll(entitiesForTerm(related));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Plain map form with the four tables under their artifact keys.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("termMap", termMap);
        record.put("categoryMap", categoryMap);
        record.put("contextMap", contextMap);
        record.put("intentMap", intentMap);
        return record;
    }

    private static String normalize(String term) {
        Objects.requireNonNull(term, "term is required");
        return term.toLowerCase(Locale.ROOT).trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final SortedMap<String, SortedSet<String>> termMap = new TreeMap<>();
        private final SortedMap<String, SortedSet<String>> categoryMap = new TreeMap<>();
        private final SortedMap<String, SortedSet<String>> contextMap = new TreeMap<>();
        private final SortedMap<String, SortedSet<String>> intentMap = new TreeMap<>();

        public Builder term(String term, String entityId) {
            termMap.computeIfAbsent(term, k -> new TreeSet<>()).add(entityId);
            return this;
        }

        public Builder category(String category, String entityId) {
            categoryMap.computeIfAbsent(category, k -> new TreeSet<>()).add(entityId);
            return this;
        }

        public Builder context(String context, String entityId) {
            contextMap.computeIfAbsent(context, k -> new TreeSet<>()).add(entityId);
            return this;
        }

        public Builder intents(Map<String, ? extends SortedSet<String>> intents) {
            intents.forEach((term, related) -> intentMap.put(term, new TreeSet<>(related)));
            return this;
        }

        public SearchIndex build() {
            return new SearchIndex(this);
        }
    }

    @Override
    public String toString() {
        return "SearchIndex{terms=" + termMap.size() + ", categories=" + categoryMap.size()
                + ", contexts=" + contextMap.size() + ", intents=" + intentMap.size() + '}';
    }
}
