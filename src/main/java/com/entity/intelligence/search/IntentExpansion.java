package com.entity.intelligence.search;

import com.entity.intelligence.rules.RuleTables;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Query intent expansion built from a hand-curated map of base terms to related terms.
 *
 * <p>The map is expanded so that relatedness is symmetric: a base term links to each of its
 * expansions, each expansion links back to the base term, and the expansions of one base term
 * link to one another. A term that is both a base and an expansion collects the union.</p>
 */
public class IntentExpansion {

    private final SortedMap<String, SortedSet<String>> expanded;

    public IntentExpansion() {
        this(RuleTables.INTENT_MAPPINGS);
    }

    public IntentExpansion(Map<String, List<String>> mappings) {
        Objects.requireNonNull(mappings, "mappings is required");
        this.expanded = expand(mappings);
    }

    static SortedMap<String, SortedSet<String>> expand(Map<String, List<String>> mappings) {
        SortedMap<String, SortedSet<String>> result = new TreeMap<>();
        mappings.forEach((base, expansions) -> {
            String baseTerm = normalize(base);
            List<String> terms = expansions.stream().map(IntentExpansion::normalize).toList();
            for (String term : terms) {
                link(result, baseTerm, term);
                for (String other : terms) {
                    link(result, term, other);
                }
            }
        });
        SortedMap<String, SortedSet<String>> frozen = new TreeMap<>();
        result.forEach((term, related) -> frozen.put(term, Collections.unmodifiableSortedSet(related)));
        return Collections.unmodifiableSortedMap(frozen);
    }

    private static void link(SortedMap<String, SortedSet<String>> map, String a, String b) {
        if (a.equals(b)) {
            return;
        }
        map.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
        map.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
    }

    static String normalize(String term) {
        return term.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Related terms of a query term, empty when the term has no intent.
     */
    public SortedSet<String> expansionsOf(String term) {
        SortedSet<String> related = expanded.get(normalize(term));
        return related != null ? related : Collections.emptySortedSet();
    }

    public SortedMap<String, SortedSet<String>> asMap() {
        return expanded;
    }

    public int size() {
        return expanded.size();
    }
}
