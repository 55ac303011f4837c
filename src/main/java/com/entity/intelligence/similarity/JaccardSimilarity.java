package com.entity.intelligence.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Jaccard similarity over sets: |intersection| / |union|.
 * Either set being empty scores 0.
 */
public class JaccardSimilarity {

    public double compute(Set<String> s1, Set<String> s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = intersectionSize(s1, s2);
        // |union| = |A| + |B| - |intersection|
        int unionSize = s1.size() + s2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    public int intersectionSize(Set<String> s1, Set<String> s2) {
        Set<String> smaller = s1.size() <= s2.size() ? s1 : s2;
        Set<String> larger = smaller == s1 ? s2 : s1;
        int count = 0;
        for (String element : smaller) {
            if (larger.contains(element)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Elements of the first set also present in the second, in the first set's order.
     */
    public Set<String> intersection(Set<String> s1, Set<String> s2) {
        Set<String> common = new LinkedHashSet<>();
        if (s1 == null || s2 == null) {
            return common;
        }
        for (String element : s1) {
            if (s2.contains(element)) {
                common.add(element);
            }
        }
        return common;
    }

    public String getName() {
        return "Jaccard";
    }
}
