package com.entity.intelligence.recommend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recommendations of one entity: a short high-confidence list and a broad ranked one.
 */
public record RecommendationSet(List<Recommendation> quick, List<Recommendation> deep) {

    public static final RecommendationSet EMPTY = new RecommendationSet(List.of(), List.of());

    public RecommendationSet {
        quick = List.copyOf(quick);
        deep = List.copyOf(deep);
    }

    public boolean isEmpty() {
        return quick.isEmpty() && deep.isEmpty();
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("quick", quick.stream().map(Recommendation::toRecord).toList());
        record.put("deep", deep.stream().map(Recommendation::toRecord).toList());
        return record;
    }
}
