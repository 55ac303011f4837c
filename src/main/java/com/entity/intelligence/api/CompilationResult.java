package com.entity.intelligence.api;

import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.graph.GraphStatistics;
import com.entity.intelligence.graph.RelationshipGraph;
import com.entity.intelligence.recommend.RecommendationSet;
import com.entity.intelligence.search.SearchIndex;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Everything one build produced.
 *
 * @param buildId          id carried in the logging context of the build
 * @param corpus           the enriched corpus the graph was built from
 * @param excludedIds      entities removed by enrichment
 * @param graph            the scored relationship graph
 * @param statistics       summary and validation of the graph
 * @param searchIndex      compiled search tables
 * @param recommendations  recommendation set per entity id
 * @param duration         wall-clock time of the build
 */
public record CompilationResult(
        String buildId,
        EntityCorpus corpus,
        SortedSet<String> excludedIds,
        RelationshipGraph graph,
        GraphStatistics statistics,
        SearchIndex searchIndex,
        SortedMap<String, RecommendationSet> recommendations,
        Duration duration
) {

    public CompilationResult {
        Objects.requireNonNull(buildId, "buildId is required");
        Objects.requireNonNull(corpus, "corpus is required");
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(statistics, "statistics is required");
        Objects.requireNonNull(searchIndex, "searchIndex is required");
        Objects.requireNonNull(duration, "duration is required");
        excludedIds = Collections.unmodifiableSortedSet(new TreeSet<>(excludedIds));
        recommendations = Collections.unmodifiableSortedMap(new TreeMap<>(recommendations));
    }

    public RecommendationSet recommendationsFor(String entityId) {
        return recommendations.getOrDefault(entityId, RecommendationSet.EMPTY);
    }

    @Override
    public String toString() {
        return "CompilationResult{buildId=" + buildId +
                ", entities=" + corpus.size() +
                ", excluded=" + excludedIds.size() +
                ", connections=" + statistics.connections() +
                ", clusters=" + statistics.clusters() +
                ", durationMs=" + duration.toMillis() + '}';
    }
}
