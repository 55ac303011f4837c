package com.entity.intelligence.search;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.cache.NoOpProfileCache;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.graph.RelationshipGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.entity.intelligence.EntityFixtures.corpus;
import static com.entity.intelligence.EntityFixtures.movie;
import static org.junit.jupiter.api.Assertions.*;

class SearchIndexCompilerTest {

    private final SearchIndexCompiler compiler = new SearchIndexCompiler();

    private SearchIndex index;

    @BeforeEach
    void setUp() {
        Entity kappa = movie(1).title("Kappa").genres("Horror").released(1994).build();
        Entity sigma = movie(2).title("Sigma").genres("Comedy").released(2015).build();
        EntityCorpus corpus = corpus(kappa, sigma);
        index = compiler.compile(corpus, RelationshipGraph.builder(corpus.ids()).build(),
                AnalysisContext.of(new NoOpProfileCache(), 2024));
    }

    @Test
    @DisplayName("Terms, categories and contexts should map to entity ids")
    void testMaps() {
        assertEquals(Set.of("movie:1"), index.entitiesForTerm("Kappa"));
        assertEquals(Set.of("movie:2"), index.entitiesForTerm("2010s"));
        assertEquals(Set.of("movie:1"), index.entitiesForCategory("genre_horror"));
        assertEquals(Set.of("movie:1", "movie:2"), index.entitiesForCategory("movie"));
        assertEquals(Set.of("movie:1", "movie:2"), index.entitiesForContext("isolated"));
        assertTrue(index.entitiesForTerm("unknown").isEmpty());
    }

    @Test
    @DisplayName("Search should follow intent links to related terms")
    void testSearchWithIntent() {
        assertEquals(Set.of("movie:1"), index.search("scary"));
        assertEquals(Set.of("movie:2"), index.search("funny"));
        assertTrue(index.search("zzz").isEmpty());
    }

    @Test
    @DisplayName("Intent map should be carried into the index")
    void testIntentMap() {
        assertEquals(new IntentExpansion().asMap(), index.intentMap());
        assertEquals(List.of("termMap", "categoryMap", "contextMap", "intentMap"),
                List.copyOf(index.toRecord().keySet()));
    }

    @Test
    @DisplayName("Index tables should be read-only")
    void testReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> index.termMap().clear());
        assertThrows(UnsupportedOperationException.class, () -> index.entitiesForTerm("kappa").add("movie:9"));
    }
}
