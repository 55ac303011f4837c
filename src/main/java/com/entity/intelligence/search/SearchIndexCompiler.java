package com.entity.intelligence.search;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.graph.RelationshipGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flattens a corpus and its relationship graph into a {@link SearchIndex}.
 */
public class SearchIndexCompiler {
    private static final Logger log = LoggerFactory.getLogger(SearchIndexCompiler.class);

    private final TermExtractor termExtractor;
    private final EntityTagger entityTagger;
    private final IntentExpansion intentExpansion;

    public SearchIndexCompiler() {
        this(new TermExtractor(), new EntityTagger(), new IntentExpansion());
    }

    public SearchIndexCompiler(TermExtractor termExtractor, EntityTagger entityTagger,
                               IntentExpansion intentExpansion) {
        this.termExtractor = Objects.requireNonNull(termExtractor, "termExtractor is required");
        this.entityTagger = Objects.requireNonNull(entityTagger, "entityTagger is required");
        this.intentExpansion = Objects.requireNonNull(intentExpansion, "intentExpansion is required");
    }

    /**
     * @param context the same build context the graph was analyzed with
     */
    public SearchIndex compile(EntityCorpus corpus, RelationshipGraph graph, AnalysisContext context) {
        Objects.requireNonNull(corpus, "corpus is required");
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(context, "context is required");

        SearchIndex.Builder builder = SearchIndex.builder();
        for (Entity entity : corpus.entities()) {
            String id = entity.getId();
            termExtractor.extract(entity).forEach(term -> builder.term(term, id));
            entityTagger.categories(entity, context).forEach(category -> builder.category(category, id));
            entityTagger.contexts(entity, graph, context).forEach(tag -> builder.context(tag, id));
        }
        builder.intents(intentExpansion.asMap());

        SearchIndex index = builder.build();
        log.info("search.index.compiled terms={} categories={} contexts={} intents={}",
                index.termMap().size(), index.categoryMap().size(),
                index.contextMap().size(), index.intentMap().size());
        return index;
    }
}
