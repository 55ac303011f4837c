package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;

import java.util.List;

/**
 * Scores the relationships of one entity against the whole corpus.
 *
 * <p>Analyzers are independent of each other and must treat malformed attributes as
 * absent data. They never emit a connection back to the source entity. Any runtime
 * exception that still escapes is caught by the graph builder, which then drops this
 * analyzer's output for that entity only.</p>
 */
public interface ConnectionAnalyzer {

    /**
     * Stable analyzer name used in logs and metrics.
     */
    String getName();

    /**
     * The graph category every connection of this analyzer belongs to.
     */
    ConnectionCategory getCategory();

    /**
     * Finds the outbound connections of {@code source}.
     *
     * @param source  the entity being analyzed
     * @param corpus  the frozen corpus, including {@code source}
     * @param context build-scoped collaborators
     * @return connections to other corpus entities, never {@code null}
     */
    List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context);
}
