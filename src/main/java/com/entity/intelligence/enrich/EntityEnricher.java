package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;

/**
 * Precomputes derived fields on entities of a specific kind before graph building.
 * Implementations only add fields and may exclude an entity from the corpus.
 */
public interface EntityEnricher {

    /**
     * Enricher name used in logs.
     */
    String getName();

    /**
     * Whether this enricher handles the given entity.
     */
    boolean supports(Entity entity);

    /**
     * Enriches a supported entity.
     *
     * @param entity entity with raw attributes
     * @param corpus the input corpus, unchanged by the run; used to find the titles
     *               that reference a company, collection, genre or keyword
     * @return the enriched entity, or an exclusion with its reason
     */
    EnrichmentResult enrich(Entity entity, EntityCorpus corpus);
}
