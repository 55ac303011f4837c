package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Runs every registered enricher over a frozen corpus and produces a new frozen corpus.
 *
 * <p>Enrichers apply in registration order; an entity excluded by one enricher is not
 * offered to the next. An enricher that throws leaves the entity as it was. Every
 * enricher sees the input corpus, never the partially enriched one.</p>
 */
public class EnrichmentPipeline {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentPipeline.class);

    private final List<EntityEnricher> enrichers;

    public EnrichmentPipeline(List<EntityEnricher> enrichers) {
        this.enrichers = List.copyOf(Objects.requireNonNull(enrichers, "enrichers is required"));
    }

    /**
     * Result of a pipeline run.
     *
     * @param corpus      the enriched corpus without excluded entities
     * @param excludedIds ids dropped by an enricher
     */
    public record Outcome(EntityCorpus corpus, SortedSet<String> excludedIds) {
        public Outcome {
            Objects.requireNonNull(corpus, "corpus is required");
            excludedIds = Collections.unmodifiableSortedSet(new TreeSet<>(excludedIds));
        }
    }

    public Outcome run(EntityCorpus corpus) {
        EntityCorpus.Builder builder = EntityCorpus.builder();
        SortedSet<String> excluded = new TreeSet<>();

        for (Entity entity : corpus.entities()) {
            Entity current = entity;
            boolean dropped = false;
            for (EntityEnricher enricher : enrichers) {
                if (!enricher.supports(current)) {
                    continue;
                }
                try {
                    EnrichmentResult result = enricher.enrich(current, corpus);
                    if (result.excluded()) {
                        log.debug("enrich.excluded entityId={} enricher={} reason={}",
                                entity.getId(), enricher.getName(), result.exclusionReason());
                        dropped = true;
                        break;
                    }
                    current = result.entity();
                } catch (RuntimeException e) {
                    log.warn("enrich.failed entityId={} enricher={} error={}",
                            entity.getId(), enricher.getName(), e.getMessage());
                }
            }
            if (dropped) {
                excluded.add(entity.getId());
            } else {
                builder.add(current);
            }
        }

        log.info("enrich.completed entities={} excluded={}", builder.size(), excluded.size());
        return new Outcome(builder.build(), excluded);
    }

    public List<EntityEnricher> getEnrichers() {
        return enrichers;
    }
}
