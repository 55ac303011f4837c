package com.entity.intelligence.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Frozen mapping from entity id to entity, iterated in id order.
 *
 * <p>A corpus is assembled through {@link Builder} and never changes afterwards,
 * so the graph builder cannot observe a partially populated corpus.</p>
 */
public final class EntityCorpus {

    private static final EntityCorpus EMPTY = new EntityCorpus(new TreeMap<>());

    private final SortedMap<String, Entity> entities;
    private final List<Entity> ordered;

    private EntityCorpus(SortedMap<String, Entity> entities) {
        this.entities = Collections.unmodifiableSortedMap(entities);
        this.ordered = List.copyOf(entities.values());
    }

    public static EntityCorpus empty() {
        return EMPTY;
    }

    public static EntityCorpus of(Collection<Entity> entities) {
        Builder builder = builder();
        entities.forEach(builder::add);
        return builder.build();
    }

    public Optional<Entity> get(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public boolean contains(String id) {
        return entities.containsKey(id);
    }

    /**
     * All entities in id order.
     */
    public List<Entity> entities() {
        return ordered;
    }

    public SortedSet<String> ids() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(entities.keySet()));
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * Returns a new corpus containing only entities matching the predicate.
     */
    public EntityCorpus filter(Predicate<Entity> predicate) {
        Builder builder = builder();
        for (Entity entity : ordered) {
            if (predicate.test(entity)) {
                builder.add(entity);
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Append-only assembly of a corpus. Later additions with the same id replace earlier ones.
     */
    public static class Builder {
        private final SortedMap<String, Entity> entities = new TreeMap<>();

        public Builder add(Entity entity) {
            entities.put(entity.getId(), entity);
            return this;
        }

        public Builder addAll(Collection<Entity> toAdd) {
            toAdd.forEach(this::add);
            return this;
        }

        public int size() {
            return entities.size();
        }

        public EntityCorpus build() {
            return new EntityCorpus(new TreeMap<>(entities));
        }
    }

    @Override
    public String toString() {
        return "EntityCorpus{size=" + entities.size() + '}';
    }
}
