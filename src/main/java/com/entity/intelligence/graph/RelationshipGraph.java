package com.entity.intelligence.graph;

import com.entity.intelligence.core.model.Cluster;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable mapping from entity id to its outbound connections, partitioned by category.
 *
 * <p>Every entity of the corpus has an entry, with an empty list for each category it has
 * no connection in. Connection lists are ordered by {@link Connection#BY_FINAL_SCORE}.
 * Graphs are produced by {@link Builder}; each build phase derives a new graph.</p>
 */
public final class RelationshipGraph {

    private static final RelationshipGraph EMPTY = new RelationshipGraph(new TreeMap<>(), List.of());

    private final SortedMap<String, Map<ConnectionCategory, List<Connection>>> edges;
    private final List<Cluster> clusters;

    private RelationshipGraph(SortedMap<String, Map<ConnectionCategory, List<Connection>>> edges,
                              List<Cluster> clusters) {
        this.edges = Collections.unmodifiableSortedMap(edges);
        this.clusters = List.copyOf(clusters);
    }

    public static RelationshipGraph empty() {
        return EMPTY;
    }

    public SortedSet<String> entityIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(edges.keySet()));
    }

    public boolean contains(String entityId) {
        return edges.containsKey(entityId);
    }

    public int size() {
        return edges.size();
    }

    /**
     * All categories of an entity's connections; empty lists for an unknown entity.
     */
    public Map<ConnectionCategory, List<Connection>> connectionsOf(String entityId) {
        Map<ConnectionCategory, List<Connection>> byCategory = edges.get(entityId);
        return byCategory != null ? byCategory : emptyCategories();
    }

    public List<Connection> connections(String entityId, ConnectionCategory category) {
        return connectionsOf(entityId).get(category);
    }

    /**
     * Connections of every category, in category order.
     */
    public List<Connection> allConnections(String entityId) {
        List<Connection> all = new ArrayList<>();
        connectionsOf(entityId).values().forEach(all::addAll);
        return all;
    }

    public List<Cluster> clusters() {
        return clusters;
    }

    public long connectionCount() {
        return edges.values().stream()
                .flatMap(byCategory -> byCategory.values().stream())
                .mapToLong(List::size)
                .sum();
    }

    public long connectionCount(ConnectionCategory category) {
        return edges.values().stream()
                .mapToLong(byCategory -> byCategory.get(category).size())
                .sum();
    }

    /**
     * Copy of this graph with every category list truncated to {@code maxPerCategory}.
     * The cluster category uses {@code maxCluster}; zero or less leaves it untouched.
     */
    public RelationshipGraph capped(int maxPerCategory, int maxCluster) {
        Builder builder = new Builder(edges.keySet()).clusters(clusters);
        for (Map.Entry<String, Map<ConnectionCategory, List<Connection>>> entry : edges.entrySet()) {
            for (Map.Entry<ConnectionCategory, List<Connection>> category : entry.getValue().entrySet()) {
                int limit = category.getKey() == ConnectionCategory.CLUSTER
                        ? (maxCluster > 0 ? maxCluster : Integer.MAX_VALUE)
                        : maxPerCategory;
                List<Connection> list = category.getValue();
                builder.addAll(entry.getKey(), list.subList(0, Math.min(limit, list.size())));
            }
        }
        return builder.build();
    }

    /**
     * Builder pre-populated with every entity and connection of this graph.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(edges.keySet()).clusters(clusters);
        edges.forEach((id, byCategory) -> byCategory.values().forEach(list -> builder.addAll(id, list)));
        return builder;
    }

    /**
     * Plain map form: entity id, then category wire name, then connection records.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new TreeMap<>();
        edges.forEach((id, byCategory) -> {
            Map<String, Object> categories = new LinkedHashMap<>();
            byCategory.forEach((category, list) ->
                    categories.put(category.getWireName(), list.stream().map(Connection::toRecord).toList()));
            record.put(id, categories);
        });
        return record;
    }

    private static Map<ConnectionCategory, List<Connection>> emptyCategories() {
        Map<ConnectionCategory, List<Connection>> empty = new EnumMap<>(ConnectionCategory.class);
        for (ConnectionCategory category : ConnectionCategory.values()) {
            empty.put(category, List.of());
        }
        return Collections.unmodifiableMap(empty);
    }

    public static Builder builder(Collection<String> entityIds) {
        return new Builder(entityIds);
    }

    /**
     * Append-only assembly of a graph. Connections are sorted when the graph is built.
     */
    public static class Builder {
        private final SortedMap<String, Map<ConnectionCategory, List<Connection>>> edges = new TreeMap<>();
        private final List<Cluster> clusters = new ArrayList<>();

        private Builder(Collection<String> entityIds) {
            Objects.requireNonNull(entityIds, "entityIds is required");
            for (String id : entityIds) {
                Map<ConnectionCategory, List<Connection>> byCategory = new EnumMap<>(ConnectionCategory.class);
                for (ConnectionCategory category : ConnectionCategory.values()) {
                    byCategory.put(category, new ArrayList<>());
                }
                edges.put(id, byCategory);
            }
        }

        /**
         * Adds a connection under its type's category.
         *
         * @throws IllegalArgumentException for an unknown source or a self-loop
         */
        public Builder add(String sourceId, Connection connection) {
            Map<ConnectionCategory, List<Connection>> byCategory = edges.get(sourceId);
            if (byCategory == null) {
                throw new IllegalArgumentException("Unknown source entity: " + sourceId);
            }
            if (sourceId.equals(connection.getTargetId())) {
                throw new IllegalArgumentException("Self-loop on " + sourceId);
            }
            byCategory.get(connection.getCategory()).add(connection);
            return this;
        }

        public Builder addAll(String sourceId, Collection<Connection> connections) {
            connections.forEach(connection -> add(sourceId, connection));
            return this;
        }

        public boolean contains(String entityId) {
            return edges.containsKey(entityId);
        }

        public Builder clusters(Collection<Cluster> toSet) {
            clusters.clear();
            clusters.addAll(toSet);
            return this;
        }

        public RelationshipGraph build() {
            SortedMap<String, Map<ConnectionCategory, List<Connection>>> frozen = new TreeMap<>();
            edges.forEach((id, byCategory) -> {
                Map<ConnectionCategory, List<Connection>> sorted = new EnumMap<>(ConnectionCategory.class);
                byCategory.forEach((category, list) -> {
                    List<Connection> copy = new ArrayList<>(list);
                    copy.sort(Connection.BY_FINAL_SCORE);
                    sorted.put(category, List.copyOf(copy));
                });
                frozen.put(id, Collections.unmodifiableMap(sorted));
            });
            List<Cluster> orderedClusters = new ArrayList<>(clusters);
            orderedClusters.sort((a, b) -> a.key().compareTo(b.key()));
            return new RelationshipGraph(frozen, orderedClusters);
        }
    }

    @Override
    public String toString() {
        return "RelationshipGraph{entities=" + edges.size() + ", clusters=" + clusters.size() + '}';
    }
}
