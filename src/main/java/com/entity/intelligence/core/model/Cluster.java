package com.entity.intelligence.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A derived group of at least {@link #MIN_MEMBERS} entities sharing a semantic connection type.
 *
 * @param key     cluster key, e.g. {@code semantic_similarity_cluster}
 * @param members member entity ids in natural order
 */
public record Cluster(String key, SortedSet<String> members) {

    public static final int MIN_MEMBERS = 3;

    public Cluster {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(members, "members is required");
        if (members.size() < MIN_MEMBERS) {
            throw new IllegalArgumentException(
                    "Cluster '" + key + "' needs at least " + MIN_MEMBERS + " members, got " + members.size());
        }
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    }

    public boolean contains(String entityId) {
        return members.contains(entityId);
    }

    public int size() {
        return members.size();
    }
}
