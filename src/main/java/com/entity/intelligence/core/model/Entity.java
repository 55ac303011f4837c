package com.entity.intelligence.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A content entity from the corpus.
 *
 * <p>Entities are backed by the attribute record handed over by ingestion plus a
 * separate map of derived fields added by enrichers. Both maps are read-only; an
 * enricher obtains a new instance through {@link #withDerived(Map)}, which may only
 * add keys that are not yet present.</p>
 */
public final class Entity {

    private static final Pattern ID_PATTERN = Pattern.compile("^([a-z]+):(\\d+)$");

    private final String id;
    private final EntityKind kind;
    private final long sourceId;
    private final Map<String, Object> attributes;
    private final Map<String, Object> derived;

    private Entity(String id, Map<String, Object> attributes, Map<String, Object> derived) {
        Objects.requireNonNull(id, "id is required");
        Matcher matcher = ID_PATTERN.matcher(id);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Entity id must look like kind:numeric-id, got " + id);
        }
        this.id = id;
        this.kind = EntityKind.fromPrefix(matcher.group(1));
        this.sourceId = Long.parseLong(matcher.group(2));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.derived = Collections.unmodifiableMap(new LinkedHashMap<>(derived));
    }

    /**
     * Creates an entity from its id and raw attribute record.
     */
    public static Entity of(String id, Map<String, Object> attributes) {
        return new Entity(id, attributes != null ? attributes : Map.of(), Map.of());
    }

    /**
     * Formats an entity id from its parts.
     */
    public static String idOf(EntityKind kind, long sourceId) {
        return kind.getPrefix() + ":" + sourceId;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public long getSourceId() {
        return sourceId;
    }

    /**
     * Display name: {@code title} for movies, {@code name} for everything else.
     * Falls back to the id when neither attribute holds a string.
     */
    public String getDisplayName() {
        if (attributes.get("title") instanceof String title && !title.isBlank()) {
            return title;
        }
        if (attributes.get("name") instanceof String name && !name.isBlank()) {
            return name;
        }
        return id;
    }

    /**
     * Raw attributes from ingestion, without derived fields.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Fields added by enrichers.
     */
    public Map<String, Object> getDerived() {
        return derived;
    }

    /**
     * Looks up a field, checking raw attributes first and then derived fields.
     */
    public Optional<Object> get(String key) {
        Object value = attributes.get(key);
        if (value == null) {
            value = derived.get(key);
        }
        return Optional.ofNullable(value);
    }

    /**
     * Returns a copy of this entity with additional derived fields.
     *
     * @throws IllegalStateException if a key already exists as attribute or derived field
     */
    public Entity withDerived(Map<String, Object> additions) {
        Map<String, Object> merged = new LinkedHashMap<>(derived);
        for (Map.Entry<String, Object> entry : additions.entrySet()) {
            String key = entry.getKey();
            if (attributes.containsKey(key) || derived.containsKey(key)) {
                throw new IllegalStateException("Field '" + key + "' already present on " + id);
            }
            merged.put(key, entry.getValue());
        }
        return new Entity(id, attributes, merged);
    }

    /**
     * Attributes and derived fields merged into one record, as written to the corpus artifact.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>(attributes);
        record.putAll(derived);
        return record;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return id.equals(entity.id)
                && attributes.equals(entity.attributes)
                && derived.equals(entity.derived);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributes, derived);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + getDisplayName() + '\'' +
                '}';
    }
}
