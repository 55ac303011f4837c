package com.entity.intelligence.core.model;

import java.util.Locale;

/**
 * Kinds of content entity known to the engine.
 * The prefix is the part of an entity id before the colon, e.g. {@code movie:603}.
 */
public enum EntityKind {
    MOVIE("movie", "Movie"),
    SHOW("show", "Show"),
    PERSON("person", "Person"),
    COMPANY("company", "Company"),
    COLLECTION("collection", "Collection"),
    GENRE("genre", "Genre"),
    KEYWORD("keyword", "Keyword");

    private final String prefix;
    private final String label;

    EntityKind(String prefix, String label) {
        this.prefix = prefix;
        this.label = label;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a kind from its id prefix.
     *
     * @throws IllegalArgumentException if the prefix is unknown
     */
    public static EntityKind fromPrefix(String prefix) {
        if (prefix != null) {
            String lower = prefix.toLowerCase(Locale.ROOT);
            for (EntityKind kind : values()) {
                if (kind.prefix.equals(lower)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + prefix);
    }
}
