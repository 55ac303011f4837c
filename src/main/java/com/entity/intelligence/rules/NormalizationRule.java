package com.entity.intelligence.rules;

import com.entity.intelligence.core.model.EntityKind;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to names before they are indexed.
 * An empty kind set means the rule applies to every kind.
 *
 * @param name        rule name used in debug logs
 * @param pattern     what to rewrite
 * @param replacement replacement text, empty to delete the match
 * @param kinds       entity kinds the rule is limited to
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<EntityKind> kinds,
                                int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        kinds = kinds != null ? Set.copyOf(kinds) : Set.of();
    }

    /**
     * Case-insensitive rule deleting every match of {@code regex} from names of the given kinds.
     */
    public static NormalizationRule stripping(String name, String regex, int priority, EntityKind... kinds) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), "", Set.of(kinds),
                priority);
    }

    public boolean appliesTo(EntityKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    boolean matches(String input) {
        return pattern.matcher(input).find();
    }

    String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
