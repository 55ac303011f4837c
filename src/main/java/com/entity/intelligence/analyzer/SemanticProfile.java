package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.rules.RuleTables;
import com.entity.intelligence.rules.SemanticRules;
import com.entity.intelligence.rules.SemanticRules.Axis;
import com.entity.intelligence.rules.SemanticRules.GenreSemantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keywords detected for an entity on each of the four semantic axes.
 * Keywords come from pattern matches over the entity's text, from its genres and
 * from title heuristics.
 */
public final class SemanticProfile {

    private final Map<Axis, Set<String>> keywords;

    private SemanticProfile(Map<Axis, Set<String>> keywords) {
        this.keywords = keywords;
    }

    /**
     * The entity's profile from the build's cache, computed on the first request.
     */
    public static SemanticProfile cached(Entity entity, AnalysisContext context) {
        return context.cache().getOrCompute(SemanticAnalyzer.PROFILE, entity, SemanticProfile.class,
                SemanticProfile::of);
    }

    public static SemanticProfile of(Entity entity) {
        Map<Axis, Set<String>> keywords = new EnumMap<>(Axis.class);
        for (Axis axis : Axis.values()) {
            keywords.put(axis, new LinkedHashSet<>());
        }

        String content = contentOf(entity);
        for (Axis axis : Axis.values()) {
            for (Map.Entry<String, Pattern> entry : SemanticRules.patternsFor(axis).entrySet()) {
                if (entry.getValue().matcher(content).find()) {
                    keywords.get(axis).add(entry.getKey());
                }
            }
        }

        for (String genre : EntityAttributes.genres(entity)) {
            GenreSemantics semantics = SemanticRules.GENRE_SEMANTICS.get(genre);
            if (semantics != null) {
                for (Axis axis : Axis.values()) {
                    keywords.get(axis).addAll(semantics.forAxis(axis));
                }
            }
        }

        addTitleSemantics(entity, keywords);

        Map<Axis, Set<String>> frozen = new EnumMap<>(Axis.class);
        keywords.forEach((axis, values) -> frozen.put(axis, Collections.unmodifiableSet(values)));
        return new SemanticProfile(Collections.unmodifiableMap(frozen));
    }

    /**
     * Lower-cased text fields followed by genre and keyword names.
     */
    static String contentOf(Entity entity) {
        List<String> parts = new ArrayList<>();
        String text = EntityAttributes.joinedText(entity, SemanticRules.CONTENT_FIELDS);
        if (!text.isEmpty()) {
            parts.add(text);
        }
        List<String> genres = EntityAttributes.genres(entity);
        if (!genres.isEmpty()) {
            parts.add(String.join(" ", genres));
        }
        List<String> keywords = EntityAttributes.keywords(entity);
        if (!keywords.isEmpty()) {
            parts.add(String.join(" ", keywords));
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    private static void addTitleSemantics(Entity entity, Map<Axis, Set<String>> keywords) {
        String title = EntityAttributes.text(entity, "title")
                .or(() -> EntityAttributes.text(entity, "name"))
                .orElse("")
                .toLowerCase(Locale.ROOT);
        if (title.isEmpty()) {
            return;
        }
        if (RuleTables.SAGA_TITLE.matcher(title).find()) {
            keywords.get(Axis.THEME).add("adventure");
        }
        if (RuleTables.SEQUEL_TITLE.matcher(title).find() || RuleTables.REBOOT_TITLE.matcher(title).find()) {
            keywords.get(Axis.AUDIENCE).add("mainstream");
        }
        if (RuleTables.DARK_TITLE.matcher(title).find()) {
            keywords.get(Axis.MOOD).add("dark");
        }
        if (RuleTables.LIGHT_TITLE.matcher(title).find()) {
            keywords.get(Axis.MOOD).add("light");
        }
        if (RuleTables.FAMILY_TITLE.matcher(title).find()) {
            keywords.get(Axis.THEME).add("family");
            keywords.get(Axis.AUDIENCE).add("family_friendly");
        }
    }

    public Set<String> get(Axis axis) {
        return keywords.get(axis);
    }

    public Set<String> themes() {
        return get(Axis.THEME);
    }

    public Set<String> settings() {
        return get(Axis.SETTING);
    }

    public Set<String> moods() {
        return get(Axis.MOOD);
    }

    public Set<String> audience() {
        return get(Axis.AUDIENCE);
    }

    /**
     * True when no axis holds a keyword.
     */
    public boolean isEmpty() {
        return keywords.values().stream().allMatch(Set::isEmpty);
    }

    @Override
    public String toString() {
        return "SemanticProfile{" + keywords + '}';
    }
}
