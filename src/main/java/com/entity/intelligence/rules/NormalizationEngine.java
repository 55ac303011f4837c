package com.entity.intelligence.rules;

import com.entity.intelligence.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies {@link NormalizationRule}s to names in priority order
 * (lower number first) and derives search variations from them.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(NormalizationRule::priority))
                .toList();
    }

    /**
     * Lower-cases and trims a name and collapses its whitespace without applying any rule.
     */
    public String clean(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * Applies every rule that fits the kind, one after the other, then cleans the result.
     */
    public String normalize(String name, EntityKind kind) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("normalize.rule rule={} before='{}' after='{}'", rule.name(), before, result);
                }
            }
        }
        return clean(result);
    }

    /**
     * One variation per matching rule, each produced by applying that rule alone.
     * Variations equal to the cleaned name, or empty, are dropped.
     */
    public Set<String> variations(String name, EntityKind kind) {
        Set<String> variations = new LinkedHashSet<>();
        String cleaned = clean(name);
        if (cleaned.isEmpty()) {
            return variations;
        }
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(kind) && rule.matches(cleaned)) {
                String variation = clean(rule.apply(cleaned));
                if (!variation.isEmpty() && !variation.equals(cleaned)) {
                    variations.add(variation);
                }
            }
        }
        return variations;
    }
}
