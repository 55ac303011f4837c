package com.entity.intelligence.search;

import com.entity.intelligence.analyzer.AnalysisContext;
import com.entity.intelligence.analyzer.CulturalProfile;
import com.entity.intelligence.analyzer.SemanticProfile;
import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityAttributes.Ref;
import com.entity.intelligence.graph.RelationshipGraph;
import com.entity.intelligence.rules.RuleTables;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

import static com.entity.intelligence.rules.ScoringConstants.AWARD_WORTHY_RATING;
import static com.entity.intelligence.rules.ScoringConstants.CONNECTED;
import static com.entity.intelligence.rules.ScoringConstants.HIGHLY_CONNECTED;
import static com.entity.intelligence.rules.ScoringConstants.MAINSTREAM_HIT_POPULARITY;
import static com.entity.intelligence.rules.ScoringConstants.WELL_CONNECTED;

/**
 * Assigns category and context tags to entities.
 *
 * <p>Category tags describe the entity itself (kind, genre, studio family, rating,
 * popularity, era, language, theme, career, and the catalog category an enricher
 * derived for a company, collection or keyword). Context tags describe how it is seen
 * (cultural markers, seasons, awards, franchise) and where it sits in the graph.
 * Themes and cultural markers are read from the build's profile cache, so an entity
 * the analyzers already profiled is not profiled again.</p>
 */
public class EntityTagger {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    public Set<String> categories(Entity entity, AnalysisContext context) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(entity.getKind().getPrefix());

        for (String genre : EntityAttributes.genres(entity)) {
            tags.add("genre_" + slug(genre));
        }
        for (Ref company : EntityAttributes.companies(entity)) {
            studioFamily(company.name()).ifPresent(tags::add);
        }

        RuleTables.tierOf(RuleTables.RATING_TIERS, EntityAttributes.ratingOrZero(entity)).ifPresent(tags::add);
        RuleTables.tierOf(RuleTables.POPULARITY_TIERS, EntityAttributes.popularity(entity)).ifPresent(tags::add);

        OptionalInt year = EntityAttributes.releaseYear(entity);
        if (year.isPresent()) {
            tags.add("decade_" + (year.getAsInt() / 10) * 10 + "s");
            RuleTables.tierOf(RuleTables.ERA_TIERS, year.getAsInt()).ifPresent(tags::add);
        }

        EntityAttributes.text(entity, "original_language").ifPresent(language -> {
            tags.add("language_" + slug(language));
            if (!"en".equalsIgnoreCase(language)) {
                tags.add("foreign_language");
            }
        });
        if (Boolean.TRUE.equals(entity.get("adult").orElse(null))) {
            tags.add("adult_content");
        }
        if (EntityAttributes.text(entity, "overview").isPresent()) {
            SemanticProfile.cached(entity, context).themes().forEach(theme -> tags.add("theme_" + theme));
        }

        EntityAttributes.text(entity, "career_stage").ifPresent(stage -> tags.add("career_" + slug(stage)));
        EntityAttributes.text(entity, "known_for_department")
                .ifPresent(department -> tags.add("profession_" + slug(department)));
        EntityAttributes.text(entity, "company_category").ifPresent(category -> tags.add("company_" + slug(category)));
        EntityAttributes.text(entity, "franchise_type").ifPresent(type -> tags.add("franchise_" + slug(type)));
        EntityAttributes.text(entity, "keyword_category").ifPresent(category -> tags.add("keyword_" + slug(category)));
        return tags;
    }

    /**
     * Context tags from the entity's content and its connections in the graph.
     */
    public Set<String> contexts(Entity entity, RelationshipGraph graph, AnalysisContext context) {
        Set<String> tags = new LinkedHashSet<>();

        CulturalProfile.cached(entity, context).markerTypes()
                .forEach(marker -> tags.add("cultural_" + marker));

        String content = seasonalContent(entity);
        if (!content.isBlank()) {
            for (Map.Entry<String, Pattern> season : RuleTables.SEASONAL_PATTERNS.entrySet()) {
                if (season.getValue().matcher(content).find()) {
                    tags.add("seasonal_" + season.getKey());
                }
            }
        }

        if (EntityAttributes.ratingOrZero(entity) >= AWARD_WORTHY_RATING) {
            tags.add("award_worthy");
        }
        if (EntityAttributes.popularity(entity) >= MAINSTREAM_HIT_POPULARITY) {
            tags.add("mainstream_hit");
        }
        if (EntityAttributes.collection(entity).isPresent()) {
            tags.add("part_of_franchise");
        }

        int total = 0;
        for (Map.Entry<ConnectionCategory, List<Connection>> entry : graph.connectionsOf(entity.getId()).entrySet()) {
            if (!entry.getValue().isEmpty()) {
                tags.add("connected_" + entry.getKey().getWireName());
                total += entry.getValue().size();
            }
        }
        tags.add(networkPosition(total));
        return tags;
    }

    static String networkPosition(int connections) {
        if (connections >= HIGHLY_CONNECTED) {
            return "highly_connected";
        }
        if (connections >= WELL_CONNECTED) {
            return "well_connected";
        }
        if (connections >= CONNECTED) {
            return "connected";
        }
        return "isolated";
    }

    /**
     * First studio family whose key occurs in the company name.
     */
    static Optional<String> studioFamily(String companyName) {
        String name = companyName.toLowerCase(Locale.ROOT);
        return RuleTables.STUDIO_FAMILIES.entrySet().stream()
                .filter(entry -> name.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    static String slug(String value) {
        String slug = NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll("_");
        return slug.replaceAll("^_+|_+$", "");
    }

    private static String seasonalContent(Entity entity) {
        String overview = EntityAttributes.text(entity, "overview").orElse("");
        String title = EntityAttributes.text(entity, "title")
                .or(() -> EntityAttributes.text(entity, "name"))
                .orElse("");
        return (overview + " " + title).toLowerCase(Locale.ROOT);
    }
}
