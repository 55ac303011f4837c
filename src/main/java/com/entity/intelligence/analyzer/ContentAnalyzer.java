package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityAttributes.Ref;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.rules.RuleTables;
import com.entity.intelligence.similarity.JaccardSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

import static com.entity.intelligence.rules.ScoringConstants.*;

/**
 * Direct relationships backed by shared structured attributes: genres, production
 * companies, cast and crew, collections, and high ratings.
 */
public class ContentAnalyzer implements ConnectionAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ContentAnalyzer.class);

    static final String PROFILE = "content";

    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    /**
     * Structured features of one entity, computed once per build.
     */
    record ContentProfile(Set<String> genres, List<Ref> companies, List<Talent> talent,
                          Optional<Ref> collection, OptionalDouble rating) {

        static ContentProfile of(Entity entity) {
            return new ContentProfile(
                    new LinkedHashSet<>(EntityAttributes.genres(entity)),
                    EntityAttributes.companies(entity),
                    Talent.of(entity),
                    EntityAttributes.collection(entity),
                    EntityAttributes.rating(entity));
        }
    }

    @Override
    public String getName() {
        return "content";
    }

    @Override
    public ConnectionCategory getCategory() {
        return ConnectionCategory.DIRECT;
    }

    @Override
    public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
        ContentProfile profile = profileOf(source, context);
        List<Connection> connections = new ArrayList<>();
        for (Entity other : corpus.entities()) {
            if (other.getId().equals(source.getId())) {
                continue;
            }
            ContentProfile otherProfile = profileOf(other, context);
            genreMatch(profile, other.getId(), otherProfile).ifPresent(connections::add);
            studioUniverse(profile, other.getId(), otherProfile).ifPresent(connections::add);
            talentOverlap(profile, other.getId(), otherProfile).ifPresent(connections::add);
            franchiseMember(profile, other.getId(), otherProfile).ifPresent(connections::add);
            ratingSimilarity(profile, other.getId(), otherProfile).ifPresent(connections::add);
        }
        log.trace("content.analyzed entityId={} connections={}", source.getId(), connections.size());
        return connections;
    }

    private ContentProfile profileOf(Entity entity, AnalysisContext context) {
        return context.cache().getOrCompute(PROFILE, entity, ContentProfile.class, ContentProfile::of);
    }

    Optional<Connection> genreMatch(ContentProfile source, String targetId, ContentProfile target) {
        Set<String> common = jaccard.intersection(source.genres(), target.genres());
        if (common.isEmpty()) {
            return Optional.empty();
        }
        double strength = jaccard.compute(source.genres(), target.genres());
        for (String genre : common) {
            strength *= RuleTables.GENRE_WEIGHTS.getOrDefault(genre, RuleTables.DEFAULT_GENRE_WEIGHT);
        }
        strength *= 1 + (common.size() - 1) * GENRE_MULTI_MATCH_STEP;
        strength = Math.min(GENRE_STRENGTH_CAP, strength);
        if (strength <= GENRE_MATCH_THRESHOLD) {
            return Optional.empty();
        }

        double confidence = common.stream().anyMatch(RuleTables.DISTINCTIVE_GENRES::contains)
                ? GENRE_DISTINCT_CONFIDENCE : GENRE_BASE_CONFIDENCE;
        if (common.size() > 1) {
            confidence = Math.min(GENRE_CONFIDENCE_CAP, confidence + (common.size() - 1) * GENRE_CONFIDENCE_STEP);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("commonGenres", List.copyOf(common));
        metadata.put("totalEntityGenres", source.genres().size());
        metadata.put("totalOtherGenres", target.genres().size());
        return Optional.of(Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.GENRE_MATCH)
                .strength(strength)
                .confidence(confidence)
                .reason("Shared genres: " + String.join(", ", common))
                .metadata(metadata)
                .build());
    }

    Optional<Connection> studioUniverse(ContentProfile source, String targetId, ContentProfile target) {
        Set<String> targetIds = target.companies().stream().map(Ref::id).collect(Collectors.toSet());
        List<Ref> common = source.companies().stream()
                .filter(company -> targetIds.contains(company.id()))
                .collect(Collectors.toList());
        if (common.isEmpty()) {
            return Optional.empty();
        }
        double importance = studioImportance(common);
        double strength = Math.min(STUDIO_STRENGTH_CAP, STUDIO_BASE_STRENGTH * importance);

        List<Map<String, Object>> studios = new ArrayList<>();
        for (Ref company : common) {
            Map<String, Object> studio = new LinkedHashMap<>();
            studio.put("id", company.id());
            studio.put("name", company.name());
            studios.add(studio);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("commonStudios", studios);
        metadata.put("studioImportance", importance);
        return Optional.of(Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.STUDIO_UNIVERSE)
                .strength(strength)
                .confidence(STUDIO_CONFIDENCE)
                .reason("Same production company: "
                        + common.stream().map(Ref::name).collect(Collectors.joining(", ")))
                .metadata(metadata)
                .build());
    }

    static double studioImportance(List<Ref> studios) {
        double importance = STUDIO_DEFAULT_IMPORTANCE;
        for (Ref studio : studios) {
            String name = studio.name();
            if (RuleTables.MAJOR_STUDIOS.stream().anyMatch(name::contains)) {
                importance = Math.max(importance, STUDIO_MAJOR_IMPORTANCE);
            } else if (RuleTables.PRESTIGE_STUDIOS.stream().anyMatch(name::contains)) {
                importance = Math.max(importance, STUDIO_PRESTIGE_IMPORTANCE);
            }
        }
        return importance;
    }

    Optional<Connection> talentOverlap(ContentProfile source, String targetId, ContentProfile target) {
        List<Talent> common = commonTalent(source.talent(), target.talent());
        if (common.isEmpty()) {
            return Optional.empty();
        }
        double strength = talentStrength(common);
        if (strength <= TALENT_MIN_STRENGTH) {
            return Optional.empty();
        }
        double finalStrength = Math.min(TALENT_STRENGTH_CAP, strength * talentImportance(common));

        List<Map<String, Object>> people = new ArrayList<>();
        for (Talent person : common) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", person.name());
            entry.put("job", person.job());
            entry.put("importance", person.importance());
            people.add(entry);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("commonTalent", people);
        metadata.put("talentCount", common.size());
        return Optional.of(Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.TALENT_OVERLAP)
                .strength(finalStrength)
                .confidence(talentConfidence(common))
                .reason(common.size() + " shared cast/crew members")
                .metadata(metadata)
                .build());
    }

    /**
     * Source credits whose person also appears on the target, at the higher of the two importances.
     */
    static List<Talent> commonTalent(List<Talent> source, List<Talent> target) {
        List<Talent> common = new ArrayList<>();
        for (Talent person : source) {
            for (Talent other : target) {
                if (other.personId().equals(person.personId())) {
                    common.add(person.withImportance(Math.max(person.importance(), other.importance())));
                    break;
                }
            }
        }
        return common;
    }

    static double talentStrength(List<Talent> common) {
        double strength = TALENT_BASE_STRENGTH;
        for (Talent person : common) {
            strength += TALENT_PER_PERSON_STEP * person.importance();
        }
        if (common.stream().anyMatch(person -> "Director".equals(person.job()))) {
            strength *= TALENT_DIRECTOR_BONUS;
        }
        if (common.stream().filter(Talent::isKeyRole).count() > 1) {
            strength *= TALENT_KEY_ROLES_BONUS;
        }
        return Math.min(TALENT_STRENGTH_CAP, strength);
    }

    static double talentImportance(List<Talent> common) {
        double importance = TALENT_BASE_IMPORTANCE;
        for (Talent person : common) {
            switch (person.job()) {
                case "Director" -> importance = Math.max(importance, 0.95);
                case "Producer" -> importance = Math.max(importance, 0.85);
                case "Writer" -> importance = Math.max(importance, 0.8);
                default -> {
                    if (person.importance() > TALENT_HEADLINER_THRESHOLD) {
                        importance = Math.max(importance, TALENT_HEADLINER_IMPORTANCE);
                    }
                }
            }
        }
        return importance;
    }

    static double talentConfidence(List<Talent> common) {
        double confidence = common.stream().anyMatch(Talent::isKeyRole)
                ? TALENT_KEY_ROLE_CONFIDENCE : TALENT_BASE_CONFIDENCE;
        if (common.size() > 1) {
            confidence = Math.min(TALENT_CONFIDENCE_CAP, confidence + (common.size() - 1) * TALENT_CONFIDENCE_STEP);
        }
        return confidence;
    }

    Optional<Connection> franchiseMember(ContentProfile source, String targetId, ContentProfile target) {
        if (source.collection().isEmpty() || target.collection().isEmpty()) {
            return Optional.empty();
        }
        Ref collection = source.collection().get();
        if (!collection.id().equals(target.collection().get().id())) {
            return Optional.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("collectionId", collection.id());
        metadata.put("collectionName", collection.name());
        return Optional.of(Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.FRANCHISE_MEMBER)
                .strength(FRANCHISE_STRENGTH)
                .confidence(FRANCHISE_CONFIDENCE)
                .reason("Part of " + collection.name() + " collection")
                .metadata(metadata)
                .build());
    }

    Optional<Connection> ratingSimilarity(ContentProfile source, String targetId, ContentProfile target) {
        if (source.rating().isEmpty() || target.rating().isEmpty()) {
            return Optional.empty();
        }
        double rating = source.rating().getAsDouble();
        double otherRating = target.rating().getAsDouble();
        if (rating == 0 || otherRating == 0) {
            return Optional.empty();
        }
        double difference = Math.abs(rating - otherRating);
        if (difference > RATING_MAX_DIFFERENCE || rating < RATING_FLOOR || otherRating < RATING_FLOOR) {
            return Optional.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entityRating", rating);
        metadata.put("otherRating", otherRating);
        metadata.put("ratingDifference", difference);
        return Optional.of(Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.RATING_SIMILARITY)
                .strength((1 - difference / 10) * RATING_STRENGTH_SCALE)
                .confidence(RATING_CONFIDENCE)
                .reason(String.format(Locale.ROOT, "Similar high ratings: %.1f vs %.1f", rating, otherRating))
                .metadata(metadata)
                .build());
    }
}
