package com.entity.intelligence.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant readers for the loosely typed attribute records of an {@link Entity}.
 *
 * <p>Every accessor treats a missing or wrongly typed value as absent and never
 * throws. Analyzers use these readers so malformed ingestion data contributes no
 * signal instead of failing the build.</p>
 */
public final class EntityAttributes {

    private static final Pattern YEAR_PREFIX = Pattern.compile("^(\\d{4})");
    private static final List<String> DATE_FIELDS = List.of("release_date", "first_air_date", "air_date");

    /**
     * Reference to another record by id and name, e.g. a production company or collection.
     */
    public record Ref(String id, String name) {
    }

    private EntityAttributes() {
        // Utility class
    }

    public static Optional<String> text(Entity entity, String key) {
        return entity.get(key).flatMap(EntityAttributes::asText);
    }

    public static OptionalDouble number(Entity entity, String key) {
        return entity.get(key).map(EntityAttributes::asNumber).orElse(OptionalDouble.empty());
    }

    /**
     * Elements of a list attribute that are themselves records. Non-record elements are skipped.
     */
    public static List<Map<String, Object>> records(Entity entity, String key) {
        return entity.get(key).map(EntityAttributes::asRecords).orElse(List.of());
    }

    /**
     * Names held by a list attribute whose elements are either plain strings or
     * records with a {@code name} field. Duplicates are dropped, order is kept.
     */
    public static List<String> names(Entity entity, String key) {
        Optional<Object> value = entity.get(key);
        if (value.isEmpty() || !(value.get() instanceof List<?> list)) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (Object element : list) {
            if (element instanceof String s && !s.isBlank()) {
                names.add(s.trim());
            } else if (element instanceof Map<?, ?> map) {
                asText(map.get("name")).ifPresent(names::add);
            }
        }
        return List.copyOf(names);
    }

    /**
     * String elements of a list attribute.
     */
    public static List<String> strings(Entity entity, String key) {
        Optional<Object> value = entity.get(key);
        if (value.isEmpty() || !(value.get() instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object element : list) {
            if (element instanceof String s && !s.isBlank()) {
                result.add(s.trim());
            }
        }
        return Collections.unmodifiableList(result);
    }

    public static List<String> genres(Entity entity) {
        return names(entity, "genres");
    }

    public static List<String> keywords(Entity entity) {
        return names(entity, "keywords");
    }

    public static OptionalDouble rating(Entity entity) {
        return number(entity, "vote_average");
    }

    public static double ratingOrZero(Entity entity) {
        return rating(entity).orElse(0.0);
    }

    public static double voteCount(Entity entity) {
        return number(entity, "vote_count").orElse(0.0);
    }

    public static double popularity(Entity entity) {
        return number(entity, "popularity").orElse(0.0);
    }

    /**
     * Release year from {@code release_date}, {@code first_air_date} or {@code air_date}.
     */
    public static OptionalInt releaseYear(Entity entity) {
        for (String field : DATE_FIELDS) {
            Optional<String> date = text(entity, field);
            if (date.isPresent()) {
                return yearOf(date.get());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Year prefix of an ISO date string, if it has one.
     */
    public static OptionalInt yearOf(String date) {
        if (date == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = YEAR_PREFIX.matcher(date.trim());
        if (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            return year > 0 ? OptionalInt.of(year) : OptionalInt.empty();
        }
        return OptionalInt.empty();
    }

    /**
     * Production companies with both id and name present.
     */
    public static List<Ref> companies(Entity entity) {
        List<Ref> refs = new ArrayList<>();
        for (Map<String, Object> company : records(entity, "production_companies")) {
            refOf(company).ifPresent(refs::add);
        }
        return Collections.unmodifiableList(refs);
    }

    public static Optional<Ref> collection(Entity entity) {
        return entity.get("belongs_to_collection")
                .filter(Map.class::isInstance)
                .flatMap(value -> refOf((Map<?, ?>) value));
    }

    /**
     * Country codes from {@code origin_country}, falling back to {@code production_countries}.
     */
    public static List<String> countries(Entity entity) {
        List<String> origin = strings(entity, "origin_country");
        if (!origin.isEmpty()) {
            return origin;
        }
        List<String> codes = new ArrayList<>();
        for (Map<String, Object> country : records(entity, "production_countries")) {
            asText(country.get("iso_3166_1")).ifPresent(codes::add);
        }
        return Collections.unmodifiableList(codes);
    }

    /**
     * Lower-cased concatenation of the given text attributes, skipping absent ones.
     */
    public static String joinedText(Entity entity, List<String> keys) {
        StringBuilder sb = new StringBuilder();
        for (String key : keys) {
            text(entity, key).ifPresent(value -> {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(value);
            });
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    public static Optional<Ref> refOf(Map<?, ?> record) {
        Optional<String> id = idOf(record.get("id"));
        Optional<String> name = asText(record.get("name"));
        if (id.isPresent() && name.isPresent()) {
            return Optional.of(new Ref(id.get(), name.get()));
        }
        return Optional.empty();
    }

    /**
     * Canonical string form of an id value: integral numbers and non-blank strings.
     */
    public static Optional<String> idOf(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isFinite(d) && d != 0 && d == Math.rint(d)) {
                return Optional.of(Long.toString(n.longValue()));
            }
            return Optional.empty();
        }
        return asText(value);
    }

    public static Optional<String> asText(Object value) {
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s.trim());
        }
        return Optional.empty();
    }

    public static OptionalDouble asNumber(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> asRecords(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object element : list) {
            if (element instanceof Map<?, ?> map) {
                records.add((Map<String, Object>) map);
            }
        }
        return Collections.unmodifiableList(records);
    }
}
