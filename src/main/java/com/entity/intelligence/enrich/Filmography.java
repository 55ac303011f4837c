package com.entity.intelligence.enrich;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.core.model.EntityKind;
import com.entity.intelligence.rules.RuleTables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;

/**
 * The titles a company, collection, genre or keyword is attached to, reduced to the
 * fields the catalog enrichers score on.
 */
final class Filmography {

    private static final int MIN_YEAR = 1900;

    /**
     * One title. {@code kind} is {@code null} for records that are not corpus entities.
     */
    record Work(String title, String date, OptionalInt year, List<String> genres,
                double popularity, double rating, EntityKind kind) {

        boolean releasedSince(int year) {
            return this.year.isPresent() && this.year.getAsInt() >= year;
        }
    }

    private final List<Work> works;

    private Filmography(List<Work> works) {
        this.works = List.copyOf(works);
    }

    static Filmography of(List<Work> works) {
        return new Filmography(works);
    }

    /**
     * Movies and shows of the corpus accepted by the predicate, in corpus order.
     */
    static Filmography referencing(EntityCorpus corpus, Predicate<Entity> references) {
        List<Work> works = new ArrayList<>();
        for (Entity entity : corpus.entities()) {
            EntityKind kind = entity.getKind();
            if ((kind == EntityKind.MOVIE || kind == EntityKind.SHOW) && references.test(entity)) {
                works.add(workOf(entity));
            }
        }
        return new Filmography(works);
    }

    static Work workOf(Entity title) {
        String date = EntityAttributes.text(title, "release_date")
                .or(() -> EntityAttributes.text(title, "first_air_date"))
                .orElse(null);
        return new Work(title.getDisplayName(), date, EntityAttributes.releaseYear(title),
                EntityAttributes.genres(title), EntityAttributes.popularity(title),
                EntityAttributes.ratingOrZero(title), title.getKind());
    }

    /**
     * A title held as a plain record, e.g. a collection part. Genres come from
     * {@code genre_ids} or, failing that, from named {@code genres}.
     */
    static Work workOf(Map<String, Object> record) {
        String date = EntityAttributes.asText(record.get("release_date"))
                .or(() -> EntityAttributes.asText(record.get("first_air_date")))
                .orElse(null);
        String title = EntityAttributes.asText(record.get("title"))
                .or(() -> EntityAttributes.asText(record.get("name")))
                .orElse("");
        List<String> genres = new ArrayList<>();
        if (record.get("genre_ids") instanceof List<?> ids) {
            for (Object id : ids) {
                if (id instanceof Number n && RuleTables.CREDIT_GENRES.containsKey(n.intValue())) {
                    genres.add(RuleTables.CREDIT_GENRES.get(n.intValue()));
                }
            }
        } else {
            for (Map<String, Object> genre : EntityAttributes.asRecords(record.get("genres"))) {
                EntityAttributes.asText(genre.get("name")).ifPresent(genres::add);
            }
        }
        return new Work(title, date, EntityAttributes.yearOf(date), genres,
                EntityAttributes.asNumber(record.get("popularity")).orElse(0.0),
                EntityAttributes.asNumber(record.get("vote_average")).orElse(0.0), null);
    }

    List<Work> works() {
        return works;
    }

    int size() {
        return works.size();
    }

    boolean isEmpty() {
        return works.isEmpty();
    }

    /**
     * Release years after 1900, ascending.
     */
    List<Integer> years() {
        List<Integer> years = new ArrayList<>();
        for (Work work : works) {
            if (work.year().isPresent() && work.year().getAsInt() > MIN_YEAR) {
                years.add(work.year().getAsInt());
            }
        }
        Collections.sort(years);
        return years;
    }

    /**
     * Dated titles ordered by release date; equal dates keep corpus order.
     */
    List<Work> byRelease() {
        return works.stream()
                .filter(work -> work.date() != null)
                .sorted((a, b) -> a.date().compareTo(b.date()))
                .toList();
    }

    long releasedSince(int year) {
        return works.stream().filter(work -> work.releasedSince(year)).count();
    }

    /**
     * Mean rating over all titles, unrated ones counting as zero.
     */
    double averageRating() {
        return works.stream().mapToDouble(Work::rating).average().orElse(0.0);
    }

    double averagePopularity() {
        return works.stream().mapToDouble(Work::popularity).average().orElse(0.0);
    }

    /**
     * Genre counts over all titles, most frequent first. Ties keep first-seen order.
     */
    Map<String, Integer> genreFrequency() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Work work : works) {
            for (String genre : work.genres()) {
                counts.merge(genre, 1, Integer::sum);
            }
        }
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    List<String> topGenres(int limit) {
        return genreFrequency().keySet().stream().limit(limit).toList();
    }

    /**
     * The most frequent genres with their count and rounded share of all genre tags.
     */
    static List<Map<String, Object>> genreShares(Map<String, Integer> frequency, int limit) {
        int total = frequency.values().stream().mapToInt(Integer::intValue).sum();
        List<Map<String, Object>> shares = new ArrayList<>();
        frequency.entrySet().stream().limit(limit).forEach(e -> {
            Map<String, Object> share = new LinkedHashMap<>();
            share.put("genre", e.getKey());
            share.put("count", e.getValue());
            share.put("percentage", Math.round(e.getValue() * 100.0 / total));
            shares.add(share);
        });
        return shares;
    }

    /**
     * Decade with the most dated titles; the earliest-seen decade wins a tie.
     */
    Optional<Map<String, Object>> peakDecade() {
        Map<Integer, Integer> decades = new LinkedHashMap<>();
        for (Work work : works) {
            work.year().ifPresent(year -> decades.merge((year / 10) * 10, 1, Integer::sum));
        }
        if (decades.isEmpty()) {
            return Optional.empty();
        }
        int peak = 0;
        int peakCount = 0;
        for (Map.Entry<Integer, Integer> entry : decades.entrySet()) {
            if (entry.getValue() > peakCount) {
                peak = entry.getKey();
                peakCount = entry.getValue();
            }
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("decade", peak + "s");
        result.put("movie_count", peakCount);
        result.put("percentage", Math.round(peakCount * 100.0 / works.size()));
        return Optional.of(result);
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
