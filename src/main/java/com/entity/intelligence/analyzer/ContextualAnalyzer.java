package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.rules.RuleTables;
import com.entity.intelligence.rules.RuleTables.FilmEra;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.entity.intelligence.rules.ScoringConstants.CULTURAL_MOVEMENT_CONFIDENCE;
import static com.entity.intelligence.rules.ScoringConstants.CULTURAL_MOVEMENT_STRENGTH;
import static com.entity.intelligence.rules.ScoringConstants.SAME_DECADE_CONFIDENCE;
import static com.entity.intelligence.rules.ScoringConstants.SAME_DECADE_STRENGTH;

/**
 * Situational relationships: releases from the same decade and titles that belong
 * to the same film-industry era.
 */
public class ContextualAnalyzer implements ConnectionAnalyzer {

    @Override
    public String getName() {
        return "contextual";
    }

    @Override
    public ConnectionCategory getCategory() {
        return ConnectionCategory.CONTEXTUAL;
    }

    @Override
    public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
        int year = EntityAttributes.releaseYear(source).orElse(0);
        int decade = decadeOf(year);
        Optional<String> movement = filmEra(source, year);
        if (decade == 0 && movement.isEmpty()) {
            return List.of();
        }

        List<Connection> connections = new ArrayList<>();
        for (Entity other : corpus.entities()) {
            if (other.getId().equals(source.getId())) {
                continue;
            }
            int otherYear = EntityAttributes.releaseYear(other).orElse(0);
            if (decade > 0 && decade == decadeOf(otherYear)) {
                connections.add(Connection.builder()
                        .targetId(other.getId())
                        .type(ConnectionType.SAME_DECADE)
                        .strength(SAME_DECADE_STRENGTH)
                        .confidence(SAME_DECADE_CONFIDENCE)
                        .reason("Both from the " + decade + "s")
                        .metadata(Map.of("decade", decade))
                        .build());
            }
            if (movement.isPresent() && movement.equals(filmEra(other, otherYear))) {
                connections.add(Connection.builder()
                        .targetId(other.getId())
                        .type(ConnectionType.CULTURAL_MOVEMENT)
                        .strength(CULTURAL_MOVEMENT_STRENGTH)
                        .confidence(CULTURAL_MOVEMENT_CONFIDENCE)
                        .reason("Both part of " + movement.get() + " movement")
                        .metadata(Map.of("movement", movement.get()))
                        .build());
            }
        }
        return connections;
    }

    static int decadeOf(int year) {
        return year > 0 ? (year / 10) * 10 : 0;
    }

    /**
     * First era whose window covers the year and whose keywords appear in the overview or title.
     */
    static Optional<String> filmEra(Entity entity, int year) {
        if (year <= 0) {
            return Optional.empty();
        }
        String overview = EntityAttributes.text(entity, "overview").orElse("").toLowerCase(Locale.ROOT);
        String title = EntityAttributes.text(entity, "title")
                .or(() -> EntityAttributes.text(entity, "name"))
                .orElse("")
                .toLowerCase(Locale.ROOT);
        for (Map.Entry<String, FilmEra> entry : RuleTables.FILM_ERAS.entrySet()) {
            FilmEra era = entry.getValue();
            if (era.covers(year) && era.keywords().stream()
                    .anyMatch(keyword -> overview.contains(keyword) || title.contains(keyword))) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
