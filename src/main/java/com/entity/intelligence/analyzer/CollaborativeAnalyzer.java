package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.entity.intelligence.rules.ScoringConstants.COLLABORATIVE_CONFIDENCE_SCALE;
import static com.entity.intelligence.rules.ScoringConstants.COLLABORATIVE_MAX_RATING_DISTANCE;
import static com.entity.intelligence.rules.ScoringConstants.COLLABORATIVE_MIN_SHARED_GENRES;
import static com.entity.intelligence.rules.ScoringConstants.COLLABORATIVE_THRESHOLD;

/**
 * Taste-based relationships: titles sharing several genres at a similar rating tend
 * to appeal to the same viewers.
 */
public class CollaborativeAnalyzer implements ConnectionAnalyzer {

    @Override
    public String getName() {
        return "collaborative";
    }

    @Override
    public ConnectionCategory getCategory() {
        return ConnectionCategory.COLLABORATIVE;
    }

    @Override
    public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
        Set<String> genres = new LinkedHashSet<>(EntityAttributes.genres(source));
        if (genres.size() < COLLABORATIVE_MIN_SHARED_GENRES) {
            return List.of();
        }
        double rating = EntityAttributes.ratingOrZero(source);

        List<Connection> connections = new ArrayList<>();
        for (Entity other : corpus.entities()) {
            if (other.getId().equals(source.getId())) {
                continue;
            }
            Set<String> otherGenres = new LinkedHashSet<>(EntityAttributes.genres(other));
            long overlap = genres.stream().filter(otherGenres::contains).count();
            double distance = Math.abs(rating - EntityAttributes.ratingOrZero(other));
            if (overlap < COLLABORATIVE_MIN_SHARED_GENRES || distance >= COLLABORATIVE_MAX_RATING_DISTANCE) {
                continue;
            }
            double strength = ((double) overlap / Math.max(genres.size(), otherGenres.size()))
                    * (1 - distance / 10);
            if (strength > COLLABORATIVE_THRESHOLD) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("sharedGenres", overlap);
                metadata.put("ratingDistance", distance);
                connections.add(Connection.builder()
                        .targetId(other.getId())
                        .type(ConnectionType.COLLABORATIVE_FILTERING)
                        .strength(strength)
                        .confidence(strength * COLLABORATIVE_CONFIDENCE_SCALE)
                        .reason("Users with similar taste enjoy both")
                        .metadata(metadata)
                        .build());
            }
        }
        return connections;
    }
}
