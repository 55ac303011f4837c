package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.rules.RuleTables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.entity.intelligence.rules.ScoringConstants.CAST_DEFAULT_IMPORTANCE;
import static com.entity.intelligence.rules.ScoringConstants.CAST_IMPORTANCE_CAP;
import static com.entity.intelligence.rules.ScoringConstants.CAST_POPULARITY_BOOST;
import static com.entity.intelligence.rules.ScoringConstants.CAST_POPULARITY_THRESHOLD;
import static com.entity.intelligence.rules.ScoringConstants.CREW_DEFAULT_IMPORTANCE;

/**
 * A cast member or key crew member credited on an entity.
 *
 * @param personId   source id of the person
 * @param name       credited name
 * @param job        {@code Actor} for cast, otherwise the crew job
 * @param importance billing or job importance in [0, 1]
 */
record Talent(String personId, String name, String job, double importance) {

    static final String ACTOR = "Actor";

    boolean isKeyRole() {
        return RuleTables.KEY_ROLES.contains(job);
    }

    Talent withImportance(double value) {
        return new Talent(personId, name, job, value);
    }

    /**
     * Cast with id and name, followed by crew holding a key job.
     */
    static List<Talent> of(Entity entity) {
        List<Talent> talent = new ArrayList<>();
        for (Map<String, Object> person : EntityAttributes.records(entity, "cast")) {
            credited(person).ifPresent(ref -> talent.add(
                    new Talent(ref.id(), ref.name(), ACTOR, castImportance(person))));
        }
        for (Map<String, Object> person : EntityAttributes.records(entity, "crew")) {
            Optional<String> job = EntityAttributes.asText(person.get("job"));
            if (job.isEmpty() || !RuleTables.KEY_CREW_JOBS.contains(job.get())) {
                continue;
            }
            credited(person).ifPresent(ref -> talent.add(new Talent(ref.id(), ref.name(), job.get(),
                    RuleTables.CREW_JOB_IMPORTANCE.getOrDefault(job.get(), CREW_DEFAULT_IMPORTANCE))));
        }
        return Collections.unmodifiableList(talent);
    }

    static double castImportance(Map<String, Object> person) {
        double importance = CAST_DEFAULT_IMPORTANCE;
        OptionalDouble order = EntityAttributes.asNumber(person.get("order"));
        if (order.isPresent()) {
            double o = order.getAsDouble();
            if (o < 3) {
                importance = 0.9;
            } else if (o < 5) {
                importance = 0.8;
            } else if (o < 10) {
                importance = 0.7;
            }
        }
        OptionalDouble popularity = EntityAttributes.asNumber(person.get("popularity"));
        if (popularity.isPresent() && popularity.getAsDouble() > CAST_POPULARITY_THRESHOLD) {
            importance = Math.min(CAST_IMPORTANCE_CAP, importance + CAST_POPULARITY_BOOST);
        }
        return importance;
    }

    private static Optional<EntityAttributes.Ref> credited(Map<String, Object> person) {
        return EntityAttributes.refOf(person);
    }
}
