package com.entity.intelligence.analyzer;

import com.entity.intelligence.core.model.Connection;
import com.entity.intelligence.core.model.ConnectionCategory;
import com.entity.intelligence.core.model.ConnectionType;
import com.entity.intelligence.core.model.Entity;
import com.entity.intelligence.core.model.EntityAttributes;
import com.entity.intelligence.core.model.EntityCorpus;
import com.entity.intelligence.rules.RuleTables;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

import static com.entity.intelligence.rules.ScoringConstants.*;

/**
 * Release-timing relationships: near-concurrent releases and entries of the same
 * franchise released a typical sequel gap apart.
 */
public class TemporalAnalyzer implements ConnectionAnalyzer {

    /**
     * Franchise signals read from an entity's title, overview and collection.
     */
    record FranchiseInfo(boolean franchise, boolean sequel, boolean reboot,
                         Optional<String> franchiseName, Optional<String> collectionId,
                         List<String> indicators) {

        static FranchiseInfo of(Entity entity) {
            String title = titleOf(entity);
            String overview = EntityAttributes.text(entity, "overview").orElse("").toLowerCase(Locale.ROOT);
            boolean franchise = false;
            boolean sequel = false;
            boolean reboot = false;
            List<String> indicators = new ArrayList<>();

            if (RuleTables.SEQUEL_NUMBER.matcher(title).find()) {
                franchise = sequel = true;
                indicators.add("sequel_number");
            }
            if (RuleTables.SEQUEL_WORD.matcher(title).find()) {
                franchise = sequel = true;
                indicators.add("sequel_word");
            }
            if (RuleTables.FRANCHISE_TITLE.matcher(title).find()) {
                franchise = true;
                indicators.add("franchise_indicator");
            }
            if (RuleTables.REBOOT_INDICATOR.matcher(title).find()
                    || RuleTables.REBOOT_INDICATOR.matcher(overview).find()) {
                franchise = reboot = true;
                indicators.add("reboot_indicator");
            }

            Optional<String> name = franchise ? Optional.of(baseName(title)) : Optional.empty();
            Optional<EntityAttributes.Ref> collection = EntityAttributes.collection(entity);
            if (collection.isPresent()) {
                franchise = true;
                name = Optional.of(collection.get().name());
                indicators.add("collection_member");
            }
            return new FranchiseInfo(franchise, sequel, reboot,
                    name.filter(n -> !n.isBlank()),
                    collection.map(EntityAttributes.Ref::id),
                    List.copyOf(indicators));
        }
    }

    @Override
    public String getName() {
        return "temporal";
    }

    @Override
    public ConnectionCategory getCategory() {
        return ConnectionCategory.TEMPORAL;
    }

    @Override
    public List<Connection> analyze(Entity source, EntityCorpus corpus, AnalysisContext context) {
        OptionalInt year = EntityAttributes.releaseYear(source);
        if (year.isEmpty()) {
            return List.of();
        }
        int sourceYear = year.getAsInt();
        FranchiseInfo sourceInfo = FranchiseInfo.of(source);

        List<Connection> connections = new ArrayList<>();
        for (Entity other : corpus.entities()) {
            if (other.getId().equals(source.getId())) {
                continue;
            }
            OptionalInt otherYear = EntityAttributes.releaseYear(other);
            if (otherYear.isEmpty()) {
                continue;
            }
            int gap = Math.abs(sourceYear - otherYear.getAsInt());
            if (gap <= CONCURRENT_RELEASE_MAX_GAP) {
                connections.add(concurrentRelease(other.getId(), sourceYear, otherYear.getAsInt(), gap));
            }
            if (sourceInfo.franchise()) {
                FranchiseInfo otherInfo = FranchiseInfo.of(other);
                if (franchiseRelated(source, other, sourceInfo, otherInfo)) {
                    double strength = franchiseTimingStrength(gap, sourceInfo, otherInfo);
                    if (strength > FRANCHISE_TIMING_THRESHOLD) {
                        connections.add(franchiseTiming(other.getId(), gap, strength, sourceInfo, otherInfo));
                    }
                }
            }
        }
        connections.sort(Connection.BY_STRENGTH);
        return connections;
    }

    static double concurrentReleaseStrength(int gap) {
        if (gap == 0) {
            return SAME_YEAR_STRENGTH * SAME_YEAR_BONUS;
        }
        return gap == 1 ? ONE_YEAR_STRENGTH : TWO_YEAR_STRENGTH;
    }

    private Connection concurrentRelease(String targetId, int year, int otherYear, int gap) {
        String reason = gap == 0
                ? "Both released in " + year
                : "Released within " + gap + " year" + (gap > 1 ? "s" : "") + " (" + year + " vs " + otherYear + ")";
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entityYear", year);
        metadata.put("otherYear", otherYear);
        metadata.put("yearDifference", gap);
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.CONCURRENT_RELEASE)
                .strength(concurrentReleaseStrength(gap))
                .confidence(gap == 0 ? SAME_YEAR_CONFIDENCE : CONCURRENT_RELEASE_CONFIDENCE)
                .reason(reason)
                .metadata(metadata)
                .build();
    }

    static boolean franchiseRelated(Entity first, Entity second, FranchiseInfo info1, FranchiseInfo info2) {
        if (info1.collectionId().isPresent() && info2.collectionId().isPresent()) {
            return info1.collectionId().equals(info2.collectionId());
        }
        if (info1.franchiseName().isPresent() && info2.franchiseName().isPresent()) {
            return sameFranchiseName(info1.franchiseName().get(), info2.franchiseName().get());
        }
        if (info1.franchise() && info2.franchise()) {
            return shareTitleWord(first, second);
        }
        return false;
    }

    static double franchiseTimingStrength(int gap, FranchiseInfo info1, FranchiseInfo info2) {
        double strength = FRANCHISE_TIMING_BASE;
        if (gap >= 2 && gap <= 4) {
            strength = 0.9;
        } else if (gap == 1) {
            strength = 0.85;
        } else if (gap >= 5 && gap <= 8) {
            strength = 0.7;
        } else if (gap > 8) {
            strength = 0.5;
        }
        if ((info1.reboot() || info2.reboot()) && gap > 10) {
            strength = 0.75;
        }
        return Math.min(FRANCHISE_TIMING_CAP, strength);
    }

    private Connection franchiseTiming(String targetId, int gap, double strength,
                                       FranchiseInfo info1, FranchiseInfo info2) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("yearDifference", gap);
        metadata.put("entityIndicators", info1.indicators());
        metadata.put("otherIndicators", info2.indicators());
        metadata.put("franchiseRelation", relation(info1, info2));
        return Connection.builder()
                .targetId(targetId)
                .type(ConnectionType.FRANCHISE_TIMING)
                .strength(strength)
                .confidence(FRANCHISE_TIMING_CONFIDENCE)
                .reason("Franchise timing pattern: " + gap + " years apart")
                .metadata(metadata)
                .build();
    }

    static String relation(FranchiseInfo info1, FranchiseInfo info2) {
        if (info1.reboot() || info2.reboot()) {
            return "reboot";
        }
        if (info1.sequel() || info2.sequel()) {
            return "sequel";
        }
        return "franchise";
    }

    static String titleOf(Entity entity) {
        return EntityAttributes.text(entity, "title")
                .or(() -> EntityAttributes.text(entity, "name"))
                .orElse("")
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Title with the first sequel, franchise and reboot marker removed.
     */
    static String baseName(String title) {
        String name = removeFirst(title, RuleTables.SEQUEL_NUMBER.matcher(title));
        name = removeFirst(name, RuleTables.SEQUEL_WORD.matcher(name));
        name = removeFirst(name, RuleTables.FRANCHISE_TITLE.matcher(name));
        name = removeFirst(name, RuleTables.REBOOT_INDICATOR.matcher(name));
        return name.trim();
    }

    private static String removeFirst(String input, Matcher matcher) {
        return matcher.replaceFirst("");
    }

    static boolean sameFranchiseName(String name1, String name2) {
        String clean1 = name1.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        String clean2 = name2.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (clean1.isEmpty() || clean2.isEmpty()) {
            return false;
        }
        return clean1.contains(clean2) || clean2.contains(clean1);
    }

    static boolean shareTitleWord(Entity first, Entity second) {
        Set<String> words = significantWords(titleOf(second));
        return significantWords(titleOf(first)).stream().anyMatch(words::contains);
    }

    private static Set<String> significantWords(String title) {
        return Arrays.stream(title.split("\\s+"))
                .filter(word -> word.length() > 2)
                .collect(Collectors.toSet());
    }
}
