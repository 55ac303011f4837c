package com.entity.intelligence.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityTest {

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Should divide intersection by union")
        void testCompute() {
            assertEquals(0.5, jaccard.compute(Set.of("dark", "tense", "gritty"), Set.of("dark", "tense", "light")),
                    1e-9);
            assertEquals(1.0, jaccard.compute(Set.of("dark"), Set.of("dark")));
        }

        @Test
        @DisplayName("Empty or missing sets should score zero")
        void testEmpty() {
            assertEquals(0.0, jaccard.compute(Set.of(), Set.of("dark")));
            assertEquals(0.0, jaccard.compute(null, Set.of("dark")));
        }

        @Test
        @DisplayName("Intersection should keep the first set's order")
        void testIntersectionOrder() {
            Set<String> first = new LinkedHashSet<>(List.of("tense", "dark", "gritty"));

            assertEquals(List.of("tense", "dark"), List.copyOf(jaccard.intersection(first, Set.of("dark", "tense"))));
            assertEquals(2, jaccard.intersectionSize(first, Set.of("dark", "tense")));
        }
    }

    @Nested
    @DisplayName("CulturalWeights")
    class WeightTests {

        @Test
        @DisplayName("Default weights should combine sub-scores")
        void testCombine() {
            CulturalWeights weights = CulturalWeights.defaultWeights();

            assertEquals(1.0, weights.combine(1, 1, 1, 1, 1), 1e-9);
            assertEquals(0.3, weights.combine(1, 0, 0, 0, 0), 1e-9);
        }

        @Test
        @DisplayName("Should reject negative weights and bad sums")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CulturalWeights(-0.1, 0.4, 0.3, 0.2, 0.2));
            assertThrows(IllegalArgumentException.class, () -> new CulturalWeights(0.5, 0.5, 0.5, 0, 0));
        }
    }
}
