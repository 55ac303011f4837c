package com.entity.intelligence.similarity;

/**
 * Weights of the five cultural sub-scores in the combined cultural similarity.
 */
public record CulturalWeights(
        double markerWeight,
        double themeWeight,
        double movementWeight,
        double regionalWeight,
        double audienceWeight
) {
    public CulturalWeights {
        if (markerWeight < 0 || themeWeight < 0 || movementWeight < 0
                || regionalWeight < 0 || audienceWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = markerWeight + themeWeight + movementWeight + regionalWeight + audienceWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static CulturalWeights defaultWeights() {
        return new CulturalWeights(0.3, 0.25, 0.2, 0.15, 0.1);
    }

    public double combine(double markers, double themes, double movements, double regional, double audience) {
        return markerWeight * markers
                + themeWeight * themes
                + movementWeight * movements
                + regionalWeight * regional
                + audienceWeight * audience;
    }
}
