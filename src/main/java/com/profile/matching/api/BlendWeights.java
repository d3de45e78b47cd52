package com.profile.matching.api;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Weights for blending the structural and similarity scores.
 * Formula: final = round(structuralWeight * structural + similarityWeight * similarity, 2)
 */
public record BlendWeights(
        double structuralWeight,
        double similarityWeight
) {
    public static final double DEFAULT_STRUCTURAL_WEIGHT = 0.45;
    public static final double DEFAULT_SIMILARITY_WEIGHT = 0.55;

    public BlendWeights {
        if (structuralWeight < 0 || similarityWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = structuralWeight + similarityWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: 45% knowledge graph, 55% semantic similarity.
     */
    public static BlendWeights defaultWeights() {
        return new BlendWeights(DEFAULT_STRUCTURAL_WEIGHT, DEFAULT_SIMILARITY_WEIGHT);
    }

    /**
     * Weights from the structural share alone; similarity takes the remainder.
     */
    public static BlendWeights ofStructural(double structuralWeight) {
        return new BlendWeights(structuralWeight, 1.0 - structuralWeight);
    }

    /**
     * Blends two 0-100 scores and rounds to two decimals. Rounding works on the exact binary
     * value of the blend, half-even, so 1.005 (stored as 1.00499...) becomes 1.0.
     */
    public double blend(double structuralScore, double similarityScore) {
        double raw = structuralWeight * structuralScore + similarityWeight * similarityScore;
        return new BigDecimal(raw).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
