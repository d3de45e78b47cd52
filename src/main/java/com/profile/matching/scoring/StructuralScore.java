package com.profile.matching.scoring;

import java.util.List;

/**
 * Structural overlap score (0-100) and the signals that produced it, in discovery order.
 */
public record StructuralScore(double score, List<String> signals) {

    public StructuralScore {
        if (score < 0.0 || score > StructuralScorer.MAX_SCORE) {
            throw new IllegalArgumentException("Structural score must be between 0 and 100, got " + score);
        }
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    public static StructuralScore empty() {
        return new StructuralScore(0.0, List.of());
    }

    public boolean hasSignals() {
        return !signals.isEmpty();
    }

    /**
     * The first signal discovered, or null when there are none.
     */
    public String topSignal() {
        return signals.isEmpty() ? null : signals.get(0);
    }
}
