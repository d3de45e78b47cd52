package com.profile.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityTest {

    @Test
    @DisplayName("Parallel vectors score 1")
    void parallel() {
        assertEquals(1.0, CosineSimilarity.compute(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-9);
    }

    @Test
    @DisplayName("Orthogonal vectors score 0")
    void orthogonal() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
    }

    @Test
    @DisplayName("Opposite vectors score -1")
    void opposite() {
        assertEquals(-1.0, CosineSimilarity.compute(new float[]{1, 1}, new float[]{-1, -1}), 1e-9);
    }

    @Test
    @DisplayName("Zero vector scores 0")
    void zeroMagnitude() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{0, 0}, new float[]{1, 1}));
    }

    @Test
    @DisplayName("Mismatched dimensions are rejected")
    void dimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> CosineSimilarity.compute(new float[]{1}, new float[]{1, 2}));
    }
}
