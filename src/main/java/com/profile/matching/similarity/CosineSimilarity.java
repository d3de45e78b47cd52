package com.profile.matching.similarity;

/**
 * Cosine similarity between dense embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return cosine of the angle between {@code a} and {@code b}, in [-1, 1];
     *         0.0 when either vector has zero magnitude
     * @throws IllegalArgumentException when the dimensions differ
     */
    public static double compute(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
