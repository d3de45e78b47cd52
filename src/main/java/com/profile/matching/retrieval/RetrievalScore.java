package com.profile.matching.retrieval;

/**
 * Semantic similarity of one candidate (0-100) and its retrieval rank, when it was retrieved.
 */
public record RetrievalScore(double similarity, Integer rank) {

    private static final RetrievalScore ABSENT = new RetrievalScore(0.0, null);

    public RetrievalScore {
        if (similarity < 0.0 || similarity > 100.0) {
            throw new IllegalArgumentException("Similarity must be between 0 and 100, got " + similarity);
        }
        if (rank != null && rank < 1) {
            throw new IllegalArgumentException("Rank must be positive, got " + rank);
        }
    }

    /**
     * Score used for candidates the retriever did not return.
     */
    public static RetrievalScore absent() {
        return ABSENT;
    }

    public static RetrievalScore of(double similarity, int rank) {
        return new RetrievalScore(similarity, rank);
    }
}
