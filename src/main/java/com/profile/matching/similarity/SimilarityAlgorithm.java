package com.profile.matching.similarity;

/**
 * Text-to-text similarity used by lexical retrieval.
 * Implementations return a value in [0, 1], where 1 means identical.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    /**
     * Short name, used in retriever names and logs.
     */
    String getName();
}
