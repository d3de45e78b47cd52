package com.profile.matching.retrieval;

import com.profile.matching.similarity.JaccardSimilarity;
import com.profile.matching.similarity.SimilarityAlgorithm;

import java.util.List;
import java.util.Objects;

/**
 * Retriever that needs no embedding model: scores documents with a text similarity
 * algorithm (token Jaccard by default).
 */
public class LexicalSimilarityRetriever extends RankingSimilarityRetriever {

    private final SimilarityAlgorithm algorithm;

    public LexicalSimilarityRetriever() {
        this(new JaccardSimilarity(), DEFAULT_TOP_K);
    }

    public LexicalSimilarityRetriever(SimilarityAlgorithm algorithm, int topK) {
        super(topK);
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
    }

    @Override
    protected double[] similarities(String query, List<String> documents) {
        double[] scores = new double[documents.size()];
        for (int i = 0; i < documents.size(); i++) {
            scores[i] = algorithm.compute(query, documents.get(i));
        }
        return scores;
    }

    @Override
    public String getName() {
        return "Lexical/" + algorithm.getName();
    }
}
