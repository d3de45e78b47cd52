package com.profile.matching.retrieval;

import com.profile.matching.retrieval.embedding.EmbeddingModel;
import com.profile.matching.similarity.CosineSimilarity;

import java.util.List;
import java.util.Objects;

/**
 * Retriever that ranks candidates by cosine similarity of embeddings.
 *
 * <p>The embedding model is handed in at construction so a model that was loaded
 * (and warmed up) once can be reused across requests:</p>
 * <pre>
 * EmbeddingModel model = new CachingEmbeddingModel(OllamaEmbeddingModel.createDefault(), CacheConfig.defaults());
 * model.warmUp();
 * SimilarityRetriever retriever = new EmbeddingSimilarityRetriever(model);
 * </pre>
 */
public class EmbeddingSimilarityRetriever extends RankingSimilarityRetriever {

    private final EmbeddingModel model;

    public EmbeddingSimilarityRetriever(EmbeddingModel model) {
        this(model, DEFAULT_TOP_K);
    }

    public EmbeddingSimilarityRetriever(EmbeddingModel model, int topK) {
        super(topK);
        this.model = Objects.requireNonNull(model, "model is required");
    }

    @Override
    protected double[] similarities(String query, List<String> documents) {
        List<float[]> vectors = model.embedAll(documents);
        float[] queryVector = model.embed(query);
        double[] scores = new double[documents.size()];
        for (int i = 0; i < documents.size(); i++) {
            scores[i] = CosineSimilarity.compute(queryVector, vectors.get(i));
        }
        return scores;
    }

    @Override
    public String getName() {
        return "Embedding/" + model.getModelName();
    }
}
