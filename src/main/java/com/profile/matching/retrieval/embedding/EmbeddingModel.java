package com.profile.matching.retrieval.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into dense vectors. Implementations are expected to be loaded once and shared.
 */
public interface EmbeddingModel {

    /**
     * Embeds a single text.
     *
     * @throws com.profile.matching.retrieval.RetrievalException when the model cannot embed
     */
    float[] embed(String text);

    /**
     * Embeds several texts, preserving order.
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Forces the model to load by embedding a throwaway text.
     */
    default void warmUp() {
        embed("warm-up");
    }

    /**
     * Returns the name/identifier of the underlying model.
     */
    String getModelName();
}
