package com.profile.matching.health;

import com.profile.matching.retrieval.RetrievalException;
import com.profile.matching.retrieval.embedding.EmbeddingModel;

import java.util.Objects;

/**
 * Readiness of the embedding model: DOWN until a warm-up embedding succeeds.
 * The first successful check is remembered so later checks make no calls.
 */
public class EmbeddingModelHealthCheck implements HealthCheck {

    private final EmbeddingModel model;
    private volatile boolean ready;

    public EmbeddingModelHealthCheck(EmbeddingModel model) {
        this.model = Objects.requireNonNull(model, "model is required");
    }

    @Override
    public String getName() {
        return "embedding-model";
    }

    @Override
    public HealthStatus check() {
        if (ready) {
            return HealthStatus.up().withDetail("model", model.getModelName());
        }
        try {
            model.warmUp();
            ready = true;
            return HealthStatus.up("Embedding model ready").withDetail("model", model.getModelName());
        } catch (RetrievalException e) {
            return HealthStatus.down("Embedding model warm-up failed: " + e.getMessage())
                    .withDetail("model", model.getModelName());
        }
    }
}
