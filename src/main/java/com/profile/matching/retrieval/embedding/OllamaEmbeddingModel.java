package com.profile.matching.retrieval.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.profile.matching.retrieval.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Embedding model served by a local Ollama instance ({@code POST /api/embeddings}).
 *
 * Pull model: ollama pull all-minilm
 *
 * Usage:
 * <pre>
 * OllamaEmbeddingModel model = OllamaEmbeddingModel.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("all-minilm")
 *     .build();
 * </pre>
 */
public class OllamaEmbeddingModel implements EmbeddingModel {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingModel.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "all-minilm";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEmbeddingModel(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public float[] embed(String text) {
        try {
            String requestBody = objectMapper.writeValueAsString(new EmbeddingRequest(model, text));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new RetrievalException("Ollama embeddings returned status " + response.statusCode()
                        + ": " + response.body());
            }

            EmbeddingResponse embeddingResponse = objectMapper.readValue(response.body(), EmbeddingResponse.class);
            if (embeddingResponse.embedding() == null || embeddingResponse.embedding().isEmpty()) {
                throw new RetrievalException("Ollama embeddings returned an empty vector for model " + model);
            }
            log.debug("Embedded {} chars into {} dimensions", text.length(), embeddingResponse.embedding().size());
            return toArray(embeddingResponse.embedding());
        } catch (IOException e) {
            throw new RetrievalException("Error calling Ollama embeddings: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalException("Interrupted while calling Ollama embeddings", e);
        }
    }

    @Override
    public String getModelName() {
        return "Ollama/" + model;
    }

    private static float[] toArray(List<Double> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default Ollama embedding model (all-minilm on localhost).
     */
    public static OllamaEmbeddingModel createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaEmbeddingModel build() {
            return new OllamaEmbeddingModel(this);
        }
    }

    private record EmbeddingRequest(String model, String prompt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(List<Double> embedding) {}
}
