package com.profile.matching.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Reason backend using the hosted Hugging Face Inference API.
 * Requires an API token; without one every call fails immediately and no request is sent.
 */
public class HuggingFaceReasonBackend implements ReasonBackend {
    private static final Logger log = LoggerFactory.getLogger(HuggingFaceReasonBackend.class);

    private static final String DEFAULT_BASE_URL = "https://api-inference.huggingface.co/models/";
    private static final String DEFAULT_MODEL = "mistralai/Mistral-7B-Instruct-v0.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String model;
    private final String apiToken;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HuggingFaceReasonBackend(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.apiToken = builder.apiToken != null ? builder.apiToken : "";
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        if (!hasToken()) {
            return CompletionResult.failure("Hugging Face API token not configured");
        }
        try {
            HfRequest hfRequest = new HfRequest(request.prompt(),
                    new HfParameters(request.maxTokens(), request.temperature(), false));
            String requestBody = objectMapper.writeValueAsString(hfRequest);

            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + model))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiToken)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("HuggingFace call failed: status {}", response.statusCode());
                return CompletionResult.failure("Hugging Face returned status " + response.statusCode());
            }

            List<HfGeneration> generations = objectMapper.readValue(response.body(),
                    new TypeReference<List<HfGeneration>>() {});
            if (generations.isEmpty() || generations.get(0).generatedText() == null
                    || generations.get(0).generatedText().isBlank()) {
                log.warn("HuggingFace call failed: empty generation");
                return CompletionResult.failure("Hugging Face returned no generated text");
            }
            return CompletionResult.success(generations.get(0).generatedText().strip());
        } catch (HttpTimeoutException e) {
            log.warn("HuggingFace call timed out after {}", timeout);
            return CompletionResult.failure("Hugging Face timed out after " + timeout);
        } catch (IOException e) {
            log.warn("HuggingFace call failed: {}", e.getMessage());
            return CompletionResult.failure("Hugging Face transport error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletionResult.failure("Interrupted while calling Hugging Face");
        }
    }

    @Override
    public String getBackendName() {
        return "HuggingFace/" + model;
    }

    /**
     * A hosted backend counts as available when it has credentials.
     */
    @Override
    public boolean isAvailable() {
        return hasToken();
    }

    private boolean hasToken() {
        return !apiToken.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private String apiToken;
        private Duration timeout;

        /**
         * Base URL the model id is appended to. Must end with {@code /}.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HuggingFaceReasonBackend build() {
            return new HuggingFaceReasonBackend(this);
        }
    }

    private record HfRequest(String inputs, HfParameters parameters) {}

    private record HfParameters(
            @JsonProperty("max_new_tokens") int maxNewTokens,
            double temperature,
            @JsonProperty("return_full_text") boolean returnFullText
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record HfGeneration(@JsonProperty("generated_text") String generatedText) {}
}
