package com.profile.matching.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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

/**
 * Reason backend using a local Ollama server ({@code POST /api/generate}).
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * Pull model: ollama pull mistral
 *
 * Usage:
 * <pre>
 * OllamaReasonBackend backend = OllamaReasonBackend.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("mistral")
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * </pre>
 */
public class OllamaReasonBackend implements ReasonBackend {
    private static final Logger log = LoggerFactory.getLogger(OllamaReasonBackend.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "mistral";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaReasonBackend(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CompletionResult complete(CompletionRequest request) {
        try {
            OllamaRequest ollamaRequest = new OllamaRequest(model, request.prompt(), false,
                    new OllamaOptions(request.temperature(), request.maxTokens()));
            String requestBody = objectMapper.writeValueAsString(ollamaRequest);

            log.debug("Calling Ollama with model: {}", model);

            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/generate"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Ollama call failed: status {}", response.statusCode());
                return CompletionResult.failure("Ollama returned status " + response.statusCode());
            }

            OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
            String text = ollamaResponse.response() != null ? ollamaResponse.response().strip() : "";
            if (text.isEmpty()) {
                log.warn("Ollama call failed: empty response");
                return CompletionResult.failure("Ollama returned an empty response");
            }
            log.debug("Ollama response received, length: {}", text.length());
            return CompletionResult.success(text);
        } catch (HttpTimeoutException e) {
            log.warn("Ollama call timed out after {}", timeout);
            return CompletionResult.failure("Ollama timed out after " + timeout);
        } catch (IOException e) {
            log.warn("Ollama call failed: {}", e.getMessage());
            return CompletionResult.failure("Ollama transport error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletionResult.failure("Interrupted while calling Ollama");
        }
    }

    @Override
    public String getBackendName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default Ollama backend with mistral on localhost.
     */
    public static OllamaReasonBackend createDefault() {
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

        public OllamaReasonBackend build() {
            return new OllamaReasonBackend(this);
        }
    }

    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            OllamaOptions options
    ) {}

    private record OllamaOptions(
            double temperature,
            @JsonProperty("num_predict") int numPredict
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
