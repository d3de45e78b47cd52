package com.profile.matching.llm;

import java.util.Objects;

/**
 * A text-completion request: one prompt plus generation parameters.
 */
public record CompletionRequest(
        String prompt,
        double temperature,
        int maxTokens
) {
    public static final double DEFAULT_TEMPERATURE = 0.3;
    public static final int DEFAULT_MAX_TOKENS = 60;

    public CompletionRequest {
        Objects.requireNonNull(prompt, "prompt is required");
        if (temperature < 0.0) {
            throw new IllegalArgumentException("temperature must be >= 0");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
    }

    public static CompletionRequest of(String prompt) {
        return new CompletionRequest(prompt, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }
}
