package com.profile.matching.api;

import com.profile.matching.llm.BackendMode;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Options for matching requests.
 * Configures blend weights, score filtering, reason backends and fan-out.
 */
public class MatchingOptions {

    private static final double DEFAULT_MIN_SCORE_THRESHOLD = 0.0;
    private static final Duration DEFAULT_REASON_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_CONCURRENCY = 8;

    private final BlendWeights blendWeights;
    private final double minScoreThreshold;
    private final BackendMode backendMode;
    private final Duration reasonTimeout;
    private final int maxConcurrency;
    private final RetrievalFailurePolicy retrievalFailurePolicy;

    private MatchingOptions(Builder builder) {
        this.blendWeights = builder.blendWeights;
        this.minScoreThreshold = builder.minScoreThreshold;
        this.backendMode = builder.backendMode;
        this.reasonTimeout = builder.reasonTimeout;
        this.maxConcurrency = builder.maxConcurrency;
        this.retrievalFailurePolicy = builder.retrievalFailurePolicy;
    }

    public BlendWeights getBlendWeights() {
        return blendWeights;
    }

    public double getMinScoreThreshold() {
        return minScoreThreshold;
    }

    public BackendMode getBackendMode() {
        return backendMode;
    }

    public Duration getReasonTimeout() {
        return reasonTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public RetrievalFailurePolicy getRetrievalFailurePolicy() {
        return retrievalFailurePolicy;
    }

    /**
     * Creates default options.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from environment-style variables. Absent variables keep their defaults.
     *
     * <ul>
     *   <li>{@code LLM_BACKEND}: auto | ollama | hf | none</li>
     *   <li>{@code LLM_TIMEOUT}: seconds per backend call</li>
     *   <li>{@code MIN_SCORE_THRESHOLD}: 0-100</li>
     *   <li>{@code KG_WEIGHT}: structural weight, similarity gets the remainder</li>
     *   <li>{@code MAX_CONCURRENCY}: parallel reason tasks</li>
     *   <li>{@code RETRIEVAL_FAILURE_POLICY}: zero_fill | abort</li>
     * </ul>
     *
     * @throws IllegalArgumentException naming the variable when a value is malformed
     */
    public static MatchingOptions fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String backend = env.get("LLM_BACKEND");
        if (backend != null) {
            builder.backendMode(parse("LLM_BACKEND", backend, BackendMode::parse));
        }
        String timeout = env.get("LLM_TIMEOUT");
        if (timeout != null) {
            builder.reasonTimeout(Duration.ofSeconds(parse("LLM_TIMEOUT", timeout, Long::parseLong)));
        }
        String threshold = env.get("MIN_SCORE_THRESHOLD");
        if (threshold != null) {
            builder.minScoreThreshold(parse("MIN_SCORE_THRESHOLD", threshold, Double::parseDouble));
        }
        String kgWeight = env.get("KG_WEIGHT");
        if (kgWeight != null) {
            builder.blendWeights(parse("KG_WEIGHT", kgWeight, v -> BlendWeights.ofStructural(Double.parseDouble(v))));
        }
        String concurrency = env.get("MAX_CONCURRENCY");
        if (concurrency != null) {
            builder.maxConcurrency(parse("MAX_CONCURRENCY", concurrency, Integer::parseInt));
        }
        String policy = env.get("RETRIEVAL_FAILURE_POLICY");
        if (policy != null) {
            builder.retrievalFailurePolicy(parse("RETRIEVAL_FAILURE_POLICY", policy, RetrievalFailurePolicy::parse));
        }
        return builder.build();
    }

    private static <T> T parse(String variable, String value, Function<String, T> parser) {
        try {
            return parser.apply(value.strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + variable + ": '" + value + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BlendWeights blendWeights = BlendWeights.defaultWeights();
        private double minScoreThreshold = DEFAULT_MIN_SCORE_THRESHOLD;
        private BackendMode backendMode = BackendMode.AUTO;
        private Duration reasonTimeout = DEFAULT_REASON_TIMEOUT;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private RetrievalFailurePolicy retrievalFailurePolicy = RetrievalFailurePolicy.ZERO_FILL;

        public Builder blendWeights(BlendWeights blendWeights) {
            if (blendWeights == null) {
                throw new IllegalArgumentException("blendWeights must not be null");
            }
            this.blendWeights = blendWeights;
            return this;
        }

        public Builder minScoreThreshold(double minScoreThreshold) {
            if (minScoreThreshold < 0.0 || minScoreThreshold > 100.0) {
                throw new IllegalArgumentException("minScoreThreshold must be between 0 and 100");
            }
            this.minScoreThreshold = minScoreThreshold;
            return this;
        }

        public Builder backendMode(BackendMode backendMode) {
            if (backendMode == null) {
                throw new IllegalArgumentException("backendMode must not be null");
            }
            this.backendMode = backendMode;
            return this;
        }

        public Builder reasonTimeout(Duration reasonTimeout) {
            if (reasonTimeout == null || reasonTimeout.isNegative() || reasonTimeout.isZero()) {
                throw new IllegalArgumentException("reasonTimeout must be positive");
            }
            this.reasonTimeout = reasonTimeout;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder retrievalFailurePolicy(RetrievalFailurePolicy retrievalFailurePolicy) {
            if (retrievalFailurePolicy == null) {
                throw new IllegalArgumentException("retrievalFailurePolicy must not be null");
            }
            this.retrievalFailurePolicy = retrievalFailurePolicy;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }
    }
}
