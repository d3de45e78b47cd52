package com.profile.matching.retrieval.embedding;

/**
 * Configuration for the embedding cache.
 *
 * @param maxSize    maximum number of cached vectors
 * @param ttlSeconds time-to-live in seconds for each entry
 */
public record CacheConfig(int maxSize, int ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 vectors, 1 hour TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3_600);
    }
}
