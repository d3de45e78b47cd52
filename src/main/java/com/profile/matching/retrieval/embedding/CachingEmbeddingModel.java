package com.profile.matching.retrieval.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Caffeine-backed decorator that memoizes embeddings by exact text.
 * Candidate documents recur across requests, so repeated calls skip the model.
 */
public class CachingEmbeddingModel implements EmbeddingModel {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingModel.class);

    private final EmbeddingModel delegate;
    private final Cache<String, float[]> cache;

    public CachingEmbeddingModel(EmbeddingModel delegate, CacheConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingEmbeddingModel initialized for {}: maxSize={}, ttl={}s",
                delegate.getModelName(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public float[] embed(String text) {
        return cache.get(text, delegate::embed);
    }

    @Override
    public String getModelName() {
        return delegate.getModelName();
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
