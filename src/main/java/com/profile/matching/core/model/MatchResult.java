package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One ranked candidate: blended score, structural signals, retrieval rank and reason.
 * Built once per candidate per request and never mutated.
 */
public record MatchResult(
        @JsonProperty("profile_id") String profileId,
        String name,
        double score,
        String reason,
        @JsonProperty("kg_signals") List<String> kgSignals,
        @JsonProperty("retrieval_rank") Integer retrievalRank
) {
    public MatchResult {
        Objects.requireNonNull(profileId, "profileId is required");
        Objects.requireNonNull(reason, "reason is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        kgSignals = kgSignals != null ? List.copyOf(kgSignals) : List.of();
    }

    public boolean hasRetrievalRank() {
        return retrievalRank != null;
    }
}
