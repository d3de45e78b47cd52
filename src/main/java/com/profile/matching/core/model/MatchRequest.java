package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A complete matching request: the user, their objective, and the candidates to rank.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchRequest(
        @JsonProperty("user_profile") UserProfile userProfile,
        @JsonProperty("user_objective") UserObjective userObjective,
        @JsonProperty("network_profiles") List<CandidateProfile> networkProfiles
) {
    public MatchRequest {
        Objects.requireNonNull(userProfile, "userProfile is required");
        Objects.requireNonNull(userObjective, "userObjective is required");
        networkProfiles = networkProfiles != null ? List.copyOf(networkProfiles) : List.of();
    }
}
