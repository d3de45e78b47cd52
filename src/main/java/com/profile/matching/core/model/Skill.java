package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A skill on the user's profile, optionally with where it was applied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Skill(
        String skill,
        @JsonProperty("applied_in") String appliedIn
) {
    public Skill {
        Objects.requireNonNull(skill, "skill is required");
    }

    public static Skill of(String skill) {
        return new Skill(skill, null);
    }
}
