package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A position held by the user: title plus optional company and location.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Role(
        String title,
        String company,
        String location
) {
    public Role {
        Objects.requireNonNull(title, "title is required");
    }

    public static Role of(String title) {
        return new Role(title, null, null);
    }
}
