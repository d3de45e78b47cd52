package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * A kind of person the user wants to reach, expressed as one or more titles
 * and an optional rationale.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetProfile(
        String type,
        List<String> titles,
        String why
) {
    public TargetProfile {
        Objects.requireNonNull(type, "type is required");
        titles = titles != null ? List.copyOf(titles) : List.of();
    }

    public static TargetProfile of(String type, String why, String... titles) {
        return new TargetProfile(type, List.of(titles), why);
    }
}
