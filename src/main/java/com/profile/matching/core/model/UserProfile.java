package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The requesting user's own profile.
 * Optional lists are normalized to empty lists, never null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
        @JsonProperty("current_role") Role currentRole,
        @JsonProperty("previous_roles") List<Role> previousRoles,
        @JsonProperty("top_skills") List<Skill> topSkills,
        @JsonProperty("solutions_offered") List<String> solutionsOffered,
        @JsonProperty("career_highlights") List<String> careerHighlights
) {
    public UserProfile {
        Objects.requireNonNull(currentRole, "currentRole is required");
        previousRoles = previousRoles != null ? List.copyOf(previousRoles) : List.of();
        topSkills = topSkills != null ? List.copyOf(topSkills) : List.of();
        solutionsOffered = solutionsOffered != null ? List.copyOf(solutionsOffered) : List.of();
        careerHighlights = careerHighlights != null ? List.copyOf(careerHighlights) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Role currentRole;
        private List<Role> previousRoles;
        private List<Skill> topSkills;
        private List<String> solutionsOffered;
        private List<String> careerHighlights;

        public Builder currentRole(Role currentRole) {
            this.currentRole = currentRole;
            return this;
        }

        public Builder currentRole(String title) {
            this.currentRole = Role.of(title);
            return this;
        }

        public Builder previousRoles(List<Role> previousRoles) {
            this.previousRoles = previousRoles;
            return this;
        }

        public Builder topSkills(List<Skill> topSkills) {
            this.topSkills = topSkills;
            return this;
        }

        /**
         * Convenience for skills without an "applied in" note.
         */
        public Builder skills(String... skills) {
            this.topSkills = Arrays.stream(skills).map(Skill::of).toList();
            return this;
        }

        public Builder solutionsOffered(List<String> solutionsOffered) {
            this.solutionsOffered = solutionsOffered;
            return this;
        }

        public Builder careerHighlights(List<String> careerHighlights) {
            this.careerHighlights = careerHighlights;
            return this;
        }

        public UserProfile build() {
            return new UserProfile(currentRole, previousRoles, topSkills, solutionsOffered, careerHighlights);
        }
    }
}
