package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A profile from the user's network that is ranked against the user's objective.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CandidateProfile(
        @JsonProperty("profile_id") String profileId,
        String name,
        String title,
        String company,
        String industry,
        List<String> skills,
        String summary
) {
    public CandidateProfile {
        Objects.requireNonNull(profileId, "profileId is required");
        if (profileId.isBlank()) {
            throw new IllegalArgumentException("profileId must not be blank");
        }
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(title, "title is required");
        skills = skills != null ? List.copyOf(skills) : List.of();
    }

    public boolean hasIndustry() {
        return industry != null && !industry.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String profileId;
        private String name;
        private String title;
        private String company;
        private String industry;
        private List<String> skills;
        private String summary;

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder skills(List<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder skills(String... skills) {
            this.skills = List.of(skills);
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public CandidateProfile build() {
            return new CandidateProfile(profileId, name, title, company, industry, skills, summary);
        }
    }
}
