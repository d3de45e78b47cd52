package com.profile.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * What the user is trying to achieve with this request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserObjective(
        @JsonProperty("person_id") String personId,
        @JsonProperty("primary_goal") String primaryGoal,
        @JsonProperty("secondary_goals") List<String> secondaryGoals,
        @JsonProperty("target_profiles") List<TargetProfile> targetProfiles,
        List<String> exclude,
        @JsonProperty("success_signals") List<String> successSignals
) {
    public UserObjective {
        Objects.requireNonNull(personId, "personId is required");
        if (personId.isBlank()) {
            throw new IllegalArgumentException("personId must not be blank");
        }
        Objects.requireNonNull(primaryGoal, "primaryGoal is required");
        secondaryGoals = secondaryGoals != null ? List.copyOf(secondaryGoals) : List.of();
        targetProfiles = targetProfiles != null ? List.copyOf(targetProfiles) : List.of();
        exclude = exclude != null ? List.copyOf(exclude) : List.of();
        successSignals = successSignals != null ? List.copyOf(successSignals) : List.of();
    }

    /**
     * Every title sought across all target profiles, in declaration order.
     */
    public List<String> soughtTitles() {
        return targetProfiles.stream()
                .flatMap(tp -> tp.titles().stream())
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String personId;
        private String primaryGoal;
        private List<String> secondaryGoals;
        private List<TargetProfile> targetProfiles;
        private List<String> exclude;
        private List<String> successSignals;

        public Builder personId(String personId) {
            this.personId = personId;
            return this;
        }

        public Builder primaryGoal(String primaryGoal) {
            this.primaryGoal = primaryGoal;
            return this;
        }

        public Builder secondaryGoals(List<String> secondaryGoals) {
            this.secondaryGoals = secondaryGoals;
            return this;
        }

        public Builder targetProfiles(List<TargetProfile> targetProfiles) {
            this.targetProfiles = targetProfiles;
            return this;
        }

        public Builder targetProfiles(TargetProfile... targetProfiles) {
            this.targetProfiles = List.of(targetProfiles);
            return this;
        }

        public Builder exclude(List<String> exclude) {
            this.exclude = exclude;
            return this;
        }

        public Builder successSignals(List<String> successSignals) {
            this.successSignals = successSignals;
            return this;
        }

        public Builder successSignals(String... successSignals) {
            this.successSignals = List.of(successSignals);
            return this;
        }

        public UserObjective build() {
            return new UserObjective(personId, primaryGoal, secondaryGoals, targetProfiles, exclude, successSignals);
        }
    }
}
