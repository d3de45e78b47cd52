package com.profile.matching.llm;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to explain one candidate match: both parties, the structural
 * signals and both component scores.
 */
public record ReasonContext(
        UserProfile userProfile,
        UserObjective objective,
        CandidateProfile candidate,
        List<String> signals,
        double structuralScore,
        double similarityScore
) {
    public ReasonContext {
        Objects.requireNonNull(userProfile, "userProfile is required");
        Objects.requireNonNull(objective, "objective is required");
        Objects.requireNonNull(candidate, "candidate is required");
        signals = signals != null ? List.copyOf(signals) : List.of();
    }
}
