package com.profile.matching.retrieval;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.Skill;
import com.profile.matching.core.model.TargetProfile;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens profiles into the plain-text documents compared by retrievers.
 */
public final class RetrievalDocuments {

    private static final String PART_DELIMITER = ". ";

    private RetrievalDocuments() {
    }

    /**
     * Candidate document: name, title and whichever of company, industry, skills and summary are present.
     */
    public static String candidateDocument(CandidateProfile candidate) {
        List<String> parts = new ArrayList<>();
        parts.add("Name: " + candidate.name());
        parts.add("Title: " + candidate.title());
        if (isPresent(candidate.company())) {
            parts.add("Company: " + candidate.company());
        }
        if (candidate.hasIndustry()) {
            parts.add("Industry: " + candidate.industry());
        }
        if (!candidate.skills().isEmpty()) {
            parts.add("Skills: " + String.join(", ", candidate.skills()));
        }
        if (isPresent(candidate.summary())) {
            parts.add("Summary: " + candidate.summary());
        }
        return String.join(PART_DELIMITER, parts);
    }

    /**
     * Query document synthesizing the user's intent.
     */
    public static String queryDocument(UserProfile userProfile, UserObjective objective) {
        List<String> parts = new ArrayList<>();
        parts.add("Goal: " + objective.primaryGoal());
        for (TargetProfile target : objective.targetProfiles()) {
            parts.add("Seeking: " + String.join(", ", target.titles())
                    + " — " + (target.why() != null ? target.why() : ""));
        }
        if (!objective.successSignals().isEmpty()) {
            parts.add("Success signals: " + String.join(", ", objective.successSignals()));
        }
        if (!userProfile.topSkills().isEmpty()) {
            parts.add("User skills: " + String.join(", ",
                    userProfile.topSkills().stream().map(Skill::skill).toList()));
        }
        if (!userProfile.solutionsOffered().isEmpty()) {
            parts.add("Solutions offered: " + String.join(", ", userProfile.solutionsOffered()));
        }
        return String.join(PART_DELIMITER, parts);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
