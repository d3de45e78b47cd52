package com.profile.matching.llm;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.Skill;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;

import java.util.List;
import java.util.Locale;

/**
 * Builds the instruction prompt sent to remote backends.
 * Uses the Mistral instruction format ({@code <s>[INST] ... [/INST]}).
 */
public class ReasonPromptBuilder {

    public static final int MAX_REASON_WORDS = 25;

    private static final String NOT_AVAILABLE = "N/A";

    public String build(ReasonContext context) {
        UserProfile user = context.userProfile();
        UserObjective objective = context.objective();
        CandidateProfile candidate = context.candidate();

        String userSkills = String.join(", ", user.topSkills().stream().map(Skill::skill).toList());
        String targetTitles = String.join(", ", objective.soughtTitles());
        String signals = context.signals().isEmpty() ? "none" : String.join("; ", context.signals());

        StringBuilder prompt = new StringBuilder();
        prompt.append("<s>[INST]\n");
        prompt.append("You are an AI recruitment assistant. Given the context below, write a single concise sentence\n");
        prompt.append("(max ").append(MAX_REASON_WORDS)
                .append(" words) explaining why this candidate is a good match for the user's objective.\n");
        prompt.append("Be specific. Do not repeat the candidate's name in the reason.\n\n");

        prompt.append("USER CONTEXT\n");
        prompt.append("  Goal: ").append(objective.primaryGoal()).append("\n");
        prompt.append("  Seeking: ").append(targetTitles).append("\n");
        prompt.append("  User skills: ").append(userSkills).append("\n");
        prompt.append("  Success signals: ").append(String.join(", ", objective.successSignals())).append("\n\n");

        prompt.append("CANDIDATE\n");
        prompt.append("  Title: ").append(candidate.title()).append("\n");
        prompt.append("  Company: ").append(orNotAvailable(candidate.company())).append("\n");
        prompt.append("  Industry: ").append(orNotAvailable(candidate.industry())).append("\n");
        prompt.append("  Skills: ").append(join(candidate.skills())).append("\n");
        prompt.append("  Summary: ").append(orNotAvailable(candidate.summary())).append("\n\n");

        prompt.append("MATCH SIGNALS (from knowledge graph): ").append(signals).append("\n");
        prompt.append(String.format(Locale.ROOT, "KG Score: %.1f/100   Semantic Score: %.1f/100\n",
                context.structuralScore(), context.similarityScore()));
        prompt.append("\nRespond with ONLY the reason sentence, nothing else.\n");
        prompt.append("[/INST]");
        return prompt.toString();
    }

    private static String orNotAvailable(String value) {
        return value != null && !value.isBlank() ? value : NOT_AVAILABLE;
    }

    private static String join(List<String> values) {
        return String.join(", ", values);
    }
}
