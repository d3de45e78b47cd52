package com.profile.matching.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchRequestJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static final String REQUEST = """
            {
              "user_profile": {
                "current_role": {"title": "Founder", "company": "Acme"},
                "top_skills": [{"skill": "Python", "applied_in": "Data platform"}],
                "solutions_offered": ["Payments API"],
                "unknown_field": true
              },
              "user_objective": {
                "person_id": "user-1",
                "primary_goal": "Hire a founding engineer",
                "target_profiles": [{"type": "hire", "titles": ["CTO", "VP Engineering"], "why": "Build v1"}],
                "success_signals": ["Shipped a product"]
              },
              "network_profiles": [
                {"profile_id": "c1", "name": "Ada", "title": "Staff Engineer", "skills": ["Python"]},
                {"profile_id": "c2", "name": "Grace", "title": "CTO", "industry": "Fintech"}
              ]
            }
            """;

    @Test
    @DisplayName("Reads snake_case request JSON and ignores unknown fields")
    void readsRequest() throws Exception {
        MatchRequest request = mapper.readValue(REQUEST, MatchRequest.class);

        assertEquals("Founder", request.userProfile().currentRole().title());
        assertEquals("Data platform", request.userProfile().topSkills().get(0).appliedIn());
        assertEquals(List.of(), request.userProfile().previousRoles());
        assertEquals("user-1", request.userObjective().personId());
        assertEquals(List.of("CTO", "VP Engineering"), request.userObjective().soughtTitles());
        assertEquals(List.of(), request.userObjective().secondaryGoals());
        assertEquals(2, request.networkProfiles().size());
        assertEquals(List.of(), request.networkProfiles().get(1).skills());
        assertTrue(request.networkProfiles().get(1).hasIndustry());
        assertFalse(request.networkProfiles().get(0).hasIndustry());
    }

    @Test
    @DisplayName("Writes results with snake_case names and a null rank when not retrieved")
    void writesResult() throws Exception {
        MatchResult result = new MatchResult("c1", "Ada", 50.75, "Strong fit.", List.of("Shared skill: python"), null);

        String json = mapper.writeValueAsString(result);

        assertTrue(json.contains("\"profile_id\":\"c1\""));
        assertTrue(json.contains("\"kg_signals\":[\"Shared skill: python\"]"));
        assertTrue(json.contains("\"retrieval_rank\":null"));
        assertTrue(json.contains("\"score\":50.75"));
    }

    @Test
    @DisplayName("Missing required fields are rejected")
    void rejectsMissingFields() {
        assertThrows(Exception.class, () -> mapper.readValue(
                "{\"profile_id\":\"c1\",\"title\":\"CTO\"}", CandidateProfile.class));
        assertThrows(IllegalArgumentException.class, () -> CandidateProfile.builder()
                .profileId(" ").name("n").title("t").build());
        assertThrows(IllegalArgumentException.class,
                () -> new MatchResult("c1", "n", 100.01, "r", List.of(), null));
    }
}
