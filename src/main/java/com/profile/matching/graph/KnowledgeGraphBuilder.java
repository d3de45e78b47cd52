package com.profile.matching.graph;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.Skill;
import com.profile.matching.core.model.TargetProfile;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds the per-request knowledge graph from the user's profile, objective and candidates.
 *
 * <p>The user contributes HAS_SKILL, SEEKS_TITLE and HAS_GOAL edges. Each candidate contributes
 * HAS_SKILL edges, one HAS_TITLE edge per title token longer than {@value #MIN_TITLE_TOKEN_LENGTH}
 * characters plus one for the full title, and an IN_INDUSTRY edge when the industry is present.
 * Missing or empty lists simply produce no edges.</p>
 */
public class KnowledgeGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphBuilder.class);

    /** Title tokens of this length or shorter are noise ("of", "VP", "and") and never become nodes. */
    public static final int MIN_TITLE_TOKEN_LENGTH = 3;

    public static final String ATTR_TITLE = "title";
    public static final String ATTR_COMPANY = "company";
    public static final String ATTR_INDUSTRY = "industry";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Builds a fresh graph. Pure function of its inputs.
     */
    public KnowledgeGraph build(UserProfile userProfile, UserObjective objective,
                                List<CandidateProfile> candidates) {
        Objects.requireNonNull(userProfile, "userProfile is required");
        Objects.requireNonNull(objective, "objective is required");
        Objects.requireNonNull(candidates, "candidates is required");

        KnowledgeGraph graph = new KnowledgeGraph();
        String userId = userNodeId(objective);
        graph.addNode(new GraphNode(userId, NodeType.USER, userProfile.currentRole().title(), Map.of()));

        for (Skill skill : userProfile.topSkills()) {
            link(graph, userId, NodeType.SKILL, skill.skill(), EdgeType.HAS_SKILL, Map.of());
        }

        for (TargetProfile target : objective.targetProfiles()) {
            Map<String, String> why = Map.of(GraphEdge.WHY, target.why() != null ? target.why() : "");
            for (String title : target.titles()) {
                link(graph, userId, NodeType.TITLE, title, EdgeType.SEEKS_TITLE, why);
            }
        }

        for (String signal : objective.successSignals()) {
            link(graph, userId, NodeType.GOAL, signal, EdgeType.HAS_GOAL, Map.of());
        }

        for (CandidateProfile candidate : candidates) {
            addCandidate(graph, candidate);
        }

        log.debug("Built knowledge graph for user {}: {}", objective.personId(), graph);
        return graph;
    }

    private void addCandidate(KnowledgeGraph graph, CandidateProfile candidate) {
        String candidateId = candidateNodeId(candidate.profileId());
        graph.addNode(new GraphNode(candidateId, NodeType.CANDIDATE, candidate.name(), Map.of(
                ATTR_TITLE, candidate.title(),
                ATTR_COMPANY, candidate.company() != null ? candidate.company() : "",
                ATTR_INDUSTRY, candidate.industry() != null ? candidate.industry() : "")));

        for (String skill : candidate.skills()) {
            link(graph, candidateId, NodeType.SKILL, skill, EdgeType.HAS_SKILL, Map.of());
        }

        for (String token : WHITESPACE.split(candidate.title().strip())) {
            if (token.length() > MIN_TITLE_TOKEN_LENGTH) {
                link(graph, candidateId, NodeType.TITLE, token, EdgeType.HAS_TITLE, Map.of());
            }
        }
        link(graph, candidateId, NodeType.TITLE, candidate.title(), EdgeType.HAS_TITLE, Map.of());

        if (candidate.hasIndustry()) {
            link(graph, candidateId, NodeType.INDUSTRY, candidate.industry(), EdgeType.IN_INDUSTRY, Map.of());
        }
    }

    /**
     * Adds (or reuses) the attribute node for {@code label} and links it from {@code sourceId}.
     * Blank labels contribute nothing.
     */
    private void link(KnowledgeGraph graph, String sourceId, NodeType type, String label,
                      EdgeType edgeType, Map<String, String> edgeProperties) {
        if (label == null || label.isBlank()) {
            return;
        }
        String nodeId = LabelNormalizer.nodeId(type, label);
        graph.addNode(new GraphNode(nodeId, type, label, Map.of()));
        graph.addEdge(new GraphEdge(sourceId, nodeId, edgeType, edgeProperties));
    }

    public static String userNodeId(UserObjective objective) {
        return LabelNormalizer.entityId(NodeType.USER, objective.personId());
    }

    public static String candidateNodeId(String profileId) {
        return LabelNormalizer.entityId(NodeType.CANDIDATE, profileId);
    }
}
