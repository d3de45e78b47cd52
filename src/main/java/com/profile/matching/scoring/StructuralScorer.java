package com.profile.matching.scoring;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.graph.EdgeType;
import com.profile.matching.graph.KnowledgeGraph;
import com.profile.matching.graph.KnowledgeGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores a candidate by structural overlap with the user's intent in the knowledge graph.
 *
 * <p>Contributions, applied in this order:</p>
 * <ol>
 *   <li>Shared skill: {@value #SHARED_SKILL_POINTS} each</li>
 *   <li>Exact title match (sought title node is also a candidate title node): {@value #EXACT_TITLE_POINTS} each</li>
 *   <li>Partial title match (case-folded substring either way) for sought titles not yet matched:
 *       {@value #PARTIAL_TITLE_POINTS}, at most once per sought title</li>
 *   <li>Goal match (goal label contained in, or containing, a candidate skill or title label):
 *       {@value #GOAL_POINTS}, at most once per goal</li>
 * </ol>
 * The total is clamped to {@value #MAX_SCORE}. Three or more shared skills can exceed it on paper.
 */
public class StructuralScorer {
    private static final Logger log = LoggerFactory.getLogger(StructuralScorer.class);

    public static final double SHARED_SKILL_POINTS = 15.0;
    public static final double EXACT_TITLE_POINTS = 20.0;
    public static final double PARTIAL_TITLE_POINTS = 10.0;
    public static final double GOAL_POINTS = 10.0;
    public static final double MAX_SCORE = 100.0;

    /**
     * Scores one candidate node against one user node.
     */
    public StructuralScore score(KnowledgeGraph graph, String userId, String candidateId) {
        List<String> signals = new ArrayList<>();
        double score = 0.0;

        Set<String> userSkills = graph.successors(userId, EdgeType.HAS_SKILL);
        Set<String> candidateSkills = graph.successors(candidateId, EdgeType.HAS_SKILL);
        for (String skill : userSkills) {
            if (candidateSkills.contains(skill)) {
                signals.add("Shared skill: " + graph.labelOf(skill));
                score += SHARED_SKILL_POINTS;
            }
        }

        Set<String> soughtTitles = graph.successors(userId, EdgeType.SEEKS_TITLE);
        Set<String> candidateTitles = graph.successors(candidateId, EdgeType.HAS_TITLE);
        Set<String> matchedTitles = new HashSet<>();
        for (String title : soughtTitles) {
            if (candidateTitles.contains(title)) {
                signals.add("Title match: " + graph.labelOf(title));
                score += EXACT_TITLE_POINTS;
                matchedTitles.add(title);
            }
        }

        for (String sought : soughtTitles) {
            if (matchedTitles.contains(sought)) {
                continue;
            }
            String soughtLabel = folded(graph, sought);
            for (String held : candidateTitles) {
                String heldLabel = folded(graph, held);
                if (containsEitherWay(soughtLabel, heldLabel)) {
                    signals.add("Partial title match: " + soughtLabel + " ↔ " + heldLabel);
                    score += PARTIAL_TITLE_POINTS;
                    matchedTitles.add(sought);
                    break;
                }
            }
        }

        Set<String> candidateLabels = new LinkedHashSet<>(candidateSkills);
        candidateLabels.addAll(candidateTitles);
        for (String goal : graph.successors(userId, EdgeType.HAS_GOAL)) {
            String goalLabel = folded(graph, goal);
            for (String node : candidateLabels) {
                if (containsEitherWay(goalLabel, folded(graph, node))) {
                    signals.add("Goal signal match: " + goalLabel);
                    score += GOAL_POINTS;
                    break;
                }
            }
        }

        double clamped = Math.min(score, MAX_SCORE);
        log.debug("Structural score for {}: raw={}, clamped={}, signals={}", candidateId, score, clamped, signals.size());
        return new StructuralScore(clamped, signals);
    }

    /**
     * Scores every candidate over one shared graph, keyed by profile id in input order.
     */
    public Map<String, StructuralScore> scoreAll(KnowledgeGraph graph, UserObjective objective,
                                                 List<CandidateProfile> candidates) {
        String userId = KnowledgeGraphBuilder.userNodeId(objective);
        Map<String, StructuralScore> results = new LinkedHashMap<>();
        for (CandidateProfile candidate : candidates) {
            String candidateId = KnowledgeGraphBuilder.candidateNodeId(candidate.profileId());
            results.put(candidate.profileId(), score(graph, userId, candidateId));
        }
        return results;
    }

    private static String folded(KnowledgeGraph graph, String nodeId) {
        return graph.labelOf(nodeId).toLowerCase(Locale.ROOT);
    }

    private static boolean containsEitherWay(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return a.contains(b) || b.contains(a);
    }
}
