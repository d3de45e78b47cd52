package com.profile.matching.retrieval;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for retrievers that score every candidate document against the query document
 * and keep the top-K as ranked results. Candidates outside the top-K are left out.
 */
public abstract class RankingSimilarityRetriever implements SimilarityRetriever {
    private static final Logger log = LoggerFactory.getLogger(RankingSimilarityRetriever.class);

    public static final int DEFAULT_TOP_K = 5;

    private final int topK;

    protected RankingSimilarityRetriever(int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        this.topK = topK;
    }

    @Override
    public Map<String, RetrievalScore> retrieve(UserProfile userProfile, UserObjective objective,
                                                List<CandidateProfile> candidates) {
        if (candidates.isEmpty()) {
            return Map.of();
        }

        String query = RetrievalDocuments.queryDocument(userProfile, objective);
        List<String> documents = candidates.stream()
                .map(RetrievalDocuments::candidateDocument)
                .toList();
        double[] similarities = similarities(query, documents);

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        // List.sort is stable: equal similarities keep input order
        order.sort(Comparator.comparingDouble((Integer i) -> similarities[i]).reversed());

        Map<String, RetrievalScore> ranked = new LinkedHashMap<>();
        int limit = Math.min(topK, candidates.size());
        for (int rank = 1; rank <= limit; rank++) {
            int index = order.get(rank - 1);
            ranked.putIfAbsent(candidates.get(index).profileId(),
                    RetrievalScore.of(toPercent(similarities[index]), rank));
        }

        log.debug("{} retrieved {} of {} candidates", getName(), ranked.size(), candidates.size());
        return ranked;
    }

    /**
     * Similarity of each document to the query, in the same order as {@code documents}.
     * Values are expected in [-1, 1]; anything below 0 is reported as 0.
     */
    protected abstract double[] similarities(String query, List<String> documents);

    public int getTopK() {
        return topK;
    }

    static double toPercent(double similarity) {
        double clamped = Math.max(0.0, Math.min(1.0, similarity));
        return new BigDecimal(clamped * 100.0).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }
}
