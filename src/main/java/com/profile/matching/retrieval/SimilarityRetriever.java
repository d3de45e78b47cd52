package com.profile.matching.retrieval;

import com.profile.matching.core.model.CandidateProfile;
import com.profile.matching.core.model.UserObjective;
import com.profile.matching.core.model.UserProfile;

import java.util.List;
import java.util.Map;

/**
 * Supplies the semantic half of the blended score.
 *
 * <p>Candidates absent from the returned map are treated as similarity 0 with no rank.
 * Implementations may throw {@link RetrievalException}; how that is handled is decided by
 * the caller's {@code RetrievalFailurePolicy}.</p>
 */
public interface SimilarityRetriever {

    /**
     * @return profile id to similarity (0-100) and rank
     */
    Map<String, RetrievalScore> retrieve(UserProfile userProfile, UserObjective objective,
                                         List<CandidateProfile> candidates);

    /**
     * Returns the name of this retriever, used in logs.
     */
    String getName();
}
