package com.profile.matching.llm;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Deterministic reason used when no remote backend produced one. Never makes a remote call.
 */
public class FallbackReasonComposer {

    public static final String PRODUCER_NAME = "Fallback";

    static final String SEMANTIC_ONLY_REASON = "Candidate aligns semantically with the target profile.";

    /**
     * Names the top structural signal and the mean of both scores, rounded half-even to a
     * whole number, when there are signals; otherwise a generic semantic-alignment sentence.
     */
    public String compose(ReasonContext context) {
        if (context.signals().isEmpty()) {
            return SEMANTIC_ONLY_REASON;
        }
        String top = context.signals().get(0).toLowerCase(Locale.ROOT);
        double combined = (context.structuralScore() + context.similarityScore()) / 2.0;
        return String.format(Locale.ROOT,
                "Strong match based on %s with a combined alignment score of %s/100.",
                top, new BigDecimal(combined).setScale(0, RoundingMode.HALF_EVEN).toPlainString());
    }
}
