package com.profile.matching.api;

import java.util.Locale;

/**
 * What a request does when the similarity retriever fails.
 */
public enum RetrievalFailurePolicy {
    /** Continue with similarity 0 and no rank for every candidate. */
    ZERO_FILL,
    /** Fail the whole request with a {@link MatchingException}. */
    ABORT;

    public static RetrievalFailurePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return ZERO_FILL;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown retrieval failure policy: " + value, e);
        }
    }
}
