package com.profile.matching.llm;

import java.util.Objects;

/**
 * The final reason for one candidate and where it came from.
 */
public record GeneratedReason(String text, ReasonSource source, String producer) {

    public GeneratedReason {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(producer, "producer is required");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Reason text must not be blank");
        }
    }

    public boolean isFallback() {
        return source == ReasonSource.FALLBACK;
    }
}
