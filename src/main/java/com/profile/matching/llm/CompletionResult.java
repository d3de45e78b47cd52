package com.profile.matching.llm;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one backend attempt: either generated text or a failure reason.
 * Backends report failures through this value instead of throwing.
 */
public record CompletionResult(
        String text,
        String failureReason
) {
    public CompletionResult {
        if ((text == null) == (failureReason == null)) {
            throw new IllegalArgumentException("Exactly one of text or failureReason must be set");
        }
    }

    public static CompletionResult success(String text) {
        Objects.requireNonNull(text, "text is required");
        return new CompletionResult(text, null);
    }

    public static CompletionResult failure(String reason) {
        Objects.requireNonNull(reason, "reason is required");
        return new CompletionResult(null, reason);
    }

    /**
     * A success carrying blank text is not usable and counts as a failure.
     */
    public boolean isSuccess() {
        return text != null && !text.isBlank();
    }

    public Optional<String> value() {
        return isSuccess() ? Optional.of(text.strip()) : Optional.empty();
    }
}
