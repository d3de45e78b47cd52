package com.profile.matching.llm;

/**
 * A remote text-completion service that can write a match reason.
 * Any backend honoring this contract is interchangeable in the reason chain.
 */
public interface ReasonBackend {

    /**
     * Requests a completion. Timeouts, non-success responses and transport errors are
     * returned as {@link CompletionResult#failure(String)}, never thrown.
     */
    CompletionResult complete(CompletionRequest request);

    /**
     * Returns the name/identifier of this backend.
     */
    String getBackendName();

    /**
     * Checks whether the backend is configured and reachable.
     */
    boolean isAvailable();
}
