package com.profile.matching.retrieval;

/**
 * Thrown when the similarity retriever or its embedding model cannot produce scores.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
