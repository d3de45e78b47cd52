package com.profile.matching.api;

/**
 * Single aggregate failure for a matching request. No partial results accompany it.
 */
public class MatchingException extends RuntimeException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
