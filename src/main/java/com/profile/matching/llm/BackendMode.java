package com.profile.matching.llm;

import java.util.Locale;

/**
 * Which remote backends the reason chain may try before falling back.
 */
public enum BackendMode {
    /** primary, then secondary, then fallback */
    AUTO,
    /** primary only, then fallback */
    PRIMARY,
    /** secondary only, then fallback */
    SECONDARY,
    /** fallback only, no remote calls */
    NONE;

    /**
     * Parses a mode name. Accepts the enum names and the backend aliases
     * {@code ollama} (primary) and {@code hf} (secondary), case-insensitively.
     */
    public static BackendMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "primary", "ollama" -> PRIMARY;
            case "secondary", "hf", "huggingface" -> SECONDARY;
            case "none", "off" -> NONE;
            default -> throw new IllegalArgumentException("Unknown backend mode: " + value);
        };
    }
}
