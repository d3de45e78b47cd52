package com.profile.matching.graph;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes free-text labels into node keys.
 * Lower-cases, trims and collapses internal whitespace to a single {@code _}.
 * The result is the deduplication key: "Machine Learning" and "  machine   learning "
 * produce the same node.
 */
public final class LabelNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String SEPARATOR = "_";
    private static final String ID_DELIMITER = "::";

    private LabelNormalizer() {
    }

    /**
     * Normalizes a label. Idempotent; null or blank input yields the empty string.
     */
    public static String normalize(String label) {
        if (label == null || label.isBlank()) {
            return "";
        }
        return WHITESPACE.matcher(label.strip().toLowerCase(Locale.ROOT)).replaceAll(SEPARATOR);
    }

    /**
     * Identifier for an attribute node (skill, title, industry, goal).
     */
    public static String nodeId(NodeType type, String label) {
        return type.getPrefix() + ID_DELIMITER + normalize(label);
    }

    /**
     * Identifier for an entity node (user, candidate). The key is used verbatim.
     */
    public static String entityId(NodeType type, String key) {
        return type.getPrefix() + ID_DELIMITER + key;
    }
}
