package com.profile.matching.graph;

/**
 * Directed, labeled relationships between graph nodes.
 */
public enum EdgeType {
    /** user or candidate to skill */
    HAS_SKILL,
    /** user to title, may carry a {@code why} rationale */
    SEEKS_TITLE,
    /** user to goal */
    HAS_GOAL,
    /** candidate to title token or full title */
    HAS_TITLE,
    /** candidate to industry */
    IN_INDUSTRY
}
