package com.profile.matching.graph;

/**
 * Node types of the per-request knowledge graph.
 * The prefix is the first half of every node identifier ({@code prefix::key}).
 */
public enum NodeType {
    USER("user"),
    CANDIDATE("candidate"),
    SKILL("skill"),
    TITLE("title"),
    INDUSTRY("industry"),
    GOAL("goal");

    private final String prefix;

    NodeType(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
