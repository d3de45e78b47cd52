package com.profile.matching.graph;

import java.util.Map;
import java.util.Objects;

/**
 * A node in the knowledge graph. The label keeps the casing of the first insertion.
 */
public record GraphNode(
        String id,
        NodeType type,
        String label,
        Map<String, String> attributes
) {
    public GraphNode {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(label, "label is required");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public String attribute(String key) {
        return attributes.getOrDefault(key, "");
    }
}
