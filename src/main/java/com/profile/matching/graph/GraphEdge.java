package com.profile.matching.graph;

import java.util.Map;
import java.util.Objects;

/**
 * A directed, typed edge between two node identifiers.
 */
public record GraphEdge(
        String sourceId,
        String targetId,
        EdgeType type,
        Map<String, String> properties
) {
    public static final String WHY = "why";

    public GraphEdge {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(type, "type is required");
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public String property(String key) {
        return properties.getOrDefault(key, "");
    }
}
