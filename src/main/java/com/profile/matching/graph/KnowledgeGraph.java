package com.profile.matching.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Request-scoped typed directed graph backed by adjacency maps keyed by node identifier.
 *
 * <p>Nodes and edges are kept in insertion order so that traversals are deterministic.
 * Adding a node or edge that already exists is a no-op: the first insertion wins.
 * Only {@link KnowledgeGraphBuilder} mutates a graph; once returned it is read-only.</p>
 */
public final class KnowledgeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> adjacency = new LinkedHashMap<>();
    private int edgeCount;

    KnowledgeGraph() {
    }

    /**
     * Adds a node unless one with the same identifier exists.
     *
     * @return true if the node was added
     */
    boolean addNode(GraphNode node) {
        if (nodes.containsKey(node.id())) {
            return false;
        }
        nodes.put(node.id(), node);
        return true;
    }

    /**
     * Adds an edge unless the source already has an edge to the target.
     *
     * @return true if the edge was added
     */
    boolean addEdge(GraphEdge edge) {
        if (!nodes.containsKey(edge.sourceId()) || !nodes.containsKey(edge.targetId())) {
            throw new IllegalStateException("Both endpoints must exist before adding edge "
                    + edge.sourceId() + " -> " + edge.targetId());
        }
        Map<String, GraphEdge> out = adjacency.computeIfAbsent(edge.sourceId(), k -> new LinkedHashMap<>());
        if (out.containsKey(edge.targetId())) {
            return false;
        }
        out.put(edge.targetId(), edge);
        edgeCount++;
        return true;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<GraphNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Label of a node, or the empty string when the node is unknown.
     */
    public String labelOf(String id) {
        GraphNode node = nodes.get(id);
        return node != null ? node.label() : "";
    }

    public Optional<GraphEdge> getEdge(String sourceId, String targetId) {
        Map<String, GraphEdge> out = adjacency.get(sourceId);
        return out != null ? Optional.ofNullable(out.get(targetId)) : Optional.empty();
    }

    /**
     * Targets reachable from {@code sourceId} by one edge of the given type, in insertion order.
     */
    public Set<String> successors(String sourceId, EdgeType type) {
        Map<String, GraphEdge> out = adjacency.get(sourceId);
        if (out == null) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (GraphEdge edge : out.values()) {
            if (edge.type() == type) {
                result.add(edge.targetId());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * All outgoing edges of a node, in insertion order.
     */
    public List<GraphEdge> outgoing(String sourceId) {
        Map<String, GraphEdge> out = adjacency.get(sourceId);
        return out != null ? List.copyOf(out.values()) : List.of();
    }

    public List<GraphNode> nodesOfType(NodeType type) {
        return nodes.values().stream()
                .filter(n -> n.type() == type)
                .toList();
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public String toString() {
        return "KnowledgeGraph{nodes=" + nodes.size() + ", edges=" + edgeCount + "}";
    }
}
