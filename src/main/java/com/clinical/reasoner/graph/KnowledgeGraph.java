package com.clinical.reasoner.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable node/edge projection of one patient's facts and findings
 */
public final class KnowledgeGraph {

    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<String, GraphNode> nodesByKey;

    public KnowledgeGraph(List<GraphNode> nodes, List<GraphEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        Map<String, GraphNode> byKey = new HashMap<>();
        for (GraphNode node : nodes) {
            byKey.put(node.getKey(), node);
        }
        this.nodesByKey = Map.copyOf(byKey);
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public Optional<GraphNode> findNode(String key) {
        return Optional.ofNullable(nodesByKey.get(key));
    }

    public List<GraphEdge> getEdges(EdgeKind kind) {
        return edges.stream().filter(e -> e.getKind() == kind).toList();
    }

    /**
     * @return true if an edge of the given kind connects the two keyed nodes in that direction
     */
    public boolean hasEdge(String sourceKey, EdgeKind kind, String targetKey) {
        GraphNode source = nodesByKey.get(sourceKey);
        GraphNode target = nodesByKey.get(targetKey);
        if (source == null || target == null) {
            return false;
        }
        return edges.stream().anyMatch(e -> e.getKind() == kind
                && e.getSource() == source.getIndex()
                && e.getTarget() == target.getIndex());
    }
}
