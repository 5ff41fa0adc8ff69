package com.trendscope.core.correlation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entities and the correlation edges between them, held as a node list plus
 * an edge list that refers to nodes by index.
 *
 * <p>
 * An undirected graph stores each edge once with {@code source < target}. A
 * directed graph points from the leading entity to the lagging one. Self
 * loops and parallel edges are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityGraph implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean directed;
    private final List<String> nodes = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();

    private EntityGraph(boolean directed, List<String> nodes) {
        this.directed = directed;
        for (String node : nodes) {
            Objects.requireNonNull(node, "node must not be null");
            if (index.putIfAbsent(node, this.nodes.size()) == null) {
                this.nodes.add(node);
            }
        }
    }

    public static EntityGraph undirected(List<String> nodes) {
        return new EntityGraph(false, nodes);
    }

    public static EntityGraph directed(List<String> nodes) {
        return new EntityGraph(true, nodes);
    }

    /**
     * Add an edge between two existing nodes.
     *
     * @param lag lead of {@code from} over {@code to} in days, or {@code null}
     * @throws IllegalArgumentException for an unknown node, a self loop or a
     *                                  duplicate edge
     */
    public GraphEdge addEdge(String from, String to, double weight, double pValue, Integer lag) {
        int a = requireNode(from);
        int b = requireNode(to);
        if (a == b) {
            throw new IllegalArgumentException("Self loop on '" + from + "' is not allowed");
        }
        if (!directed && a > b) {
            int swap = a;
            a = b;
            b = swap;
        }
        if (findEdge(a, b).isPresent()) {
            throw new IllegalArgumentException("Edge " + from + " / " + to + " already exists");
        }
        GraphEdge edge = new GraphEdge(a, b, nodes.get(a), nodes.get(b), weight, pValue, lag);
        edges.add(edge);
        return edge;
    }

    public boolean isDirected() {
        return directed;
    }

    public List<String> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<GraphEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public int indexOf(String node) {
        return index.getOrDefault(node, -1);
    }

    /**
     * @return the edge between two entities; for a directed graph only the
     *         edge from {@code from} to {@code to}
     */
    public Optional<GraphEdge> edge(String from, String to) {
        int a = indexOf(from);
        int b = indexOf(to);
        if (a < 0 || b < 0) {
            return Optional.empty();
        }
        if (!directed && a > b) {
            return findEdge(b, a);
        }
        return findEdge(a, b);
    }

    public boolean hasEdge(String from, String to) {
        return edge(from, to).isPresent();
    }

    /**
     * @return per node, the indices of the nodes it shares an edge with,
     *         ignoring direction
     */
    public List<List<Integer>> adjacency() {
        List<List<Integer>> adjacency = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            adjacency.add(new ArrayList<>());
        }
        for (GraphEdge edge : edges) {
            adjacency.get(edge.getSource()).add(edge.getTarget());
            adjacency.get(edge.getTarget()).add(edge.getSource());
        }
        return adjacency;
    }

    private Optional<GraphEdge> findEdge(int source, int target) {
        return edges.stream()
                .filter(e -> e.getSource() == source && e.getTarget() == target)
                .findFirst();
    }

    private int requireNode(String node) {
        int i = indexOf(node);
        if (i < 0) {
            throw new IllegalArgumentException("Unknown node: '" + node + "'");
        }
        return i;
    }

    @Override
    public String toString() {
        return "EntityGraph{" + (directed ? "directed" : "undirected")
                + ", nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
