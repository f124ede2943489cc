package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.graph.Edge;

import java.util.List;

/**
 * A simple directed path between the designated input and output nodes.
 *
 * Holds both the visited node ids and the edges actually taken, so two
 * parallel edges between the same pair yield two paths with their own gains.
 */
public final class ForwardPath {
    private final List<String> nodeIds;
    private final List<Edge> edges;

    public ForwardPath(List<String> nodeIds, List<Edge> edges) {
        if (nodeIds.size() != edges.size() + 1)
            throw new IllegalArgumentException(
                    "Path with " + edges.size() + " edges must visit " + (edges.size() + 1) + " nodes");
        this.nodeIds = List.copyOf(nodeIds);
        this.edges = List.copyOf(edges);
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    public List<Edge> edges() {
        return edges;
    }

    public String start() {
        return nodeIds.get(0);
    }

    public String end() {
        return nodeIds.get(nodeIds.size() - 1);
    }

    /** Product of the edge weights along the path; 1 when start equals end. */
    public Expression gain() {
        return Gains.product(edges);
    }

    @Override
    public String toString() {
        return String.join(" -> ", nodeIds);
    }
}
