package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.graph.Edge;

import java.util.*;

/**
 * A simple directed cycle: a closed edge sequence whose first edge starts where
 * the last one ends, with no repeated intermediate node.
 */
public final class Loop {
    private final List<Edge> edges;
    private final Set<String> nodeIds;

    public Loop(List<Edge> edges) {
        if (edges.isEmpty())
            throw new IllegalArgumentException("Loop needs at least one edge");
        this.edges = List.copyOf(edges);
        Set<String> ids = new LinkedHashSet<>();
        for (Edge e : edges)
            ids.add(e.destination());
        this.nodeIds = Collections.unmodifiableSet(ids);
    }

    public List<Edge> edges() {
        return edges;
    }

    /** Every node on the loop, in traversal order. */
    public Set<String> nodeIds() {
        return nodeIds;
    }

    public boolean touches(Collection<String> otherNodes) {
        for (String id : otherNodes)
            if (nodeIds.contains(id))
                return true;
        return false;
    }

    /** Product of the edge weights. */
    public Expression gain() {
        return Gains.product(edges);
    }

    @Override
    public String toString() {
        return Gains.describe(edges);
    }
}
