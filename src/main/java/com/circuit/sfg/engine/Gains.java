package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.graph.Edge;

import java.util.List;

/** Gain helpers shared by loops, paths and loop combinations. */
final class Gains {
    private Gains() {
        // Utility class
    }

    /** Product of the weights along an edge sequence; 1 for an empty one. */
    static Expression product(List<Edge> edges) {
        Expression gain = Expression.one();
        for (Edge e : edges)
            gain = gain.multiply(e.weight());
        return gain;
    }

    /** Renders {@code a -> b -> c}. */
    static String describe(List<Edge> edges) {
        if (edges.isEmpty())
            return "";
        StringBuilder sb = new StringBuilder(edges.get(0).source());
        for (Edge e : edges)
            sb.append(" -> ").append(e.destination());
        return sb.toString();
    }
}
