package com.circuit.sfg.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A variable of the linear equation system.
 *
 * The order of outgoing edges is the order in which they were added and
 * drives enumeration order in the engine.
 */
public final class Node {
    private final String id;
    private final String value;
    private final List<Edge> outgoingEdges;

    public Node(String id) {
        this(id, null);
    }

    public Node(String id, String value) {
        this(id, value, new ArrayList<>());
    }

    private Node(String id, String value, List<Edge> outgoingEdges) {
        this.id = id;
        this.value = value;
        this.outgoingEdges = outgoingEdges;
    }

    public String id() {
        return id;
    }

    /** Constant stored on the node, or null. */
    public String value() {
        return value;
    }

    public List<Edge> outgoingEdges() {
        return Collections.unmodifiableList(outgoingEdges);
    }

    void addEdge(Edge edge) {
        if (!edge.source().equals(id))
            throw new IllegalArgumentException("Edge " + edge.id() + " does not start at node " + id);
        outgoingEdges.add(edge);
    }

    /**
     * Removes every outgoing edge pointing at one of the given ids.
     *
     * @return number of edges removed.
     */
    public int removeEdgesTo(Collection<String> destinations) {
        int before = outgoingEdges.size();
        outgoingEdges.removeIf(e -> destinations.contains(e.destination()));
        return before - outgoingEdges.size();
    }

    /** Deep copy: the returned node owns an independent edge list. */
    public Node copy() {
        List<Edge> edges = new ArrayList<>(outgoingEdges.size());
        for (Edge e : outgoingEdges)
            edges.add(e.copy());
        return new Node(id, value, edges);
    }

    @Override
    public String toString() {
        return id;
    }
}
