package com.circuit.sfg.graph;

/**
 * A directed, weighted branch of the signal-flow graph.
 *
 * Endpoints are node ids rather than node references; they are resolved
 * against the owning {@link SignalFlowGraph} at traversal time. The weight is
 * an opaque string handed to the expression engine.
 */
public final class Edge {
    private final String id;
    private final String weight;
    private final String source;
    private final String destination;

    public Edge(String weight, String source, String destination) {
        this(source + destination, weight, source, destination);
    }

    public Edge(String id, String weight, String source, String destination) {
        this.id = id;
        this.weight = weight;
        this.source = source;
        this.destination = destination;
    }

    public String id() {
        return id;
    }

    public String weight() {
        return weight;
    }

    public String source() {
        return source;
    }

    public String destination() {
        return destination;
    }

    public boolean isSelfLoop() {
        return source.equals(destination);
    }

    public Edge copy() {
        return new Edge(id, weight, source, destination);
    }

    @Override
    public String toString() {
        return source + " -[" + weight + "]-> " + destination;
    }
}
