package com.circuit.sfg.graph;

import java.util.*;

/**
 * Directed weighted multigraph keyed by node id.
 *
 * <p>
 * Nodes own their outgoing edges; edges name their destination by id only.
 * This keeps the naturally cyclic graph free of object cycles and makes
 * "graph minus some nodes" a plain copy of the retained nodes.
 *
 * <p>
 * An edge whose destination does not resolve is legal here. The traversals
 * skip it.
 *
 * <p>
 * Instances handed to the engine are never mutated by it; residual graphs are
 * built from deep copies via {@link #without(Collection)}.
 */
public final class SignalFlowGraph {
    private final Map<String, Node> nodesById;

    private SignalFlowGraph(Map<String, Node> nodesById) {
        this.nodesById = nodesById;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Resolves an id. Absent for unknown ids, including dangling edge targets. */
    public Optional<Node> lookup(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    /** Nodes in insertion order. */
    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodesById.values());
    }

    public int nodeCount() {
        return nodesById.size();
    }

    public int edgeCount() {
        int n = 0;
        for (Node node : nodesById.values())
            n += node.outgoingEdges().size();
        return n;
    }

    /**
     * Residual subgraph with the given nodes deleted.
     *
     * Retained nodes are deep-copied and lose every edge that pointed at a
     * deleted node. Deleted nodes disappear together with their own edges.
     */
    public SignalFlowGraph without(Collection<String> removedIds) {
        Set<String> removed = new HashSet<>(removedIds);
        Map<String, Node> retained = new LinkedHashMap<>();
        for (Node node : nodesById.values()) {
            if (removed.contains(node.id()))
                continue;
            Node copy = node.copy();
            copy.removeEdgesTo(removed);
            retained.put(copy.id(), copy);
        }
        return new SignalFlowGraph(retained);
    }

    /** Deep copy of the whole graph. */
    public SignalFlowGraph copy() {
        return without(Collections.emptySet());
    }

    /**
     * Builder for a {@link SignalFlowGraph}.
     *
     * <p>
     * Edge ids default to {@code source + destination}. When another edge with
     * the same endpoints already exists, the first keeps the bare id and the
     * n-th later one gets {@code "_" + n} appended.
     */
    public static final class Builder {
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Map<List<String>, Integer> parallelCounts = new HashMap<>();
        private final Set<String> edgeIds = new HashSet<>();

        public Builder addNode(String id) {
            return addNode(id, null);
        }

        public Builder addNode(String id, String value) {
            if (nodes.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            nodes.put(id, new Node(id, value));
            return this;
        }

        /**
         * Adds a branch {@code from -> to}. The destination need not exist;
         * such an edge is kept and skipped at traversal time.
         *
         * <p>
         * The id is {@code from + to}. The n-th later edge between the same
         * endpoints takes the suffix {@code _n}. An id already held by another
         * edge (for example {@code x1 -> x12} against {@code x11 -> x2}) moves
         * on to the next free suffix, so edge ids are unique.
         */
        public Builder addEdge(String from, String to, String weight) {
            Node source = nodes.get(from);
            if (source == null)
                throw new IllegalArgumentException("Unknown node: " + from);
            String bareId = from + to;
            int n = parallelCounts.getOrDefault(List.of(from, to), 0);
            String id = n == 0 ? bareId : bareId + "_" + n;
            while (!edgeIds.add(id))
                id = bareId + "_" + (++n);
            parallelCounts.put(List.of(from, to), n + 1);
            source.addEdge(new Edge(id, weight, from, to));
            return this;
        }

        public boolean hasNode(String id) {
            return nodes.containsKey(id);
        }

        public SignalFlowGraph build() {
            Map<String, Node> copy = new LinkedHashMap<>();
            for (Node n : nodes.values())
                copy.put(n.id(), n.copy());
            return new SignalFlowGraph(copy);
        }
    }
}
