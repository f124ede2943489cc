package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.graph.Edge;

import java.util.*;

/**
 * A combination of pairwise node-disjoint loops.
 *
 * Its identity is the sorted list of member edge ids, which does not depend on
 * the order in which the members were combined.
 */
public final class NonTouchingSet {
    private final List<Loop> loops;
    private final List<Edge> edges;
    private final Set<String> nodeIds;
    private final List<String> key;

    NonTouchingSet(List<Loop> loops) {
        this.loops = List.copyOf(loops);
        List<Edge> all = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Loop l : loops) {
            all.addAll(l.edges());
            ids.addAll(l.nodeIds());
        }
        this.edges = Collections.unmodifiableList(all);
        this.nodeIds = Collections.unmodifiableSet(ids);
        this.key = canonicalKey(all);
    }

    static NonTouchingSet of(Loop loop) {
        return new NonTouchingSet(List.of(loop));
    }

    /** Adds a loop in front of the current members. */
    NonTouchingSet with(Loop loop) {
        List<Loop> next = new ArrayList<>(loops.size() + 1);
        next.add(loop);
        next.addAll(loops);
        return new NonTouchingSet(next);
    }

    static List<String> canonicalKey(List<Edge> edges) {
        List<String> ids = new ArrayList<>(edges.size());
        for (Edge e : edges)
            ids.add(e.id());
        Collections.sort(ids);
        return Collections.unmodifiableList(ids);
    }

    public List<Loop> loops() {
        return loops;
    }

    public int order() {
        return loops.size();
    }

    /** Concatenated edges of all members. */
    public List<Edge> edges() {
        return edges;
    }

    public Set<String> nodeIds() {
        return nodeIds;
    }

    /** Sorted edge ids; equal for equal combinations. */
    public List<String> key() {
        return key;
    }

    /** Product of every member's gain. */
    public Expression gain() {
        return Gains.product(edges);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NonTouchingSet s && key.equals(s.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(" | ", "{", "}");
        for (Loop l : loops)
            sj.add(l.toString());
        return sj.toString();
    }
}
