package com.circuit.sfg.engine;

import com.circuit.sfg.graph.Edge;

import java.util.*;

/**
 * Non-touching loop combinations grouped by order, for orders 2 and up.
 *
 * Orders are contiguous from 2: a missing order means no higher order exists
 * either.
 */
public final class NonTouchingLoops {
    private static final NonTouchingLoops EMPTY = new NonTouchingLoops(new TreeMap<>());

    private final SortedMap<Integer, List<NonTouchingSet>> byOrder;

    NonTouchingLoops(SortedMap<Integer, List<NonTouchingSet>> byOrder) {
        this.byOrder = Collections.unmodifiableSortedMap(byOrder);
    }

    public static NonTouchingLoops empty() {
        return EMPTY;
    }

    public SortedMap<Integer, List<NonTouchingSet>> byOrder() {
        return byOrder;
    }

    /** Combinations of exactly {@code order} loops; empty when there are none. */
    public List<NonTouchingSet> ofOrder(int order) {
        return byOrder.getOrDefault(order, Collections.emptyList());
    }

    /** Highest order present, or 1 when no combination exists. */
    public int maxOrder() {
        return byOrder.isEmpty() ? 1 : byOrder.lastKey();
    }

    public boolean isEmpty() {
        return byOrder.isEmpty();
    }

    /**
     * Same content as plain edge lists: order -> combined edge lists.
     */
    public Map<Integer, List<List<Edge>>> asEdgeLists() {
        Map<Integer, List<List<Edge>>> result = new TreeMap<>();
        for (Map.Entry<Integer, List<NonTouchingSet>> e : byOrder.entrySet()) {
            List<List<Edge>> lists = new ArrayList<>(e.getValue().size());
            for (NonTouchingSet s : e.getValue())
                lists.add(s.edges());
            result.put(e.getKey(), Collections.unmodifiableList(lists));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return byOrder.toString();
    }
}
