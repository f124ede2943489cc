package com.circuit.sfg.engine;

import com.circuit.sfg.api.AnalysisListener;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds all combinations of mutually non-touching loops.
 *
 * <p>
 * Level 1 is the loop list itself. Level k is formed by pairing every level
 * k-1 combination with every single loop that shares no node with it. The same
 * combination is reachable from several k-1 combinations, so candidates are
 * deduplicated on their sorted edge ids.
 *
 * <p>
 * The search stops at the first empty level: a k-combination contains
 * k-1-combinations, so no level after an empty one can be non-empty.
 */
public final class NonTouchingLoopFinder {
    private static final Logger log = LogManager.getLogger(NonTouchingLoopFinder.class);

    private final AnalysisListener listener;

    public NonTouchingLoopFinder() {
        this(AnalysisListener.NONE);
    }

    public NonTouchingLoopFinder(AnalysisListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * @param loops All loops of one graph.
     * @return Combinations of order 2 and up.
     */
    public NonTouchingLoops findNonTouching(List<Loop> loops) {
        SortedMap<Integer, List<NonTouchingSet>> result = new TreeMap<>();
        Set<List<String>> seen = new HashSet<>();

        List<NonTouchingSet> previous = new ArrayList<>(loops.size());
        for (Loop l : loops)
            previous.add(NonTouchingSet.of(l));

        for (int order = 2; order <= loops.size(); order++) {
            List<NonTouchingSet> level = new ArrayList<>();
            for (NonTouchingSet combination : previous) {
                for (Loop candidate : loops) {
                    if (candidate.touches(combination.nodeIds()))
                        continue;
                    NonTouchingSet next = combination.with(candidate);
                    if (seen.add(next.key()))
                        level.add(next);
                }
            }
            listener.onNonTouchingLevel(order, level.size());
            if (level.isEmpty())
                break;
            result.put(order, Collections.unmodifiableList(level));
            previous = level;
        }

        if (log.isDebugEnabled())
            log.debug("Non-touching combinations by order: {}", counts(result));
        return result.isEmpty() ? NonTouchingLoops.empty() : new NonTouchingLoops(result);
    }

    private static Map<Integer, Integer> counts(SortedMap<Integer, List<NonTouchingSet>> byOrder) {
        Map<Integer, Integer> counts = new TreeMap<>();
        byOrder.forEach((k, v) -> counts.put(k, v.size()));
        return counts;
    }
}
