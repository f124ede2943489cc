package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;

import java.util.List;
import java.util.Map;

/**
 * Assembles the graph determinant.
 *
 * <pre>
 * delta = 1 - sum(L) + sum(L2) - sum(L3) + ...
 * </pre>
 *
 * where {@code L} are single loop gains and {@code Lk} the gains of the
 * k-wise non-touching combinations. Even orders add, odd orders subtract.
 */
public final class DeltaCalculator {

    public Expression calculateDenominator(List<Loop> loops, NonTouchingLoops nonTouching) {
        Expression delta = Expression.one();
        for (Loop loop : loops)
            delta = delta.subtract(loop.gain());

        for (Map.Entry<Integer, List<NonTouchingSet>> level : nonTouching.byOrder().entrySet()) {
            Expression sum = Expression.zero();
            for (NonTouchingSet set : level.getValue())
                sum = sum.add(set.gain());
            delta = level.getKey() % 2 == 0 ? delta.add(sum) : delta.subtract(sum);
        }
        return delta;
    }
}
