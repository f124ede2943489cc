package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Assembles the numerator of Mason's rule: the sum over forward paths of the
 * path gain times the path's cofactor. No forward path gives 0.
 */
@Log4j2
public final class NumeratorCalculator {
    private final ForwardPathFinder pathFinder;
    private final CofactorCalculator cofactorCalculator;
    private final AnalysisListener listener;

    public NumeratorCalculator(ForwardPathFinder pathFinder, CofactorCalculator cofactorCalculator,
            AnalysisListener listener) {
        this.pathFinder = pathFinder;
        this.cofactorCalculator = cofactorCalculator;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public Expression calculateNumerator(String startId, String endId, SignalFlowGraph graph) {
        List<ForwardPath> paths = pathFinder.findForwardPaths(startId, endId, graph);
        if (paths.isEmpty())
            log.debug("No forward path from {} to {}", startId, endId);

        List<Expression> cofactors = new ArrayList<>(paths.size());
        for (ForwardPath path : paths) {
            Expression cofactor = cofactorCalculator.cofactor(path, graph);
            cofactors.add(cofactor);
            listener.onCofactor(path, cofactor);
        }
        return combine(paths, cofactors);
    }

    /**
     * Sums gain x cofactor pairwise.
     *
     * @throws PathCofactorMismatchException if the lists differ in length.
     */
    static Expression combine(List<ForwardPath> paths, List<Expression> cofactors) {
        if (paths.size() != cofactors.size())
            throw new PathCofactorMismatchException(paths.size(), cofactors.size());
        Expression numerator = Expression.zero();
        for (int i = 0; i < paths.size(); i++)
            numerator = numerator.add(paths.get(i).gain().multiply(cofactors.get(i)));
        return numerator;
    }
}
