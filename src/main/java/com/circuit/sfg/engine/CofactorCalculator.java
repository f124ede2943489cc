package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.List;

/**
 * Computes the cofactor of a forward path: the determinant of the graph that
 * remains once every node of the path has been deleted.
 *
 * The residual is built from deep copies ({@link SignalFlowGraph#without}); the
 * input graph is left untouched. An acyclic residual yields 1.
 */
public final class CofactorCalculator {
    private final LoopFinder loopFinder;
    private final NonTouchingLoopFinder nonTouchingFinder;
    private final DeltaCalculator deltaCalculator;

    public CofactorCalculator(LoopFinder loopFinder, NonTouchingLoopFinder nonTouchingFinder,
            DeltaCalculator deltaCalculator) {
        this.loopFinder = loopFinder;
        this.nonTouchingFinder = nonTouchingFinder;
        this.deltaCalculator = deltaCalculator;
    }

    public Expression cofactor(ForwardPath path, SignalFlowGraph graph) {
        return delta(residual(path, graph));
    }

    public SignalFlowGraph residual(ForwardPath path, SignalFlowGraph graph) {
        return graph.without(path.nodeIds());
    }

    /** Determinant of any graph: loops, then combinations, then the sum. */
    public Expression delta(SignalFlowGraph graph) {
        List<Loop> loops = loopFinder.findAllLoops(graph);
        NonTouchingLoops nonTouching = nonTouchingFinder.findNonTouching(loops);
        return deltaCalculator.calculateDenominator(loops, nonTouching);
    }
}
