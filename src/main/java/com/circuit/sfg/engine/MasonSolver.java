package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.graph.Edge;
import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Mason's gain formula over a {@link SignalFlowGraph}.
 *
 * <pre>
 * T = sum(P_k * delta_k) / delta
 * </pre>
 *
 * Wires the loop, combination, determinant, path and cofactor components
 * around one {@link AnalysisListener}. Stateless apart from that listener;
 * the graphs passed in are never modified.
 *
 * Single-threaded. Every call runs to completion on the calling thread.
 */
public final class MasonSolver {
    private static final Logger log = LogManager.getLogger(MasonSolver.class);

    private final AnalysisListener listener;
    private final LoopFinder loopFinder;
    private final NonTouchingLoopFinder nonTouchingFinder;
    private final DeltaCalculator deltaCalculator;
    private final CofactorCalculator cofactorCalculator;
    private final NumeratorCalculator numeratorCalculator;

    public MasonSolver() {
        this(AnalysisListener.NONE);
    }

    public MasonSolver(AnalysisListener listener) {
        this.listener = listener;
        this.loopFinder = new LoopFinder(listener);
        this.nonTouchingFinder = new NonTouchingLoopFinder(listener);
        this.deltaCalculator = new DeltaCalculator();
        this.cofactorCalculator = new CofactorCalculator(loopFinder, nonTouchingFinder, deltaCalculator);
        this.numeratorCalculator = new NumeratorCalculator(new ForwardPathFinder(listener), cofactorCalculator,
                listener);
    }

    public List<Loop> findAllLoops(SignalFlowGraph graph) {
        return loopFinder.findAllLoops(graph);
    }

    public NonTouchingLoops findNonTouching(List<Loop> loops) {
        return nonTouchingFinder.findNonTouching(loops);
    }

    /** Order -> combined edge lists, the plain form of {@link #findNonTouching}. */
    public Map<Integer, List<List<Edge>>> findNonTouchingEdgeLists(List<Loop> loops) {
        return findNonTouching(loops).asEdgeLists();
    }

    public Expression calculateDenominator(List<Loop> loops, NonTouchingLoops nonTouching) {
        return deltaCalculator.calculateDenominator(loops, nonTouching);
    }

    public Expression calculateNumerator(String startId, String endId, SignalFlowGraph graph) {
        return numeratorCalculator.calculateNumerator(startId, endId, graph);
    }

    /** Determinant of the whole graph. */
    public Expression determinant(SignalFlowGraph graph) {
        return cofactorCalculator.delta(graph);
    }

    /**
     * Numerator, denominator and Bode formulas for {@code end / start}.
     *
     * @throws IllegalArgumentException      if either id is unknown.
     * @throws PathCofactorMismatchException if paths and cofactors do not pair up.
     */
    public TransferFunction computeTransferFunction(SignalFlowGraph graph, String startId, String endId) {
        List<Loop> loops = findAllLoops(graph);
        NonTouchingLoops nonTouching = findNonTouching(loops);
        Expression denominator = calculateDenominator(loops, nonTouching);
        Expression numerator = calculateNumerator(startId, endId, graph);
        log.info("{} loops, non-touching up to order {}", loops.size(), nonTouching.maxOrder());
        listener.onAnalysisComplete(numerator, denominator);
        return TransferFunction.of(startId, endId, numerator, denominator);
    }

    /** Loop gain of the graph, {@code delta - 1}, with its Bode formulas. */
    public LoopGainResponse computeLoopGain(SignalFlowGraph graph) {
        return LoopGainResponse.of(determinant(graph));
    }
}
