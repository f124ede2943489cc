package com.circuit.sfg.util;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.engine.ForwardPath;
import com.circuit.sfg.engine.Loop;
import com.circuit.sfg.graph.Edge;

import lombok.extern.log4j.Log4j2;

/**
 * Traces the analysis to Log4j2. Loops, paths and cofactors go to DEBUG,
 * dangling edges to WARN, the final result to INFO.
 */
@Log4j2
public final class LoggingAnalysisListener implements AnalysisListener {

    @Override
    public void onLoopFound(Loop loop) {
        if (log.isDebugEnabled())
            log.debug("Loop: {} (gain {})", loop, loop.gain());
    }

    @Override
    public void onDanglingEdge(Edge edge) {
        log.warn("Skipping edge {} -> {}: destination not in graph", edge.id(), edge.destination());
    }

    @Override
    public void onNonTouchingLevel(int order, int count) {
        log.debug("{} non-touching combinations of order {}", count, order);
    }

    @Override
    public void onForwardPath(ForwardPath path) {
        if (log.isDebugEnabled())
            log.debug("Forward path: {} (gain {})", path, path.gain());
    }

    @Override
    public void onCofactor(ForwardPath path, Expression cofactor) {
        log.debug("Cofactor of {}: {}", path, cofactor);
    }

    @Override
    public void onAnalysisComplete(Expression numerator, Expression denominator) {
        log.info("numer: {}", numerator);
        log.info("denom: {}", denominator);
    }
}
