package com.circuit.sfg.util;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.engine.ForwardPath;
import com.circuit.sfg.engine.Loop;
import com.circuit.sfg.graph.Edge;

import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;

/**
 * Counts analysis events. Loop and path counts include the searches run on
 * residual graphs for cofactors.
 */
@Getter
public final class AnalysisStatsListener implements AnalysisListener {
    private int loopsFound;
    private int danglingEdges;
    private int forwardPaths;
    private int cofactors;
    private int analyses;
    private final Map<Integer, Integer> combinationsByOrder = new TreeMap<>();

    @Override
    public void onLoopFound(Loop loop) {
        loopsFound++;
    }

    @Override
    public void onDanglingEdge(Edge edge) {
        danglingEdges++;
    }

    @Override
    public void onNonTouchingLevel(int order, int count) {
        if (count > 0)
            combinationsByOrder.merge(order, count, Integer::sum);
    }

    @Override
    public void onForwardPath(ForwardPath path) {
        forwardPaths++;
    }

    @Override
    public void onCofactor(ForwardPath path, Expression cofactor) {
        cofactors++;
    }

    @Override
    public void onAnalysisComplete(Expression numerator, Expression denominator) {
        analyses++;
    }

    public void reset() {
        loopsFound = 0;
        danglingEdges = 0;
        forwardPaths = 0;
        cofactors = 0;
        analyses = 0;
        combinationsByOrder.clear();
    }
}
