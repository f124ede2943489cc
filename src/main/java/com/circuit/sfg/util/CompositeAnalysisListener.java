package com.circuit.sfg.util;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.engine.ForwardPath;
import com.circuit.sfg.engine.Loop;
import com.circuit.sfg.graph.Edge;

import java.util.Arrays;

/**
 * Fans every callback out to several {@link AnalysisListener} instances, in
 * registration order.
 */
public class CompositeAnalysisListener implements AnalysisListener {
    private AnalysisListener[] listeners = new AnalysisListener[0];

    public CompositeAnalysisListener add(AnalysisListener listener) {
        AnalysisListener[] old = listeners;
        AnalysisListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onLoopFound(Loop loop) {
        for (AnalysisListener l : listeners)
            l.onLoopFound(loop);
    }

    @Override
    public void onDanglingEdge(Edge edge) {
        for (AnalysisListener l : listeners)
            l.onDanglingEdge(edge);
    }

    @Override
    public void onNonTouchingLevel(int order, int count) {
        for (AnalysisListener l : listeners)
            l.onNonTouchingLevel(order, count);
    }

    @Override
    public void onForwardPath(ForwardPath path) {
        for (AnalysisListener l : listeners)
            l.onForwardPath(path);
    }

    @Override
    public void onCofactor(ForwardPath path, Expression cofactor) {
        for (AnalysisListener l : listeners)
            l.onCofactor(path, cofactor);
    }

    @Override
    public void onAnalysisComplete(Expression numerator, Expression denominator) {
        for (AnalysisListener l : listeners)
            l.onAnalysisComplete(numerator, denominator);
    }
}
