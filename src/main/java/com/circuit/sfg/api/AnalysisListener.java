package com.circuit.sfg.api;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.engine.ForwardPath;
import com.circuit.sfg.engine.Loop;
import com.circuit.sfg.graph.Edge;

/**
 * Observability hook for the Mason analysis.
 *
 * Implementations are handed to the engine components explicitly; there is no
 * global trace switch. Every callback defaults to a no-op so a listener only
 * overrides what it cares about.
 *
 * Callbacks run inline on the analysis thread, inside the recursive searches.
 * Keep them cheap.
 */
public interface AnalysisListener {

    /** Shared no-op instance. */
    AnalysisListener NONE = new AnalysisListener() {
    };

    /**
     * Called for each simple cycle as it is discovered.
     *
     * @param loop The cycle, in traversal order starting at its root.
     */
    default void onLoopFound(Loop loop) {
    }

    /**
     * Called when a traversal meets an edge whose destination is not in the
     * graph. The edge is skipped.
     */
    default void onDanglingEdge(Edge edge) {
    }

    /**
     * Called after a level of non-touching combinations has been built.
     *
     * @param order Number of loops per combination (2 and up).
     * @param count Combinations found at this level; 0 ends the search.
     */
    default void onNonTouchingLevel(int order, int count) {
    }

    /** Called for each forward path found between the designated nodes. */
    default void onForwardPath(ForwardPath path) {
    }

    /** Called once the cofactor of a forward path is known. */
    default void onCofactor(ForwardPath path, Expression cofactor) {
    }

    /**
     * Called at the end of a transfer function computation.
     *
     * @param numerator   Sum of forward gains times cofactors.
     * @param denominator The graph determinant.
     */
    default void onAnalysisComplete(Expression numerator, Expression denominator) {
    }
}
