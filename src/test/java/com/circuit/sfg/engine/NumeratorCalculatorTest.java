package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;
import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.graph.SignalFlowGraph;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class NumeratorCalculatorTest {

    private final LoopFinder loopFinder = new LoopFinder();
    private final CofactorCalculator cofactors = new CofactorCalculator(loopFinder, new NonTouchingLoopFinder(),
            new DeltaCalculator());
    private final NumeratorCalculator calculator = new NumeratorCalculator(new ForwardPathFinder(), cofactors,
            AnalysisListener.NONE);

    @Test
    public void testPathThroughLoopHasUnitCofactor() {
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2").addNode("x3")
                .addEdge("x1", "x2", "a")
                .addEdge("x2", "x3", "b")
                .addEdge("x2", "x2", "f")
                .build();
        assertEquals("a*b", calculator.calculateNumerator("x1", "x3", g).toString());
    }

    @Test
    public void testCofactorOfUntouchedLoop() {
        // Loop x3 <-> x4 hangs off x2 but is not on the path x1 -> x2 -> x5
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2").addNode("x3").addNode("x4").addNode("x5")
                .addEdge("x1", "x2", "a")
                .addEdge("x2", "x5", "b")
                .addEdge("x2", "x3", "c")
                .addEdge("x3", "x4", "d")
                .addEdge("x4", "x3", "e")
                .build();

        ForwardPath path = new ForwardPathFinder().findForwardPaths("x1", "x5", g).get(0);
        assertEquals("1 - d*e", cofactors.cofactor(path, g).toString());
        assertEquals("a*b - a*b*d*e", calculator.calculateNumerator("x1", "x5", g).toString());
    }

    @Test
    public void testNoForwardPathGivesZero() {
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2")
                .addEdge("x2", "x1", "a")
                .build();
        assertEquals(Expression.zero(), calculator.calculateNumerator("x1", "x2", g));
    }

    @Test
    public void testParallelForwardEdgesAdd() {
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2")
                .addEdge("x1", "x2", "a")
                .addEdge("x1", "x2", "b")
                .build();
        assertEquals("a + b", calculator.calculateNumerator("x1", "x2", g).toString());
    }

    @Test
    public void testResidualLeavesGraphUntouched() {
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2").addNode("x3")
                .addEdge("x1", "x2", "a")
                .addEdge("x2", "x3", "b")
                .addEdge("x3", "x3", "f")
                .addEdge("x3", "x1", "h")
                .build();

        ForwardPath path = new ForwardPathFinder().findForwardPaths("x1", "x2", g).get(0);
        SignalFlowGraph residual = cofactors.residual(path, g);
        assertEquals(1, residual.nodeCount());
        assertEquals(1, residual.edgeCount());
        assertEquals("1 - f", cofactors.cofactor(path, g).toString());

        assertEquals(3, g.nodeCount());
        assertEquals(4, g.edgeCount());
        assertEquals(2, g.lookup("x3").get().outgoingEdges().size());
    }

    @Test
    public void testMismatchedCountsFail() {
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2")
                .addEdge("x1", "x2", "a")
                .build();
        List<ForwardPath> paths = new ForwardPathFinder().findForwardPaths("x1", "x2", g);
        try {
            NumeratorCalculator.combine(paths, Collections.emptyList());
            fail("Should have thrown PathCofactorMismatchException");
        } catch (PathCofactorMismatchException e) {
            assertEquals(1, e.pathCount());
            assertEquals(0, e.cofactorCount());
            assertTrue(e.getMessage().contains("does not match"));
        }
    }
}
