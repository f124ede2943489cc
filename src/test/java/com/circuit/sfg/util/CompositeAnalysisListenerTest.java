package com.circuit.sfg.util;

import com.circuit.sfg.engine.MasonSolver;
import com.circuit.sfg.graph.SignalFlowGraph;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompositeAnalysisListenerTest {

    @Test
    public void testFansOutToAllListeners() {
        AnalysisStatsListener first = new AnalysisStatsListener();
        AnalysisStatsListener second = new AnalysisStatsListener();
        CompositeAnalysisListener composite = new CompositeAnalysisListener()
                .add(first)
                .add(new LoggingAnalysisListener())
                .add(second);
        assertEquals(3, composite.size());

        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x1").addNode("x2")
                .addEdge("x1", "x2", "a")
                .addEdge("x2", "x1", "h")
                .addEdge("x2", "ghost", "z")
                .build();
        new MasonSolver(composite).computeTransferFunction(g, "x1", "x2");

        for (AnalysisStatsListener stats : new AnalysisStatsListener[] { first, second }) {
            assertEquals(1, stats.getLoopsFound());
            assertEquals(1, stats.getForwardPaths());
            assertEquals(1, stats.getCofactors());
            assertEquals(1, stats.getAnalyses());
            assertTrue(stats.getDanglingEdges() > 0);
        }
    }

    @Test
    public void testReset() {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        stats.onForwardPath(null);
        stats.onNonTouchingLevel(2, 4);
        stats.onNonTouchingLevel(3, 0);
        assertEquals(1, stats.getForwardPaths());
        assertEquals(1, stats.getCombinationsByOrder().size());
        stats.reset();
        assertEquals(0, stats.getForwardPaths());
        assertTrue(stats.getCombinationsByOrder().isEmpty());
    }
}
