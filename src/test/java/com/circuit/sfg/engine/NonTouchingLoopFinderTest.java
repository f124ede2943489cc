package com.circuit.sfg.engine;

import com.circuit.sfg.graph.Edge;
import com.circuit.sfg.graph.SignalFlowGraph;
import com.circuit.sfg.util.AnalysisStatsListener;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class NonTouchingLoopFinderTest {

    private final LoopFinder loopFinder = new LoopFinder();
    private final NonTouchingLoopFinder finder = new NonTouchingLoopFinder();

    private static SignalFlowGraph selfLoops(String... weights) {
        SignalFlowGraph.Builder b = SignalFlowGraph.builder();
        for (int i = 0; i < weights.length; i++)
            b.addNode("x" + i).addEdge("x" + i, "x" + i, weights[i]);
        return b.build();
    }

    @Test
    public void testNoLoops() {
        NonTouchingLoops result = finder.findNonTouching(Collections.emptyList());
        assertTrue(result.isEmpty());
        assertEquals(1, result.maxOrder());
    }

    @Test
    public void testSingleLoopHasNoCombinations() {
        List<Loop> loops = loopFinder.findAllLoops(selfLoops("f"));
        assertTrue(finder.findNonTouching(loops).isEmpty());
    }

    @Test
    public void testTwoDisjointLoopsGiveExactlyOnePair() {
        List<Loop> loops = loopFinder.findAllLoops(selfLoops("g1", "g2"));
        NonTouchingLoops result = finder.findNonTouching(loops);

        assertEquals(Set.of(2), result.byOrder().keySet());
        List<NonTouchingSet> pairs = result.ofOrder(2);
        assertEquals(1, pairs.size());
        assertEquals(List.of("x0x0", "x1x1"), pairs.get(0).key());
        assertEquals("g1*g2", pairs.get(0).gain().toString());
        assertEquals(2, pairs.get(0).edges().size());
    }

    @Test
    public void testPairFoundOnceWhateverTheLoopOrder() {
        List<Loop> loops = new ArrayList<>(loopFinder.findAllLoops(selfLoops("g1", "g2")));
        Collections.reverse(loops);
        NonTouchingLoops result = finder.findNonTouching(loops);
        assertEquals(1, result.ofOrder(2).size());
    }

    @Test
    public void testTouchingLoopsAreNotCombined() {
        // x0 <-> x1 and a self-loop on x1 share x1
        SignalFlowGraph g = SignalFlowGraph.builder()
                .addNode("x0").addNode("x1")
                .addEdge("x0", "x1", "a")
                .addEdge("x1", "x0", "b")
                .addEdge("x1", "x1", "c")
                .build();
        List<Loop> loops = loopFinder.findAllLoops(g);
        assertEquals(2, loops.size());
        assertTrue(finder.findNonTouching(loops).isEmpty());
    }

    @Test
    public void testThreeDisjointLoops() {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        List<Loop> loops = loopFinder.findAllLoops(selfLoops("a", "b", "c"));
        NonTouchingLoops result = new NonTouchingLoopFinder(stats).findNonTouching(loops);

        assertEquals(3, result.ofOrder(2).size());
        assertEquals(1, result.ofOrder(3).size());
        assertEquals(3, result.maxOrder());
        assertEquals("a*b*c", result.ofOrder(3).get(0).gain().toString());

        // Search stops after the first empty order
        assertEquals(Map.of(2, 3, 3, 1), stats.getCombinationsByOrder());
        assertTrue(result.ofOrder(4).isEmpty());
    }

    @Test
    public void testOrdersAreContiguous() {
        // Chain of loops where only neighbours touch: x0-x1, x1-x2, x2-x3, x3-x4
        SignalFlowGraph.Builder b = SignalFlowGraph.builder();
        for (int i = 0; i < 5; i++)
            b.addNode("x" + i);
        for (int i = 0; i < 4; i++) {
            b.addEdge("x" + i, "x" + (i + 1), "f" + i);
            b.addEdge("x" + (i + 1), "x" + i, "h" + i);
        }
        List<Loop> loops = loopFinder.findAllLoops(b.build());
        assertEquals(4, loops.size());

        NonTouchingLoops result = finder.findNonTouching(loops);
        // Disjoint pairs: (0,2), (0,3), (1,3)
        assertEquals(3, result.ofOrder(2).size());
        assertEquals(2, result.maxOrder());
        int expected = 2;
        for (int order : result.byOrder().keySet())
            assertEquals(expected++, order);
    }

    @Test
    public void testEdgeListsView() {
        List<Loop> loops = loopFinder.findAllLoops(selfLoops("g1", "g2"));
        Map<Integer, List<List<Edge>>> lists = finder.findNonTouching(loops).asEdgeLists();
        assertEquals(1, lists.size());
        assertEquals(2, lists.get(2).get(0).size());
    }

    @Test
    public void testCombinationsAreUnique() {
        List<Loop> loops = loopFinder.findAllLoops(selfLoops("a", "b", "c", "d"));
        NonTouchingLoops result = finder.findNonTouching(loops);
        assertEquals(6, result.ofOrder(2).size());
        assertEquals(4, result.ofOrder(3).size());
        assertEquals(1, result.ofOrder(4).size());
        for (List<NonTouchingSet> level : result.byOrder().values())
            assertEquals(level.size(), new HashSet<>(level).size());
    }
}
