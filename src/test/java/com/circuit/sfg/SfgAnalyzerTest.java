package com.circuit.sfg;

import com.circuit.sfg.engine.TransferFunction;
import com.circuit.sfg.graph.SignalFlowGraph;
import com.circuit.sfg.util.AnalysisStatsListener;
import org.junit.Test;

import static org.junit.Assert.*;

public class SfgAnalyzerTest {

    @Test
    public void testFeedbackChainResource() {
        SfgAnalyzer analyzer = SfgAnalyzer.fromResource("graphs/feedback_chain.json");
        TransferFunction tf = analyzer.transferFunction();
        assertEquals("x3/x1 = (a*b) / (1 - f)", tf.describe());
        assertEquals("feedback_chain", analyzer.getName());
    }

    @Test
    public void testTwoLoopsResource() {
        AnalysisStatsListener stats = new AnalysisStatsListener();
        SfgAnalyzer analyzer = SfgAnalyzer.fromResource("graphs/two_loops.json").addListener(stats);
        TransferFunction tf = analyzer.transferFunction();

        assertEquals("G4*G5 + G1*G2*G3*G4 + G2*G4*G5*H1", tf.numerator().toString());
        assertEquals("1 + G2*H1 + G4*H2 + G2*G4*H1*H2", tf.denominator().toString());
        assertEquals(2, stats.getForwardPaths());
    }

    @Test
    public void testAmplifierResource() {
        TransferFunction tf = SfgAnalyzer.fromResource("graphs/amplifier.json").transferFunction();
        assertEquals("-1/1000*A*R2", tf.numerator().toString());
        assertEquals("1 + A*C*R2*j*w", tf.denominator().toString());
    }

    @Test
    public void testExplicitEndpoints() {
        SfgAnalyzer analyzer = SfgAnalyzer.fromResource("graphs/two_loops.json");
        TransferFunction tf = analyzer.transferFunction("x2", "x4");
        assertEquals("x2", tf.startId());
        assertEquals("x4", tf.endId());
        assertEquals("G2*G3", tf.numerator().toString());
        assertEquals("1 + G2*H1 + G4*H2 + G2*G4*H1*H2", tf.denominator().toString());
    }

    @Test
    public void testExplainListsConnections() {
        String dump = SfgAnalyzer.fromResource("graphs/feedback_chain.json").explain();
        assertTrue(dump.contains("Node: x2"));
        assertTrue(dump.contains("Edge id x2x2: connected node = x2, weight = f"));
        assertTrue(dump.contains("The value stored in the node is 1"));
    }

    @Test
    public void testLoopGain() {
        assertEquals("-f", SfgAnalyzer.fromResource("graphs/feedback_chain.json").loopGain().loopGain().toString());
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingEndpoints() {
        SignalFlowGraph g = SignalFlowGraph.builder().addNode("x1").build();
        new SfgAnalyzer("bare", g, null, null).transferFunction();
    }
}
