package com.circuit.sfg.util;

import com.circuit.sfg.engine.ForwardPath;
import com.circuit.sfg.engine.Loop;
import com.circuit.sfg.engine.NonTouchingLoops;
import com.circuit.sfg.engine.NonTouchingSet;
import com.circuit.sfg.graph.Edge;
import com.circuit.sfg.graph.Node;
import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a signal-flow graph and the structures
 * derived from it.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and log output. Allocates
 * strings freely.
 */
public final class GraphExplain {
    private static final String RULE = "------------------------------------\n";

    private final SignalFlowGraph graph;

    public GraphExplain(SignalFlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps each node with its stored value and its outgoing connections.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("SFG (").append(graph.nodeCount()).append(" nodes, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (Node node : graph.nodes())
            sb.append(explainNode(node));
        return sb.toString();
    }

    /**
     * Dumps a single node.
     *
     * @throws IllegalArgumentException if the node is unknown.
     */
    public String explainNode(String id) {
        return explainNode(graph.lookup(id).orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id)));
    }

    private String explainNode(Node node) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(RULE)
                .append("Node: ").append(node.id()).append('\n')
                .append("The value stored in the node is ").append(node.value()).append('\n')
                .append(RULE)
                .append("Connections: \n");
        for (Edge e : node.outgoingEdges()) {
            sb.append("Edge id ").append(e.id())
                    .append(": connected node = ").append(e.destination())
                    .append(", weight = ").append(e.weight());
            if (!graph.contains(e.destination()))
                sb.append(" (dangling)");
            sb.append('\n');
        }
        return sb.toString();
    }

    /** One line per loop with its gain. */
    public static String describeLoops(List<Loop> loops) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Found ").append(loops.size()).append(" loops:\n");
        for (Loop l : loops)
            sb.append("  ").append(l).append("  [").append(l.gain()).append("]\n");
        return sb.toString();
    }

    /** Non-touching combinations grouped by order. */
    public static String describeNonTouching(NonTouchingLoops nonTouching) {
        StringBuilder sb = new StringBuilder(256);
        for (Map.Entry<Integer, List<NonTouchingSet>> e : nonTouching.byOrder().entrySet()) {
            sb.append(e.getKey()).append(" =>\n");
            for (NonTouchingSet s : e.getValue())
                sb.append("  ").append(s).append('\n');
        }
        return sb.toString();
    }

    /** One line per forward path with its gain. */
    public static String describePaths(List<ForwardPath> paths) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Found ").append(paths.size()).append(" forward paths:\n");
        for (ForwardPath p : paths)
            sb.append("  ").append(p).append("  [").append(p.gain()).append("]\n");
        return sb.toString();
    }
}
