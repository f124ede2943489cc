package com.circuit.sfg.engine;

import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.graph.Edge;
import com.circuit.sfg.graph.Node;
import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.*;

/**
 * Enumerates the simple paths from an input node to an output node.
 *
 * Reaching the output ends a branch successfully. A branch is abandoned when
 * its current node is already on the path or has no outgoing edges. Each
 * branch extends its own copy of the accumulated path, so siblings at a
 * fan-out never see each other's nodes.
 */
public final class ForwardPathFinder {
    private final AnalysisListener listener;

    public ForwardPathFinder() {
        this(AnalysisListener.NONE);
    }

    public ForwardPathFinder(AnalysisListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * @throws IllegalArgumentException if either id is not a node of the graph.
     */
    public List<ForwardPath> findForwardPaths(String startId, String endId, SignalFlowGraph graph) {
        Node start = require(graph, startId);
        require(graph, endId);
        List<ForwardPath> paths = new ArrayList<>();
        Set<String> dangling = new HashSet<>();
        walk(graph, start, endId, new ArrayList<>(), new ArrayList<>(), paths, dangling);
        return paths;
    }

    private void walk(SignalFlowGraph graph, Node current, String endId,
            List<String> nodes, List<Edge> edges, List<ForwardPath> paths, Set<String> dangling) {
        if (current.id().equals(endId)) {
            nodes.add(current.id());
            ForwardPath path = new ForwardPath(nodes, edges);
            paths.add(path);
            listener.onForwardPath(path);
            return;
        }
        if (nodes.contains(current.id()) || current.outgoingEdges().isEmpty())
            return;
        nodes.add(current.id());

        for (Edge edge : current.outgoingEdges()) {
            Optional<Node> next = graph.lookup(edge.destination());
            if (next.isEmpty()) {
                if (dangling.add(edge.id()))
                    listener.onDanglingEdge(edge);
                continue;
            }
            List<String> branchNodes = new ArrayList<>(nodes);
            List<Edge> branchEdges = new ArrayList<>(edges);
            branchEdges.add(edge);
            walk(graph, next.get(), endId, branchNodes, branchEdges, paths, dangling);
        }
    }

    private static Node require(SignalFlowGraph graph, String id) {
        return graph.lookup(id).orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id));
    }
}
