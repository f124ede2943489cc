package com.circuit.sfg.engine;

import com.circuit.sfg.api.AnalysisListener;
import com.circuit.sfg.graph.Edge;
import com.circuit.sfg.graph.Node;
import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Enumerates every simple directed cycle of a graph by depth-first search.
 *
 * <p>
 * Algorithm: each node in graph order becomes the root of one DFS. The search
 * keeps a visited set and a stack of the edges taken. For an edge {@code u -> v}:
 * <ul>
 * <li>{@code v} not in the graph: the edge is skipped, and reported to the
 * listener once per enumeration.</li>
 * <li>{@code v} is the root: {@code stack + edge} is recorded as a loop and the
 * search does not continue past it.</li>
 * <li>{@code v} already visited: skipped, the walk would not be simple.</li>
 * <li>otherwise: push, recurse, pop and unmark on the way back.</li>
 * </ul>
 * The root stays marked for its whole search and remains blocked for the
 * searches rooted at later nodes, so each cycle is reported once, rooted at
 * its first node in graph order.
 *
 * <p>
 * Self-loops are one-edge cycles. Parallel edges give distinct cycles.
 * Worst-case cost is exponential in the number of nodes.
 */
@Log4j2
public final class LoopFinder {
    private final AnalysisListener listener;

    public LoopFinder() {
        this(AnalysisListener.NONE);
    }

    public LoopFinder(AnalysisListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Finds all simple cycles. The graph is only read.
     *
     * @return Loops in discovery order; deterministic for a given edge order.
     */
    public List<Loop> findAllLoops(SignalFlowGraph graph) {
        Search search = new Search(graph);
        for (Node root : graph.nodes()) {
            search.visited.add(root.id());
            search.visit(root, root.id());
            // Root stays in 'visited': later roots must not reuse it
        }
        log.debug("Found {} loops in graph of {} nodes", search.loops.size(), graph.nodeCount());
        return search.loops;
    }

    /** Mutable traversal state shared by one enumeration. */
    private final class Search {
        private final SignalFlowGraph graph;
        private final Set<String> visited = new HashSet<>();
        private final Deque<Edge> stack = new ArrayDeque<>();
        private final List<Loop> loops = new ArrayList<>();
        private final Set<String> reportedDangling = new HashSet<>();

        Search(SignalFlowGraph graph) {
            this.graph = graph;
        }

        void visit(Node current, String rootId) {
            for (Edge edge : current.outgoingEdges()) {
                Optional<Node> next = graph.lookup(edge.destination());
                if (next.isEmpty()) {
                    if (reportedDangling.add(edge.id()))
                        listener.onDanglingEdge(edge);
                    continue;
                }
                String nextId = next.get().id();
                if (nextId.equals(rootId)) {
                    List<Edge> cycle = new ArrayList<>(stack.size() + 1);
                    cycle.addAll(stack);
                    cycle.add(edge);
                    Loop loop = new Loop(cycle);
                    loops.add(loop);
                    listener.onLoopFound(loop);
                    continue;
                }
                if (visited.contains(nextId))
                    continue;

                visited.add(nextId);
                stack.addLast(edge);
                try {
                    visit(next.get(), rootId);
                } finally {
                    stack.removeLast();
                    visited.remove(nextId);
                }
            }
        }
    }
}
