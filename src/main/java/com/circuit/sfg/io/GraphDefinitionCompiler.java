package com.circuit.sfg.io;

import com.circuit.sfg.graph.SignalFlowGraph;

import java.util.Collections;
import java.util.List;

/**
 * Turns a {@link GraphDefinition} into a {@link SignalFlowGraph}.
 *
 * All nodes are declared before any edge is added, so edges may point at
 * nodes defined later in the file. Edges to ids that no node declares are
 * kept as dangling edges.
 */
public final class GraphDefinitionCompiler {

    public SignalFlowGraph compile(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new GraphDefinitionException("Missing 'graph' key");
        List<GraphDefinition.NodeDef> nodeDefs = info.getNodes() != null ? info.getNodes() : Collections.emptyList();

        SignalFlowGraph.Builder builder = SignalFlowGraph.builder();
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getId() == null || nd.getId().isBlank())
                throw new GraphDefinitionException("Node without id in graph " + info.getName());
            try {
                builder.addNode(nd.getId(), nd.getValue());
            } catch (IllegalArgumentException e) {
                throw new GraphDefinitionException(e.getMessage(), e);
            }
        }

        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getEdges() == null)
                continue;
            for (GraphDefinition.EdgeDef ed : nd.getEdges()) {
                if (ed.getTo() == null)
                    throw new GraphDefinitionException("Edge without 'to' on node " + nd.getId());
                if (ed.getWeight() == null)
                    throw new GraphDefinitionException(
                            "Edge " + nd.getId() + " -> " + ed.getTo() + " has no weight");
                builder.addEdge(nd.getId(), ed.getTo(), ed.getWeight());
            }
        }
        return builder.build();
    }
}
