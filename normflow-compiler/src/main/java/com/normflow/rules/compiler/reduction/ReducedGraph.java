package com.normflow.rules.compiler.reduction;

import com.normflow.rules.api.model.NodeKind;
import com.normflow.rules.api.model.ProcessNode;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.compiler.diagram.BranchOrderIndex;

import java.util.List;
import java.util.Map;

/**
 * The control-flow graph restricted to entry, exit and decision nodes.
 *
 * @param entryId     id of the single entry node
 * @param keptNodes   kept nodes in document order
 * @param edges       reduced edges sorted by {@code (src, dst, guard, obligations)}
 * @param branchOrder declared branch order, passed through from the front-end
 */
public record ReducedGraph(
        String entryId,
        Map<String, ProcessNode> keptNodes,
        List<ReducedEdge> edges,
        BranchOrderIndex branchOrder
) {

    public ReducedGraph {
        edges = List.copyOf(edges);
    }

    public ProcessNode node(String id) {
        return keptNodes.get(id);
    }

    public boolean isExit(String id) {
        ProcessNode node = keptNodes.get(id);
        return node != null && node.kind() == NodeKind.EXIT;
    }

    public boolean isDecision(String id) {
        ProcessNode node = keptNodes.get(id);
        return node != null && node.kind() == NodeKind.DECISION;
    }
}
