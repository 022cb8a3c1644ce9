package com.normflow.rules.compiler.diagram;

import com.normflow.rules.api.model.ProcessNode;

import java.util.List;
import java.util.Map;

/**
 * Output of the diagram front-end: the full graph of one process container.
 *
 * @param processId   id of the process container that was scanned
 * @param nodes       node id to node, in document order
 * @param flows       flow id to flow, in document order
 * @param outgoing    node id to outgoing flow ids; every node has an entry
 * @param incoming    node id to incoming flow ids; every node has an entry
 * @param branchOrder declared outgoing flow order of each decision node
 */
public record DiagramArtifacts(
        String processId,
        Map<String, ProcessNode> nodes,
        Map<String, DiagramFlow> flows,
        Map<String, List<String>> outgoing,
        Map<String, List<String>> incoming,
        BranchOrderIndex branchOrder
) {

    public List<String> outgoingOf(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<String> incomingOf(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }
}
