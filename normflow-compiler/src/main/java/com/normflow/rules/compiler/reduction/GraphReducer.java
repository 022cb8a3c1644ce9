/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.compiler.reduction;

import com.normflow.rules.api.exceptions.StructuralException;
import com.normflow.rules.api.model.NodeKind;
import com.normflow.rules.api.model.ProcessNode;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.compiler.diagram.DiagramArtifacts;
import com.normflow.rules.compiler.diagram.DiagramFlow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Collapses the full diagram graph onto its entry, exit and decision nodes.
 *
 * <p>For every kept node {@code k} and every flow {@code f0} leaving it, a forward walk
 * follows all outgoing flows until a kept node other than {@code k} is reached, collecting
 * the labels of obligation nodes and the ids of traversed flows on the way. Each walk that
 * reaches a kept node yields one {@link ReducedEdge}; the guard of the edge is the label of
 * {@code f0} when {@code k} is a decision node.
 *
 * <p><b>Cycle guard:</b> a walk tracks the {@code (node, lastFlowId)} states it has visited
 * and stops expanding a branch that returns to one. This terminates on any input but may
 * drop distinct paths that pass through an already-visited state in heavily cyclic
 * diagrams. Process diagrams are expected to be close to acyclic.
 *
 * <p><b>Deduplication:</b> edges are unique by {@code (src, dst, guard, obligations)}. Two
 * flow sequences that reach the same kept node with the same guard and obligations collapse
 * into one edge that keeps the flows of the first walk.
 *
 * <p>Walks use an explicit work-stack, so long chains of collapsed nodes do not grow the
 * call stack.
 */
public class GraphReducer {
    private static final Logger logger = Logger.getLogger(GraphReducer.class.getName());

    /**
     * Orders reduced edges by source, destination, guard (absent sorts as empty) and then
     * the obligation sequence compared element by element.
     */
    public static final Comparator<ReducedEdge> EDGE_ORDER = Comparator
            .comparing(ReducedEdge::src)
            .thenComparing(ReducedEdge::dst)
            .thenComparing(e -> e.guard() != null ? e.guard() : "")
            .thenComparing(ReducedEdge::obligations, GraphReducer::compareSequences);

    public ReducedGraph reduce(DiagramArtifacts artifacts) {
        Map<String, ProcessNode> kept = artifacts.nodes().values().stream()
                .filter(n -> n.kind().isKept())
                .collect(Collectors.toMap(ProcessNode::id, n -> n, (a, b) -> a, LinkedHashMap::new));

        String entryId = validate(kept);

        Map<TransitionKey, ReducedEdge> unique = new LinkedHashMap<>();
        int walks = 0;
        for (ProcessNode source : kept.values()) {
            for (String firstFlowId : artifacts.outgoingOf(source.id())) {
                walk(artifacts, kept, source, firstFlowId, unique);
                walks++;
            }
        }

        List<ReducedEdge> edges = new ArrayList<>(unique.values());
        edges.sort(EDGE_ORDER);

        int walkCount = walks;
        logger.fine(() -> String.format("Reduced %d nodes to %d kept nodes and %d edges (%d walks)",
                artifacts.nodes().size(), kept.size(), edges.size(), walkCount));

        return new ReducedGraph(entryId, kept, edges, artifacts.branchOrder());
    }

    private String validate(Map<String, ProcessNode> kept) {
        List<String> entries = idsOfKind(kept, NodeKind.ENTRY);
        List<String> exits = idsOfKind(kept, NodeKind.EXIT);
        if (entries.size() != 1) {
            throw new StructuralException("Expected exactly 1 entry node (startEvent); got " + entries.size()
                    + (entries.isEmpty() ? "" : " " + entries));
        }
        if (exits.isEmpty()) {
            throw new StructuralException("Expected at least 1 exit node (endEvent)");
        }
        return entries.get(0);
    }

    private void walk(DiagramArtifacts artifacts,
                      Map<String, ProcessNode> kept,
                      ProcessNode source,
                      String firstFlowId,
                      Map<TransitionKey, ReducedEdge> unique) {
        DiagramFlow first = artifacts.flows().get(firstFlowId);
        String guard = null;
        if (source.kind() == NodeKind.DECISION) {
            guard = first.label() != null ? first.label() : "";
        }

        Set<VisitState> seen = new HashSet<>();
        Deque<WalkFrame> stack = new ArrayDeque<>();
        stack.push(WalkFrame.start(first, obligationLabel(artifacts, first.targetId())));

        while (!stack.isEmpty()) {
            WalkFrame frame = stack.pop();
            if (!seen.add(new VisitState(frame.node(), frame.lastFlowId()))) {
                continue;
            }

            if (kept.containsKey(frame.node()) && !frame.node().equals(source.id())) {
                ReducedEdge edge = new ReducedEdge(source.id(), frame.node(), guard,
                        frame.obligations(), frame.viaFlows());
                unique.putIfAbsent(new TransitionKey(edge), edge);
                continue;
            }

            // Pushed in reverse so flows are expanded in document order
            List<String> next = artifacts.outgoingOf(frame.node());
            for (int i = next.size() - 1; i >= 0; i--) {
                DiagramFlow flow = artifacts.flows().get(next.get(i));
                stack.push(frame.advance(flow, obligationLabel(artifacts, flow.targetId())));
            }
        }
    }

    private static String obligationLabel(DiagramArtifacts artifacts, String nodeId) {
        ProcessNode node = artifacts.nodes().get(nodeId);
        if (node == null || node.kind() != NodeKind.OBLIGATION) {
            return null;
        }
        return node.label().isEmpty() ? node.id() : node.label();
    }

    private static List<String> idsOfKind(Map<String, ProcessNode> nodes, NodeKind kind) {
        return nodes.values().stream()
                .filter(n -> n.kind() == kind)
                .map(ProcessNode::id)
                .collect(Collectors.toList());
    }

    private static int compareSequences(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private record VisitState(String node, String lastFlowId) {
    }

    private record TransitionKey(String src, String dst, String guard, List<String> obligations) {
        TransitionKey(ReducedEdge edge) {
            this(edge.src(), edge.dst(), edge.guard(), edge.obligations());
        }
    }

    /**
     * One pending step of a walk: the node reached and what was collected on the way there.
     */
    private record WalkFrame(String node, List<String> obligations, List<String> viaFlows) {

        static WalkFrame start(DiagramFlow first, String obligation) {
            List<String> obligations = obligation != null ? List.of(obligation) : List.of();
            return new WalkFrame(first.targetId(), obligations, List.of(first.id()));
        }

        String lastFlowId() {
            return viaFlows.isEmpty() ? "" : viaFlows.get(viaFlows.size() - 1);
        }

        WalkFrame advance(DiagramFlow flow, String obligation) {
            List<String> nextObligations = obligations;
            if (obligation != null) {
                nextObligations = new ArrayList<>(obligations.size() + 1);
                nextObligations.addAll(obligations);
                nextObligations.add(obligation);
            }
            List<String> nextFlows = new ArrayList<>(viaFlows.size() + 1);
            nextFlows.addAll(viaFlows);
            nextFlows.add(flow.id());
            return new WalkFrame(flow.targetId(), nextObligations, nextFlows);
        }
    }
}
