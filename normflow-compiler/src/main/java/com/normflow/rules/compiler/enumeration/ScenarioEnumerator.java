/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.compiler.enumeration;

import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.RuleIR;
import com.normflow.rules.compiler.reduction.ReducedGraph;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Enumerates every entry-to-exit scenario of a reduced graph and turns each into a rule.
 *
 * <p><b>Ordering:</b> the edges leaving a decision node are tried in the order the
 * decision declares its outgoing flows, so the affirmative branch of a typical
 * {@code Yes}/{@code No} gateway yields the lower rule id regardless of where its flow sits
 * in the document. Edges leaving any other node keep the reduced-graph order. Combined with
 * the sorted reduced edges this makes rule ids and the precedence chain deterministic.
 *
 * <p><b>Cycles:</b> a node already on the current path is not re-entered. Reaching an exit
 * completes a scenario even if the exit was seen on another path.
 *
 * <p>Rules are numbered {@code r1, r2, ...} in completion order and each rule after the
 * first is placed below its predecessor in the precedence chain.
 */
public class ScenarioEnumerator {
    private static final Logger logger = Logger.getLogger(ScenarioEnumerator.class.getName());

    private static final int UNREACHED = Integer.MAX_VALUE;

    private final RuleSynthesizer synthesizer;

    public ScenarioEnumerator(RuleSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * Runs the enumeration, pushing every rule and precedence link to {@code sink}.
     *
     * @return the number of scenarios found
     */
    public int enumerate(ReducedGraph graph, ScenarioSink sink) {
        Object2IntMap<String> depth = hopDepths(graph);
        Map<String, List<ReducedEdge>> adjacency = orderedAdjacency(graph, depth);

        EnumerationContext context = new EnumerationContext(sink);
        visit(graph.entryId(), graph, adjacency, context);

        logger.fine(() -> String.format("Enumerated %d scenarios from entry %s",
                context.ruleCount(), graph.entryId()));
        return context.ruleCount();
    }

    private void visit(String nodeId,
                       ReducedGraph graph,
                       Map<String, List<ReducedEdge>> adjacency,
                       EnumerationContext context) {
        if (graph.isExit(nodeId)) {
            RuleIR rule = synthesizer.synthesize(context.nextRuleId(), context.path(), graph);
            context.complete(rule);
            return;
        }
        if (!context.enter(nodeId)) {
            return;
        }
        for (ReducedEdge edge : adjacency.getOrDefault(nodeId, List.of())) {
            context.push(edge);
            visit(edge.dst(), graph, adjacency, context);
            context.pop();
        }
        context.leave(nodeId);
    }

    /**
     * Minimum hop count from the entry over reduced edges. Unreachable nodes are absent and
     * read as {@link #UNREACHED}.
     */
    static Object2IntMap<String> hopDepths(ReducedGraph graph) {
        Map<String, List<String>> successors = new LinkedHashMap<>();
        for (ReducedEdge edge : graph.edges()) {
            successors.computeIfAbsent(edge.src(), k -> new ArrayList<>()).add(edge.dst());
        }

        Object2IntMap<String> depth = new Object2IntOpenHashMap<>();
        depth.defaultReturnValue(UNREACHED);
        Deque<String> queue = new ArrayDeque<>();
        depth.put(graph.entryId(), 0);
        queue.add(graph.entryId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = depth.getInt(current) + 1;
            for (String successor : successors.getOrDefault(current, List.of())) {
                if (!depth.containsKey(successor)) {
                    depth.put(successor, next);
                    queue.add(successor);
                }
            }
        }
        return depth;
    }

    private static Map<String, List<ReducedEdge>> orderedAdjacency(ReducedGraph graph, Object2IntMap<String> depth) {
        Comparator<ReducedEdge> priority = Comparator
                .comparingInt((ReducedEdge e) -> graph.isDecision(e.src()) ? depth.getInt(e.src()) : UNREACHED)
                .thenComparingInt(e -> graph.isDecision(e.src())
                        ? graph.branchOrder().position(e.src(), e.firstFlowId())
                        : UNREACHED);

        Map<String, List<ReducedEdge>> adjacency = new LinkedHashMap<>();
        for (ReducedEdge edge : graph.edges()) {
            adjacency.computeIfAbsent(edge.src(), k -> new ArrayList<>()).add(edge);
        }
        // List.sort is stable, so ties keep the reduced-graph order
        adjacency.values().forEach(edges -> edges.sort(priority));
        return adjacency;
    }
}
