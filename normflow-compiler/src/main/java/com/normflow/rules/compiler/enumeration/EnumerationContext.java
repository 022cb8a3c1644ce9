package com.normflow.rules.compiler.enumeration;

import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.RuleIR;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one enumeration run: the current path, the nodes on it, and the rule
 * numbering that links consecutive rules into the precedence chain.
 */
final class EnumerationContext {
    private final ScenarioSink sink;
    private final List<ReducedEdge> path = new ArrayList<>();
    private final Set<String> onPath = new HashSet<>();
    private int ruleSequence;
    private String lastRuleId;

    EnumerationContext(ScenarioSink sink) {
        this.sink = sink;
    }

    boolean enter(String nodeId) {
        return onPath.add(nodeId);
    }

    void leave(String nodeId) {
        onPath.remove(nodeId);
    }

    void push(ReducedEdge edge) {
        path.add(edge);
    }

    void pop() {
        path.remove(path.size() - 1);
    }

    List<ReducedEdge> path() {
        return path;
    }

    String nextRuleId() {
        return "r" + (ruleSequence + 1);
    }

    void complete(RuleIR rule) {
        ruleSequence++;
        sink.onRule(rule, List.copyOf(path));
        if (lastRuleId != null) {
            sink.onPrecedence(new Precedence(lastRuleId, rule.id()));
        }
        lastRuleId = rule.id();
    }

    int ruleCount() {
        return ruleSequence;
    }
}
