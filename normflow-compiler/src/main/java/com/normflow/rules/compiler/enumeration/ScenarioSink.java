package com.normflow.rules.compiler.enumeration;

import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.RuleIR;

import java.util.List;

/**
 * Receives rules as the enumerator completes scenarios.
 */
public interface ScenarioSink {

    /**
     * Called once per completed entry-to-exit scenario, in completion order.
     *
     * @param rule the rule synthesized for the scenario
     * @param path the reduced edges of the scenario; a snapshot the sink may keep
     */
    void onRule(RuleIR rule, List<ReducedEdge> path);

    /**
     * Called after every rule but the first with the link to its predecessor.
     */
    default void onPrecedence(Precedence precedence) {
    }
}
