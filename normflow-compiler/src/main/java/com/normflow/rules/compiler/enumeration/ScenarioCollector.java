package com.normflow.rules.compiler.enumeration;

import com.normflow.rules.api.model.Precedence;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.RuleIR;
import com.normflow.rules.api.model.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Default sink: keeps every rule and the precedence chain, and the scenario paths only
 * when asked to.
 */
public class ScenarioCollector implements ScenarioSink {
    private final boolean collectPaths;
    private final List<RuleIR> rules = new ArrayList<>();
    private final List<Precedence> precedence = new ArrayList<>();
    private final List<Scenario> scenarios;

    public ScenarioCollector(boolean collectPaths) {
        this.collectPaths = collectPaths;
        this.scenarios = collectPaths ? new ArrayList<>() : null;
    }

    @Override
    public void onRule(RuleIR rule, List<ReducedEdge> path) {
        rules.add(rule);
        if (collectPaths) {
            scenarios.add(new Scenario(rule.id(), path));
        }
    }

    @Override
    public void onPrecedence(Precedence link) {
        precedence.add(link);
    }

    public List<RuleIR> rules() {
        return Collections.unmodifiableList(rules);
    }

    public List<Precedence> precedence() {
        return Collections.unmodifiableList(precedence);
    }

    /**
     * @return the collected scenarios, or null when path collection is off
     */
    public List<Scenario> scenarios() {
        return scenarios == null ? null : Collections.unmodifiableList(scenarios);
    }

    public int ruleCount() {
        return rules.size();
    }
}
