/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.compiler.enumeration;

import com.normflow.rules.api.exceptions.StructuralException;
import com.normflow.rules.api.model.Action;
import com.normflow.rules.api.model.Condition;
import com.normflow.rules.api.model.LabelFormatWarning;
import com.normflow.rules.api.model.ProcessNode;
import com.normflow.rules.api.model.ReducedEdge;
import com.normflow.rules.api.model.RuleIR;
import com.normflow.rules.compiler.BranchLabelPolicy;
import com.normflow.rules.compiler.CompilerOptions;
import com.normflow.rules.compiler.reduction.ReducedGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the {@link RuleIR} of one scenario.
 *
 * <p>Conditions come from edges leaving a decision node whose guard is exactly the
 * affirmative or negative branch label; the actor and predicate are split from the
 * decision's own label. Actions come from every obligation label on the path, in path
 * order. Both lists keep the first occurrence: a condition on an {@code (actor, predicate)}
 * pair already present is dropped even when its value differs.
 *
 * <p>Labels that fall back to the placeholder actor are recorded once each as
 * {@link LabelFormatWarning}s.
 */
public class RuleSynthesizer {
    private static final Logger logger = Logger.getLogger(RuleSynthesizer.class.getName());

    private final CompilerOptions options;
    private final Set<LabelFormatWarning> warnings = new LinkedHashSet<>();

    public RuleSynthesizer(CompilerOptions options) {
        this.options = options;
    }

    public RuleIR synthesize(String ruleId, List<ReducedEdge> path, ReducedGraph graph) {
        Map<String, Condition> conditions = new LinkedHashMap<>();
        Set<Action> actions = new LinkedHashSet<>();

        for (ReducedEdge edge : path) {
            if (graph.isDecision(edge.src())) {
                Boolean value = branchValue(edge.guard());
                if (value != null) {
                    ProcessNode decision = graph.node(edge.src());
                    LabelNormalizer.SplitLabel split = LabelNormalizer.splitCondition(decision.label());
                    record(LabelFormatWarning.Role.CONDITION, decision.label(), split);
                    addCondition(ruleId, conditions, new Condition(split.actor(), split.symbol(), value));
                }
            }
            for (String obligation : edge.obligations()) {
                LabelNormalizer.SplitLabel split = LabelNormalizer.splitAction(obligation);
                record(LabelFormatWarning.Role.ACTION, obligation, split);
                actions.add(new Action(split.actor(), split.symbol()));
            }
        }

        if (actions.isEmpty()) {
            logger.fine(() -> "Scenario " + ruleId + " carries no obligations; emitting vacuous rule");
        }
        return new RuleIR(ruleId, new ArrayList<>(conditions.values()), new ArrayList<>(actions));
    }

    /**
     * Rejects decision edges whose guard is neither branch label when the policy is
     * {@link BranchLabelPolicy#STRICT}. Does nothing under the lenient policy.
     *
     * @throws StructuralException on the first unrecognized guard
     */
    public void checkBranchLabels(ReducedGraph graph) {
        if (options.branchLabelPolicy() != BranchLabelPolicy.STRICT) {
            return;
        }
        for (ReducedEdge edge : graph.edges()) {
            if (graph.isDecision(edge.src()) && branchValue(edge.guard()) == null) {
                throw new StructuralException(String.format(
                        "Decision %s has branch %s labelled '%s'; expected '%s' or '%s'",
                        edge.src(), edge.firstFlowId(), edge.guard(),
                        options.affirmativeLabel(), options.negativeLabel()));
            }
        }
    }

    public List<LabelFormatWarning> warnings() {
        return List.copyOf(warnings);
    }

    private static void addCondition(String ruleId, Map<String, Condition> conditions, Condition condition) {
        String key = condition.actor() + ' ' + condition.predicate();
        Condition existing = conditions.putIfAbsent(key, condition);
        if (existing != null && existing.value() != condition.value()) {
            logger.warning(String.format("Rule %s: condition %s is both %s and %s; keeping %s",
                    ruleId, key, existing.value(), condition.value(), existing.value()));
        }
    }

    private Boolean branchValue(String guard) {
        if (options.affirmativeLabel().equals(guard)) {
            return Boolean.TRUE;
        }
        if (options.negativeLabel().equals(guard)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private void record(LabelFormatWarning.Role role, String label, LabelNormalizer.SplitLabel split) {
        if (!split.fallback()) {
            return;
        }
        LabelFormatWarning warning = new LabelFormatWarning(role, label, split.actor(), split.symbol());
        if (warnings.add(warning)) {
            logger.warning(String.format("%s label '%s' has no actor part; using %s(%s)",
                    role, label, split.actor(), split.symbol()));
        }
    }
}
