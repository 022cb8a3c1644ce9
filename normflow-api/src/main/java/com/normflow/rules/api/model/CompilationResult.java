/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a compilation run produces: the reduced graph it worked on, the synthesized
 * rules with their superiority chain, and run statistics.
 *
 * <p>{@code scenarios} is only present when path collection was enabled. The rules and the
 * precedence chain are identical either way.
 *
 * @param processId   id of the process container the rules were taken from
 * @param keptNodes   entry, exit and decision nodes in document order
 * @param reducedEdges reduced edges sorted by {@code (src, dst, guard, obligations)}
 * @param branchOrder decision node id to its authored outgoing flow ids
 * @param rules       one rule per scenario, in enumeration-completion order
 * @param precedence  superiority chain, {@code (r1, r2), (r2, r3), ...}
 * @param scenarios   enumerated paths, or null when not collected
 * @param warnings    distinct label normalization warnings
 * @param stats       counts and timings
 */
public record CompilationResult(
        String processId,
        Map<String, ProcessNode> keptNodes,
        List<ReducedEdge> reducedEdges,
        Map<String, List<String>> branchOrder,
        List<RuleIR> rules,
        List<Precedence> precedence,
        List<Scenario> scenarios,
        List<LabelFormatWarning> warnings,
        CompilationStats stats
) {

    public CompilationResult {
        keptNodes = Collections.unmodifiableMap(new LinkedHashMap<>(keptNodes));
        reducedEdges = List.copyOf(reducedEdges);
        branchOrder = Collections.unmodifiableMap(new LinkedHashMap<>(branchOrder));
        rules = List.copyOf(rules);
        precedence = List.copyOf(precedence);
        scenarios = scenarios != null ? List.copyOf(scenarios) : null;
        warnings = List.copyOf(warnings);
    }

    public Optional<List<Scenario>> collectedScenarios() {
        return Optional.ofNullable(scenarios);
    }

    public Optional<RuleIR> findRule(String ruleId) {
        return rules.stream().filter(r -> r.id().equals(ruleId)).findFirst();
    }
}
