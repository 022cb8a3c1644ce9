package com.normflow.rules.api.model;

import java.util.List;

/**
 * One complete entry-to-exit traversal of the reduced graph and the rule built from it.
 */
public record Scenario(String ruleId, List<ReducedEdge> edges) {

    public Scenario {
        edges = List.copyOf(edges);
    }
}
