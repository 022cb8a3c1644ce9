package com.normflow.rules.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A transition of the reduced graph between two kept nodes.
 *
 * @param src         id of the source node (entry or decision)
 * @param dst         id of the kept node reached
 * @param guard       label of the first flow leaving {@code src}; non-null iff {@code src} is a decision
 * @param obligations obligation labels collapsed into this transition, in traversal order
 * @param viaFlows    ids of the traversed flows, in traversal order
 */
public record ReducedEdge(
        String src,
        String dst,
        String guard,
        List<String> obligations,
        List<String> viaFlows
) {

    public ReducedEdge {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        obligations = List.copyOf(obligations);
        viaFlows = List.copyOf(viaFlows);
    }

    /**
     * Returns the id of the flow that leaves {@code src}, or null for an edge without flows.
     */
    public String firstFlowId() {
        return viaFlows.isEmpty() ? null : viaFlows.get(0);
    }
}
