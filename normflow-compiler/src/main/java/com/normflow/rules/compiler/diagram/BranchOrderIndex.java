package com.normflow.rules.compiler.diagram;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Author-declared order of each decision node's outgoing flows, with an O(1)
 * {@code flow id -> position} lookup used to order branches during enumeration.
 */
public final class BranchOrderIndex {

    /** Position reported for flows a decision never declared. */
    public static final int UNDECLARED = Integer.MAX_VALUE;

    private final Map<String, List<String>> order = new LinkedHashMap<>();
    private final Map<String, Object2IntMap<String>> positions = new LinkedHashMap<>();

    /**
     * Records the declared outgoing flows of a decision node. Decisions that declare no
     * flows are not recorded.
     */
    public void declare(String decisionId, List<String> outgoingFlowIds) {
        if (outgoingFlowIds.isEmpty()) {
            return;
        }
        Object2IntMap<String> index = new Object2IntOpenHashMap<>();
        index.defaultReturnValue(UNDECLARED);
        for (int i = 0; i < outgoingFlowIds.size(); i++) {
            index.putIfAbsent(outgoingFlowIds.get(i), i);
        }
        order.put(decisionId, List.copyOf(outgoingFlowIds));
        positions.put(decisionId, index);
    }

    /**
     * Gets the declared position of a flow among the outgoing flows of a decision.
     *
     * @return the 0-based position, or {@link #UNDECLARED} if unknown
     */
    public int position(String decisionId, String flowId) {
        Object2IntMap<String> index = positions.get(decisionId);
        if (index == null || flowId == null) {
            return UNDECLARED;
        }
        return index.getInt(flowId);
    }

    public List<String> declaredOrder(String decisionId) {
        return order.getOrDefault(decisionId, List.of());
    }

    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(order);
    }

    public int size() {
        return order.size();
    }
}
