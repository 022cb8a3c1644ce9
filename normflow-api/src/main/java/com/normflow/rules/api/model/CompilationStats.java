package com.normflow.rules.api.model;

import java.util.Map;

public record CompilationStats(
        int diagramNodeCount,
        int flowCount,
        int keptNodeCount,
        int reducedEdgeCount,
        int scenarioCount,
        long compilationTimeNanos,
        Map<String, Object> metadata
) {

    public CompilationStats {
        metadata = Map.copyOf(metadata);
    }
}
