/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>The compilation pipeline consists of 3 stages:
 * <ol>
 *   <li>PARSING - Read the diagram markup into node and flow tables</li>
 *   <li>REDUCTION - Collapse the graph onto entry, exit and decision nodes</li>
 *   <li>ENUMERATION - Enumerate scenarios and synthesize one rule per scenario</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IProcessRuleCompiler compiler = new ProcessRuleCompiler();
 * compiler.setCompilationListener(listener);
 * CompilationResult result = compiler.compile(diagramPath);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "REDUCTION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "nodeCount", "reducedEdgeCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
