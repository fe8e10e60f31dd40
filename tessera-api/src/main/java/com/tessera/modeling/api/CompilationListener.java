/*
 * Copyright (c) 2025 Tessera Modeling Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.modeling.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 * Allows monitoring systems and the command line to track compilation progress.
 *
 * <p>The compilation pipeline consists of 6 stages:
 * <ol>
 *   <li>PARSING - Tokenize and parse model and data text</li>
 *   <li>VALIDATION - Build the symbol table, check references, shapes and cycles</li>
 *   <li>DATA_BINDING - Resolve sets and materialize parameter tables</li>
 *   <li>COLUMN_GENERATION - Allocate one column per variable tuple</li>
 *   <li>ROW_GENERATION - Instantiate constraint templates</li>
 *   <li>OBJECTIVE - Evaluate the objective row</li>
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
 * IModelCompiler compiler = new ModelCompiler(tracer);
 * compiler.setCompilationListener(listener);
 * Instance instance = compiler.compile(modelPath, dataPath);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "VALIDATION")
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
     * @param metrics Stage-specific metrics (e.g., "rowCount", "columnCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        /**
         * Returns the duration in microseconds.
         */
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
