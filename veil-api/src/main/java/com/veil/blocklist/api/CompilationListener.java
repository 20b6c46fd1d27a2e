/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api;

import java.util.Map;

/**
 * Callback interface for bulk-initialization stage events.
 *
 * <p>Bulk initialization runs two stages:
 * <ol>
 *   <li>PARSING - compile raw pattern strings into their typed form</li>
 *   <li>INDEXING - populate the domain index, Bloom filter and wildcard automata</li>
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
 * </pre>
 */
public interface CompilationListener {

    String STAGE_PARSING = "PARSING";
    String STAGE_INDEXING = "INDEXING";

    /**
     * Called when a stage starts.
     *
     * @param stageName   name of the stage
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a stage completes successfully.
     *
     * @param stageName name of the stage
     * @param result    duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails.
     *
     * @param stageName name of the stage that failed
     * @param error     the failure
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single stage.
     *
     * @param stageName     name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics       stage-specific metrics (e.g. "accepted", "rejected")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
