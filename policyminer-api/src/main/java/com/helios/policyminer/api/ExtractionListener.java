/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api;

import java.util.Map;

/**
 * Callback interface for extraction stage events.
 * Lets audit tooling and monitoring follow a mining run.
 *
 * <p>An extraction run has 3 stages:
 * <ol>
 *   <li>COUNTING - tally action, antecedent and co-occurrence frequencies</li>
 *   <li>SCORING - compute support, confidence and lift, apply thresholds</li>
 *   <li>RANKING - order by confidence and assign policy ids</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * ExtractionListener listener = new ExtractionListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s: %s%n", stageName, result.metrics());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * extractor.setExtractionListener(listener);
 * PolicySet policies = extractor.extract(logs);
 * </pre>
 */
public interface ExtractionListener {

    String STAGE_COUNTING = "COUNTING";
    String STAGE_SCORING = "SCORING";
    String STAGE_RANKING = "RANKING";
    int TOTAL_STAGES = 3;

    /**
     * Called when an extraction stage starts.
     *
     * @param stageName   name of the stage (e.g. "COUNTING")
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when an extraction stage completes.
     *
     * @param stageName name of the stage
     * @param result    duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails. Only the parallel counting pass can fail,
     * when one of its workers does.
     *
     * @param stageName name of the stage that failed
     * @param error     the exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single extraction stage.
     *
     * @param stageName     name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics       stage-specific metrics (e.g. "candidateRules", "acceptedRules")
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
    }
}
