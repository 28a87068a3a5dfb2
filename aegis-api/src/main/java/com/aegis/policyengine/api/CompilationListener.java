/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>Each compilation runs three stages:
 * <ol>
 *   <li>ANALYSIS - eligibility analysis</li>
 *   <li>TEMPLATE_EXTRACTION - pre-computed Open and Conflict residuals</li>
 *   <li>CODE_GENERATION - fragment emission and composition</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * compiler.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         log.fine(stageName + " took " + result.durationMicros() + "us");
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    String ANALYSIS = "ANALYSIS";
    String TEMPLATE_EXTRACTION = "TEMPLATE_EXTRACTION";
    String CODE_GENERATION = "CODE_GENERATION";
    int TOTAL_STAGES = 3;

    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "pathCount", "fragmentCount")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
