package com.codereview.orchestrator.model;

/**
 * Execution state of a single stage within a task.
 *
 *   IDLE → RUNNING → COMPLETED
 *                  ↘ FAILED
 *
 * COMPLETED and FAILED are final for the stage.
 */
public enum StageStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
