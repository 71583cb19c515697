package com.codereview.orchestrator.model;

/**
 * Lifecycle of a review task.
 *
 * Transitions:
 *   PENDING → RUNNING    (orchestrator claimed the task)
 *   RUNNING → COMPLETED  (every stage succeeded)
 *   RUNNING → FAILED     (a stage failed; remaining stages never run)
 *
 * There are no back transitions.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
