package com.codereview.orchestrator.model;

import java.time.Instant;

/**
 * Point-in-time view of one stage of a task.
 */
public record StageState(
        Stage       stage,
        StageStatus status,
        String      message,
        int         progress,
        Instant     updatedAt
) {
    public static StageState idle(Stage stage, Instant at) {
        return new StageState(stage, StageStatus.IDLE, "Waiting to start", 0, at);
    }
}
