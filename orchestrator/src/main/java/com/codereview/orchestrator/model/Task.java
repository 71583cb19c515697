package com.codereview.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable snapshot of one review task.
 *
 * The store hands these out and keeps the mutable record to itself, so a
 * caller holding a Task never observes a half-applied update.
 *
 * overallProgress is derived from stageStates (completed / total * 100)
 * and is recomputed by the store on every mutation.
 */
public record Task(
        UUID             id,
        String           fileName,
        String           filePath,
        long             fileSize,
        TaskStatus       status,
        int              stageCursor,
        int              overallProgress,
        List<StageState> stageStates,
        ReviewResult     result,
        String           error,
        Stage            failedStage,
        Instant          createdAt,
        Instant          updatedAt,
        Instant          startedAt,
        Instant          completedAt
) {
    public Task {
        stageStates = List.copyOf(stageStates);
    }

    public StageState stageState(Stage stage) {
        return stageStates.get(stage.ordinal());
    }

    public Stage currentStage() {
        return Stage.PIPELINE.get(stageCursor);
    }

    public Optional<ReviewResult> resultIfCompleted() {
        return Optional.ofNullable(result);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static int progressOf(List<StageState> states) {
        if (states.isEmpty()) return 0;
        long completed = states.stream()
                .filter(s -> s.status() == StageStatus.COMPLETED)
                .count();
        return (int) (completed * 100 / states.size());
    }
}
