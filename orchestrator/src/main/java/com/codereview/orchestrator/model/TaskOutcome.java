package com.codereview.orchestrator.model;

/**
 * How a task ended. Passed to {@code TaskStore.finalize}.
 */
public interface TaskOutcome {

    TaskStatus status();

    record Completed(ReviewResult result) implements TaskOutcome {
        @Override
        public TaskStatus status() { return TaskStatus.COMPLETED; }
    }

    record Failed(Stage stage, String error) implements TaskOutcome {
        @Override
        public TaskStatus status() { return TaskStatus.FAILED; }
    }
}
