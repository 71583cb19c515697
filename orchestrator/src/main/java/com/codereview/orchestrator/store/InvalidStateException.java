package com.codereview.orchestrator.store;

import com.codereview.orchestrator.model.TaskStatus;

import java.util.UUID;

/**
 * Thrown when a task is asked to make a transition its current status
 * does not allow, e.g. starting a task that is already RUNNING.
 */
public class InvalidStateException extends RuntimeException {

    private final UUID       taskId;
    private final TaskStatus actual;

    public InvalidStateException(UUID taskId, TaskStatus actual, String attempted) {
        super("Cannot %s task %s in state %s".formatted(attempted, taskId, actual));
        this.taskId = taskId;
        this.actual = actual;
    }

    public UUID       getTaskId() { return taskId; }
    public TaskStatus getActual() { return actual; }
}
