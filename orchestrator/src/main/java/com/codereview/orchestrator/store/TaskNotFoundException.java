package com.codereview.orchestrator.store;

import java.util.UUID;

/**
 * Thrown when an operation references a task id the store does not know.
 * Never retried; the REST layer turns it into a 404.
 */
public class TaskNotFoundException extends RuntimeException {

    private final UUID taskId;

    public TaskNotFoundException(UUID taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public UUID getTaskId() { return taskId; }
}
