package com.codereview.orchestrator.store;

import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.model.StageStatus;
import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.model.TaskOutcome;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative store for review tasks.
 *
 * Every state transition of a task goes through this interface. Writes to
 * one task are serialized; writes to different tasks never wait on each
 * other. Reads return immutable {@link Task} snapshots.
 */
public interface TaskStore {

    /** Create a PENDING task with every stage pre-populated as IDLE. */
    Task create(String fileName, String filePath, long fileSize);

    Optional<Task> get(UUID taskId);

    /** Same as {@link #get} but throws {@link TaskNotFoundException} for an unknown id. */
    default Task require(UUID taskId) {
        return get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Atomically move a task from PENDING to RUNNING.
     *
     * @throws InvalidStateException if the task is not PENDING
     * @throws TaskNotFoundException if the id is unknown
     */
    Task start(UUID taskId);

    /**
     * Record a stage transition.
     *
     * @return false when the update was ignored because the task is terminal
     *         or the stage has already finished; true when it was applied
     * @throws TaskNotFoundException if the id is unknown
     */
    boolean updateStage(UUID taskId, Stage stage, StageStatus status, String message, int progress);

    /**
     * Move a RUNNING task into its terminal state. The first call wins;
     * later calls leave the task untouched.
     *
     * @return the terminal snapshot, taken atomically with the transition, if
     *         this call performed it; empty if the task was already terminal
     * @throws InvalidStateException if the task is still PENDING
     * @throws TaskNotFoundException if the id is unknown
     */
    Optional<Task> finalizeTask(UUID taskId, TaskOutcome outcome);

    /** Tasks ordered newest first. */
    List<Task> list(int skip, int limit);

    int count();

    /**
     * Retention cleanup: drop the oldest terminal tasks until at most
     * {@code capacity} tasks remain. PENDING and RUNNING tasks are kept.
     *
     * @return number of tasks removed
     */
    int evictOldest(int capacity);
}
