package com.codereview.orchestrator.service;

import com.codereview.orchestrator.broker.ProgressBroker;
import com.codereview.orchestrator.broker.ProgressEvent;
import com.codereview.orchestrator.model.*;
import com.codereview.orchestrator.stage.StageContext;
import com.codereview.orchestrator.stage.StageException;
import com.codereview.orchestrator.stage.StageResult;
import com.codereview.orchestrator.stage.StageRunnerRegistry;
import com.codereview.orchestrator.storage.SourceReader;
import com.codereview.orchestrator.store.InvalidStateException;
import com.codereview.orchestrator.store.TaskNotFoundException;
import com.codereview.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives a review task through ARCHITECT → REVIEWER → OPTIMIZER → SAVE.
 *
 * This is the only writer of task status transitions. For each stage it:
 *   1. Marks the stage RUNNING and broadcasts
 *   2. Runs the stage with everything earlier stages produced
 *   3. Marks the stage COMPLETED, folds the result into the context, broadcasts
 *
 * A stage failure marks that stage FAILED, finalizes the task as FAILED and
 * broadcasts; later stages never run and stay IDLE. After SAVE the task is
 * finalized as COMPLETED with the assembled {@link ReviewResult}.
 *
 * Stages of one task run strictly in sequence; separate tasks run in
 * parallel, one executor thread each. Stage errors are absorbed into the
 * task's terminal state and never escape {@link #run}.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskStore           store;
    private final ProgressBroker      broker;
    private final StageRunnerRegistry runners;
    private final SourceReader        sources;
    private final ExecutorService     executor;

    public TaskOrchestrator(TaskStore store,
                            ProgressBroker broker,
                            StageRunnerRegistry runners,
                            SourceReader sources,
                            @Qualifier("reviewTaskExecutor") ExecutorService executor) {
        this.store    = store;
        this.broker   = broker;
        this.runners  = runners;
        this.sources  = sources;
        this.executor = executor;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run a PENDING task to completion on the calling thread.
     *
     * @return the task's terminal snapshot (COMPLETED or FAILED)
     * @throws InvalidStateException if the task was already started
     * @throws TaskNotFoundException if the id is unknown
     */
    public Task run(UUID taskId) {
        Task task = store.start(taskId);
        return execute(task);
    }

    /**
     * Claim a PENDING task on the calling thread, then run its stages in the
     * background. A second start of the same task fails here, before anything
     * is scheduled.
     *
     * @throws InvalidStateException if the task was already started
     * @throws TaskNotFoundException if the id is unknown
     */
    public CompletableFuture<Task> start(UUID taskId) {
        Task task = store.start(taskId);
        try {
            return CompletableFuture.supplyAsync(() -> execute(task), executor)
                    .whenComplete((done, error) -> {
                        if (error != null) {
                            log.error("Review of task {} terminated abnormally", taskId, error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            // Already RUNNING; fail it so it does not stay RUNNING forever.
            log.error("Task executor rejected task {}", taskId, e);
            fail(task.id(), task.currentStage(), new StageException(task.currentStage(), e));
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Stage loop
    // ------------------------------------------------------------------

    private Task execute(Task task) {
        UUID id = task.id();
        MDC.put("taskId", id.toString());
        Stage stage = Stage.PIPELINE.get(0);
        try {
            log.info("Starting review of '{}' ({} stages)", task.fileName(), Stage.PIPELINE.size());
            StageContext context = null;

            for (Stage next : Stage.PIPELINE) {
                stage = next;
                MDC.put("stage", stage.name());
                markStage(id, stage, StageStatus.RUNNING, runningMessage(stage), 0);
                long started = System.nanoTime();
                try {
                    if (context == null) {
                        // Loading the upload counts as part of the first stage.
                        context = new StageContext(id, task.fileName(), sources.read(task.filePath()));
                    }
                    StageResult result = runners.execute(stage, context);
                    context = context.with(stage, result);
                } catch (StageException e) {
                    return fail(id, stage, e);
                } catch (RuntimeException e) {
                    return fail(id, stage, new StageException(stage, e));
                }
                log.info("Stage {} completed in {} ms", stage, (System.nanoTime() - started) / 1_000_000);
                markStage(id, stage, StageStatus.COMPLETED, completedMessage(stage), 100);
            }

            MDC.remove("stage");
            return complete(id, context);
        } catch (RuntimeException e) {
            // Assembling or finalizing the result failed after the last stage.
            return fail(id, stage, new StageException(stage, e));
        } catch (Error e) {
            // The task must reach a terminal state before the error unwinds the worker.
            try {
                fail(id, stage, new StageException(stage, e));
            } catch (RuntimeException failure) {
                e.addSuppressed(failure);
            }
            throw e;
        } finally {
            // Executor threads are reused; never leak one task's context into the next.
            MDC.clear();
        }
    }

    private void markStage(UUID id, Stage stage, StageStatus status, String message, int progress) {
        if (store.updateStage(id, stage, status, message, progress)) {
            broker.broadcast(id, ProgressEvent.stageUpdate(store.require(id), stage));
        }
    }

    private Task complete(UUID id, StageContext context) {
        String original = context.originalContent();
        String fixed    = context.latestContent();

        ReviewResult result = new ReviewResult(
                context.fileName(),
                original,
                fixed,
                context.report(Stage.ARCHITECT),
                context.report(Stage.REVIEWER),
                context.report(Stage.OPTIMIZER),
                context.result(Stage.REVIEWER)
                        .map(r -> r.metricAsDouble(StageResult.QUALITY_SCORE, 0.0))
                        .orElse(0.0),
                context.result(Stage.SAVE).map(StageResult::artifact).orElse(null),
                DiffStats.between(original, fixed)
        );

        Optional<Task> done = store.finalizeTask(id, new TaskOutcome.Completed(result));
        if (done.isPresent()) {
            broker.broadcast(id, ProgressEvent.completed(done.get()));
            log.info("Review completed: quality score {}, {} line(s) added, {} removed",
                    result.qualityScore(), result.diffStats().added(), result.diffStats().removed());
            return done.get();
        }
        return store.require(id);
    }

    private Task fail(UUID id, Stage stage, StageException e) {
        log.error("Stage {} failed for task {}: {}", stage, id, e.getMessage(), e.getCause());
        markStage(id, stage, StageStatus.FAILED, e.getMessage(), 0);

        Optional<Task> failed = store.finalizeTask(id, new TaskOutcome.Failed(stage, e.getMessage()));
        if (failed.isPresent()) {
            broker.broadcast(id, ProgressEvent.failed(failed.get()));
            return failed.get();
        }
        return store.require(id);
    }

    // ------------------------------------------------------------------
    // Messages
    // ------------------------------------------------------------------

    private static String runningMessage(Stage stage) {
        return switch (stage) {
            case ARCHITECT -> "Analysing architecture";
            case REVIEWER  -> "Reviewing code";
            case OPTIMIZER -> "Optimizing code";
            case SAVE      -> "Saving results";
        };
    }

    private static String completedMessage(Stage stage) {
        return switch (stage) {
            case ARCHITECT -> "Architecture analysis complete";
            case REVIEWER  -> "Code review complete";
            case OPTIMIZER -> "Optimization complete";
            case SAVE      -> "Results saved";
        };
    }
}
