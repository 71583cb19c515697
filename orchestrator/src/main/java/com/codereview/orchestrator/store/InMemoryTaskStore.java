package com.codereview.orchestrator.store;

import com.codereview.orchestrator.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link TaskStore}.
 *
 * Records live in a ConcurrentHashMap; each record carries its own lock, so
 * mutations of one task are serialized while unrelated tasks proceed in
 * parallel. Nothing here survives a restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final Map<UUID, TaskRecord> tasks = new ConcurrentHashMap<>();

    // Creation order; breaks ties between tasks created within the same clock tick.
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Creation and lookup
    // ------------------------------------------------------------------

    @Override
    public Task create(String fileName, String filePath, long fileSize) {
        TaskRecord record = new TaskRecord(sequence.incrementAndGet(), UUID.randomUUID(),
                fileName, filePath, fileSize, clock.instant());
        tasks.put(record.id, record);
        log.info("Created task {} for '{}' ({} bytes)", record.id, fileName, fileSize);
        return record.snapshot();
    }

    @Override
    public Optional<Task> get(UUID taskId) {
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.snapshot());
    }

    @Override
    public List<Task> list(int skip, int limit) {
        if (skip < 0 || limit < 0) {
            throw new IllegalArgumentException("skip and limit must be >= 0");
        }
        return tasks.values().stream()
                .sorted(Comparator.comparingLong((TaskRecord r) -> r.sequence).reversed())
                .skip(skip)
                .limit(limit)
                .map(TaskRecord::snapshot)
                .toList();
    }

    @Override
    public int count() {
        return tasks.size();
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @Override
    public Task start(UUID taskId) {
        TaskRecord record = recordFor(taskId);
        record.lock.lock();
        try {
            if (record.status != TaskStatus.PENDING) {
                throw new InvalidStateException(taskId, record.status, "start");
            }
            Instant now = clock.instant();
            record.status    = TaskStatus.RUNNING;
            record.startedAt = now;
            record.touch(now);
            log.info("Task {} PENDING → RUNNING", taskId);
            return record.snapshot();
        } finally {
            record.lock.unlock();
        }
    }

    @Override
    public boolean updateStage(UUID taskId, Stage stage, StageStatus status, String message, int progress) {
        TaskRecord record = recordFor(taskId);
        record.lock.lock();
        try {
            if (record.status.isTerminal()) {
                log.debug("Ignoring late {} update for stage {} of terminal task {}", status, stage, taskId);
                return false;
            }
            StageState current = record.stages.get(stage.ordinal());
            if (current.status().isFinished()) {
                log.debug("Ignoring {} update for finished stage {} of task {}", status, stage, taskId);
                return false;
            }
            Instant now = clock.instant();
            record.stages.set(stage.ordinal(),
                    new StageState(stage, status, message, clamp(progress), now));
            record.stageCursor = Math.max(record.stageCursor, stage.cursor());
            record.touch(now);
            return true;
        } finally {
            record.lock.unlock();
        }
    }

    @Override
    public Optional<Task> finalizeTask(UUID taskId, TaskOutcome outcome) {
        TaskRecord record = recordFor(taskId);
        record.lock.lock();
        try {
            if (record.status.isTerminal()) {
                log.debug("Task {} already {}, ignoring {}", taskId, record.status, outcome.status());
                return Optional.empty();
            }
            if (record.status == TaskStatus.PENDING) {
                throw new InvalidStateException(taskId, record.status, "finalize");
            }
            Instant now = clock.instant();
            if (outcome instanceof TaskOutcome.Completed completed) {
                record.result = completed.result();
            } else if (outcome instanceof TaskOutcome.Failed failed) {
                record.error       = failed.error();
                record.failedStage = failed.stage();
            }
            record.status      = outcome.status();
            record.completedAt = now;
            record.touch(now);
            log.info("Task {} RUNNING → {}", taskId, record.status);
            return Optional.of(record.snapshot());
        } finally {
            record.lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Retention
    // ------------------------------------------------------------------

    @Override
    public int evictOldest(int capacity) {
        int excess = tasks.size() - capacity;
        if (excess <= 0) return 0;

        List<TaskRecord> candidates = tasks.values().stream()
                .sorted(Comparator.comparingLong((TaskRecord r) -> r.sequence))
                .filter(TaskRecord::isTerminal)
                .limit(excess)
                .toList();

        int removed = 0;
        for (TaskRecord record : candidates) {
            if (tasks.remove(record.id, record)) removed++;
        }
        if (removed > 0) {
            log.info("Retention cleanup evicted {} task(s), {} remain", removed, tasks.size());
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TaskRecord recordFor(UUID taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            throw new TaskNotFoundException(taskId);
        }
        return record;
    }

    private static int clamp(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    /**
     * Mutable task state. Every field except the immutable identity is read
     * and written only while holding {@link #lock}.
     */
    private static final class TaskRecord {

        final ReentrantLock lock = new ReentrantLock();

        final long    sequence;
        final UUID    id;
        final String  fileName;
        final String  filePath;
        final long    fileSize;
        final Instant createdAt;

        TaskStatus       status = TaskStatus.PENDING;
        int              stageCursor = 0;
        int              overallProgress = 0;
        List<StageState> stages = new ArrayList<>();
        ReviewResult     result;
        String           error;
        Stage            failedStage;
        Instant          updatedAt;
        Instant          startedAt;
        Instant          completedAt;

        TaskRecord(long sequence, UUID id, String fileName, String filePath, long fileSize, Instant now) {
            this.sequence  = sequence;
            this.id        = id;
            this.fileName  = fileName;
            this.filePath  = filePath;
            this.fileSize  = fileSize;
            this.createdAt = now;
            this.updatedAt = now;
            for (Stage stage : Stage.PIPELINE) {
                stages.add(StageState.idle(stage, now));
            }
        }

        boolean isTerminal() {
            lock.lock();
            try {
                return status.isTerminal();
            } finally {
                lock.unlock();
            }
        }

        void touch(Instant now) {
            overallProgress = Task.progressOf(stages);
            updatedAt = now;
        }

        Task snapshot() {
            lock.lock();
            try {
                return new Task(id, fileName, filePath, fileSize, status, stageCursor,
                        overallProgress, stages, result, error, failedStage,
                        createdAt, updatedAt, startedAt, completedAt);
            } finally {
                lock.unlock();
            }
        }
    }
}
