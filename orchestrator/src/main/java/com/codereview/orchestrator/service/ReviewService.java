package com.codereview.orchestrator.service;

import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.storage.SourceFileStore;
import com.codereview.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for the REST layer: accepts uploads, starts reviews and
 * answers queries. Everything that moves a task forward is delegated to
 * {@link TaskOrchestrator}.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    public static final int MAX_PAGE_SIZE = 100;

    private final TaskStore        store;
    private final SourceFileStore  sources;
    private final TaskOrchestrator orchestrator;

    public ReviewService(TaskStore store, SourceFileStore sources, TaskOrchestrator orchestrator) {
        this.store        = store;
        this.sources      = sources;
        this.orchestrator = orchestrator;
    }

    /**
     * Persist an uploaded file and create a PENDING task for it.
     *
     * @throws IllegalArgumentException if the file is rejected (type, size, empty)
     */
    public Task upload(String fileName, byte[] content) {
        Path stored = sources.save(fileName, content);
        Task task = store.create(fileName, stored.toString(), content.length);
        log.info("Created task {} for '{}'", task.id(), fileName);
        return task;
    }

    /**
     * Start a PENDING task in the background and return its RUNNING snapshot.
     *
     * @throws com.codereview.orchestrator.store.TaskNotFoundException for an unknown id
     * @throws com.codereview.orchestrator.store.InvalidStateException if already started
     */
    public Task start(UUID taskId) {
        orchestrator.start(taskId);
        return store.require(taskId);
    }

    public Optional<Task> findById(UUID taskId) {
        return store.get(taskId);
    }

    public List<Task> history(int skip, int limit) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be >= 0");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        return store.list(skip, limit);
    }

    public int totalTasks() {
        return store.count();
    }
}
