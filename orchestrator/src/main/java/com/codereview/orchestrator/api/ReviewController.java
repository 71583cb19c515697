package com.codereview.orchestrator.api;

import com.codereview.orchestrator.api.dto.HistoryResponse;
import com.codereview.orchestrator.api.dto.ReviewResponse;
import com.codereview.orchestrator.api.dto.StartResponse;
import com.codereview.orchestrator.api.dto.StartReviewRequest;
import com.codereview.orchestrator.api.dto.TaskResponse;
import com.codereview.orchestrator.api.dto.UploadResponse;
import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.service.ReviewService;
import com.codereview.orchestrator.store.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * REST API for review tasks.
 *
 * POST /api/v1/review/upload            upload a source file, creates a PENDING task
 * POST /api/v1/review/start             start the pipeline for a PENDING task
 * GET  /api/v1/review/status/{taskId}   current state of the task and its stages
 * GET  /api/v1/review/result/{taskId}   final result (202 while still in progress)
 * GET  /api/v1/review/history           tasks newest first, paginated
 *
 * Live progress is pushed on /ws/review/{taskId}, see {@link ProgressWebSocketHandler}.
 */
@RestController
@RequestMapping("/api/v1/review")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    /**
     * Upload a source file.
     *
     * Example:
     *   curl -F file=@app.py http://localhost:8080/api/v1/review/upload
     */
    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestParam("file") MultipartFile file) throws IOException {
        Task task = reviewService.upload(file.getOriginalFilename(), file.getBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.from(task));
    }

    /**
     * Start the review. Returns immediately; the stages run in the background.
     * 404 for an unknown task, 409 if it was already started.
     */
    @PostMapping("/start")
    public ResponseEntity<StartResponse> start(@RequestBody StartReviewRequest req) {
        if (req == null || req.taskId() == null) {
            throw new IllegalArgumentException("task_id is required");
        }
        Task task = reviewService.start(req.taskId());
        return ResponseEntity.accepted().body(StartResponse.from(task));
    }

    @GetMapping("/status/{taskId}")
    public TaskResponse status(@PathVariable UUID taskId) {
        return TaskResponse.from(find(taskId));
    }

    /**
     * HTTP 200 when the task is COMPLETED (with the result) or FAILED (with the error),
     * HTTP 202 while it is PENDING or RUNNING.
     */
    @GetMapping("/result/{taskId}")
    public ResponseEntity<ReviewResponse> result(@PathVariable UUID taskId) {
        Task task = find(taskId);
        if (!task.isTerminal()) {
            return ResponseEntity.accepted().body(ReviewResponse.from(task));
        }
        return ResponseEntity.ok(ReviewResponse.from(task));
    }

    @GetMapping("/history")
    public HistoryResponse history(@RequestParam(defaultValue = "0") int skip,
                                   @RequestParam(defaultValue = "20") int limit) {
        List<Task> page = reviewService.history(skip, limit);
        return HistoryResponse.of(page, skip, limit, reviewService.totalTasks());
    }

    private Task find(UUID taskId) {
        return reviewService.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
