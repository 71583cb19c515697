package com.codereview.orchestrator.api;

import com.codereview.orchestrator.model.*;
import com.codereview.orchestrator.service.ReviewService;
import com.codereview.orchestrator.store.InvalidStateException;
import com.codereview.orchestrator.store.TaskNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for ReviewController.
 *
 * Only the web layer and the exception advice are loaded; ReviewService is
 * a mock, so no stages run and nothing touches the disk.
 */
@WebMvcTest(ReviewController.class)
class ReviewControllerTest {

    static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired MockMvc          mockMvc;
    @MockitoBean ReviewService  reviewService;

    // ------------------------------------------------------------------
    // POST /upload
    // ------------------------------------------------------------------

    @Test
    void upload_validFile_returns201WithTaskId() throws Exception {
        Task task = task(TaskStatus.PENDING, 0);
        when(reviewService.upload(eq("app.py"), any())).thenReturn(task);

        mockMvc.perform(multipart("/api/v1/review/upload")
                        .file(new MockMultipartFile("file", "app.py", "text/x-python", "print(1)".getBytes())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.task_id").value(task.id().toString()))
                .andExpect(jsonPath("$.file_name").value("app.py"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void upload_rejectedFile_returns400WithErrorBody() throws Exception {
        when(reviewService.upload(any(), any()))
                .thenThrow(new IllegalArgumentException("Unsupported file type '.txt'"));

        mockMvc.perform(multipart("/api/v1/review/upload")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", "hi".getBytes())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("Unsupported file type '.txt'"));
    }

    @Test
    void upload_missingFilePart_returns400() throws Exception {
        mockMvc.perform(multipart("/api/v1/review/upload"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /start
    // ------------------------------------------------------------------

    @Test
    void start_pendingTask_returns202() throws Exception {
        Task task = task(TaskStatus.RUNNING, 0);
        when(reviewService.start(task.id())).thenReturn(task);

        mockMvc.perform(post("/api/v1/review/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_id\":\"" + task.id() + "\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    void start_unknownTask_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(reviewService.start(unknown)).thenThrow(new TaskNotFoundException(unknown));

        mockMvc.perform(post("/api/v1/review/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_id\":\"" + unknown + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void start_alreadyRunning_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(reviewService.start(id)).thenThrow(new InvalidStateException(id, TaskStatus.RUNNING, "start"));

        mockMvc.perform(post("/api/v1/review/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_id\":\"" + id + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.status").value("RUNNING"));
    }

    @Test
    void start_missingTaskId_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /status/{taskId}
    // ------------------------------------------------------------------

    @Test
    void status_existingTask_returnsEveryStage() throws Exception {
        Task task = task(TaskStatus.RUNNING, 1);
        when(reviewService.findById(task.id())).thenReturn(Optional.of(task));

        mockMvc.perform(get("/api/v1/review/status/{id}", task.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.overall_progress").value(25))
                .andExpect(jsonPath("$.current_stage").value("Reviewer"))
                .andExpect(jsonPath("$.stages.length()").value(4))
                .andExpect(jsonPath("$.stages[0].stage").value("Architect"))
                .andExpect(jsonPath("$.stages[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.stages[3].status").value("IDLE"));
    }

    @Test
    void status_unknownTask_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(reviewService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/review/status/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    @Test
    void status_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/review/status/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /result/{taskId}
    // ------------------------------------------------------------------

    @Test
    void result_completedTask_returns200WithResult() throws Exception {
        Task task = completed();
        when(reviewService.findById(task.id())).thenReturn(Optional.of(task));

        mockMvc.perform(get("/api/v1/review/result/{id}", task.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.result.quality_score").value(7.5))
                .andExpect(jsonPath("$.result.fixed_content").value("x = 1"))
                .andExpect(jsonPath("$.result.diff_stats.changed_ratio").value(1.0))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void result_runningTask_returns202() throws Exception {
        Task task = task(TaskStatus.RUNNING, 2);
        when(reviewService.findById(task.id())).thenReturn(Optional.of(task));

        mockMvc.perform(get("/api/v1/review/result/{id}", task.id()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    void result_failedTask_returns200WithError() throws Exception {
        Task task = failed();
        when(reviewService.findById(task.id())).thenReturn(Optional.of(task));

        mockMvc.perform(get("/api/v1/review/result/{id}", task.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.failed_stage").value("Reviewer"))
                .andExpect(jsonPath("$.error").value("Reviewer stage failed: timeout"));
    }

    // ------------------------------------------------------------------
    // GET /history
    // ------------------------------------------------------------------

    @Test
    void history_firstPage_reportsHasMore() throws Exception {
        when(reviewService.history(0, 2)).thenReturn(List.of(completed(), task(TaskStatus.PENDING, 0)));
        when(reviewService.totalTasks()).thenReturn(3);

        mockMvc.perform(get("/api/v1/review/history").param("skip", "0").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks.length()").value(2))
                .andExpect(jsonPath("$.tasks[0].quality_score").value(7.5))
                .andExpect(jsonPath("$.pagination.total").value(3))
                .andExpect(jsonPath("$.pagination.has_more").value(true));
    }

    @Test
    void history_defaults_usedWhenParamsMissing() throws Exception {
        when(reviewService.history(0, 20)).thenReturn(List.of());
        when(reviewService.totalTasks()).thenReturn(0);

        mockMvc.perform(get("/api/v1/review/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.limit").value(20))
                .andExpect(jsonPath("$.pagination.has_more").value(false));

        verify(reviewService).history(0, 20);
    }

    @Test
    void history_invalidLimit_returns400() throws Exception {
        when(reviewService.history(0, 500)).thenThrow(new IllegalArgumentException("limit must be between 1 and 100"));

        mockMvc.perform(get("/api/v1/review/history").param("limit", "500"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** A task whose first {@code completedStages} stages are done and the rest idle. */
    private static Task task(TaskStatus status, int completedStages) {
        List<StageState> states = new ArrayList<>();
        for (Stage stage : Stage.PIPELINE) {
            StageStatus s = stage.ordinal() < completedStages ? StageStatus.COMPLETED : StageStatus.IDLE;
            states.add(new StageState(stage, s, "m", s == StageStatus.COMPLETED ? 100 : 0, NOW));
        }
        int cursor = Math.min(completedStages, Stage.PIPELINE.size() - 1);
        return new Task(UUID.randomUUID(), "app.py", "uploads/x_app.py", 8, status, cursor,
                Task.progressOf(states), states, null, null, null, NOW, NOW,
                status == TaskStatus.PENDING ? null : NOW, null);
    }

    private static Task completed() {
        Task base = task(TaskStatus.COMPLETED, 4);
        ReviewResult result = new ReviewResult("app.py", "x=1", "x = 1", "arch", "rev", "opt",
                7.5, "fixed/app.py", DiffStats.between("x=1", "x = 1"));
        return new Task(base.id(), base.fileName(), base.filePath(), base.fileSize(), base.status(),
                base.stageCursor(), base.overallProgress(), base.stageStates(), result, null, null,
                NOW, NOW, NOW, NOW);
    }

    private static Task failed() {
        Task base = task(TaskStatus.FAILED, 1);
        return new Task(base.id(), base.fileName(), base.filePath(), base.fileSize(), base.status(),
                base.stageCursor(), base.overallProgress(), base.stageStates(), null,
                "Reviewer stage failed: timeout", Stage.REVIEWER, NOW, NOW, NOW, NOW);
    }
}
