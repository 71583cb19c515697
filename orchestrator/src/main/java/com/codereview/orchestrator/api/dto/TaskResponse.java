package com.codereview.orchestrator.api.dto;

import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /api/v1/review/status/{taskId}.
 * Carries every stage's state so a client that missed WebSocket events can
 * catch up by polling.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("task_id")          UUID                taskId,
        @JsonProperty("file_name")        String              fileName,
        @JsonProperty("file_size")        long                fileSize,
        @JsonProperty("status")           TaskStatus          status,
        @JsonProperty("current_stage")    String              currentStage,
        @JsonProperty("overall_progress") int                 overallProgress,
        @JsonProperty("stages")           List<StageResponse> stages,
        @JsonProperty("error")            String              error,
        @JsonProperty("failed_stage")     String              failedStage,
        @JsonProperty("created_at")       Instant             createdAt,
        @JsonProperty("updated_at")       Instant             updatedAt,
        @JsonProperty("started_at")       Instant             startedAt,
        @JsonProperty("completed_at")     Instant             completedAt
) {
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.fileName(),
                task.fileSize(),
                task.status(),
                task.currentStage().displayName(),
                task.overallProgress(),
                task.stageStates().stream().map(StageResponse::from).toList(),
                task.error(),
                task.failedStage() == null ? null : task.failedStage().displayName(),
                task.createdAt(),
                task.updatedAt(),
                task.startedAt(),
                task.completedAt()
        );
    }
}
