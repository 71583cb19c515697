package com.codereview.orchestrator.api.dto;

import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Response body for POST /api/v1/review/upload.
 * The task id is what the client passes to /start and the WebSocket.
 */
public record UploadResponse(
        @JsonProperty("task_id")   UUID       taskId,
        @JsonProperty("file_name") String     fileName,
        @JsonProperty("file_size") long       fileSize,
        @JsonProperty("status")    TaskStatus status
) {
    public static UploadResponse from(Task task) {
        return new UploadResponse(task.id(), task.fileName(), task.fileSize(), task.status());
    }
}
