package com.codereview.orchestrator.api.dto;

import com.codereview.orchestrator.model.ReviewResult;
import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Response body for GET /api/v1/review/result/{taskId}.
 *
 * COMPLETED carries the result, FAILED carries the error and the stage that
 * failed, anything else carries only the status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewResponse(
        @JsonProperty("task_id")      UUID         taskId,
        @JsonProperty("status")       TaskStatus   status,
        @JsonProperty("result")       ReviewResult result,
        @JsonProperty("error")        String       error,
        @JsonProperty("failed_stage") String       failedStage
) {
    public static ReviewResponse from(Task task) {
        return new ReviewResponse(
                task.id(),
                task.status(),
                task.result(),
                task.error(),
                task.failedStage() == null ? null : task.failedStage().displayName()
        );
    }
}
