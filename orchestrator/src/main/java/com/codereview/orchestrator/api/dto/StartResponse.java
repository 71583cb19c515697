package com.codereview.orchestrator.api.dto;

import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record StartResponse(
        @JsonProperty("task_id") UUID       taskId,
        @JsonProperty("status")  TaskStatus status,
        @JsonProperty("message") String     message
) {
    public static StartResponse from(Task task) {
        return new StartResponse(task.id(), task.status(),
                "Review started, subscribe to /ws/review/" + task.id() + " for progress");
    }
}
