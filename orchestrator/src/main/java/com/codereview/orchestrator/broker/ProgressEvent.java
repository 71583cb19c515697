package com.codereview.orchestrator.broker;

import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.model.StageStatus;
import com.codereview.orchestrator.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * One notification pushed to every subscriber of a task.
 *
 * Not every field applies to every event type: stage updates carry the
 * stage and its status, completion carries the result as payload, failure
 * carries the failing stage and the error message. Absent fields are left
 * out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        @JsonProperty("task_id")        UUID        taskId,
        @JsonProperty("event_type")     EventType   eventType,
        @JsonProperty("stage")          String      stage,
        @JsonProperty("status")         StageStatus status,
        @JsonProperty("progress")       Integer     progress,
        @JsonProperty("stage_progress") Integer     stageProgress,
        @JsonProperty("message")        String      message,
        @JsonProperty("payload")        Object      payload,
        @JsonProperty("timestamp")      Instant     timestamp
) {

    public static ProgressEvent stageUpdate(Task task, Stage stage) {
        var state = task.stageState(stage);
        return new ProgressEvent(task.id(), EventType.STAGE_UPDATE, stage.displayName(),
                state.status(), task.overallProgress(), state.progress(), state.message(),
                null, task.updatedAt());
    }

    public static ProgressEvent completed(Task task) {
        return new ProgressEvent(task.id(), EventType.COMPLETED, null, null,
                task.overallProgress(), null, "Code review completed",
                task.result(), task.updatedAt());
    }

    public static ProgressEvent failed(Task task) {
        String stage = task.failedStage() == null ? null : task.failedStage().displayName();
        return new ProgressEvent(task.id(), EventType.FAILED, stage, StageStatus.FAILED,
                task.overallProgress(), null, task.error(), null, task.updatedAt());
    }
}
