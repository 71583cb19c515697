package com.codereview.orchestrator.api.dto;

import com.codereview.orchestrator.model.ReviewResult;
import com.codereview.orchestrator.model.Task;
import com.codereview.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Response body for GET /api/v1/review/history. */
public record HistoryResponse(
        @JsonProperty("tasks")      List<Entry> tasks,
        @JsonProperty("pagination") Pagination  pagination
) {

    public record Entry(
            @JsonProperty("task_id")          UUID       taskId,
            @JsonProperty("file_name")        String     fileName,
            @JsonProperty("status")           TaskStatus status,
            @JsonProperty("overall_progress") int        overallProgress,
            @JsonProperty("quality_score")    Double     qualityScore,
            @JsonProperty("created_at")       Instant    createdAt,
            @JsonProperty("completed_at")     Instant    completedAt
    ) {
        public static Entry from(Task task) {
            return new Entry(
                    task.id(),
                    task.fileName(),
                    task.status(),
                    task.overallProgress(),
                    task.resultIfCompleted().map(ReviewResult::qualityScore).orElse(null),
                    task.createdAt(),
                    task.completedAt()
            );
        }
    }

    public record Pagination(
            @JsonProperty("skip")     int     skip,
            @JsonProperty("limit")    int     limit,
            @JsonProperty("total")    int     total,
            @JsonProperty("has_more") boolean hasMore
    ) {}

    public static HistoryResponse of(List<Task> page, int skip, int limit, int total) {
        return new HistoryResponse(
                page.stream().map(Entry::from).toList(),
                new Pagination(skip, limit, total, skip + page.size() < total)
        );
    }
}
