package com.codereview.orchestrator.api.dto;

import com.codereview.orchestrator.model.StageState;
import com.codereview.orchestrator.model.StageStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record StageResponse(
        @JsonProperty("stage")      String      stage,
        @JsonProperty("status")     StageStatus status,
        @JsonProperty("message")    String      message,
        @JsonProperty("progress")   int         progress,
        @JsonProperty("updated_at") Instant     updatedAt
) {
    public static StageResponse from(StageState state) {
        return new StageResponse(
                state.stage().displayName(),
                state.status(),
                state.message(),
                state.progress(),
                state.updatedAt()
        );
    }
}
