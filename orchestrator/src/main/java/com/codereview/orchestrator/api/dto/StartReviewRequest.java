package com.codereview.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/** Request body for POST /api/v1/review/start. */
public record StartReviewRequest(@JsonProperty("task_id") UUID taskId) {}
