package com.codereview.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final artefact of a completed review: the fixed source plus every
 * stage's report. Populated only when the task reaches COMPLETED.
 */
public record ReviewResult(
        @JsonProperty("file_name")         String    fileName,
        @JsonProperty("original_content")  String    originalContent,
        @JsonProperty("fixed_content")     String    fixedContent,
        @JsonProperty("architect_report")  String    architectReport,
        @JsonProperty("reviewer_report")   String    reviewerReport,
        @JsonProperty("optimizer_summary") String    optimizerSummary,
        @JsonProperty("quality_score")     double    qualityScore,
        @JsonProperty("saved_file_path")   String    savedFilePath,
        @JsonProperty("diff_stats")        DiffStats diffStats
) {}
