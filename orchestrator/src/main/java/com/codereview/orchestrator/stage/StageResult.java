package com.codereview.orchestrator.stage;

import java.util.Map;

/**
 * Output of one stage.
 *
 * @param report   human-readable report shown to the user
 * @param artifact the stage's primary product, if any: fixed source for the
 *                 optimizer, saved file path for the save stage
 * @param metrics  structured extras (e.g. {@code quality_score})
 */
public record StageResult(String report, String artifact, Map<String, Object> metrics) {

    public static final String QUALITY_SCORE = "quality_score";

    public StageResult {
        report  = report == null ? "" : report;
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static StageResult of(String report) {
        return new StageResult(report, null, Map.of());
    }

    public double metricAsDouble(String key, double fallback) {
        Object v = metrics.get(key);
        return v instanceof Number n ? n.doubleValue() : fallback;
    }
}
