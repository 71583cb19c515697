package com.codereview.orchestrator.stage;

import com.codereview.orchestrator.model.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything a stage may read: the uploaded source and the results of the
 * stages that ran before it. Immutable; the orchestrator folds each new
 * result in with {@link #with}.
 */
public final class StageContext {

    private final UUID   taskId;
    private final String fileName;
    private final String originalContent;
    private final Map<Stage, StageResult> results;

    public StageContext(UUID taskId, String fileName, String originalContent) {
        this(taskId, fileName, originalContent, new EnumMap<>(Stage.class));
    }

    private StageContext(UUID taskId, String fileName, String originalContent,
                         EnumMap<Stage, StageResult> results) {
        this.taskId          = taskId;
        this.fileName        = fileName;
        this.originalContent = originalContent;
        this.results         = Collections.unmodifiableMap(results);
    }

    public StageContext with(Stage stage, StageResult result) {
        EnumMap<Stage, StageResult> next = new EnumMap<>(Stage.class);
        next.putAll(results);
        next.put(stage, result);
        return new StageContext(taskId, fileName, originalContent, next);
    }

    public UUID   taskId()          { return taskId; }
    public String fileName()        { return fileName; }
    public String originalContent() { return originalContent; }

    /** Prior results in pipeline order. */
    public Map<Stage, StageResult> results() { return results; }

    public Optional<StageResult> result(Stage stage) {
        return Optional.ofNullable(results.get(stage));
    }

    /** Report text of an earlier stage, or empty string if it has not run. */
    public String report(Stage stage) {
        return result(stage).map(StageResult::report).orElse("");
    }

    /**
     * The most recent version of the source: the optimizer's fixed content
     * once available, the upload before that.
     */
    public String latestContent() {
        return result(Stage.OPTIMIZER)
                .map(StageResult::artifact)
                .filter(a -> !a.isBlank())
                .orElse(originalContent);
    }
}
