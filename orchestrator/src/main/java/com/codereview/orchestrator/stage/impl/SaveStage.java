package com.codereview.orchestrator.stage.impl;

import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.stage.StageContext;
import com.codereview.orchestrator.stage.StageResult;
import com.codereview.orchestrator.stage.StageRunner;
import com.codereview.orchestrator.storage.SourceFileStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the optimizer's fixed file to {@code {fixedDir}/{taskId}/{fileName}}
 * with a {@code .meta.json} sidecar next to it.
 *
 * The saved path is the stage's artifact and ends up as the result's
 * {@code saved_file_path}.
 */
@Component
public class SaveStage implements StageRunner {

    private static final Logger log = LoggerFactory.getLogger(SaveStage.class);

    private final Path         fixedDir;
    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public SaveStage(@Value("${codereview.storage.fixed-dir:fixed}") String fixedDir,
                     ObjectMapper objectMapper,
                     Clock clock) {
        this.fixedDir     = Path.of(fixedDir);
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public Stage stage() {
        return Stage.SAVE;
    }

    @Override
    public StageResult run(StageContext context) throws IOException {
        String content = context.latestContent();
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("nothing to save for " + context.fileName());
        }

        Path taskDir = fixedDir.resolve(context.taskId().toString());
        Files.createDirectories(taskDir);

        String safeName = SourceFileStore.sanitize(context.fileName());
        Path target = taskDir.resolve(safeName);
        Files.writeString(target, content, StandardCharsets.UTF_8);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("task_id",    context.taskId().toString());
        metadata.put("file_name",  context.fileName());
        metadata.put("file_path",  target.toString());
        metadata.put("file_size",  content.getBytes(StandardCharsets.UTF_8).length);
        metadata.put("line_count", content.lines().count());
        metadata.put("saved_at",   clock.instant().toString());
        objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(taskDir.resolve(safeName + ".meta.json").toFile(), metadata);

        log.info("Saved fixed file for task {} to {}", context.taskId(), target);
        return new StageResult("Fixed code saved to " + target, target.toString(), metadata);
    }
}
